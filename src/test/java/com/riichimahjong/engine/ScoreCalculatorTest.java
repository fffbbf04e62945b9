package com.riichimahjong.engine;

import com.riichimahjong.model.GameContext;
import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.HandLimit;
import com.riichimahjong.model.HandOrganization;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.PlayerContext;
import com.riichimahjong.model.Recognition;
import com.riichimahjong.model.ScoreResult;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.TileType;
import com.riichimahjong.model.WaitType;
import com.riichimahjong.model.WinType;
import com.riichimahjong.model.Wind;
import com.riichimahjong.model.Yaku;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 番符与支付计算测试
 */
class ScoreCalculatorTest {

    private final StandardPatternRecognizer recognizer = new StandardPatternRecognizer();

    private static HandInput hand(String tiles, String winningTile, WinType winType, boolean dealer) {
        HandInput input = new HandInput();
        input.setHandTiles(TileFactory.parse(tiles));
        input.setWinningTile(TileFactory.parseTile(winningTile));
        input.setWinType(winType);
        input.setPlayer(new PlayerContext(dealer ? Wind.EAST : Wind.SOUTH, dealer));
        return input;
    }

    private ScoreResult score(HandInput input) {
        Recognition recognition = recognizer.recognize(HandOrganizer.organize(input), input);
        return ScoreCalculator.calculate(recognition, input.getPlayer(), input.getGame(), input.getWinType());
    }

    @Test
    void hanemanTsumoWithHonba() {
        HandInput input = hand("234m567m345p678p44s", "8p", WinType.TSUMO, false);
        input.getPlayer().setRiichi(true);
        input.getGame().setHonba(1);
        input.getGame().setDoraIndicators(TileFactory.parse("2p"));
        input.getGame().setUraDoraIndicators(TileFactory.parse("6m"));
        input.getGame().setRedFiveCount(1);

        ScoreResult result = score(input);

        assertEquals(7, result.getHan());
        assertEquals(20, result.getFu());
        assertEquals(HandLimit.HANEMAN, result.getLimit());
        assertEquals(1, result.getRedFiveCount());
        assertEquals(6000, result.getDealerPayment());
        assertEquals(3000, result.getNonDealerPayment());
        assertEquals(3000, result.getBasePoints());
        assertEquals(12300, result.getTotalPayment());
        assertEquals(WaitType.TWO_SIDED, result.getWait());
    }

    @Test
    void pinfuRonIsThirtyFu() {
        ScoreResult result = score(hand("234m567m345p678p44s", "8p", WinType.RON, false));

        assertEquals(2, result.getHan());
        assertEquals(30, result.getFu());
        assertNull(result.getLimit());
        // 30 * 2^4 * 4 = 1920 -> 2000
        assertEquals(2000, result.getTotalPayment());
        assertEquals(2000, result.getBasePoints());
        assertEquals(0, result.getDealerPayment());
        assertEquals(0, result.getNonDealerPayment());
    }

    @Test
    void sevenPairsRon() {
        ScoreResult result = score(hand("1133m5577p99s2266z", "2z", WinType.RON, false));

        assertEquals(2, result.getHan());
        assertEquals(25, result.getFu());
        assertEquals(1600, result.getTotalPayment());
    }

    @Test
    void closedWaitConcealedRon() {
        // 副底 20 + 门清荣和 10 + 777p 暗刻 4 + 999s 暗刻 8 + 白雀头 2 + 嵌张 2 = 46 -> 50
        HandInput input = hand("234m777p999s567s55z", "3m", WinType.RON, false);
        input.getPlayer().setRiichi(true);

        ScoreResult result = score(input);

        assertEquals(Arrays.asList(Yaku.RIICHI), result.getYakuList());
        assertEquals(WaitType.CLOSED, result.getWait());
        assertEquals(1, result.getHan());
        assertEquals(50, result.getFu());
        assertEquals(1600, result.getTotalPayment());
    }

    @Test
    void openDragonTripletRon() {
        // 副底 20 + 明刻字牌 4 + 发雀头 2 = 26 -> 30
        HandInput input = hand("123m456p789s55566z", "1m", WinType.RON, false);
        input.setOpenMelds(Arrays.asList(Meld.triplet(Tile.of(TileType.DRAGON, 1), true)));
        input.getPlayer().setConcealed(false);

        ScoreResult result = score(input);

        assertEquals(1, result.getHan());
        assertEquals(30, result.getFu());
        assertEquals(1000, result.getTotalPayment());
    }

    @Test
    void riichiKeepsItsHanWithoutConcealedFlag() {
        // 没有副露，只是没有声明门前清：立直照样 1 番，荣和不加门清符
        HandInput input = hand("123m567m345p678p44s", "8p", WinType.RON, false);
        input.getPlayer().setRiichi(true);
        input.getPlayer().setConcealed(false);

        ScoreResult result = score(input);

        assertEquals(Arrays.asList(Yaku.RIICHI), result.getYakuList());
        assertEquals(1, result.getHan());
        assertEquals(20, result.getFu());
        // 20 * 2^3 * 4 = 640 -> 700
        assertEquals(700, result.getTotalPayment());
    }

    @Test
    void dealerTsumoSplitsEvenly() {
        // 副底 20 + 自摸 2 + 888s 暗刻 4 = 26 -> 30
        HandInput input = hand("234m567m345p888s55p", "2m", WinType.TSUMO, true);
        input.getPlayer().setRiichi(true);

        ScoreResult result = score(input);

        assertEquals(Arrays.asList(Yaku.RIICHI, Yaku.MENZEN_TSUMO, Yaku.TANYAO), result.getYakuList());
        assertEquals(30, result.getFu());
        assertEquals(2000, result.getDealerPayment());
        assertEquals(0, result.getNonDealerPayment());
        assertEquals(6000, result.getTotalPayment());

        input.getGame().setHonba(1);
        assertEquals(6300, score(input).getTotalPayment());
    }

    @Test
    void nonDealerTsumoPaymentsAddUp() {
        HandInput input = hand("234m567m345p888s55p", "2m", WinType.TSUMO, false);
        input.getPlayer().setRiichi(true);
        for (int honba = 0; honba < 4; honba++) {
            input.getGame().setHonba(honba);
            ScoreResult result = score(input);
            assertEquals(result.getDealerPayment() + 2 * result.getNonDealerPayment() + 300 * honba,
                    result.getTotalPayment());
            assertEquals(result.getNonDealerPayment(), result.getBasePoints());
        }
    }

    @Test
    void doubleYakumanDealerRon() {
        HandInput input = hand("11199m333p555777s", "9m", WinType.RON, true);
        input.getGame().setHonba(2);

        ScoreResult result = score(input);

        assertTrue(result.getYakuList().contains(Yaku.SUUANKOU_TANKI));
        assertEquals(HandLimit.DOUBLE_YAKUMAN, result.getLimit());
        assertEquals(26, result.getHan());
        assertEquals(0, result.getFu());
        // 16000 * 6 + 2 * 300
        assertEquals(96600, result.getTotalPayment());
    }

    @Test
    void yakumanIgnoresBonusTiles() {
        HandInput input = hand("119m19p19s1234567z", "9m", WinType.TSUMO, false);
        HandOrganization organization = HandOrganizer.organize(input);
        Recognition recognition = new Recognition(Arrays.asList(Yaku.KOKUSHI_MUSOU, Yaku.DORA), 1,
                organization, WaitType.THIRTEEN_ORPHANS_SINGLE);

        ScoreResult result = ScoreCalculator.calculate(recognition, input.getPlayer(), input.getGame(),
                WinType.TSUMO);

        assertEquals(HandLimit.YAKUMAN, result.getLimit());
        assertEquals(13, result.getHan());
        assertEquals(0, result.getRedFiveCount());
        assertEquals(16000, result.getDealerPayment());
        assertEquals(8000, result.getNonDealerPayment());
        assertEquals(32000, result.getTotalPayment());
    }

    @Test
    void tripleYakumanIsMultiple() {
        HandInput input = hand("11199m333p555777s", "9m", WinType.RON, false);
        HandOrganization organization = HandOrganizer.organize(input);
        Recognition recognition = new Recognition(Arrays.asList(Yaku.SUUANKOU_TANKI, Yaku.TENHOU), 0,
                organization, WaitType.SINGLE);

        ScoreResult result = ScoreCalculator.calculate(recognition, input.getPlayer(), input.getGame(),
                WinType.RON);

        assertEquals(HandLimit.MULTIPLE_YAKUMAN, result.getLimit());
        assertEquals(39, result.getHan());
        assertEquals(96000, result.getTotalPayment());
    }

    @Test
    void irregularHandWithoutChiitoitsuHasNoFu() {
        HandInput input = hand("119m19p19s1234567z", "9m", WinType.RON, false);
        Recognition recognition = new Recognition(Arrays.asList(Yaku.RIICHI), 0,
                HandOrganizer.organize(input), WaitType.SINGLE);

        assertThrows(IllegalStateException.class, () -> ScoreCalculator.calculateFu(recognition,
                input.getPlayer(), input.getGame(), WinType.RON));
    }

    @Test
    void meldFu() {
        Tile fivePin = Tile.of(TileType.PIN, 5);
        Tile oneMan = Tile.of(TileType.MAN, 1);
        Tile east = Tile.of(TileType.WIND, 1);

        assertEquals(0, ScoreCalculator.meldFu(Meld.sequence(oneMan, false)));
        assertEquals(2, ScoreCalculator.meldFu(Meld.triplet(fivePin, true)));
        assertEquals(4, ScoreCalculator.meldFu(Meld.triplet(oneMan, true)));
        assertEquals(4, ScoreCalculator.meldFu(Meld.triplet(fivePin, false)));
        assertEquals(8, ScoreCalculator.meldFu(Meld.triplet(east, false)));
        assertEquals(8, ScoreCalculator.meldFu(Meld.quad(fivePin, true)));
        assertEquals(16, ScoreCalculator.meldFu(Meld.quad(oneMan, true)));
        assertEquals(32, ScoreCalculator.meldFu(Meld.quad(east, false)));
    }

    @Test
    void pairFu() {
        GameContext eastRound = new GameContext(Wind.EAST);
        PlayerContext eastSeat = new PlayerContext(Wind.EAST, true);
        PlayerContext southSeat = new PlayerContext(Wind.SOUTH, false);

        assertEquals(2, ScoreCalculator.pairFu(Tile.of(TileType.DRAGON, 3), southSeat, eastRound));
        assertEquals(4, ScoreCalculator.pairFu(Tile.of(TileType.WIND, 1), eastSeat, eastRound));
        assertEquals(2, ScoreCalculator.pairFu(Tile.of(TileType.WIND, 1), southSeat, eastRound));
        assertEquals(2, ScoreCalculator.pairFu(Tile.of(TileType.WIND, 2), southSeat, eastRound));
        assertEquals(0, ScoreCalculator.pairFu(Tile.of(TileType.WIND, 4), southSeat, eastRound));
        assertEquals(0, ScoreCalculator.pairFu(Tile.of(TileType.MAN, 5), southSeat, eastRound));
    }

    @Test
    void limitBoundaries() {
        assertNull(ScoreCalculator.limitFor(1, 30));
        assertNull(ScoreCalculator.limitFor(4, 30));
        assertNull(ScoreCalculator.limitFor(3, 60));
        assertEquals(HandLimit.MANGAN, ScoreCalculator.limitFor(4, 40));
        assertEquals(HandLimit.MANGAN, ScoreCalculator.limitFor(3, 70));
        assertEquals(HandLimit.MANGAN, ScoreCalculator.limitFor(5, 20));
        assertEquals(HandLimit.HANEMAN, ScoreCalculator.limitFor(6, 30));
        assertEquals(HandLimit.HANEMAN, ScoreCalculator.limitFor(7, 30));
        assertEquals(HandLimit.BAIMAN, ScoreCalculator.limitFor(8, 30));
        assertEquals(HandLimit.BAIMAN, ScoreCalculator.limitFor(10, 30));
        assertEquals(HandLimit.SANBAIMAN, ScoreCalculator.limitFor(11, 30));
        assertEquals(HandLimit.SANBAIMAN, ScoreCalculator.limitFor(12, 30));
        assertEquals(HandLimit.KAZOE_YAKUMAN, ScoreCalculator.limitFor(13, 30));
        assertEquals(HandLimit.KAZOE_YAKUMAN, ScoreCalculator.limitFor(20, 30));
    }

    @Test
    void openHandLosesHanPerYaku() {
        assertEquals(5, ScoreCalculator.calculateHan(Arrays.asList(Yaku.HONITSU, Yaku.ITTSU), true));
        assertEquals(3, ScoreCalculator.calculateHan(Arrays.asList(Yaku.HONITSU, Yaku.ITTSU), false));
        // 只有食い下がり的役减番，立直、平和等不受门前标志影响
        assertEquals(2, ScoreCalculator.calculateHan(Arrays.asList(Yaku.PINFU, Yaku.RIICHI), false));
        assertEquals(2, ScoreCalculator.calculateHan(Arrays.asList(Yaku.CHIITOITSU), false));
    }

    @Test
    void yakumanCount() {
        assertEquals(0, ScoreCalculator.countYakuman(Arrays.asList(Yaku.RIICHI, Yaku.DORA)));
        assertEquals(3, ScoreCalculator.countYakuman(
                Arrays.asList(Yaku.DAISANGEN, Yaku.KOKUSHI_MUSOU_THIRTEEN_SIDED)));
    }

    @Test
    void roundUp() {
        assertEquals(30, ScoreCalculator.roundUp(22, 10));
        assertEquals(30, ScoreCalculator.roundUp(30, 10));
        assertEquals(0, ScoreCalculator.roundUp(0, 100));
        assertEquals(100, ScoreCalculator.roundUp(1, 100));
        assertEquals(2000, ScoreCalculator.roundUp(1920, 100));
    }
}
