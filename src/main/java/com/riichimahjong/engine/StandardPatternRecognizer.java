package com.riichimahjong.engine;

import com.riichimahjong.model.GameContext;
import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.HandOrganization;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.PlayerContext;
import com.riichimahjong.model.Recognition;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.TileType;
import com.riichimahjong.model.WaitType;
import com.riichimahjong.model.WinType;
import com.riichimahjong.model.WinningHand;
import com.riichimahjong.model.Yaku;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 默认役判定器
 * 支持：场况役（立直、一发、门清自摸、海底、河底、岭上、抢杠、天和、地和、人和）、
 * 七对子、国士无双、平和、断幺九、役牌、一杯口 / 二杯口、对对和、三暗刻 / 四暗刻、
 * 大三元、混一色 / 清一色、字一色，以及宝牌、里宝牌、赤宝牌。
 * 其余役（三色、一通、全带、小三元、混老头、三杠子等）暂不判定。
 */
@Component
public class StandardPatternRecognizer implements PatternRecognizer {

    private static final Logger log = LoggerFactory.getLogger(StandardPatternRecognizer.class);

    @Override
    public Recognition recognize(HandOrganization organization, HandInput input) {
        int[] counts = HandOrganizer.toCounts(input.getHandTiles());
        List<Yaku> yakuList = new ArrayList<>();
        WaitType wait;

        addStateYaku(input, yakuList);

        if (organization instanceof HandOrganization.Regular) {
            WinningHand hand = ((HandOrganization.Regular) organization).getHand();
            wait = hand.getWait();
            addStandardYaku(hand, input, yakuList);
        } else {
            HandOrganization.Irregular irregular = (HandOrganization.Irregular) organization;
            wait = addIrregularYaku(irregular, input, yakuList);
        }

        addColorYaku(counts, yakuList);

        boolean hasYaku = false;
        for (Yaku yaku : yakuList) {
            if (!yaku.isBonus()) {
                hasYaku = true;
                break;
            }
        }
        if (!hasYaku) {
            log.warn("无役：{}", organization);
            throw new HandRejectedException(RejectReason.NO_YAKU);
        }

        int redFives = input.getGame().getRedFiveCount();
        addBonusTiles(counts, input, yakuList);
        log.debug("役判定完成：{}", yakuList);
        return new Recognition(yakuList, redFives, organization, wait);
    }

    // === 场况役 ===

    private void addStateYaku(HandInput input, List<Yaku> yakuList) {
        PlayerContext p = input.getPlayer();
        GameContext g = input.getGame();
        boolean tsumo = input.getWinType() == WinType.TSUMO;

        if (g.isBlessingOfHeaven()) {
            yakuList.add(Yaku.TENHOU);
        }
        if (g.isBlessingOfEarth()) {
            yakuList.add(Yaku.CHIIHOU);
        }
        if (g.isBlessingOfMan()) {
            yakuList.add(Yaku.RENHOU);
        }
        if (p.isDoubleRiichi()) {
            yakuList.add(Yaku.DOUBLE_RIICHI);
        } else if (p.isRiichi()) {
            yakuList.add(Yaku.RIICHI);
        }
        if (p.isIppatsu()) {
            yakuList.add(Yaku.IPPATSU);
        }
        if (p.isConcealed() && tsumo) {
            yakuList.add(Yaku.MENZEN_TSUMO);
        }
        if (g.isLastDraw()) {
            yakuList.add(Yaku.HAITEI);
        }
        if (g.isLastDiscard()) {
            yakuList.add(Yaku.HOUTEI);
        }
        if (g.isAfterKan()) {
            yakuList.add(Yaku.RINSHAN);
        }
        if (g.isRobbingKan()) {
            yakuList.add(Yaku.CHANKAN);
        }
    }

    // === 非标准形：国士无双 / 七对子 ===

    private WaitType addIrregularYaku(HandOrganization.Irregular irregular, HandInput input, List<Yaku> yakuList) {
        if (!input.getOpenMelds().isEmpty() || !input.getClosedKans().isEmpty()) {
            throw new HandRejectedException(RejectReason.NO_YAKU);
        }
        int[] counts = irregular.getCounts();

        if (isThirteenOrphans(counts)) {
            // 和了牌正好是对子那一种：和了前是 13 种各一张，十三面听
            if (irregular.countOf(irregular.getWinningTile()) == 2) {
                yakuList.add(Yaku.KOKUSHI_MUSOU_THIRTEEN_SIDED);
                return WaitType.THIRTEEN_ORPHANS_THIRTEEN_SIDED;
            }
            yakuList.add(Yaku.KOKUSHI_MUSOU);
            return WaitType.THIRTEEN_ORPHANS_SINGLE;
        }

        if (isSevenPairs(counts)) {
            yakuList.add(Yaku.CHIITOITSU);
            if (allSimples(counts)) {
                yakuList.add(Yaku.TANYAO);
            }
            return WaitType.SINGLE;
        }

        log.warn("非标准形既不是七对子也不是国士无双：{}", irregular);
        throw new HandRejectedException(RejectReason.NO_YAKU);
    }

    /**
     * 13 种幺九牌各至少一张，且全部 14 张都是幺九牌
     */
    static boolean isThirteenOrphans(int[] counts) {
        int total = 0;
        for (int i = 0; i < Tile.KIND_COUNT; i++) {
            boolean terminalOrHonor = Tile.fromIndex(i).isTerminalOrHonor();
            if (terminalOrHonor && counts[i] == 0) {
                return false;
            }
            if (!terminalOrHonor && counts[i] > 0) {
                return false;
            }
            total += counts[i];
        }
        return total == 14;
    }

    /**
     * 7 种不同的对子（4 张同种牌不算两对）
     */
    static boolean isSevenPairs(int[] counts) {
        int pairs = 0;
        for (int count : counts) {
            if (count == 2) {
                pairs++;
            } else if (count != 0) {
                return false;
            }
        }
        return pairs == 7;
    }

    // === 标准形 ===

    private void addStandardYaku(WinningHand hand, HandInput input, List<Yaku> yakuList) {
        PlayerContext p = input.getPlayer();
        GameContext g = input.getGame();
        List<Meld> melds = hand.getMelds();
        int[] counts = hand.toCounts();

        int sequences = 0;
        int sets = 0;
        int dragonSets = 0;
        for (Meld meld : melds) {
            if (meld.isSequence()) {
                sequences++;
                continue;
            }
            sets++;
            Tile tile = meld.getFirstTile();
            if (tile.isDragon()) {
                dragonSets++;
            } else if (tile.isWind()) {
                if (tile.equals(p.getSeatWind().toTile())) {
                    yakuList.add(Yaku.YAKUHAI_SEAT_WIND);
                }
                if (tile.equals(g.getRoundWind().toTile())) {
                    yakuList.add(Yaku.YAKUHAI_ROUND_WIND);
                }
            }
        }

        // 大三元
        if (dragonSets == 3) {
            yakuList.add(Yaku.DAISANGEN);
        } else {
            for (int i = 0; i < dragonSets; i++) {
                yakuList.add(Yaku.YAKUHAI_DRAGON);
            }
        }

        // 平和：门清、4 组顺子、雀头不是役牌、两面听
        if (p.isConcealed() && sequences == 4 && !isValuePair(hand.getPairTile(), p, g)
                && hand.getWait() == WaitType.TWO_SIDED) {
            yakuList.add(Yaku.PINFU);
        }

        if (allSimples(counts)) {
            yakuList.add(Yaku.TANYAO);
        }

        // 一杯口 / 二杯口（门清限定）
        if (p.isConcealed()) {
            int identicalPairs = countIdenticalSequencePairs(melds);
            if (identicalPairs >= 2) {
                yakuList.add(Yaku.RYANPEIKOU);
            } else if (identicalPairs == 1) {
                yakuList.add(Yaku.IIPEIKOU);
            }
        }

        if (sets == 4) {
            yakuList.add(Yaku.TOITOI);
        }

        // 暗刻：荣和完成的双碰刻子算明刻
        int concealedSets = 0;
        boolean ronCompletedSet = input.getWinType() == WinType.RON && hand.getWait() == WaitType.TRIPLET_PAIR;
        boolean winningSetSkipped = false;
        for (Meld meld : melds) {
            if (!meld.isSet() || meld.isOpen()) {
                continue;
            }
            if (ronCompletedSet && !winningSetSkipped && meld.getTiles().size() == 3
                    && meld.getFirstTile().equals(hand.getWinningTile())) {
                winningSetSkipped = true;
                continue;
            }
            concealedSets++;
        }
        if (concealedSets == 4) {
            yakuList.add(hand.getWait() == WaitType.SINGLE ? Yaku.SUUANKOU_TANKI : Yaku.SUUANKOU);
        } else if (concealedSets == 3) {
            yakuList.add(Yaku.SANANKOU);
        }
    }

    /**
     * 雀头是否为役牌（三元牌、自风、场风）
     */
    private boolean isValuePair(Tile pairTile, PlayerContext p, GameContext g) {
        return pairTile.isDragon()
                || pairTile.equals(p.getSeatWind().toTile())
                || pairTile.equals(g.getRoundWind().toTile());
    }

    /**
     * 相同顺子的对数（两组相同记 1 对，两个不同的相同组合记 2 对）
     */
    private int countIdenticalSequencePairs(List<Meld> melds) {
        int[] sequenceCounts = new int[Tile.KIND_COUNT];
        for (Meld meld : melds) {
            if (meld.isSequence() && !meld.isOpen()) {
                sequenceCounts[meld.getFirstTile().getIndex()]++;
            }
        }
        int pairs = 0;
        for (int count : sequenceCounts) {
            pairs += count / 2;
        }
        return pairs;
    }

    // === 按牌的种类判断的役（标准形与七对子通用） ===

    private void addColorYaku(int[] counts, List<Yaku> yakuList) {
        boolean hasHonor = false;
        int suitMask = 0;
        for (int i = 0; i < Tile.KIND_COUNT; i++) {
            if (counts[i] == 0) {
                continue;
            }
            TileType type = Tile.fromIndex(i).getType();
            if (type.isSuit()) {
                suitMask |= 1 << type.ordinal();
            } else {
                hasHonor = true;
            }
        }
        boolean singleSuit = Integer.bitCount(suitMask) == 1;

        if (suitMask == 0) {
            yakuList.add(Yaku.TSUUIISOU);
        } else if (singleSuit && hasHonor) {
            yakuList.add(Yaku.HONITSU);
        } else if (singleSuit) {
            yakuList.add(Yaku.CHINITSU);
        }
    }

    static boolean allSimples(int[] counts) {
        for (int i = 0; i < Tile.KIND_COUNT; i++) {
            if (counts[i] > 0 && Tile.fromIndex(i).isTerminalOrHonor()) {
                return false;
            }
        }
        return true;
    }

    // === 宝牌 ===

    private void addBonusTiles(int[] counts, HandInput input, List<Yaku> yakuList) {
        GameContext g = input.getGame();
        for (Tile indicator : g.getDoraIndicators()) {
            int n = counts[indicator.next().getIndex()];
            for (int i = 0; i < n; i++) {
                yakuList.add(Yaku.DORA);
            }
        }

        // 里宝牌只在立直时有效
        PlayerContext p = input.getPlayer();
        if (p.isRiichi() || p.isDoubleRiichi()) {
            for (Tile indicator : g.getUraDoraIndicators()) {
                int n = counts[indicator.next().getIndex()];
                for (int i = 0; i < n; i++) {
                    yakuList.add(Yaku.URA_DORA);
                }
            }
        }

        for (int i = 0; i < g.getRedFiveCount(); i++) {
            yakuList.add(Yaku.AKA_DORA);
        }
    }
}
