package com.riichimahjong.engine;

import com.riichimahjong.model.GameContext;
import com.riichimahjong.model.HandLimit;
import com.riichimahjong.model.HandOrganization;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.MeldType;
import com.riichimahjong.model.PlayerContext;
import com.riichimahjong.model.Recognition;
import com.riichimahjong.model.ScoreResult;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WinType;
import com.riichimahjong.model.WinningHand;
import com.riichimahjong.model.Yaku;

import java.util.List;

/**
 * 计分器：番、符、基本点与各家支付
 * 输入是已经判定过役的合法手牌，本身不会拒绝
 */
public class ScoreCalculator {

    static final int YAKUMAN_BASIC_POINTS = 8000;
    static final int SANBAIMAN_BASIC_POINTS = 6000;
    static final int BAIMAN_BASIC_POINTS = 4000;
    static final int HANEMAN_BASIC_POINTS = 3000;
    static final int MANGAN_BASIC_POINTS = 2000;

    static final int TSUMO_BONUS_PER_HONBA = 100;   // 自摸：每家每本场 100
    static final int RON_BONUS_PER_HONBA = 300;     // 荣和：每本场 300

    static final int BASE_FU = 20;                  // 副底
    static final int CHIITOITSU_FU = 25;

    /**
     * 刻子的符，下标 = (门清 ? 2 : 0) + (幺九 ? 1 : 0)：明刻中张 2、明刻幺九 4、暗刻中张 4、暗刻幺九 8；
     * 杠子是对应刻子的 4 倍
     */
    private static final int[] TRIPLET_FU = {2, 4, 4, 8};
    private static final int QUAD_MULTIPLIER = 4;

    private ScoreCalculator() {
    }

    public static ScoreResult calculate(Recognition recognition, PlayerContext player, GameContext game,
                                        WinType winType) {
        List<Yaku> yakuList = recognition.getYakuList();

        // === 役满 ===
        int yakumanCount = countYakuman(yakuList);
        if (yakumanCount > 0) {
            int han = 13 * yakumanCount;
            HandLimit limit;
            if (yakumanCount == 1) {
                limit = HandLimit.YAKUMAN;
            } else if (yakumanCount == 2) {
                limit = HandLimit.DOUBLE_YAKUMAN;
            } else {
                limit = HandLimit.MULTIPLE_YAKUMAN;
            }
            // 宝牌不计入役满
            return settle(han, 0, recognition, 0, limit, YAKUMAN_BASIC_POINTS * yakumanCount,
                    player, game, winType);
        }

        // === 一般役 ===
        int han = calculateHan(yakuList, player.isConcealed());
        int fu = calculateFu(recognition, player, game, winType);

        HandLimit limit = limitFor(han, fu);
        int basicPoints = limit != null ? basicPointsOf(limit) : fu * (1 << (han + 2));
        return settle(han, fu, recognition, recognition.getRedFiveCount(), limit, basicPoints,
                player, game, winType);
    }

    /**
     * 番数合计，副露减番按役分别计算
     */
    static int calculateHan(List<Yaku> yakuList, boolean concealed) {
        int han = 0;
        for (Yaku yaku : yakuList) {
            han += yaku.getHan(concealed);
        }
        return han;
    }

    /**
     * 役满倍数合计
     */
    static int countYakuman(List<Yaku> yakuList) {
        int count = 0;
        for (Yaku yaku : yakuList) {
            count += yaku.getYakumanCount();
        }
        return count;
    }

    /**
     * 符计算：七对子固定 25 符，平和自摸 20 符 / 荣和 30 符，其余累加后进位到 10 的倍数
     */
    static int calculateFu(Recognition recognition, PlayerContext player, GameContext game, WinType winType) {
        if (recognition.contains(Yaku.CHIITOITSU)) {
            return CHIITOITSU_FU;
        }
        if (recognition.contains(Yaku.PINFU)) {
            return winType == WinType.TSUMO ? 20 : 30;
        }

        HandOrganization organization = recognition.getOrganization();
        if (!(organization instanceof HandOrganization.Regular)) {
            throw new IllegalStateException("非标准形只能是七对子或役满：" + recognition.getYakuList());
        }
        WinningHand hand = ((HandOrganization.Regular) organization).getHand();

        int fu = BASE_FU;

        // 和了方式
        if (winType == WinType.TSUMO) {
            fu += 2;
        } else if (player.isConcealed()) {
            fu += 10;
        }

        // 面子
        for (Meld meld : hand.getMelds()) {
            fu += meldFu(meld);
        }

        // 雀头
        fu += pairFu(hand.getPairTile(), player, game);

        // 听牌形
        if (hand.getWait().addsFu()) {
            fu += 2;
        }

        return roundUp(fu, 10);
    }

    static int meldFu(Meld meld) {
        if (meld.isSequence()) {
            return 0;
        }
        int index = (meld.isOpen() ? 0 : 2) + (meld.getFirstTile().isTerminalOrHonor() ? 1 : 0);
        int fu = TRIPLET_FU[index];
        return meld.getType() == MeldType.QUAD ? fu * QUAD_MULTIPLIER : fu;
    }

    /**
     * 雀头符：三元牌 2；风牌是场风 +2、是自风 +2（连风牌 4）
     */
    static int pairFu(Tile pairTile, PlayerContext player, GameContext game) {
        if (pairTile.isDragon()) {
            return 2;
        }
        int fu = 0;
        if (pairTile.isWind()) {
            if (pairTile.equals(game.getRoundWind().toTile())) {
                fu += 2;
            }
            if (pairTile.equals(player.getSeatWind().toTile())) {
                fu += 2;
            }
        }
        return fu;
    }

    /**
     * 封顶档位：13 番以上累计役满、11-12 三倍满、8-10 倍满、6-7 跳满、5 番满贯；
     * 4 番以下按公式计算，达到 2000 基本点的也按满贯封顶
     */
    static HandLimit limitFor(int han, int fu) {
        if (han >= 13) {
            return HandLimit.KAZOE_YAKUMAN;
        }
        if (han >= 11) {
            return HandLimit.SANBAIMAN;
        }
        if (han >= 8) {
            return HandLimit.BAIMAN;
        }
        if (han >= 6) {
            return HandLimit.HANEMAN;
        }
        if (han == 5) {
            return HandLimit.MANGAN;
        }
        if (fu * (1 << (han + 2)) >= MANGAN_BASIC_POINTS) {
            return HandLimit.MANGAN;
        }
        return null;
    }

    static int basicPointsOf(HandLimit limit) {
        switch (limit) {
            case MANGAN:
                return MANGAN_BASIC_POINTS;
            case HANEMAN:
                return HANEMAN_BASIC_POINTS;
            case BAIMAN:
                return BAIMAN_BASIC_POINTS;
            case SANBAIMAN:
                return SANBAIMAN_BASIC_POINTS;
            default:
                return YAKUMAN_BASIC_POINTS;
        }
    }

    /**
     * 按庄闲与和了方式分配支付，每一笔单独进位到 100
     */
    private static ScoreResult settle(int han, int fu, Recognition recognition, int redFives, HandLimit limit,
                                      int basicPoints, PlayerContext player, GameContext game, WinType winType) {
        int tsumoBonus = game.getHonba() * TSUMO_BONUS_PER_HONBA;
        int ronBonus = game.getHonba() * RON_BONUS_PER_HONBA;

        int basePoints;
        int dealerPayment;
        int nonDealerPayment;
        int total;

        if (winType == WinType.TSUMO) {
            if (player.isDealer()) {
                // 庄家自摸：三家闲家各付 2 倍
                int each = roundUp(basicPoints * 2, 100);
                basePoints = each;
                dealerPayment = each;
                nonDealerPayment = 0;
                total = (each + tsumoBonus) * 3;
            } else {
                // 闲家自摸：庄家付 2 倍，另两家闲家各付 1 倍
                int fromDealer = roundUp(basicPoints * 2, 100);
                int fromNonDealer = roundUp(basicPoints, 100);
                basePoints = fromNonDealer;
                dealerPayment = fromDealer;
                nonDealerPayment = fromNonDealer;
                total = (fromDealer + tsumoBonus) + (fromNonDealer + tsumoBonus) * 2;
            }
        } else {
            // 荣和：放铳者一家支付，庄家 6 倍、闲家 4 倍
            int multiplier = player.isDealer() ? 6 : 4;
            total = roundUp(basicPoints * multiplier, 100) + ronBonus;
            basePoints = total;
            dealerPayment = 0;
            nonDealerPayment = 0;
        }

        return new ScoreResult(han, fu, recognition.getYakuList(), redFives, limit, recognition.getWait(),
                basePoints, dealerPayment, nonDealerPayment, total);
    }

    /**
     * 进位到 unit 的倍数（本身是倍数则不变）
     */
    static int roundUp(int value, int unit) {
        return (value + unit - 1) / unit * unit;
    }
}
