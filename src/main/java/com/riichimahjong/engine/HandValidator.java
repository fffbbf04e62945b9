package com.riichimahjong.engine;

import com.riichimahjong.model.GameContext;
import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.PlayerContext;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.TileType;
import com.riichimahjong.model.WinType;

/**
 * 输入校验器：拆牌之前一次性检查完，任何一项不通过都直接拒绝
 */
public class HandValidator {

    /**
     * 一副牌中赤宝牌最多 4 张
     */
    static final int MAX_RED_FIVES = 4;

    private HandValidator() {
    }

    /**
     * 依次检查场况冲突与牌的组成
     *
     * @param input        计分请求
     * @param masterCounts 全部手牌的 34 格计数
     * @throws HandRejectedException 第一个不通过的检查
     */
    public static void validate(HandInput input, int[] masterCounts) {
        validateGameState(input);
        validateComposition(input, masterCounts);
    }

    /**
     * 场况标志之间的冲突
     */
    static void validateGameState(HandInput input) {
        PlayerContext p = input.getPlayer();
        GameContext g = input.getGame();
        WinType winType = input.getWinType();
        boolean hasCalls = input.getDeclaredMeldCount() > 0;

        // 立直
        if (p.isDoubleRiichi() && p.isRiichi()) {
            reject(RejectReason.RIICHI_AND_DOUBLE_RIICHI);
        }
        if (p.isIppatsu() && !(p.isRiichi() || p.isDoubleRiichi())) {
            reject(RejectReason.IPPATSU_WITHOUT_RIICHI);
        }

        // 门前清只和副露冲突；无副露但未声明门前清是允许的
        if (p.isConcealed() && !input.getOpenMelds().isEmpty()) {
            reject(RejectReason.CONCEALED_WITH_OPEN_MELDS);
        }

        // 自摸 / 荣和
        if (g.isLastDraw() && winType == WinType.RON) {
            reject(RejectReason.LAST_DRAW_ON_RON);
        }
        if (g.isLastDiscard() && winType == WinType.TSUMO) {
            reject(RejectReason.LAST_DISCARD_ON_TSUMO);
        }
        if (g.isLastDraw() && g.isLastDiscard()) {
            reject(RejectReason.LAST_DRAW_AND_LAST_DISCARD);
        }
        if (g.isAfterKan() && winType == WinType.RON) {
            reject(RejectReason.AFTER_KAN_ON_RON);
        }
        if (g.isRobbingKan() && winType == WinType.TSUMO) {
            reject(RejectReason.ROBBING_KAN_ON_TSUMO);
        }

        // 天和 / 地和 / 人和
        if (g.isBlessingOfHeaven()) {
            if (!p.isDealer()) {
                reject(RejectReason.HEAVEN_REQUIRES_DEALER);
            }
            if (winType != WinType.TSUMO) {
                reject(RejectReason.HEAVEN_REQUIRES_TSUMO);
            }
            if (hasCalls) {
                reject(RejectReason.HEAVEN_WITH_CALLS);
            }
        }
        if (g.isBlessingOfEarth()) {
            if (p.isDealer()) {
                reject(RejectReason.EARTH_REQUIRES_NON_DEALER);
            }
            if (winType != WinType.TSUMO) {
                reject(RejectReason.EARTH_REQUIRES_TSUMO);
            }
            if (hasCalls) {
                reject(RejectReason.EARTH_WITH_CALLS);
            }
        }
        if (g.isBlessingOfMan() && winType != WinType.RON) {
            reject(RejectReason.MAN_REQUIRES_RON);
        }
    }

    /**
     * 张数、和了牌、同种牌上限、赤宝牌数量、本场数与立直棒
     */
    static void validateComposition(HandInput input, int[] masterCounts) {
        // 1. 面子数上限
        if (input.getDeclaredMeldCount() > 4) {
            reject(RejectReason.TOO_MANY_MELDS);
        }

        // 2. 总张数：杠子数 k 时应为 3*(4-k) + 4k + 2；0 杠 14 张还可能是七对子 / 国士
        int quads = input.getQuadCount();
        int expected = expectedTileCount(quads);
        int handSize = input.getHandTiles().size();
        boolean irregularCandidate = handSize == 14 && quads == 0;
        if (!irregularCandidate && handSize != expected) {
            reject(RejectReason.TILE_COUNT_MISMATCH);
        }

        // 3. 和了牌必须在手牌中
        if (input.getWinningTile() == null || !input.getHandTiles().contains(input.getWinningTile())) {
            reject(RejectReason.WINNING_TILE_NOT_HELD);
        }

        // 4. 同一种牌最多 4 张
        for (int count : masterCounts) {
            if (count > 4) {
                reject(RejectReason.TILE_OVERFLOW);
            }
        }

        // 5. 赤宝牌
        int redFives = input.getGame().getRedFiveCount();
        if (redFives < 0) {
            reject(RejectReason.RED_FIVES_NEGATIVE);
        }
        int fives = masterCounts[Tile.of(TileType.MAN, 5).getIndex()]
                + masterCounts[Tile.of(TileType.PIN, 5).getIndex()]
                + masterCounts[Tile.of(TileType.SOU, 5).getIndex()];
        if (redFives > fives) {
            reject(RejectReason.RED_FIVES_EXCEED_FIVES);
        }
        if (redFives > MAX_RED_FIVES) {
            reject(RejectReason.RED_FIVES_OVER_LIMIT);
        }

        // 6. 本场数、立直棒
        if (input.getGame().getHonba() < 0) {
            reject(RejectReason.HONBA_NEGATIVE);
        }
        if (input.getGame().getRiichiSticks() < 0) {
            reject(RejectReason.RIICHI_STICKS_NEGATIVE);
        }
    }

    /**
     * k 个杠子时和了应有的张数
     */
    static int expectedTileCount(int quads) {
        return 3 * (4 - quads) + 4 * quads + 2;
    }

    private static void reject(RejectReason reason) {
        throw new HandRejectedException(reason);
    }
}
