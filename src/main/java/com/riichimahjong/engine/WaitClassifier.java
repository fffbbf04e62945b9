package com.riichimahjong.engine;

import com.riichimahjong.model.Meld;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WaitType;

import java.util.List;

/**
 * 听牌形判断：和了牌完成的是雀头还是哪一组面子，以及完成的形状
 */
public class WaitClassifier {

    private WaitClassifier() {
    }

    /**
     * 判断顺序：
     * 1. 和了牌就是雀头 -> 单骑（先于面子判断，避免同种牌也在面子里时误判）
     * 2. 找到包含和了牌的面子；刻子 / 杠子 -> 双碰
     * 3. 顺子：中间 -> 嵌张；最小一张 -> 顺子末尾是 9 则边张，否则两面；
     *    最大一张 -> 顺子开头是 1 则边张，否则两面
     *
     * @throws IllegalStateException 面子不是 4 组，或和了牌不在任何面子和雀头中（拆解有误）
     */
    public static WaitType classify(List<Meld> melds, Tile pairTile, Tile winningTile) {
        if (melds == null || melds.size() != 4) {
            throw new IllegalStateException("听牌判断需要正好 4 组面子，实际："
                    + (melds == null ? 0 : melds.size()));
        }

        if (winningTile.equals(pairTile)) {
            return WaitType.SINGLE;
        }

        Meld winningMeld = findWinningMeld(melds, winningTile);

        if (winningMeld.isSet()) {
            return WaitType.TRIPLET_PAIR;
        }

        Tile low = winningMeld.getFirstTile();
        Tile high = winningMeld.getLastTile();
        if (winningTile.equals(low)) {
            return high.getValue() == 9 ? WaitType.EDGE : WaitType.TWO_SIDED;
        }
        if (winningTile.equals(high)) {
            return low.getValue() == 1 ? WaitType.EDGE : WaitType.TWO_SIDED;
        }
        return WaitType.CLOSED;
    }

    /**
     * 和了牌只能完成手中拆出的面子，副露和暗杠都是和了之前就成形的，
     * 所以优先在手中拆出的面子里找；都找不到再看全部面子。
     */
    private static Meld findWinningMeld(List<Meld> melds, Tile winningTile) {
        for (Meld meld : melds) {
            if (!meld.isOpen() && meld.getTiles().size() == 3 && meld.contains(winningTile)) {
                return meld;
            }
        }
        for (Meld meld : melds) {
            if (meld.contains(winningTile)) {
                return meld;
            }
        }
        throw new IllegalStateException("和了牌 " + winningTile + " 不在雀头或任何面子中：" + melds);
    }
}
