package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 四面子一雀头的和了形
 */
public final class WinningHand {
    private final List<Meld> melds;     // 4 组面子（副露、暗杠在前，手中拆出的在后）
    private final Tile pairTile;        // 雀头
    private final Tile winningTile;     // 和了牌
    private final WaitType wait;        // 听牌形

    public WinningHand(List<Meld> melds, Tile pairTile, Tile winningTile, WaitType wait) {
        if (melds == null || melds.size() != 4) {
            throw new IllegalStateException("和了形必须正好 4 组面子，实际："
                    + (melds == null ? 0 : melds.size()));
        }
        this.melds = Collections.unmodifiableList(new ArrayList<>(melds));
        this.pairTile = pairTile;
        this.winningTile = winningTile;
        this.wait = wait;
    }

    public List<Meld> getMelds() {
        return melds;
    }

    public Tile getPairTile() {
        return pairTile;
    }

    public Tile getWinningTile() {
        return winningTile;
    }

    public WaitType getWait() {
        return wait;
    }

    /**
     * 面子 + 雀头的全部牌（按下标计数）
     */
    public int[] toCounts() {
        int[] counts = new int[Tile.KIND_COUNT];
        for (Meld meld : melds) {
            for (Tile tile : meld.getTiles()) {
                counts[tile.getIndex()]++;
            }
        }
        counts[pairTile.getIndex()] += 2;
        return counts;
    }

    @Override
    public String toString() {
        return melds + " + " + pairTile.getDisplayName().charAt(0) + pairTile + " 和了：" + winningTile + " 听：" + wait;
    }
}
