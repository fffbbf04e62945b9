package com.riichimahjong.model;

import java.util.Arrays;

/**
 * 手牌拆解结果：只有两种情况
 * <ul>
 *     <li>{@link Regular}：四面子一雀头</li>
 *     <li>{@link Irregular}：拆不出标准形，交给役判定器检查七对子 / 国士无双</li>
 * </ul>
 */
public abstract class HandOrganization {

    private HandOrganization() {
    }

    public abstract Tile getWinningTile();

    public boolean isRegular() {
        return this instanceof Regular;
    }

    /**
     * 标准形
     */
    public static final class Regular extends HandOrganization {
        private final WinningHand hand;

        public Regular(WinningHand hand) {
            this.hand = hand;
        }

        public WinningHand getHand() {
            return hand;
        }

        @Override
        public Tile getWinningTile() {
            return hand.getWinningTile();
        }

        @Override
        public String toString() {
            return "Regular" + hand;
        }
    }

    /**
     * 非标准形，保存整手牌的 34 格计数
     */
    public static final class Irregular extends HandOrganization {
        private final int[] counts;
        private final Tile winningTile;

        public Irregular(int[] counts, Tile winningTile) {
            if (counts.length != Tile.KIND_COUNT) {
                throw new IllegalStateException("计数数组长度必须是 34：" + counts.length);
            }
            this.counts = counts.clone();
            this.winningTile = winningTile;
        }

        /**
         * 返回副本，外部修改不影响本对象
         */
        public int[] getCounts() {
            return counts.clone();
        }

        public int countOf(Tile tile) {
            return counts[tile.getIndex()];
        }

        @Override
        public Tile getWinningTile() {
            return winningTile;
        }

        @Override
        public String toString() {
            return "Irregular" + Arrays.toString(counts) + " 和了：" + winningTile;
        }
    }
}
