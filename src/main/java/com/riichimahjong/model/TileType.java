package com.riichimahjong.model;

/**
 * 麻将牌类型
 * 顺序即规范下标的顺序：万、筒、索、风、三元
 */
public enum TileType {
    MAN,    // 万子（1-9）
    PIN,    // 筒子（1-9）
    SOU,    // 索子（1-9）
    WIND,   // 风牌（东南西北：1-4）
    DRAGON; // 三元牌（1=白，2=发，3=中）

    /**
     * 是否为数牌（可以组成顺子）
     */
    public boolean isSuit() {
        return this == MAN || this == PIN || this == SOU;
    }

    /**
     * 该类型牌值的上限
     */
    public int maxValue() {
        switch (this) {
            case WIND:
                return 4;
            case DRAGON:
                return 3;
            default:
                return 9;
        }
    }
}
