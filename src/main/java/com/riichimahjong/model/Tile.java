package com.riichimahjong.model;

/**
 * 麻将牌（值类型，只按种类比较，不区分实体牌）
 * 共 34 种，规范下标：
 * 0-8 万 1-9，9-17 筒 1-9，18-26 索 1-9，27-30 东南西北，31-33 白发中
 */
public final class Tile implements Comparable<Tile> {

    public static final int KIND_COUNT = 34;

    private static final Tile[] BY_INDEX = new Tile[KIND_COUNT];

    static {
        int index = 0;
        for (TileType type : TileType.values()) {
            for (int value = 1; value <= type.maxValue(); value++) {
                BY_INDEX[index++] = new Tile(type, value);
            }
        }
    }

    private final TileType type;    // 牌类型
    private final int value;        // 牌值（数牌 1-9，风 1-4，三元 1-3）

    private Tile(TileType type, int value) {
        this.type = type;
        this.value = value;
    }

    /**
     * 取得指定种类的牌
     */
    public static Tile of(TileType type, int value) {
        if (type == null || value < 1 || value > type.maxValue()) {
            throw new IllegalArgumentException("非法的牌：" + type + value);
        }
        return BY_INDEX[indexOf(type, value)];
    }

    /**
     * 下标 -> 牌；下标越界属于程序错误
     */
    public static Tile fromIndex(int index) {
        if (index < 0 || index >= KIND_COUNT) {
            throw new IllegalArgumentException("牌下标越界：" + index);
        }
        return BY_INDEX[index];
    }

    private static int indexOf(TileType type, int value) {
        switch (type) {
            case MAN:
                return value - 1;
            case PIN:
                return 9 + value - 1;
            case SOU:
                return 18 + value - 1;
            case WIND:
                return 27 + value - 1;
            default:
                return 31 + value - 1;
        }
    }

    public TileType getType() {
        return type;
    }

    public int getValue() {
        return value;
    }

    /**
     * 牌 -> 下标（0-33）
     */
    public int getIndex() {
        return indexOf(type, value);
    }

    public boolean isHonor() {
        return !type.isSuit();
    }

    public boolean isWind() {
        return type == TileType.WIND;
    }

    public boolean isDragon() {
        return type == TileType.DRAGON;
    }

    /**
     * 幺九牌：1、9 或字牌
     */
    public boolean isTerminalOrHonor() {
        return isHonor() || value == 1 || value == 9;
    }

    /**
     * 宝牌指示牌的下一张（9 -> 1，北 -> 东，中 -> 白）
     */
    public Tile next() {
        int nextValue = value % type.maxValue() + 1;
        return of(type, nextValue);
    }

    /**
     * 显示名称（MPSZ 记法，如 5m、7z）
     */
    public String getDisplayName() {
        switch (type) {
            case MAN:
                return value + "m";
            case PIN:
                return value + "p";
            case SOU:
                return value + "s";
            case WIND:
                return value + "z";
            default:
                return (value + 4) + "z";
        }
    }

    /**
     * 排序：先按类型，再按数值
     */
    @Override
    public int compareTo(Tile other) {
        return this.getIndex() - other.getIndex();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        Tile other = (Tile) o;
        return type == other.type && value == other.value;
    }

    @Override
    public int hashCode() {
        return getIndex();
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
