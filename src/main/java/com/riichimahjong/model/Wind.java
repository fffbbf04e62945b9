package com.riichimahjong.model;

/**
 * 风（自风 / 场风）
 */
public enum Wind {
    EAST,   // 东
    SOUTH,  // 南
    WEST,   // 西
    NORTH;  // 北

    /**
     * 对应的风牌
     */
    public Tile toTile() {
        return Tile.of(TileType.WIND, ordinal() + 1);
    }
}
