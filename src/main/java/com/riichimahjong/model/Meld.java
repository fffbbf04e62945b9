package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 面子（顺子 / 刻子 / 杠子）
 * 只保存真实存在的牌：顺子、刻子 3 张，杠子 4 张
 */
public final class Meld {
    private final MeldType type;    // 面子类型
    private final boolean open;     // 是否副露（明）
    private final List<Tile> tiles; // 组成的牌，按下标升序

    private Meld(MeldType type, boolean open, List<Tile> tiles) {
        this.type = type;
        this.open = open;
        this.tiles = Collections.unmodifiableList(tiles);
    }

    /**
     * 顺子：以 first 为最小牌，first 必须是 1-7 的数牌
     */
    public static Meld sequence(Tile first, boolean open) {
        if (!canStartSequence(first)) {
            throw new IllegalArgumentException("顺子起始牌非法：" + first);
        }
        List<Tile> tiles = new ArrayList<>(3);
        int index = first.getIndex();
        tiles.add(first);
        tiles.add(Tile.fromIndex(index + 1));
        tiles.add(Tile.fromIndex(index + 2));
        return new Meld(MeldType.SEQUENCE, open, tiles);
    }

    /**
     * 刻子
     */
    public static Meld triplet(Tile tile, boolean open) {
        return new Meld(MeldType.TRIPLET, open, Collections.nCopies(3, tile));
    }

    /**
     * 杠子（明杠 / 暗杠）
     */
    public static Meld quad(Tile tile, boolean open) {
        return new Meld(MeldType.QUAD, open, Collections.nCopies(4, tile));
    }

    /**
     * 是否可以作为顺子的第一张（数牌且点数不是 8、9）
     */
    public static boolean canStartSequence(Tile tile) {
        return tile != null && tile.getType().isSuit() && tile.getValue() <= 7;
    }

    /**
     * 同样的面子，标记为副露
     */
    public Meld asOpen() {
        return open ? this : new Meld(type, true, tiles);
    }

    public MeldType getType() {
        return type;
    }

    public boolean isOpen() {
        return open;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    /**
     * 第一张牌（刻子/杠子即该牌本身，顺子为最小的一张）
     */
    public Tile getFirstTile() {
        return tiles.get(0);
    }

    public Tile getLastTile() {
        return tiles.get(tiles.size() - 1);
    }

    public boolean isSequence() {
        return type == MeldType.SEQUENCE;
    }

    /**
     * 刻子或杠子
     */
    public boolean isSet() {
        return type == MeldType.TRIPLET || type == MeldType.QUAD;
    }

    public boolean contains(Tile tile) {
        if (isSet()) {
            return getFirstTile().equals(tile);
        }
        return tiles.contains(tile);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Meld)) {
            return false;
        }
        Meld other = (Meld) o;
        return type == other.type && open == other.open && tiles.equals(other.tiles);
    }

    @Override
    public int hashCode() {
        return (type.hashCode() * 31 + (open ? 1 : 0)) * 31 + tiles.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(open ? "[" : "(");
        for (Tile tile : tiles) {
            sb.append(tile.getDisplayName().charAt(0));
        }
        sb.append(tiles.get(0).getDisplayName().charAt(1));
        sb.append(open ? "]" : ")");
        return sb.toString();
    }
}
