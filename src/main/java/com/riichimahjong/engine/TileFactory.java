package com.riichimahjong.engine;

import com.riichimahjong.model.Tile;
import com.riichimahjong.model.TileType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 麻将牌工厂 - 创建牌山、洗牌、解析 MPSZ 记法
 */
public class TileFactory {

    private TileFactory() {
    }

    /**
     * 创建一副完整的立直麻将牌（136张）
     * 万、筒、索各36张（1-9，每张4张）
     * 东南西北各4张
     * 白发中各4张
     */
    public static List<Tile> createFullDeck() {
        List<Tile> tiles = new ArrayList<>(Tile.KIND_COUNT * 4);
        for (int index = 0; index < Tile.KIND_COUNT; index++) {
            for (int count = 0; count < 4; count++) {
                tiles.add(Tile.fromIndex(index));
            }
        }
        return tiles;
    }

    /**
     * 洗牌
     */
    public static void shuffle(List<Tile> tiles, Random random) {
        Collections.shuffle(tiles, random);
    }

    /**
     * 解析 MPSZ 记法，例如 "234m567m345p678p44s"、"11122z"
     * 数字在前，花色字母在后：m 万、p 筒、s 索、z 字（1-4 东南西北，5 白，6 发，7 中）。
     * 0 表示赤五，按 5 处理。
     *
     * @throws IllegalArgumentException 记法不合法
     */
    public static List<Tile> parse(String notation) {
        if (notation == null) {
            throw new IllegalArgumentException("牌的记法不能为空");
        }
        List<Tile> tiles = new ArrayList<>();
        List<Integer> pending = new ArrayList<>();
        for (char c : notation.replace(" ", "").toCharArray()) {
            if (Character.isDigit(c)) {
                pending.add(c - '0');
                continue;
            }
            if (pending.isEmpty()) {
                throw new IllegalArgumentException("花色前没有数字：" + notation);
            }
            for (int value : pending) {
                tiles.add(toTile(value, c, notation));
            }
            pending.clear();
        }
        if (!pending.isEmpty()) {
            throw new IllegalArgumentException("数字后缺少花色：" + notation);
        }
        return tiles;
    }

    /**
     * 解析单张牌，例如 "8p"、"7z"
     */
    public static Tile parseTile(String notation) {
        List<Tile> tiles = parse(notation);
        if (tiles.size() != 1) {
            throw new IllegalArgumentException("应为单张牌：" + notation);
        }
        return tiles.get(0);
    }

    private static Tile toTile(int value, char suit, String notation) {
        switch (suit) {
            case 'm':
                return Tile.of(TileType.MAN, value == 0 ? 5 : value);
            case 'p':
                return Tile.of(TileType.PIN, value == 0 ? 5 : value);
            case 's':
                return Tile.of(TileType.SOU, value == 0 ? 5 : value);
            case 'z':
                if (value >= 1 && value <= 4) {
                    return Tile.of(TileType.WIND, value);
                }
                if (value >= 5 && value <= 7) {
                    return Tile.of(TileType.DRAGON, value - 4);
                }
                throw new IllegalArgumentException("字牌只能是 1-7：" + notation);
            default:
                throw new IllegalArgumentException("未知花色 " + suit + "：" + notation);
        }
    }
}
