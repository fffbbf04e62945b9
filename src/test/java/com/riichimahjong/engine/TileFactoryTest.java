package com.riichimahjong.engine;

import com.riichimahjong.model.Tile;
import com.riichimahjong.model.TileType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 牌工厂测试
 */
class TileFactoryTest {

    @Test
    void testCreateFullDeck() {
        List<Tile> tiles = TileFactory.createFullDeck();

        // 检查总数（136张）
        assertEquals(136, tiles.size(), "牌总数应该是136张");

        // 检查万、筒、索各36张
        long manCount = tiles.stream().filter(t -> t.getType() == TileType.MAN).count();
        long pinCount = tiles.stream().filter(t -> t.getType() == TileType.PIN).count();
        long souCount = tiles.stream().filter(t -> t.getType() == TileType.SOU).count();

        assertEquals(36, manCount, "万子应该有36张");
        assertEquals(36, pinCount, "筒子应该有36张");
        assertEquals(36, souCount, "索子应该有36张");

        // 风牌 16 张，三元牌 12 张
        assertEquals(16, tiles.stream().filter(Tile::isWind).count(), "风牌应该有16张");
        assertEquals(12, tiles.stream().filter(Tile::isDragon).count(), "三元牌应该有12张");
    }

    @Test
    void testShuffle() {
        List<Tile> tiles1 = TileFactory.createFullDeck();
        List<Tile> tiles2 = TileFactory.createFullDeck();

        TileFactory.shuffle(tiles1, new Random(42));

        // 洗牌后总数不变
        assertEquals(136, tiles1.size());

        boolean isDifferent = false;
        for (int i = 0; i < 10; i++) {
            if (!tiles1.get(i).equals(tiles2.get(i))) {
                isDifferent = true;
                break;
            }
        }
        assertTrue(isDifferent, "洗牌后顺序应该改变");
    }

    @Test
    void parseMpszNotation() {
        List<Tile> tiles = TileFactory.parse("234m 567m 345p 678p 44s");
        assertEquals(14, tiles.size());
        assertEquals(Tile.of(TileType.MAN, 2), tiles.get(0));
        assertEquals(Tile.of(TileType.SOU, 4), tiles.get(13));

        List<Tile> honors = TileFactory.parse("1234567z");
        assertEquals(Tile.of(TileType.WIND, 1), honors.get(0));
        assertEquals(Tile.of(TileType.WIND, 4), honors.get(3));
        assertEquals(Tile.of(TileType.DRAGON, 1), honors.get(4));
        assertEquals(Tile.of(TileType.DRAGON, 3), honors.get(6));

        // 0 是赤五
        assertEquals(Tile.of(TileType.PIN, 5), TileFactory.parseTile("0p"));
        assertEquals("8p", TileFactory.parseTile("8p").getDisplayName());
    }

    @Test
    void malformedNotationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TileFactory.parse("123"));
        assertThrows(IllegalArgumentException.class, () -> TileFactory.parse("m123"));
        assertThrows(IllegalArgumentException.class, () -> TileFactory.parse("8z"));
        assertThrows(IllegalArgumentException.class, () -> TileFactory.parse("12x"));
        assertThrows(IllegalArgumentException.class, () -> TileFactory.parseTile("12m"));
    }
}
