package com.riichimahjong.engine;

import com.riichimahjong.model.Meld;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.TileType;
import com.riichimahjong.model.WaitType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 听牌形判断测试
 */
class WaitClassifierTest {

    private static Tile man(int value) {
        return Tile.of(TileType.MAN, value);
    }

    private static Tile pin(int value) {
        return Tile.of(TileType.PIN, value);
    }

    private static Tile sou(int value) {
        return Tile.of(TileType.SOU, value);
    }

    // 123m 456p 789s 222z
    private static List<Meld> melds() {
        return Arrays.asList(
                Meld.sequence(man(1), false),
                Meld.sequence(pin(4), false),
                Meld.sequence(sou(7), false),
                Meld.triplet(Tile.of(TileType.WIND, 2), false));
    }

    @Test
    void pairIsCheckedFirst() {
        // 1m 同时在 123m 里，但和了牌是雀头时算单骑
        assertEquals(WaitType.SINGLE, WaitClassifier.classify(melds(), man(1), man(1)));
    }

    @Test
    void tripletMeansTripletPairWait() {
        assertEquals(WaitType.TRIPLET_PAIR,
                WaitClassifier.classify(melds(), man(9), Tile.of(TileType.WIND, 2)));
    }

    @Test
    void sequencePositions() {
        // 中间一张：嵌张
        assertEquals(WaitType.CLOSED, WaitClassifier.classify(melds(), man(9), pin(5)));
        // 456p 两端：两面
        assertEquals(WaitType.TWO_SIDED, WaitClassifier.classify(melds(), man(9), pin(4)));
        assertEquals(WaitType.TWO_SIDED, WaitClassifier.classify(melds(), man(9), pin(6)));
        // 123m 的 3、789s 的 7：边张
        assertEquals(WaitType.EDGE, WaitClassifier.classify(melds(), man(9), man(3)));
        assertEquals(WaitType.EDGE, WaitClassifier.classify(melds(), man(9), sou(7)));
        // 123m 的 1、789s 的 9：两面
        assertEquals(WaitType.TWO_SIDED, WaitClassifier.classify(melds(), pin(9), man(1)));
        assertEquals(WaitType.TWO_SIDED, WaitClassifier.classify(melds(), man(9), sou(9)));
    }

    @Test
    void openMeldsAreNotCompletedByTheWinningTile() {
        // 碰了 5p，手中 345p，和了 5p 完成的是手中的顺子
        List<Meld> melds = Arrays.asList(
                Meld.triplet(pin(5), true),
                Meld.sequence(pin(3), false),
                Meld.sequence(man(2), false),
                Meld.sequence(sou(6), false));
        assertEquals(WaitType.TWO_SIDED, WaitClassifier.classify(melds, man(9), pin(5)));
    }

    @Test
    void sameInputGivesSameAnswer() {
        List<Meld> melds = melds();
        WaitType first = WaitClassifier.classify(melds, man(9), pin(5));
        for (int i = 0; i < 10; i++) {
            assertEquals(first, WaitClassifier.classify(melds, man(9), pin(5)));
        }
    }

    @Test
    void brokenDecompositionFailsLoudly() {
        assertThrows(IllegalStateException.class,
                () -> WaitClassifier.classify(melds(), man(9), Tile.of(TileType.DRAGON, 3)));
        assertThrows(IllegalStateException.class,
                () -> WaitClassifier.classify(melds().subList(0, 3), man(9), man(1)));
    }
}
