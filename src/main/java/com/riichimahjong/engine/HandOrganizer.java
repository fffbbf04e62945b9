package com.riichimahjong.engine;

import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.HandOrganization;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WaitType;
import com.riichimahjong.model.WinningHand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 手牌拆解器：把和了时的全部手牌拆成四面子一雀头，拆不出时交给役判定器按非标准形处理
 */
public class HandOrganizer {

    private static final Logger log = LoggerFactory.getLogger(HandOrganizer.class);

    private HandOrganizer() {
    }

    /**
     * 校验输入并拆解手牌
     * 1. 统计全部手牌，先做输入校验
     * 2. 扣除暗杠、副露
     * 3. 按下标从小到大枚举雀头，剩余部分回溯拆面子，第一个成功的拆法即为结果
     * 4. 都失败则返回非标准形（七对子 / 国士无双 / 诈和由役判定器决定）
     *
     * @throws HandRejectedException 输入不合法
     */
    public static HandOrganization organize(HandInput input) {
        int[] masterCounts = toCounts(input.getHandTiles());
        HandValidator.validate(input, masterCounts);

        int[] concealedCounts = masterCounts.clone();
        List<Meld> declaredMelds = new ArrayList<>(4);

        // 暗杠
        for (Tile kanTile : input.getClosedKans()) {
            Meld kan = Meld.quad(kanTile, false);
            removeMeld(concealedCounts, kan, RejectReason.CLOSED_KAN_NOT_HELD);
            declaredMelds.add(kan);
        }

        // 副露（吃、碰、明杠）
        for (Meld meld : input.getOpenMelds()) {
            Meld open = meld.asOpen();
            removeMeld(concealedCounts, open, RejectReason.OPEN_MELD_NOT_HELD);
            declaredMelds.add(open);
        }

        int meldsNeeded = 4 - declaredMelds.size();
        Tile winningTile = input.getWinningTile();

        // 已有 4 组面子：剩下的两张必须是雀头，只能是单骑
        if (meldsNeeded == 0) {
            for (int i = 0; i < Tile.KIND_COUNT; i++) {
                if (concealedCounts[i] == 2) {
                    WinningHand hand = new WinningHand(declaredMelds, Tile.fromIndex(i), winningTile, WaitType.SINGLE);
                    log.debug("四副露单骑：{}", hand);
                    return new HandOrganization.Regular(hand);
                }
            }
            if (input.getHandTiles().size() != 14) {
                throw new HandRejectedException(RejectReason.NO_PAIR_FOR_FOUR_MELDS);
            }
            log.debug("4 组面子但没有雀头，按非标准形处理");
            return new HandOrganization.Irregular(masterCounts, winningTile);
        }

        // 枚举雀头，每个假设都从扣除雀头后的新副本开始
        for (int i = 0; i < Tile.KIND_COUNT; i++) {
            if (concealedCounts[i] < 2) {
                continue;
            }
            int[] remaining = concealedCounts.clone();
            remaining[i] -= 2;
            List<Meld> closedMelds = new ArrayList<>(meldsNeeded);

            if (findMelds(remaining, closedMelds) && closedMelds.size() == meldsNeeded) {
                List<Meld> melds = new ArrayList<>(declaredMelds);
                melds.addAll(closedMelds);
                Tile pairTile = Tile.fromIndex(i);
                WaitType wait = WaitClassifier.classify(melds, pairTile, winningTile);
                WinningHand hand = new WinningHand(melds, pairTile, winningTile, wait);
                log.debug("拆解成功：{}", hand);
                return new HandOrganization.Regular(hand);
            }
        }

        log.debug("拆不出四面子一雀头，按非标准形处理");
        return new HandOrganization.Irregular(masterCounts, winningTile);
    }

    /**
     * 检查剩余的牌能否全部拆成面子（刻子 / 顺子），拆出的面子按发现顺序追加到 melds。
     * 总是从下标最小的一张牌开始：这张牌要么组刻子，要么作为顺子的第一张，
     * 保证拆出的顺序是确定的，也不会回头重复搜索已经用完的牌。
     * 返回时 counts 恢复为调用前的状态。
     */
    static boolean findMelds(int[] counts, List<Meld> melds) {
        // 找到当前还存在的最小一张牌
        int i = 0;
        while (i < Tile.KIND_COUNT && counts[i] == 0) {
            i++;
        }

        // 全部用完
        if (i == Tile.KIND_COUNT) {
            return true;
        }

        Tile tile = Tile.fromIndex(i);

        // 尝试一：刻子 AAA
        if (counts[i] >= 3 && tryMeld(counts, melds, Meld.triplet(tile, false))) {
            return true;
        }

        // 尝试二：顺子 ABC（数牌，且不是 8、9 开头）
        if (Meld.canStartSequence(tile) && counts[i + 1] > 0 && counts[i + 2] > 0
                && tryMeld(counts, melds, Meld.sequence(tile, false))) {
            return true;
        }

        return false;
    }

    /**
     * 扣除一组面子后继续搜索；无论成败，退出时都把这组牌加回去
     */
    private static boolean tryMeld(int[] counts, List<Meld> melds, Meld meld) {
        for (Tile t : meld.getTiles()) {
            counts[t.getIndex()]--;
        }
        melds.add(meld);
        try {
            if (findMelds(counts, melds)) {
                return true;
            }
            melds.remove(melds.size() - 1);
            return false;
        } finally {
            for (Tile t : meld.getTiles()) {
                counts[t.getIndex()]++;
            }
        }
    }

    /**
     * 从计数中扣除声明的面子，牌不够则拒绝
     */
    private static void removeMeld(int[] counts, Meld meld, RejectReason reasonIfMissing) {
        int[] need = toCounts(meld.getTiles());
        for (int i = 0; i < Tile.KIND_COUNT; i++) {
            if (counts[i] < need[i]) {
                log.warn("声明的面子 {} 不在手牌中", meld);
                throw new HandRejectedException(reasonIfMissing);
            }
        }
        for (int i = 0; i < Tile.KIND_COUNT; i++) {
            counts[i] -= need[i];
        }
    }

    /**
     * 牌列表 -> 34 格计数
     */
    public static int[] toCounts(List<Tile> tiles) {
        int[] counts = new int[Tile.KIND_COUNT];
        for (Tile tile : tiles) {
            counts[tile.getIndex()]++;
        }
        return counts;
    }
}
