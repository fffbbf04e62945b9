package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 计分结果
 * <p>
 * 各支付字段的含义随和了方式不同：
 * <ul>
 *     <li>荣和：basePoints = totalPayment = 放铳者支付（含本场），其余为 0</li>
 *     <li>庄家自摸：basePoints = dealerPayment = 每家闲家支付（不含本场），nonDealerPayment = 0</li>
 *     <li>闲家自摸：dealerPayment = 庄家支付，basePoints = nonDealerPayment = 每家闲家支付（不含本场）</li>
 * </ul>
 */
public final class ScoreResult {
    private final int han;                  // 番
    private final int fu;                   // 符（役满为 0）
    private final List<Yaku> yakuList;      // 役与宝牌
    private final int redFiveCount;         // 计入的赤宝牌（役满时为 0）
    private final HandLimit limit;          // 封顶档位，未达到满贯为 null
    private final WaitType wait;            // 听牌形
    private final int basePoints;
    private final int dealerPayment;
    private final int nonDealerPayment;
    private final int totalPayment;         // 总收入（含本场）

    public ScoreResult(int han, int fu, List<Yaku> yakuList, int redFiveCount, HandLimit limit, WaitType wait,
                       int basePoints, int dealerPayment, int nonDealerPayment, int totalPayment) {
        this.han = han;
        this.fu = fu;
        this.yakuList = Collections.unmodifiableList(new ArrayList<>(yakuList));
        this.redFiveCount = redFiveCount;
        this.limit = limit;
        this.wait = wait;
        this.basePoints = basePoints;
        this.dealerPayment = dealerPayment;
        this.nonDealerPayment = nonDealerPayment;
        this.totalPayment = totalPayment;
    }

    public int getHan() {
        return han;
    }

    public int getFu() {
        return fu;
    }

    public List<Yaku> getYakuList() {
        return yakuList;
    }

    public int getRedFiveCount() {
        return redFiveCount;
    }

    public HandLimit getLimit() {
        return limit;
    }

    public WaitType getWait() {
        return wait;
    }

    public int getBasePoints() {
        return basePoints;
    }

    public int getDealerPayment() {
        return dealerPayment;
    }

    public int getNonDealerPayment() {
        return nonDealerPayment;
    }

    public int getTotalPayment() {
        return totalPayment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreResult)) {
            return false;
        }
        ScoreResult other = (ScoreResult) o;
        return han == other.han && fu == other.fu && redFiveCount == other.redFiveCount
                && limit == other.limit && wait == other.wait && basePoints == other.basePoints
                && dealerPayment == other.dealerPayment && nonDealerPayment == other.nonDealerPayment
                && totalPayment == other.totalPayment && yakuList.equals(other.yakuList);
    }

    @Override
    public int hashCode() {
        int result = han;
        result = 31 * result + fu;
        result = 31 * result + yakuList.hashCode();
        result = 31 * result + totalPayment;
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(han).append("番");
        if (fu > 0) {
            sb.append(fu).append("符");
        }
        if (limit != null) {
            sb.append(" ").append(limit.getDisplayName());
        }
        sb.append(" 役：");
        for (int i = 0; i < yakuList.size(); i++) {
            if (i > 0) {
                sb.append("、");
            }
            sb.append(yakuList.get(i).getDisplayName());
        }
        sb.append(" 合计：").append(totalPayment);
        return sb.toString();
    }
}
