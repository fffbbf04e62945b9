package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 役判定结果：役列表、赤宝牌数量、判定时使用的手牌结构以及听牌形
 */
public final class Recognition {
    private final List<Yaku> yakuList;
    private final int redFiveCount;
    private final HandOrganization organization;
    private final WaitType wait;

    public Recognition(List<Yaku> yakuList, int redFiveCount, HandOrganization organization, WaitType wait) {
        this.yakuList = Collections.unmodifiableList(new ArrayList<>(yakuList));
        this.redFiveCount = redFiveCount;
        this.organization = organization;
        this.wait = wait;
    }

    public List<Yaku> getYakuList() {
        return yakuList;
    }

    public int getRedFiveCount() {
        return redFiveCount;
    }

    public HandOrganization getOrganization() {
        return organization;
    }

    /**
     * 标准形取拆解结果的听牌形；七对子为单骑；国士无双为单面或十三面
     */
    public WaitType getWait() {
        return wait;
    }

    public boolean contains(Yaku yaku) {
        return yakuList.contains(yaku);
    }
}
