package com.riichimahjong.model;

/**
 * 听牌形（待ち）
 */
public enum WaitType {
    TWO_SIDED,                          // 两面
    EDGE,                               // 边张（12 等 3、89 等 7）
    CLOSED,                             // 嵌张
    TRIPLET_PAIR,                       // 双碰
    SINGLE,                             // 单骑
    THIRTEEN_ORPHANS_SINGLE,            // 国士无双单面
    THIRTEEN_ORPHANS_THIRTEEN_SIDED;    // 国士无双十三面

    /**
     * 两面、双碰不加符，其余一般形听牌加 2 符
     */
    public boolean addsFu() {
        return this == EDGE || this == CLOSED || this == SINGLE;
    }
}
