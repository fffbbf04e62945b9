package com.riichimahjong.model;

/**
 * 满贯以上的封顶档位
 */
public enum HandLimit {
    MANGAN("满贯"),
    HANEMAN("跳满"),
    BAIMAN("倍满"),
    SANBAIMAN("三倍满"),
    KAZOE_YAKUMAN("累计役满"),
    YAKUMAN("役满"),
    DOUBLE_YAKUMAN("双倍役满"),
    MULTIPLE_YAKUMAN("多倍役满");

    private final String displayName;

    HandLimit(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
