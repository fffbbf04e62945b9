package com.riichimahjong.engine;

/**
 * 拒绝计分的原因，code 对外稳定
 */
public enum RejectReason {
    // === 场况标志冲突 ===
    RIICHI_AND_DOUBLE_RIICHI("STATE_RIICHI_CONFLICT", "不能同时立直和两立直"),
    IPPATSU_WITHOUT_RIICHI("STATE_IPPATSU_NO_RIICHI", "一发需要立直或两立直"),
    CONCEALED_WITH_OPEN_MELDS("STATE_CONCEALED_OPEN", "声明门前清但有副露"),
    LAST_DRAW_ON_RON("STATE_LAST_DRAW_RON", "海底摸月不能是荣和"),
    LAST_DISCARD_ON_TSUMO("STATE_LAST_DISCARD_TSUMO", "河底捞鱼不能是自摸"),
    LAST_DRAW_AND_LAST_DISCARD("STATE_LAST_DRAW_AND_DISCARD", "不能同时海底和河底"),
    AFTER_KAN_ON_RON("STATE_RINSHAN_RON", "岭上开花不能是荣和"),
    ROBBING_KAN_ON_TSUMO("STATE_CHANKAN_TSUMO", "抢杠不能是自摸"),
    HEAVEN_REQUIRES_DEALER("STATE_TENHOU_NOT_DEALER", "天和必须是庄家"),
    HEAVEN_REQUIRES_TSUMO("STATE_TENHOU_NOT_TSUMO", "天和必须是自摸"),
    HEAVEN_WITH_CALLS("STATE_TENHOU_CALLS", "天和不能有副露或暗杠"),
    EARTH_REQUIRES_NON_DEALER("STATE_CHIIHOU_DEALER", "地和必须是闲家"),
    EARTH_REQUIRES_TSUMO("STATE_CHIIHOU_NOT_TSUMO", "地和必须是自摸"),
    EARTH_WITH_CALLS("STATE_CHIIHOU_CALLS", "地和不能有副露或暗杠"),
    MAN_REQUIRES_RON("STATE_RENHOU_NOT_RON", "人和必须是荣和"),

    // === 牌的组成 ===
    TOO_MANY_MELDS("HAND_TOO_MANY_MELDS", "副露与暗杠合计超过 4 组"),
    TILE_COUNT_MISMATCH("HAND_TILE_COUNT", "手牌张数与杠子数不符（0 杠 14 张，每多 1 杠多 1 张）"),
    WINNING_TILE_NOT_HELD("HAND_WINNING_TILE_MISSING", "和了牌不在手牌中"),
    TILE_OVERFLOW("HAND_TILE_OVERFLOW", "同一种牌超过 4 张"),
    RED_FIVES_EXCEED_FIVES("HAND_RED_FIVES_EXCEED_FIVES", "赤宝牌数量超过手中 5 的张数"),
    RED_FIVES_OVER_LIMIT("HAND_RED_FIVES_OVER_LIMIT", "赤宝牌数量不能超过 4"),
    RED_FIVES_NEGATIVE("HAND_RED_FIVES_NEGATIVE", "赤宝牌数量不能为负数"),
    HONBA_NEGATIVE("HAND_HONBA_NEGATIVE", "本场数不能为负数"),
    RIICHI_STICKS_NEGATIVE("HAND_RIICHI_STICKS_NEGATIVE", "立直棒数量不能为负数"),

    // === 声明的副露与手牌不符 ===
    CLOSED_KAN_NOT_HELD("MELD_CLOSED_KAN_MISSING", "声明的暗杠不在手牌中"),
    OPEN_MELD_NOT_HELD("MELD_OPEN_MISSING", "声明的副露不在手牌中"),
    NO_PAIR_FOR_FOUR_MELDS("MELD_NO_PAIR", "已有 4 组面子但找不到雀头"),

    // === 役 ===
    NO_YAKU("YAKU_NONE", "无役，不能和了");

    private final String code;
    private final String message;

    RejectReason(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
