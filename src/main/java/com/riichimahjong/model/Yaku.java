package com.riichimahjong.model;

/**
 * 役（含宝牌）
 * closedHan / openHan：门前 / 副露时的番数，只有三色同顺、一气通贯、混全带幺九、
 * 纯全带幺九、混一色、清一色副露减一番。门前限定役是否成立由役判定器按手牌决定，
 * 这里不再按门前标志减番。役满只记倍数。
 */
public enum Yaku {
    // === 1 番 ===
    RIICHI("立直", 1, 1),
    IPPATSU("一发", 1, 1),
    MENZEN_TSUMO("门前清自摸和", 1, 1),
    PINFU("平和", 1, 1),
    IIPEIKOU("一杯口", 1, 1),
    HAITEI("海底摸月", 1, 1),
    HOUTEI("河底捞鱼", 1, 1),
    RINSHAN("岭上开花", 1, 1),
    CHANKAN("抢杠", 1, 1),
    TANYAO("断幺九", 1, 1),
    YAKUHAI_SEAT_WIND("役牌：自风", 1, 1),
    YAKUHAI_ROUND_WIND("役牌：场风", 1, 1),
    YAKUHAI_DRAGON("役牌：三元牌", 1, 1),

    // === 2 番 ===
    DOUBLE_RIICHI("两立直", 2, 2),
    CHIITOITSU("七对子", 2, 2),
    SANSHOKU_DOUJUN("三色同顺", 2, 1),
    ITTSU("一气通贯", 2, 1),
    CHANTA("混全带幺九", 2, 1),
    TOITOI("对对和", 2, 2),
    SANANKOU("三暗刻", 2, 2),
    SANSHOKU_DOUKOU("三色同刻", 2, 2),
    SANKANTSU("三杠子", 2, 2),
    SHOUSANGEN("小三元", 2, 2),
    HONROUTOU("混老头", 2, 2),

    // === 3 番 ===
    RYANPEIKOU("二杯口", 3, 3),
    JUNCHAN("纯全带幺九", 3, 2),
    HONITSU("混一色", 3, 2),

    // === 6 番 ===
    CHINITSU("清一色", 6, 5),

    // === 役满 ===
    TENHOU("天和", 1),
    CHIIHOU("地和", 1),
    RENHOU("人和", 1),
    DAISANGEN("大三元", 1),
    SUUANKOU("四暗刻", 1),
    DAISUUSHI("大四喜", 1),
    SHOUSUUSHI("小四喜", 1),
    TSUUIISOU("字一色", 1),
    CHINROUTOU("清老头", 1),
    RYUUIISOU("绿一色", 1),
    SUUKANTSU("四杠子", 1),
    KOKUSHI_MUSOU("国士无双", 1),
    CHUUREN_POUTOU("九莲宝灯", 1),

    // === 双倍役满 ===
    SUUANKOU_TANKI("四暗刻单骑", 2),
    KOKUSHI_MUSOU_THIRTEEN_SIDED("国士无双十三面", 2),
    JUNSEI_CHUUREN_POUTOU("纯正九莲宝灯", 2),

    // === 宝牌（不是役，不能单独和了） ===
    DORA("宝牌", 1, 1),
    URA_DORA("里宝牌", 1, 1),
    AKA_DORA("赤宝牌", 1, 1);

    private final String displayName;
    private final int closedHan;
    private final int openHan;
    private final int yakumanCount;

    Yaku(String displayName, int closedHan, int openHan) {
        this.displayName = displayName;
        this.closedHan = closedHan;
        this.openHan = openHan;
        this.yakumanCount = 0;
    }

    Yaku(String displayName, int yakumanCount) {
        this.displayName = displayName;
        this.closedHan = 0;
        this.openHan = 0;
        this.yakumanCount = yakumanCount;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 番数；役满返回 0，由计分器另行处理
     */
    public int getHan(boolean concealed) {
        return concealed ? closedHan : openHan;
    }

    /**
     * 役满倍数（双倍役满记 2）
     */
    public int getYakumanCount() {
        return yakumanCount;
    }

    public boolean isYakuman() {
        return yakumanCount > 0;
    }

    public boolean isBonus() {
        return this == DORA || this == URA_DORA || this == AKA_DORA;
    }
}
