package com.riichimahjong.model;

/**
 * 和了玩家的状态
 */
public class PlayerContext {
    private Wind seatWind;              // 自风
    private boolean dealer;             // 是否是庄家（亲）
    private boolean riichi;             // 立直
    private boolean doubleRiichi;       // 两立直
    private boolean ippatsu;            // 一发
    private boolean concealed;          // 门前清（无副露）

    public PlayerContext() {
        this.seatWind = Wind.EAST;
        this.concealed = true;
    }

    public PlayerContext(Wind seatWind, boolean dealer) {
        this.seatWind = seatWind;
        this.dealer = dealer;
        this.concealed = true;
    }

    public Wind getSeatWind() {
        return seatWind;
    }

    public void setSeatWind(Wind seatWind) {
        this.seatWind = seatWind;
    }

    public boolean isDealer() {
        return dealer;
    }

    public void setDealer(boolean dealer) {
        this.dealer = dealer;
    }

    public boolean isRiichi() {
        return riichi;
    }

    public void setRiichi(boolean riichi) {
        this.riichi = riichi;
    }

    public boolean isDoubleRiichi() {
        return doubleRiichi;
    }

    public void setDoubleRiichi(boolean doubleRiichi) {
        this.doubleRiichi = doubleRiichi;
    }

    public boolean isIppatsu() {
        return ippatsu;
    }

    public void setIppatsu(boolean ippatsu) {
        this.ippatsu = ippatsu;
    }

    public boolean isConcealed() {
        return concealed;
    }

    public void setConcealed(boolean concealed) {
        this.concealed = concealed;
    }
}
