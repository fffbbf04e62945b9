package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 本局的场况
 */
public class GameContext {
    private Wind roundWind;                     // 场风
    private int honba;                          // 本场数
    private int riichiSticks;                   // 场上立直棒（原样返回，不参与计分）
    private List<Tile> doraIndicators;          // 宝牌指示牌
    private List<Tile> uraDoraIndicators;       // 里宝牌指示牌
    private int redFiveCount;                   // 手中赤宝牌数量

    // === 特殊和了条件 ===
    private boolean blessingOfHeaven;           // 天和
    private boolean blessingOfEarth;            // 地和
    private boolean blessingOfMan;              // 人和
    private boolean lastDraw;                   // 海底摸月
    private boolean lastDiscard;                // 河底捞鱼
    private boolean afterKan;                   // 岭上开花
    private boolean robbingKan;                 // 抢杠

    public GameContext() {
        this.roundWind = Wind.EAST;
        this.doraIndicators = new ArrayList<>();
        this.uraDoraIndicators = new ArrayList<>();
    }

    public GameContext(Wind roundWind) {
        this();
        this.roundWind = roundWind;
    }

    public Wind getRoundWind() {
        return roundWind;
    }

    public void setRoundWind(Wind roundWind) {
        this.roundWind = roundWind;
    }

    public int getHonba() {
        return honba;
    }

    public void setHonba(int honba) {
        this.honba = honba;
    }

    public int getRiichiSticks() {
        return riichiSticks;
    }

    public void setRiichiSticks(int riichiSticks) {
        this.riichiSticks = riichiSticks;
    }

    public List<Tile> getDoraIndicators() {
        return doraIndicators;
    }

    public void setDoraIndicators(List<Tile> doraIndicators) {
        this.doraIndicators = doraIndicators;
    }

    public List<Tile> getUraDoraIndicators() {
        return uraDoraIndicators;
    }

    public void setUraDoraIndicators(List<Tile> uraDoraIndicators) {
        this.uraDoraIndicators = uraDoraIndicators;
    }

    public int getRedFiveCount() {
        return redFiveCount;
    }

    public void setRedFiveCount(int redFiveCount) {
        this.redFiveCount = redFiveCount;
    }

    public boolean isBlessingOfHeaven() {
        return blessingOfHeaven;
    }

    public void setBlessingOfHeaven(boolean blessingOfHeaven) {
        this.blessingOfHeaven = blessingOfHeaven;
    }

    public boolean isBlessingOfEarth() {
        return blessingOfEarth;
    }

    public void setBlessingOfEarth(boolean blessingOfEarth) {
        this.blessingOfEarth = blessingOfEarth;
    }

    public boolean isBlessingOfMan() {
        return blessingOfMan;
    }

    public void setBlessingOfMan(boolean blessingOfMan) {
        this.blessingOfMan = blessingOfMan;
    }

    public boolean isLastDraw() {
        return lastDraw;
    }

    public void setLastDraw(boolean lastDraw) {
        this.lastDraw = lastDraw;
    }

    public boolean isLastDiscard() {
        return lastDiscard;
    }

    public void setLastDiscard(boolean lastDiscard) {
        this.lastDiscard = lastDiscard;
    }

    public boolean isAfterKan() {
        return afterKan;
    }

    public void setAfterKan(boolean afterKan) {
        this.afterKan = afterKan;
    }

    public boolean isRobbingKan() {
        return robbingKan;
    }

    public void setRobbingKan(boolean robbingKan) {
        this.robbingKan = robbingKan;
    }
}
