package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次计分请求：和了时的全部牌与场况
 */
public class HandInput {
    private List<Tile> handTiles;           // 全部手牌（含副露、暗杠，14-18 张）
    private Tile winningTile;               // 和了牌
    private List<Meld> openMelds;           // 副露（吃、碰、明杠）
    private List<Tile> closedKans;          // 暗杠（每个杠记一张代表牌）
    private PlayerContext player;           // 和了玩家
    private GameContext game;               // 场况
    private WinType winType;                // 和了方式

    public HandInput() {
        this.handTiles = new ArrayList<>();
        this.openMelds = new ArrayList<>();
        this.closedKans = new ArrayList<>();
        this.player = new PlayerContext();
        this.game = new GameContext();
        this.winType = WinType.RON;
    }

    public List<Tile> getHandTiles() {
        return handTiles;
    }

    public void setHandTiles(List<Tile> handTiles) {
        this.handTiles = handTiles;
    }

    public Tile getWinningTile() {
        return winningTile;
    }

    public void setWinningTile(Tile winningTile) {
        this.winningTile = winningTile;
    }

    public List<Meld> getOpenMelds() {
        return openMelds;
    }

    public void setOpenMelds(List<Meld> openMelds) {
        this.openMelds = openMelds;
    }

    public List<Tile> getClosedKans() {
        return closedKans;
    }

    public void setClosedKans(List<Tile> closedKans) {
        this.closedKans = closedKans;
    }

    public PlayerContext getPlayer() {
        return player;
    }

    public void setPlayer(PlayerContext player) {
        this.player = player;
    }

    public GameContext getGame() {
        return game;
    }

    public void setGame(GameContext game) {
        this.game = game;
    }

    public WinType getWinType() {
        return winType;
    }

    public void setWinType(WinType winType) {
        this.winType = winType;
    }

    /**
     * 副露 + 暗杠的总数
     */
    public int getDeclaredMeldCount() {
        return openMelds.size() + closedKans.size();
    }

    /**
     * 杠子总数（暗杠 + 明杠）
     */
    public int getQuadCount() {
        int count = closedKans.size();
        for (Meld meld : openMelds) {
            if (meld.getType() == MeldType.QUAD) {
                count++;
            }
        }
        return count;
    }
}
