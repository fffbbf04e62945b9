package com.riichimahjong.controller;

import com.riichimahjong.engine.HandRejectedException;
import com.riichimahjong.engine.TileFactory;
import com.riichimahjong.model.GameContext;
import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.PlayerContext;
import com.riichimahjong.model.ScoreResult;
import com.riichimahjong.model.Tile;
import com.riichimahjong.model.WinType;
import com.riichimahjong.model.Wind;
import com.riichimahjong.model.Yaku;
import com.riichimahjong.service.ScoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 计分控制器
 */
@Controller
public class ScoreController {

    private static final Logger log = LoggerFactory.getLogger(ScoreController.class);

    private final ScoringService scoringService;

    public ScoreController(ScoringService scoringService) {
        this.scoringService = scoringService;
    }

    /**
     * 计算一手和了牌的得分
     */
    @PostMapping("/api/score")
    @ResponseBody
    public Map<String, Object> score(@RequestBody ScoreRequest request) {
        log.info("收到计分请求：手牌={}, 和了牌={}", request.getHand(), request.getWinningTile());

        Map<String, Object> response = new HashMap<>();
        HandInput input;
        try {
            input = toHandInput(request);
        } catch (IllegalArgumentException e) {
            log.warn("请求格式错误：{}", e.getMessage());
            response.put("success", false);
            response.put("code", "BAD_REQUEST");
            response.put("message", e.getMessage());
            return response;
        }

        try {
            ScoreResult result = scoringService.score(input);
            response.put("success", true);
            response.put("han", result.getHan());
            response.put("fu", result.getFu());
            response.put("limit", result.getLimit() != null ? result.getLimit().name() : null);
            response.put("wait", result.getWait() != null ? result.getWait().name() : null);
            List<String> yaku = new ArrayList<>();
            for (Yaku y : result.getYakuList()) {
                yaku.add(y.getDisplayName());
            }
            response.put("yaku", yaku);
            response.put("basePoints", result.getBasePoints());
            response.put("dealerPayment", result.getDealerPayment());
            response.put("nonDealerPayment", result.getNonDealerPayment());
            response.put("totalPayment", result.getTotalPayment());
            // 场上立直棒归和了者，不计入 totalPayment
            response.put("riichiSticks", input.getGame().getRiichiSticks());
        } catch (HandRejectedException e) {
            response.put("success", false);
            response.put("code", e.getReason().getCode());
            response.put("message", e.getReason().getMessage());
        }
        return response;
    }

    /**
     * 请求 -> 计分输入；记法错误抛 IllegalArgumentException
     */
    static HandInput toHandInput(ScoreRequest request) {
        HandInput input = new HandInput();
        input.setHandTiles(TileFactory.parse(request.getHand()));
        input.setWinningTile(TileFactory.parseTile(request.getWinningTile()));
        input.setWinType(request.isTsumo() ? WinType.TSUMO : WinType.RON);

        List<Meld> openMelds = new ArrayList<>();
        if (request.getOpenMelds() != null) {
            for (String notation : request.getOpenMelds()) {
                openMelds.add(toOpenMeld(notation));
            }
        }
        input.setOpenMelds(openMelds);

        List<Tile> closedKans = new ArrayList<>();
        if (request.getClosedKans() != null) {
            for (String notation : request.getClosedKans()) {
                closedKans.add(toClosedKan(notation));
            }
        }
        input.setClosedKans(closedKans);

        PlayerContext player = new PlayerContext(parseWind(request.getSeatWind()), request.isDealer());
        player.setRiichi(request.isRiichi());
        player.setDoubleRiichi(request.isDoubleRiichi());
        player.setIppatsu(request.isIppatsu());
        player.setConcealed(request.getConcealed() != null ? request.getConcealed() : openMelds.isEmpty());
        input.setPlayer(player);

        GameContext game = new GameContext(parseWind(request.getRoundWind()));
        game.setHonba(request.getHonba());
        game.setRiichiSticks(request.getRiichiSticks());
        if (request.getDoraIndicators() != null) {
            game.setDoraIndicators(TileFactory.parse(request.getDoraIndicators()));
        }
        if (request.getUraDoraIndicators() != null) {
            game.setUraDoraIndicators(TileFactory.parse(request.getUraDoraIndicators()));
        }
        game.setRedFiveCount(request.getRedFives());
        game.setBlessingOfHeaven(request.isBlessingOfHeaven());
        game.setBlessingOfEarth(request.isBlessingOfEarth());
        game.setBlessingOfMan(request.isBlessingOfMan());
        game.setLastDraw(request.isLastDraw());
        game.setLastDiscard(request.isLastDiscard());
        game.setAfterKan(request.isAfterKan());
        game.setRobbingKan(request.isRobbingKan());
        input.setGame(game);
        return input;
    }

    /**
     * 副露记法：三张相同为碰，四张相同为明杠，三张连续为吃
     */
    static Meld toOpenMeld(String notation) {
        List<Tile> tiles = TileFactory.parse(notation);
        Tile first = firstTile(notation);
        boolean allSame = tiles.stream().allMatch(t -> t.equals(first));
        if (tiles.size() == 4 && allSame) {
            return Meld.quad(first, true);
        }
        if (tiles.size() == 3 && allSame) {
            return Meld.triplet(first, true);
        }
        if (tiles.size() == 3) {
            List<Tile> sorted = new ArrayList<>(tiles);
            sorted.sort(null);
            Meld chi = Meld.sequence(sorted.get(0), true);
            if (chi.getTiles().equals(sorted)) {
                return chi;
            }
        }
        throw new IllegalArgumentException("无法识别的副露：" + notation);
    }

    /**
     * 暗杠记法：必须是四张相同的牌，例如 "1111m"
     */
    static Tile toClosedKan(String notation) {
        List<Tile> tiles = TileFactory.parse(notation);
        Tile first = firstTile(notation);
        if (tiles.size() != 4 || !tiles.stream().allMatch(t -> t.equals(first))) {
            throw new IllegalArgumentException("暗杠必须是四张相同的牌：" + notation);
        }
        return first;
    }

    private static Tile firstTile(String notation) {
        List<Tile> tiles = TileFactory.parse(notation);
        if (tiles.isEmpty()) {
            throw new IllegalArgumentException("记法中没有牌：" + notation);
        }
        return tiles.get(0);
    }

    private static Wind parseWind(String wind) {
        if (wind == null || wind.isEmpty()) {
            return Wind.EAST;
        }
        return Wind.valueOf(wind.trim().toUpperCase(Locale.ROOT));
    }

    // === 请求对象 ===

    public static class ScoreRequest {
        private String hand;
        private String winningTile;
        private List<String> openMelds;
        private List<String> closedKans;
        private boolean tsumo;
        private String seatWind;
        private String roundWind;
        private boolean dealer;
        private boolean riichi;
        private boolean doubleRiichi;
        private boolean ippatsu;
        private Boolean concealed;
        private int honba;
        private int riichiSticks;
        private String doraIndicators;
        private String uraDoraIndicators;
        private int redFives;
        private boolean blessingOfHeaven;
        private boolean blessingOfEarth;
        private boolean blessingOfMan;
        private boolean lastDraw;
        private boolean lastDiscard;
        private boolean afterKan;
        private boolean robbingKan;

        public String getHand() { return hand; }
        public void setHand(String hand) { this.hand = hand; }
        public String getWinningTile() { return winningTile; }
        public void setWinningTile(String winningTile) { this.winningTile = winningTile; }
        public List<String> getOpenMelds() { return openMelds; }
        public void setOpenMelds(List<String> openMelds) { this.openMelds = openMelds; }
        public List<String> getClosedKans() { return closedKans; }
        public void setClosedKans(List<String> closedKans) { this.closedKans = closedKans; }
        public boolean isTsumo() { return tsumo; }
        public void setTsumo(boolean tsumo) { this.tsumo = tsumo; }
        public String getSeatWind() { return seatWind; }
        public void setSeatWind(String seatWind) { this.seatWind = seatWind; }
        public String getRoundWind() { return roundWind; }
        public void setRoundWind(String roundWind) { this.roundWind = roundWind; }
        public boolean isDealer() { return dealer; }
        public void setDealer(boolean dealer) { this.dealer = dealer; }
        public boolean isRiichi() { return riichi; }
        public void setRiichi(boolean riichi) { this.riichi = riichi; }
        public boolean isDoubleRiichi() { return doubleRiichi; }
        public void setDoubleRiichi(boolean doubleRiichi) { this.doubleRiichi = doubleRiichi; }
        public boolean isIppatsu() { return ippatsu; }
        public void setIppatsu(boolean ippatsu) { this.ippatsu = ippatsu; }
        public Boolean getConcealed() { return concealed; }
        public void setConcealed(Boolean concealed) { this.concealed = concealed; }
        public int getHonba() { return honba; }
        public void setHonba(int honba) { this.honba = honba; }
        public int getRiichiSticks() { return riichiSticks; }
        public void setRiichiSticks(int riichiSticks) { this.riichiSticks = riichiSticks; }
        public String getDoraIndicators() { return doraIndicators; }
        public void setDoraIndicators(String doraIndicators) { this.doraIndicators = doraIndicators; }
        public String getUraDoraIndicators() { return uraDoraIndicators; }
        public void setUraDoraIndicators(String uraDoraIndicators) { this.uraDoraIndicators = uraDoraIndicators; }
        public int getRedFives() { return redFives; }
        public void setRedFives(int redFives) { this.redFives = redFives; }
        public boolean isBlessingOfHeaven() { return blessingOfHeaven; }
        public void setBlessingOfHeaven(boolean blessingOfHeaven) { this.blessingOfHeaven = blessingOfHeaven; }
        public boolean isBlessingOfEarth() { return blessingOfEarth; }
        public void setBlessingOfEarth(boolean blessingOfEarth) { this.blessingOfEarth = blessingOfEarth; }
        public boolean isBlessingOfMan() { return blessingOfMan; }
        public void setBlessingOfMan(boolean blessingOfMan) { this.blessingOfMan = blessingOfMan; }
        public boolean isLastDraw() { return lastDraw; }
        public void setLastDraw(boolean lastDraw) { this.lastDraw = lastDraw; }
        public boolean isLastDiscard() { return lastDiscard; }
        public void setLastDiscard(boolean lastDiscard) { this.lastDiscard = lastDiscard; }
        public boolean isAfterKan() { return afterKan; }
        public void setAfterKan(boolean afterKan) { this.afterKan = afterKan; }
        public boolean isRobbingKan() { return robbingKan; }
        public void setRobbingKan(boolean robbingKan) { this.robbingKan = robbingKan; }
    }
}
