package com.riichimahjong.service;

import com.riichimahjong.engine.HandOrganizer;
import com.riichimahjong.engine.HandRejectedException;
import com.riichimahjong.engine.PatternRecognizer;
import com.riichimahjong.engine.ScoreCalculator;
import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.HandOrganization;
import com.riichimahjong.model.Recognition;
import com.riichimahjong.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 计分服务：校验 -> 拆解 -> 役判定 -> 计分，单向流水线，不返回部分结果
 */
@Service
public class ScoringService {

    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final PatternRecognizer patternRecognizer;

    public ScoringService(PatternRecognizer patternRecognizer) {
        this.patternRecognizer = patternRecognizer;
    }

    /**
     * 计算一手和了牌的得分
     *
     * @throws HandRejectedException 输入不合法或无役
     */
    public ScoreResult score(HandInput input) {
        try {
            HandOrganization organization = HandOrganizer.organize(input);
            Recognition recognition = patternRecognizer.recognize(organization, input);
            ScoreResult result = ScoreCalculator.calculate(recognition, input.getPlayer(), input.getGame(),
                    input.getWinType());
            log.info("计分完成：{}", result);
            return result;
        } catch (HandRejectedException e) {
            log.warn("拒绝计分：{}", e.getMessage());
            throw e;
        }
    }
}
