package com.riichimahjong.engine;

import com.riichimahjong.model.HandInput;
import com.riichimahjong.model.HandOrganization;
import com.riichimahjong.model.Recognition;

/**
 * 役判定器：根据拆解结果和场况给出役列表与赤宝牌数量
 */
public interface PatternRecognizer {

    /**
     * @param organization 拆解结果（标准形或非标准形）
     * @param input        原始请求（场况、和了方式、全部手牌）
     * @return 判定结果
     * @throws HandRejectedException 没有任何役（包括非标准形不是七对子 / 国士无双）
     */
    Recognition recognize(HandOrganization organization, HandInput input);
}
