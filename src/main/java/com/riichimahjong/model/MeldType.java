package com.riichimahjong.model;

/**
 * 面子类型
 */
public enum MeldType {
    SEQUENCE,   // 顺子
    TRIPLET,    // 刻子
    QUAD        // 杠子（只能由副露或暗杠声明得到，搜索本身不会拆出杠子）
}
