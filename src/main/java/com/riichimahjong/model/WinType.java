package com.riichimahjong.model;

/**
 * 和了方式
 */
public enum WinType {
    TSUMO,  // 自摸
    RON     // 荣和（点炮）
}
