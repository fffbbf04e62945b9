package com.riichimahjong.engine;

/**
 * 输入不合法或无法计分。原样返回给调用方，不重试
 */
public class HandRejectedException extends RuntimeException {

    private final RejectReason reason;

    public HandRejectedException(RejectReason reason) {
        super(reason.getCode() + ": " + reason.getMessage());
        this.reason = reason;
    }

    public RejectReason getReason() {
        return reason;
    }
}
