package com.imperium.riskguide.common.exception;

/**
 * 日志库操作在重试次数用尽后仍失败，且最后一次错误不是 RuntimeException 时抛出。
 */
public class StoreOperationException extends RuntimeException {

    private final String operation;

    public StoreOperationException(String operation, Throwable cause) {
        super("Store operation failed: " + operation + " - " + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
