package com.gridcast.exception;

/**
 * 存储事务失败（约束冲突、连接丢失等），整个批次已回滚
 */
public class StoreTransactionException extends RuntimeException {

    public StoreTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
