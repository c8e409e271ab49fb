package com.gridcast.exception;

/**
 * 查询参数非法：时间范围、未知实体或没有有效列
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
