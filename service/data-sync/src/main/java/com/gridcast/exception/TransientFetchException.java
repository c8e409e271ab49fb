package com.gridcast.exception;

/**
 * 非 2xx 响应或网络失败，下个周期重试
 */
public class TransientFetchException extends FetchException {

    private final int statusCode;

    public TransientFetchException(String candidateName, int statusCode, String message) {
        super(candidateName, message);
        this.statusCode = statusCode;
    }

    public TransientFetchException(String candidateName, String message, Throwable cause) {
        super(candidateName, message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
