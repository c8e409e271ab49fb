package com.gridcast.exception;

/**
 * 拉取候选单元失败的基类。失败只影响当前候选，不影响同一周期内的其它候选
 */
public class FetchException extends Exception {

    private final String candidateName;

    public FetchException(String candidateName, String message) {
        super(message);
        this.candidateName = candidateName;
    }

    public FetchException(String candidateName, String message, Throwable cause) {
        super(message, cause);
        this.candidateName = candidateName;
    }

    public String getCandidateName() {
        return candidateName;
    }
}
