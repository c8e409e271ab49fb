package com.gridcast.exception;

/**
 * 之前被拒绝的负载没有变化
 */
public class PayloadUnchangedException extends FetchException {

    public PayloadUnchangedException(String candidateName) {
        super(candidateName, "负载未变化，仍为之前的格式错误版本");
    }
}
