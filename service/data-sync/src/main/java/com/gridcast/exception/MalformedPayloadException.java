package com.gridcast.exception;

import com.gridcast.model.PayloadFingerprint;

/**
 * 负载无法解析。在远端负载变化之前不会自动重试
 */
public class MalformedPayloadException extends FetchException {

    private final PayloadFingerprint fingerprint;

    public MalformedPayloadException(String candidateName, PayloadFingerprint fingerprint, String message) {
        super(candidateName, message);
        this.fingerprint = fingerprint;
    }

    public MalformedPayloadException(String candidateName, PayloadFingerprint fingerprint, String message, Throwable cause) {
        super(candidateName, message, cause);
        this.fingerprint = fingerprint;
    }

    public PayloadFingerprint getFingerprint() {
        return fingerprint;
    }
}
