package com.gridcast.model;

import lombok.Value;

import java.util.Objects;

/**
 * 远端负载指纹，用于识别已被判定为格式错误的负载是否发生变化
 */
@Value
public class PayloadFingerprint {

    String etag;
    String lastModified;
    String sha256;

    public boolean sameContent(String otherSha256) {
        return sha256 != null && sha256.equals(otherSha256);
    }

    public boolean sameValidators(String otherEtag, String otherLastModified) {
        if (etag != null && otherEtag != null) {
            return etag.equals(otherEtag);
        }
        return lastModified != null && Objects.equals(lastModified, otherLastModified);
    }
}
