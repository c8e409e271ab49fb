package com.gridcast.connector;

import com.gridcast.model.PayloadFingerprint;
import lombok.Value;

import java.nio.charset.StandardCharsets;

@Value
public class FetchedPayload {

    byte[] body;
    PayloadFingerprint fingerprint;

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
