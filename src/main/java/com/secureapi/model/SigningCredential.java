package com.secureapi.model;

import com.secureapi.exception.ConfigurationException;
import java.nio.charset.StandardCharsets;

/**
 * The token id / token secret pair used to sign every outbound request.
 * <p>
 * The secret is copied in and out so the record stays immutable, and it never appears in
 * {@link #toString()}.
 *
 * @param keyId  The public token id, sent as the {@code kid} header.
 * @param secret The HMAC key.
 */
public record SigningCredential(String keyId, byte[] secret) {

    public SigningCredential {
        if (keyId == null || keyId.isBlank()) {
            throw new ConfigurationException("Signing key id is missing. Set API_KEY.");
        }
        if (secret == null || secret.length == 0) {
            throw new ConfigurationException("Signing secret is missing. Set API_SECRET.");
        }
        secret = secret.clone();
    }

    public static SigningCredential of(String keyId, String secret) {
        return new SigningCredential(keyId, secret == null ? null : secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] secret() {
        return secret.clone();
    }

    @Override
    public String toString() {
        return "SigningCredential[keyId=" + keyId + ", secret=****]";
    }
}
