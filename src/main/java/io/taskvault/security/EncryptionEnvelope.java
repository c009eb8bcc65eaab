package io.taskvault.security;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Cleartext half of the key material: the salt and work factor needed to re-derive the key, and a
 * verifier sealed under that key. Neither the password nor the key is ever stored.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EncryptionEnvelope(
        String schema,
        String kdf,
        int iterations,
        String salt,
        String verifier,
        String createdAt
) {
    public static final String SCHEMA = "taskvault.envelope.v1";
    public static final String KDF = "PBKDF2WithHmacSHA256";
}
