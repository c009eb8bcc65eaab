package io.taskvault.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskvault.error.DecryptionFailedException;
import io.taskvault.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM sealing of whole documents under the session key.
 *
 * <p>The document name is bound as additional authenticated data, so a ciphertext copied over a
 * different document fails authentication instead of decrypting into the wrong place.
 */
public final class PayloadCrypto {
    static final String SCHEMA = "taskvault.aesgcm.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;

    private final SecretKey key;
    private final SecureRandom secureRandom;

    public PayloadCrypto(SecretKey key) {
        if (key == null) {
            throw new IllegalArgumentException("session key is required");
        }
        this.key = key;
        this.secureRandom = new SecureRandom();
    }

    public byte[] seal(String document, byte[] plaintext) {
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(document.getBytes(StandardCharsets.UTF_8));
            byte[] cipherText = cipher.doFinal(plaintext);
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactBytes(row);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt document " + document, e);
        }
    }

    public byte[] open(String document, byte[] sealed) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(sealed);
        } catch (Exception e) {
            throw new DecryptionFailedException(document, e);
        }
        if (node == null || !SCHEMA.equals(node.path("enc").asText(""))) {
            throw new DecryptionFailedException(document, new IllegalArgumentException("unknown ciphertext schema"));
        }
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new DecryptionFailedException(document, new IllegalArgumentException("missing iv/ct"));
        }
        try {
            byte[] iv = Base64.getDecoder().decode(ivBase64);
            byte[] cipherText = Base64.getDecoder().decode(ctBase64);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(document.getBytes(StandardCharsets.UTF_8));
            return cipher.doFinal(cipherText);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new DecryptionFailedException(document, e);
        }
    }
}
