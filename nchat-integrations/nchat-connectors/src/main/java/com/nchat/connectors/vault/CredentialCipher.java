package com.nchat.connectors.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nchat.connectors.model.ConnectorCredentials;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM encryption of {@link ConnectorCredentials} for storage at rest.
 *
 * <pre>
 * blob = base64( nonce[12] || ciphertext || tag[16] )
 * </pre>
 *
 * <p>The key is the UTF-8 encoding of the caller's key material, zero-padded
 * or truncated to 32 bytes. This is not a key-derivation function: callers
 * must supply at least 32 bytes of random material. A fresh random nonce is
 * drawn for every encryption.
 *
 * <p>Decryption fails closed on a wrong key, a tampered or truncated blob, or
 * plaintext that is not a credentials document.
 */
public final class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String KEY_ALGORITHM  = "AES";
    private static final int    KEY_LENGTH     = 32;
    private static final int    NONCE_LENGTH   = 12;
    private static final int    TAG_BITS       = 128;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private CredentialCipher() {}

    public static String encrypt(ConnectorCredentials credentials, String keyMaterial)
            throws CredentialEncryptionException {
        if (credentials == null) {
            throw new CredentialEncryptionException("credentials must not be null");
        }
        byte[] plaintext;
        try {
            plaintext = MAPPER.writeValueAsBytes(credentials);
        } catch (JsonProcessingException e) {
            throw new CredentialEncryptionException("Cannot serialise credentials", e);
        }

        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key(keyMaterial), new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            ByteBuffer out = ByteBuffer.allocate(NONCE_LENGTH + sealed.length);
            out.put(nonce).put(sealed);
            return Base64.getEncoder().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new CredentialEncryptionException("AES-GCM encryption failed", e);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    public static ConnectorCredentials decrypt(String blob, String keyMaterial)
            throws CredentialEncryptionException {
        if (blob == null || blob.isBlank()) {
            throw new CredentialEncryptionException("Encrypted credentials are empty");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(blob);
        } catch (IllegalArgumentException e) {
            throw new CredentialEncryptionException("Encrypted credentials are not valid base64", e);
        }
        if (raw.length < NONCE_LENGTH + TAG_BITS / 8) {
            throw new CredentialEncryptionException("Encrypted credentials are truncated");
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key(keyMaterial),
                    new GCMParameterSpec(TAG_BITS, raw, 0, NONCE_LENGTH));
            plaintext = cipher.doFinal(raw, NONCE_LENGTH, raw.length - NONCE_LENGTH);
        } catch (AEADBadTagException e) {
            throw new CredentialEncryptionException("Credential authentication failed (wrong key or tampered data)", e);
        } catch (GeneralSecurityException e) {
            throw new CredentialEncryptionException("AES-GCM decryption failed", e);
        }

        try {
            ConnectorCredentials credentials = MAPPER.readValue(plaintext, ConnectorCredentials.class);
            if (credentials == null) {
                throw new CredentialEncryptionException("Decrypted credentials are empty");
            }
            return credentials;
        } catch (IOException e) {
            throw new CredentialEncryptionException("Decrypted credentials are not valid JSON", e);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    private static SecretKeySpec key(String keyMaterial) throws CredentialEncryptionException {
        if (keyMaterial == null || keyMaterial.isEmpty()) {
            throw new CredentialEncryptionException("Encryption key must not be empty");
        }
        byte[] padded = Arrays.copyOf(keyMaterial.getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
        return new SecretKeySpec(padded, KEY_ALGORITHM);
    }
}
