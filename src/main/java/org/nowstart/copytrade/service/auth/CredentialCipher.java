package org.nowstart.copytrade.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.exception.CredentialDecryptionException;

/**
 * AES-256-GCM over {@code base64(iv):base64(ciphertext)} blobs. Decryption never falls back to the stored value.
 */
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialCipher(String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            this.key = null;
            return;
        }
        this.key = new SecretKeySpec(sha256(passphrase), "AES");
    }

    public String encrypt(String plainText) {
        requireKey();
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder encoder = Base64.getEncoder();
            return encoder.encodeToString(iv) + ":" + encoder.encodeToString(cipherText);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    public String decrypt(String blob) {
        requireKey();
        if (blob == null || blob.isBlank()) {
            throw new CredentialDecryptionException("Encrypted credential is empty");
        }

        String[] parts = blob.split(":", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new CredentialDecryptionException("Encrypted credential has an unexpected format");
        }

        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] iv = decoder.decode(parts[0]);
            byte[] cipherText = decoder.decode(parts[1]);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CredentialDecryptionException("Failed to decrypt credential", e);
        }
    }

    public VenueCredentials decrypt(Follower follower) {
        return new VenueCredentials(decrypt(follower.getApiKey()), decrypt(follower.getApiSecret()));
    }

    private void requireKey() {
        if (key == null) {
            throw new CredentialDecryptionException("Credential encryption key is not configured");
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
