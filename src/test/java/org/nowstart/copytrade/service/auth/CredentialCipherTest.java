package org.nowstart.copytrade.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;
import org.junit.jupiter.api.Test;
import org.nowstart.copytrade.CopyTradeFixtures;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.exception.CredentialDecryptionException;

class CredentialCipherTest {

    private final CredentialCipher cipher = new CredentialCipher("test-passphrase");

    @Test
    void decrypt_recoversEncryptedValue() {
        String blob = cipher.encrypt("my-api-secret");

        assertThat(blob).contains(":").doesNotContain("my-api-secret");
        assertThat(cipher.decrypt(blob)).isEqualTo("my-api-secret");
        assertThat(cipher.encrypt("my-api-secret")).isNotEqualTo(blob);
    }

    @Test
    void decrypt_followerCredentials() {
        Follower follower = CopyTradeFixtures.follower("f-1");
        follower.setApiKey(cipher.encrypt("key-1"));
        follower.setApiSecret(cipher.encrypt("secret-1"));

        VenueCredentials credentials = cipher.decrypt(follower);

        assertThat(credentials.apiKey()).isEqualTo("key-1");
        assertThat(credentials.apiSecret()).isEqualTo("secret-1");
    }

    @Test
    void decrypt_rejectsTamperedCiphertext() {
        String blob = cipher.encrypt("my-api-secret");
        String[] parts = blob.split(":");
        byte[] cipherText = Base64.getDecoder().decode(parts[1]);
        cipherText[0] ^= 0x01;
        String tampered = parts[0] + ":" + Base64.getEncoder().encodeToString(cipherText);

        assertThatThrownBy(() -> cipher.decrypt(tampered))
                .isInstanceOf(CredentialDecryptionException.class)
                .hasMessage("Failed to decrypt credential");
    }

    @Test
    void decrypt_rejectsMalformedOrForeignBlobs() {
        assertThatThrownBy(() -> cipher.decrypt("plain-text-secret"))
                .isInstanceOf(CredentialDecryptionException.class);
        assertThatThrownBy(() -> cipher.decrypt("not base64:@@@"))
                .isInstanceOf(CredentialDecryptionException.class);
        assertThatThrownBy(() -> new CredentialCipher("other-passphrase").decrypt(cipher.encrypt("x")))
                .isInstanceOf(CredentialDecryptionException.class);
    }

    @Test
    void decrypt_requiresConfiguredKey() {
        CredentialCipher unconfigured = new CredentialCipher("");

        assertThatThrownBy(() -> unconfigured.decrypt("aXY=:Y3Q="))
                .isInstanceOf(CredentialDecryptionException.class)
                .hasMessage("Credential encryption key is not configured");
    }
}
