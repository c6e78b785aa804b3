package org.nowstart.copytrade.service.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Builds CoinDCX request bodies and their signatures. The signature covers the exact JSON string that is sent,
 * so callers must pass the body returned by {@link #body(Map)} unchanged to the HTTP client.
 */
public class CoinDcxRequestSigner {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Clock clock;

    public CoinDcxRequestSigner(Clock clock) {
        this.clock = clock;
    }

    public String body(Map<String, Object> fields) {
        Map<String, Object> payload = new LinkedHashMap<>(fields);
        payload.put("timestamp", clock.millis());
        try {
            return OBJECT_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize CoinDCX request body", e);
        }
    }

    public String sign(String body, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("API secret is required to sign CoinDCX requests");
        }
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] sig = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(sig.length * 2);
            for (byte b : sig) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign CoinDCX request", e);
        }
    }
}
