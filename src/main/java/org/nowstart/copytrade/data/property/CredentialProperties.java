package org.nowstart.copytrade.data.property;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "copytrade.security")
public record CredentialProperties(
        // 팔로워 API 키 암호화에 사용한 패스프레이즈
        @DefaultValue("") String encryptionKey
) {
}
