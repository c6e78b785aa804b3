package org.nowstart.copytrade.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Copy-trading subscriber. Credentials are stored encrypted and only decrypted right before a venue call.
 * Only the wallet fields are written by this service; everything else belongs to the admin workflow.
 */
@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Follower extends AuditableEntity {

    @Id
    private String id;

    private String name;

    @Column(length = 1024)
    private String apiKey;

    @Column(length = 1024)
    private String apiSecret;

    @Column(precision = 38, scale = 12)
    private BigDecimal fund;

    @Column(precision = 10, scale = 4)
    private BigDecimal riskPerTrade;

    private Integer maxTradesPerDay;

    private boolean active;

    @Column(precision = 38, scale = 12)
    private BigDecimal walletBalance;

    private boolean lowFund;

    private Instant walletUpdatedAt;
}
