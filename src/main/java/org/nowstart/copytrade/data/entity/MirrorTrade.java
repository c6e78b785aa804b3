package org.nowstart.copytrade.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.data.type.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(indexes = {
        @Index(name = "idx_mirror_trade_follower", columnList = "followerId"),
        @Index(name = "idx_mirror_trade_status", columnList = "status")
})
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MirrorTrade extends AuditableEntity {

    @Id
    private String id;

    private String primaryTradeId;

    private String followerId;

    private String pair;

    @Enumerated(EnumType.STRING)
    private TradeSide side;

    @Column(precision = 38, scale = 12)
    private BigDecimal requestedPrice;

    @Column(precision = 38, scale = 12)
    private BigDecimal requestedQuantity;

    private Integer requestedLeverage;

    @Column(precision = 38, scale = 12)
    private BigDecimal executedPrice;

    @Column(precision = 38, scale = 12)
    private BigDecimal executedQuantity;

    private Integer executedLeverage;

    @Enumerated(EnumType.STRING)
    private MirrorTradeStatus status;

    private String venueOrderId;

    @Column(length = 1000)
    private String errorMessage;

    @Column(precision = 38, scale = 12)
    private BigDecimal pnl;

    @Column(precision = 38, scale = 12)
    private BigDecimal exitPrice;

    private Instant executedAt;

    private Instant pnlUpdatedAt;

    @Version
    private Long version;
}
