package org.nowstart.copytrade.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.copytrade.data.type.TradeSide;

import java.math.BigDecimal;

/**
 * Trade registered on the primary account. Written once by the trade-registration workflow.
 */
@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PrimaryTrade extends AuditableEntity {

    @Id
    private String id;

    @Column(unique = true)
    private String tradeId;

    private String pair;

    @Enumerated(EnumType.STRING)
    private TradeSide side;

    @Column(precision = 38, scale = 12)
    private BigDecimal price;

    @Column(precision = 38, scale = 12)
    private BigDecimal stopLoss;

    @Column(precision = 38, scale = 12)
    private BigDecimal takeProfit1;

    @Column(precision = 38, scale = 12)
    private BigDecimal takeProfit2;

    @Column(precision = 38, scale = 12)
    private BigDecimal takeProfit3;

    private int leverage;

    @Column(precision = 38, scale = 12)
    private BigDecimal total;
}
