package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.copytrade.data.dto.MirrorTradeDto;
import org.nowstart.copytrade.data.dto.MirrorTradeStatsDto;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.repository.MirrorTradeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MirrorTradeQueryService {

    private final MirrorTradeRepository mirrorTradeRepository;

    @Transactional(readOnly = true)
    public List<MirrorTradeDto> list(String followerId, MirrorTradeStatus status) {
        return find(followerId, status).stream()
                .map(this::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public MirrorTradeStatsDto stats(String followerId) {
        List<MirrorTrade> trades = find(followerId, null);
        long total = trades.size();
        long executed = count(trades, MirrorTradeStatus.EXECUTED);
        long failed = count(trades, MirrorTradeStatus.FAILED);
        long pending = count(trades, MirrorTradeStatus.PENDING);

        BigDecimal successRate = total == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(executed).multiply(BigDecimal.valueOf(100)).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        BigDecimal realizedPnl = trades.stream()
                .map(MirrorTrade::getPnl)
                .filter(pnl -> pnl != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new MirrorTradeStatsDto(total, executed, failed, pending, successRate, realizedPnl);
    }

    private List<MirrorTrade> find(String followerId, MirrorTradeStatus status) {
        boolean hasFollower = followerId != null && !followerId.isBlank();
        if (hasFollower && status != null) {
            return mirrorTradeRepository.findByFollowerIdAndStatusOrderByCreatedAtDesc(followerId, status);
        }
        if (hasFollower) {
            return mirrorTradeRepository.findByFollowerIdOrderByCreatedAtDesc(followerId);
        }
        if (status != null) {
            return mirrorTradeRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        return mirrorTradeRepository.findAllByOrderByCreatedAtDesc();
    }

    private long count(List<MirrorTrade> trades, MirrorTradeStatus status) {
        return trades.stream().filter(trade -> trade.getStatus() == status).count();
    }

    private MirrorTradeDto toDto(MirrorTrade trade) {
        return new MirrorTradeDto(
                trade.getId(),
                trade.getPrimaryTradeId(),
                trade.getFollowerId(),
                trade.getPair(),
                trade.getSide(),
                trade.getRequestedPrice(),
                trade.getRequestedQuantity(),
                trade.getRequestedLeverage(),
                trade.getExecutedPrice(),
                trade.getExecutedQuantity(),
                trade.getExecutedLeverage(),
                trade.getStatus(),
                trade.getVenueOrderId(),
                trade.getErrorMessage(),
                trade.getPnl(),
                trade.getExitPrice(),
                trade.getExecutedAt(),
                trade.getCreatedAt()
        );
    }
}
