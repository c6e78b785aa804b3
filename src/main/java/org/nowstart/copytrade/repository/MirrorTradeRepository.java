package org.nowstart.copytrade.repository;

import java.time.Instant;
import java.util.List;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MirrorTradeRepository extends JpaRepository<MirrorTrade, String> {

    List<MirrorTrade> findByStatusAndVenueOrderIdIsNotNullAndPnlIsNull(MirrorTradeStatus status);

    List<MirrorTrade> findAllByOrderByCreatedAtDesc();

    List<MirrorTrade> findByFollowerIdOrderByCreatedAtDesc(String followerId);

    List<MirrorTrade> findByStatusOrderByCreatedAtDesc(MirrorTradeStatus status);

    List<MirrorTrade> findByFollowerIdAndStatusOrderByCreatedAtDesc(String followerId, MirrorTradeStatus status);

    List<MirrorTrade> findByPrimaryTradeId(String primaryTradeId);

    long countByFollowerIdAndStatusAndExecutedAtAfter(String followerId, MirrorTradeStatus status, Instant executedAfter);
}
