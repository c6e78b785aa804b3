package org.nowstart.copytrade.repository;

import java.util.Optional;
import org.nowstart.copytrade.data.entity.PrimaryTrade;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PrimaryTradeRepository extends JpaRepository<PrimaryTrade, String> {

    Optional<PrimaryTrade> findByTradeId(String tradeId);
}
