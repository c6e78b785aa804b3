package org.nowstart.copytrade.repository;

import java.util.List;
import java.util.UUID;
import org.nowstart.copytrade.data.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByMirrorTradeIdOrderByCreatedAtAsc(String mirrorTradeId);
}
