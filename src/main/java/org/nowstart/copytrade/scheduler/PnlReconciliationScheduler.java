package org.nowstart.copytrade.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.copytrade.service.PnlReconciliationService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PnlReconciliationScheduler {

    private final PnlReconciliationService pnlReconciliationService;

    @Scheduled(
            initialDelayString = "${copytrade.trading.pnl-sync-initial-delay:PT1M}",
            fixedDelayString = "${copytrade.trading.pnl-sync-interval:PT5M}"
    )
    public void run() {
        pnlReconciliationService.reconcileAll();
    }
}
