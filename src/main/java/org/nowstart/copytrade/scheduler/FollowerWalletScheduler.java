package org.nowstart.copytrade.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.copytrade.service.FollowerWalletService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FollowerWalletScheduler {

    private final FollowerWalletService followerWalletService;

    @Scheduled(fixedDelayString = "${copytrade.trading.wallet-sync-interval:PT60S}")
    public void run() {
        followerWalletService.refreshAll();
    }
}
