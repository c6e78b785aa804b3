package org.nowstart.copytrade.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.dto.VenueCredentials;
import org.nowstart.copytrade.data.dto.WalletRefreshResult;
import org.nowstart.copytrade.data.entity.Follower;
import org.nowstart.copytrade.data.property.CopyTradingProperties;
import org.nowstart.copytrade.repository.FollowerRepository;
import org.nowstart.copytrade.service.auth.CredentialCipher;
import org.nowstart.copytrade.service.venue.VenueCallExecutor;
import org.nowstart.copytrade.service.venue.VenueClient;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class FollowerWalletService {

    private final FollowerRepository followerRepository;
    private final CredentialCipher credentialCipher;
    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final CopyTradingProperties copyTradingProperties;
    private final Clock clock;

    public WalletRefreshResult refreshAll() {
        if (copyTradingProperties.dryRun()) {
            log.info("event=wallet_refresh skipped=true reason=dry_run");
            return new WalletRefreshResult(0, 0, 0);
        }

        List<Follower> followers = followerRepository.findAll();
        int updated = 0;
        int errors = 0;
        int lowFund = 0;
        for (Follower follower : followers) {
            try {
                if (refresh(follower)) {
                    lowFund++;
                }
                updated++;
            } catch (RuntimeException e) {
                errors++;
                log.warn("event=wallet_refresh_failed follower_id={} reason={}", follower.getId(), e.getMessage());
            }
        }

        log.info("event=wallet_refresh followers={} updated={} errors={} low_fund={}", followers.size(), updated, errors, lowFund);
        return new WalletRefreshResult(updated, errors, lowFund);
    }

    /**
     * @return whether the follower is now flagged low on funds
     */
    boolean refresh(Follower follower) {
        VenueCredentials credentials = credentialCipher.decrypt(follower);
        String currency = copyTradingProperties.marginCurrency();
        BigDecimal balance = venueCallExecutor.execute(
                follower.getId(),
                "wallet_balance",
                () -> venueClient.getWalletBalance(credentials, currency)
        );

        BigDecimal fund = follower.getFund() == null ? BigDecimal.ZERO : follower.getFund();
        boolean lowFund = balance.compareTo(fund) < 0;
        if (lowFund != follower.isLowFund()) {
            log.info(
                    "Follower low-fund flag changed. followerId={}, lowFund={}, balance={}, fund={}",
                    follower.getId(),
                    lowFund,
                    balance,
                    fund
            );
        }

        follower.setWalletBalance(balance);
        follower.setLowFund(lowFund);
        follower.setWalletUpdatedAt(clock.instant());
        followerRepository.save(follower);
        return lowFund;
    }
}
