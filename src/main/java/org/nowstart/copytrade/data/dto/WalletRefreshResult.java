package org.nowstart.copytrade.data.dto;

public record WalletRefreshResult(
        int updated,
        int errors,
        int lowFundFollowers
) {
}
