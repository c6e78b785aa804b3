package org.nowstart.copytrade.service.venue;

import java.math.BigDecimal;
import java.util.List;
import org.nowstart.copytrade.data.dto.InstrumentMeta;
import org.nowstart.copytrade.data.dto.LedgerEntry;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;

/**
 * Single HTTP round trip against the margin venue. Implementations do not retry or throttle;
 * failures surface as {@link org.nowstart.copytrade.data.exception.VenueApiException}.
 */
public interface VenueClient {

    InstrumentMeta getInstrumentMeta(String pair);

    OrderResult createOrder(VenueCredentials credentials, OrderSpec orderSpec);

    List<LedgerEntry> getTransactions(VenueCredentials credentials, String orderId);

    BigDecimal getWalletBalance(VenueCredentials credentials, String currency);
}
