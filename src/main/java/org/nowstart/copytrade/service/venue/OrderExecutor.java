package org.nowstart.copytrade.service.venue;

import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;

public interface OrderExecutor {

    OrderResult execute(String followerId, VenueCredentials credentials, OrderSpec orderSpec);

    boolean isSimulated();
}
