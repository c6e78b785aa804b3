package org.nowstart.copytrade.service.venue;

import lombok.RequiredArgsConstructor;
import org.nowstart.copytrade.data.dto.OrderResult;
import org.nowstart.copytrade.data.dto.OrderSpec;
import org.nowstart.copytrade.data.dto.VenueCredentials;

@RequiredArgsConstructor
public class LiveOrderExecutor implements OrderExecutor {

    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;

    @Override
    public OrderResult execute(String followerId, VenueCredentials credentials, OrderSpec orderSpec) {
        return venueCallExecutor.execute(followerId, "create_order", () -> venueClient.createOrder(credentials, orderSpec));
    }

    @Override
    public boolean isSimulated() {
        return false;
    }
}
