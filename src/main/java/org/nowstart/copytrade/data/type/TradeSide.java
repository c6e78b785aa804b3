package org.nowstart.copytrade.data.type;

import java.util.Locale;

public enum TradeSide {
    BUY,
    SELL;

    public String venueValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
