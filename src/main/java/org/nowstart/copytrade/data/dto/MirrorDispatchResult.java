package org.nowstart.copytrade.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import org.nowstart.copytrade.service.MirrorBatchTracker;

public record MirrorDispatchResult(
        boolean success,
        String message,
        List<String> mirrorTradeIds,
        List<String> errors,
        @JsonIgnore MirrorBatchTracker batch
) {
}
