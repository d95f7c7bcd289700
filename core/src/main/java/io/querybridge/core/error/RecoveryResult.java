package io.querybridge.core.error;

import io.querybridge.core.model.RawResult;
import java.util.List;

/**
 * Outcome of a {@link RecoveryStrategy}.
 *
 * @param recovered      whether the strategy salvaged the operation
 * @param partialResults results to hand back alongside the error
 * @param message        replacement user-facing message, or {@code null}
 */
public record RecoveryResult(boolean recovered, List<RawResult> partialResults, String message) {

    public RecoveryResult {
        partialResults = partialResults == null ? List.of() : List.copyOf(partialResults);
    }

    public static RecoveryResult notRecovered() {
        return new RecoveryResult(false, List.of(), null);
    }

    public static RecoveryResult notRecovered(String message) {
        return new RecoveryResult(false, List.of(), message);
    }
}
