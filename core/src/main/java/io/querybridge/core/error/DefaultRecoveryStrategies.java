package io.querybridge.core.error;

import java.util.Set;

/** Stock {@link RecoveryStrategy} implementations registered by every {@link ErrorMapper}. */
public final class DefaultRecoveryStrategies {

    private DefaultRecoveryStrategies() {
        // utility class
    }

    /**
     * Reports the next retry attempt for network and timeout errors. It never
     * recovers by itself: retrying is up to the caller.
     */
    public static RecoveryStrategy networkRetry() {
        return new RecoveryStrategy() {
            @Override
            public String name() {
                return "network_retry";
            }

            @Override
            public Set<ErrorCategory> applicableCategories() {
                return Set.of(ErrorCategory.NETWORK, ErrorCategory.TIMEOUT);
            }

            @Override
            public RecoveryResult recover(TransformedError error, ErrorContext context) {
                int max = error.retryInfo() != null ? error.retryInfo().maxAttempts() : 3;
                if (context.retryAttempt() < max) {
                    return RecoveryResult.notRecovered("Retry attempt " + (context.retryAttempt() + 1) + " of " + max);
                }
                return RecoveryResult.notRecovered();
            }
        };
    }

    /** Recovers data and transformation errors with whatever partial results the context carries. */
    public static RecoveryStrategy partialResults() {
        return new RecoveryStrategy() {
            @Override
            public String name() {
                return "partial_results";
            }

            @Override
            public Set<ErrorCategory> applicableCategories() {
                return Set.of(ErrorCategory.DATA, ErrorCategory.TRANSFORMATION);
            }

            @Override
            public RecoveryResult recover(TransformedError error, ErrorContext context) {
                return new RecoveryResult(
                        true, context.partialResults(), "Some results may be incomplete due to processing errors");
            }
        };
    }
}
