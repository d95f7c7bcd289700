package io.querybridge.core.error;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies raw failures into {@link TransformedError}s.
 *
 * <p>
 * Rules are evaluated in descending priority (insertion order among equals) and
 * the first match wins; unmatched errors become {@code UNKNOWN_ERROR}.
 * Recoverable results are then offered to the registered
 * {@link RecoveryStrategy}s for their category. Classification is
 * deterministic: the same error and rule set always give the same category and
 * code.
 *
 * <p>
 * Thread-safe. Rule and strategy lists are copy-on-write; statistics are
 * lock-free counters.
 */
public final class ErrorMapper {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorMapper.class);

    private static final Comparator<ErrorRule> BY_PRIORITY =
            Comparator.comparingInt(ErrorRule::priority).reversed();

    private final List<ErrorRule> rules = new CopyOnWriteArrayList<>();
    private final List<RecoveryStrategy> strategies = new CopyOnWriteArrayList<>();
    private final Object ruleLock = new Object();

    private final AtomicLong totalErrors = new AtomicLong();
    private final Map<ErrorCategory, AtomicLong> byCategory = new EnumMap<>(ErrorCategory.class);
    private final Map<ErrorSeverity, AtomicLong> bySeverity = new EnumMap<>(ErrorSeverity.class);
    private final AtomicLong recoveryAttempts = new AtomicLong();
    private final AtomicLong successfulRecoveries = new AtomicLong();

    /** Mapper with the built-in rules and default recovery strategies. */
    public ErrorMapper() {
        this(BuiltInErrorRules.all(),
                List.of(DefaultRecoveryStrategies.networkRetry(), DefaultRecoveryStrategies.partialResults()));
    }

    public ErrorMapper(List<ErrorRule> initialRules, List<RecoveryStrategy> initialStrategies) {
        for (ErrorCategory category : ErrorCategory.values()) {
            byCategory.put(category, new AtomicLong());
        }
        for (ErrorSeverity severity : ErrorSeverity.values()) {
            bySeverity.put(severity, new AtomicLong());
        }
        initialRules.forEach(this::addRule);
        strategies.addAll(initialStrategies);
    }

    /** Adds a rule and re-sorts. A stable sort keeps insertion order among equal priorities. */
    public void addRule(ErrorRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        synchronized (ruleLock) {
            List<ErrorRule> sorted = new ArrayList<>(rules);
            sorted.add(rule);
            sorted.sort(BY_PRIORITY);
            rules.clear();
            rules.addAll(sorted);
        }
    }

    public void addRecoveryStrategy(RecoveryStrategy strategy) {
        strategies.add(Objects.requireNonNull(strategy, "strategy must not be null"));
    }

    public List<ErrorRule> rules() {
        return List.copyOf(rules);
    }

    /** Classifies {@code error} and runs recovery for recoverable results. */
    public TransformedError map(Throwable error, ErrorContext context) {
        Objects.requireNonNull(error, "error must not be null");
        ErrorContext ctx = context != null ? context : ErrorContext.of("unknown", null);
        totalErrors.incrementAndGet();

        TransformedError result;
        if (error instanceof DataSourceFailureException already) {
            result = already.error();
        } else {
            result = classify(error, ctx);
        }

        byCategory.get(result.category()).incrementAndGet();
        bySeverity.get(result.severity()).incrementAndGet();

        if (result.recoverable()) {
            result = attemptRecovery(result, ctx);
        }
        LOG.debug("Mapped {} from {} to {}/{}", error.getClass().getSimpleName(), ctx.sourceType(),
                result.category().id(), result.code());
        return result;
    }

    /** Classifies several errors, in order. */
    public List<TransformedError> mapAll(List<? extends Throwable> errors, ErrorContext context) {
        List<TransformedError> mapped = new ArrayList<>(errors.size());
        for (Throwable error : errors) {
            mapped.add(map(error, context));
        }
        return mapped;
    }

    /** Maps {@code error} and wraps the result for throwing across the connector boundary. */
    public DataSourceFailureException toFailure(Throwable error, ErrorContext context) {
        if (error instanceof DataSourceFailureException already) {
            return already;
        }
        return new DataSourceFailureException(map(error, context), error);
    }

    public ErrorStats stats() {
        Map<ErrorCategory, Long> categories = new EnumMap<>(ErrorCategory.class);
        byCategory.forEach((k, v) -> {
            if (v.get() > 0) {
                categories.put(k, v.get());
            }
        });
        Map<ErrorSeverity, Long> severities = new EnumMap<>(ErrorSeverity.class);
        bySeverity.forEach((k, v) -> {
            if (v.get() > 0) {
                severities.put(k, v.get());
            }
        });
        return new ErrorStats(
                totalErrors.get(), categories, severities, recoveryAttempts.get(), successfulRecoveries.get());
    }

    public void resetStats() {
        totalErrors.set(0);
        byCategory.values().forEach(c -> c.set(0));
        bySeverity.values().forEach(c -> c.set(0));
        recoveryAttempts.set(0);
        successfulRecoveries.set(0);
    }

    private TransformedError classify(Throwable error, ErrorContext context) {
        for (ErrorRule rule : rules) {
            boolean matched;
            try {
                matched = rule.matches(error, context);
            } catch (RuntimeException e) {
                LOG.warn("Error rule '{}' failed while matching: {}", rule.name(), e.toString());
                continue;
            }
            if (matched) {
                return rule.apply(error, context);
            }
        }
        String raw = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return TransformedError.builder(ErrorCategory.UNKNOWN, "UNKNOWN_ERROR")
                .message("An unexpected error occurred")
                .technical(raw)
                .build();
    }

    private TransformedError attemptRecovery(TransformedError error, ErrorContext context) {
        recoveryAttempts.incrementAndGet();
        for (RecoveryStrategy strategy : strategies) {
            if (!strategy.applicableCategories().contains(error.category())) {
                continue;
            }
            try {
                RecoveryResult result = strategy.recover(error, context);
                if (result.recovered()) {
                    successfulRecoveries.incrementAndGet();
                    TransformedError recovered = error.withPartialResults(result.partialResults());
                    if (result.message() != null) {
                        recovered = new TransformedError(
                                result.message(), recovered.severity(), recovered.category(), recovered.code(),
                                recovered.technical(), recovered.suggestions(), recovered.recoverable(),
                                recovered.retryInfo(), recovered.partialResults());
                    }
                    return recovered;
                }
            } catch (RuntimeException e) {
                LOG.warn("Recovery strategy '{}' failed: {}", strategy.name(), e.getMessage(), e);
            }
        }
        return error;
    }
}
