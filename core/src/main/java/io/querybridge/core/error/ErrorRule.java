package io.querybridge.core.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * One classification rule of the {@link ErrorMapper}: a matcher and a
 * transformer. Rules run in descending priority and the first match wins.
 *
 * @param name        identifier used in logs
 * @param priority    higher runs first
 * @param matcher     decides whether the rule applies
 * @param transformer builds the classified error
 */
public record ErrorRule(
        String name,
        int priority,
        BiPredicate<Throwable, ErrorContext> matcher,
        BiFunction<Throwable, ErrorContext, TransformedError> transformer) {

    public static final int DEFAULT_PRIORITY = 50;

    public ErrorRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(transformer, "transformer must not be null");
    }

    public boolean matches(Throwable error, ErrorContext context) {
        return matcher.test(error, context);
    }

    public TransformedError apply(Throwable error, ErrorContext context) {
        return transformer.apply(error, context);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lower-cased messages of the error and its causes, joined by newlines.
     * Rules match against this text so that wrapped driver errors are
     * classified by their root message.
     */
    static String messageText(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t.getMessage() != null) {
                text.append(t.getMessage().toLowerCase(Locale.ROOT)).append('\n');
            }
        }
        return text.toString();
    }

    /** Fluent construction of custom rules. Matchers added here are OR-combined. */
    public static final class Builder {

        private String name;
        private int priority = DEFAULT_PRIORITY;
        private final List<BiPredicate<Throwable, ErrorContext>> matchers = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /** Matches when any message in the cause chain contains one of the fragments (case-insensitive). */
        public Builder matchMessage(String... fragments) {
            List<String> lower = new ArrayList<>();
            for (String f : fragments) {
                lower.add(f.toLowerCase(Locale.ROOT));
            }
            matchers.add((error, context) -> {
                String text = messageText(error);
                return lower.stream().anyMatch(text::contains);
            });
            return this;
        }

        /** Matches errors of the given type or a subtype. */
        public Builder matchType(Class<? extends Throwable> type) {
            matchers.add((error, context) -> type.isInstance(error));
            return this;
        }

        public Builder match(BiPredicate<Throwable, ErrorContext> predicate) {
            matchers.add(predicate);
            return this;
        }

        /** Completes the rule with its transformer. */
        public ErrorRule transform(BiFunction<Throwable, ErrorContext, TransformedError> transformer) {
            if (matchers.isEmpty()) {
                throw new IllegalStateException("an error rule needs at least one matcher");
            }
            List<BiPredicate<Throwable, ErrorContext>> snapshot = List.copyOf(matchers);
            BiPredicate<Throwable, ErrorContext> combined =
                    (error, context) -> snapshot.stream().anyMatch(m -> m.test(error, context));
            String ruleName = name != null ? name : "custom_rule_" + System.nanoTime();
            return new ErrorRule(ruleName, priority, combined, transformer);
        }
    }
}
