package io.querybridge.core.error;

import java.util.Set;

/** Post-classification recovery for errors of certain categories. */
public interface RecoveryStrategy {

    String name();

    Set<ErrorCategory> applicableCategories();

    /** Attempts recovery. May throw; the mapper logs the failure and moves on. */
    RecoveryResult recover(TransformedError error, ErrorContext context);
}
