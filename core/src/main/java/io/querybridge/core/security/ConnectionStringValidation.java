package io.querybridge.core.security;

import java.util.List;

/**
 * Outcome of {@link SecurityValidator#validateConnectionString}.
 *
 * @param sanitized the input with credentials redacted, safe to log
 */
public record ConnectionStringValidation(boolean valid, List<String> errors, String sanitized) {

    public ConnectionStringValidation {
        errors = List.copyOf(errors);
    }
}
