package io.querybridge.core.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link SecurityValidator#validateQuery}. Errors make the query
 * invalid; warnings are informational.
 *
 * @param sanitizedParameters parameters with control characters stripped, in the original order
 */
public record SqlValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        RiskLevel riskLevel,
        List<Object> sanitizedParameters) {

    public SqlValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        // parameters may legitimately contain nulls
        sanitizedParameters = Collections.unmodifiableList(new ArrayList<>(sanitizedParameters));
    }
}
