package io.querybridge.proxy.search;

import java.util.List;

/** A client request failed validation. Carries one message per violated rule. */
public final class RequestValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public RequestValidationException(List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
