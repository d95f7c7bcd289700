package io.querybridge.proxy.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Readiness probe. Returns
 * {@code 200 {"status":"READY","database":"reachable"}} when a pooled database
 * connection passes its health check, {@code 503} otherwise.
 */
public final class ReadinessHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ReadinessHandler.class);

    private static final String READY = "{\"status\":\"READY\",\"database\":\"reachable\"}";
    private static final String NOT_READY = "{\"status\":\"NOT_READY\",\"reason\":\"database_unreachable\"}";

    private final BooleanSupplier databaseHealthy;

    public ReadinessHandler(BooleanSupplier databaseHealthy) {
        this.databaseHealthy = databaseHealthy;
    }

    @Override
    public void handle(Context ctx) {
        ctx.contentType("application/json");
        if (!databaseHealthy.getAsBoolean()) {
            LOG.debug("Readiness check: database unreachable");
            ctx.status(503);
            ctx.result(NOT_READY);
            return;
        }
        ctx.status(200);
        ctx.result(READY);
    }
}
