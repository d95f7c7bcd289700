package io.querybridge.proxy.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.querybridge.core.model.ConnectionMetrics;
import io.querybridge.core.pool.PoolStats;
import io.querybridge.core.ratelimit.RateLimiterStats;
import io.querybridge.core.ratelimit.SlidingWindowRateLimiter;
import io.querybridge.proxy.search.SearchService;
import java.util.List;

/** {@code GET /metrics}: pool counters, rate limiter counters and recent query timings. */
public final class MetricsHandler implements Handler {

    private static final int RECENT = 100;

    private final SearchService service;
    private final SlidingWindowRateLimiter limiter;
    private final ObjectMapper mapper;

    public MetricsHandler(SearchService service, SlidingWindowRateLimiter limiter, ObjectMapper mapper) {
        this.service = service;
        this.limiter = limiter;
        this.mapper = mapper;
    }

    @Override
    public void handle(Context ctx) {
        ObjectNode body = mapper.createObjectNode();

        PoolStats pool = service.poolStats();
        ObjectNode poolNode = body.putObject("pool");
        poolNode.put("total", pool.total());
        poolNode.put("idle", pool.idle());
        poolNode.put("active", pool.active());
        poolNode.put("waiting", pool.waiting());
        poolNode.put("created", pool.created());
        poolNode.put("destroyed", pool.destroyed());
        poolNode.put("acquired", pool.acquired());
        poolNode.put("timedOut", pool.timedOut());

        RateLimiterStats rate = limiter.getStats();
        ObjectNode rateNode = body.putObject("rateLimit");
        rateNode.put("activeClients", rate.activeClients());
        rateNode.put("totalRequests", rate.totalRequests());
        rateNode.put("blockedRequests", rate.blockedRequests());

        List<ConnectionMetrics> metrics = service.metrics();
        ArrayNode queries = body.putArray("queries");
        for (ConnectionMetrics m : metrics.subList(Math.max(0, metrics.size() - RECENT), metrics.size())) {
            ObjectNode node = queries.addObject();
            node.put("connectionTimeMs", m.connectionTimeMs());
            node.put("queryTimeMs", m.queryTimeMs());
            node.put("totalTimeMs", m.totalTimeMs());
            node.put("success", m.success());
            node.put("resultCount", m.resultCount());
            node.put("recordedAt", m.recordedAt().toString());
        }

        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body.toString());
    }
}
