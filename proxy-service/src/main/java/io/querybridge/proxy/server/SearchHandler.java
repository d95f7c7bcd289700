package io.querybridge.proxy.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorContext;
import io.querybridge.core.error.ErrorMapper;
import io.querybridge.core.error.TransformedError;
import io.querybridge.proxy.search.RequestValidationException;
import io.querybridge.proxy.search.SearchRequest;
import io.querybridge.proxy.search.SearchResult;
import io.querybridge.proxy.search.SearchService;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /search}: validates the body, runs the search and replies
 * <pre>{@code
 * {"success": true, "data": [...],
 *  "metadata": {"total": 42, "limit": 20, "offset": 0, "executionTimeMs": 7, "timestamp": "..."}}
 * }</pre>
 *
 * <p>
 * Validation failures are {@code 400}. Search failures are classified by the
 * core {@link ErrorMapper} and returned as {@code 500} with the user-facing
 * message only.
 */
public final class SearchHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(SearchHandler.class);

    private final SearchService service;
    private final ErrorMapper errorMapper;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SearchHandler(SearchService service, ErrorMapper errorMapper, ObjectMapper mapper, Clock clock) {
        this.service = service;
        this.errorMapper = errorMapper;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void handle(Context ctx) {
        SearchRequest request;
        try {
            request = SearchRequest.parse(readBody(ctx.body()));
        } catch (RequestValidationException e) {
            ProblemDetail.respond(ctx, ProblemDetail.validationError(e.getMessage(), e.errors(), ctx.path()));
            return;
        }

        SearchResult result;
        try {
            result = service.search(request);
        } catch (RequestValidationException e) {
            ProblemDetail.respond(ctx, ProblemDetail.validationError(e.getMessage(), e.errors(), ctx.path()));
            return;
        } catch (RuntimeException e) {
            TransformedError error = classify(e);
            LOG.error("Search on table '{}' failed: [{}] {}", request.tableName(), error.code(), error.technical(), e);
            ProblemDetail.respond(ctx, ProblemDetail.searchError(error.message(), error.code(), ctx.path()));
            return;
        }

        ObjectNode body = mapper.createObjectNode();
        body.put("success", true);
        body.putArray("data").addAll(result.data());
        ObjectNode metadata = body.putObject("metadata");
        metadata.put("total", result.total());
        metadata.put("limit", request.limit());
        metadata.put("offset", request.offset());
        metadata.put("executionTimeMs", result.executionTimeMs());
        metadata.put("timestamp", clock.instant().toString());
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body.toString());
    }

    private JsonNode readBody(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new RequestValidationException(List.of("Request body is required"));
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new RequestValidationException(List.of("Request body is not valid JSON: " + e.getOriginalMessage()));
        }
    }

    private TransformedError classify(RuntimeException e) {
        if (e instanceof DataSourceFailureException failure) {
            return failure.error();
        }
        return errorMapper.map(e, ErrorContext.of("sql", "search"));
    }
}
