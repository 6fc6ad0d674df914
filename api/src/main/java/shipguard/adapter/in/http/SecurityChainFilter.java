package shipguard.adapter.in.http;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.TimeoutException;
import org.jboss.logging.Logger;

import shipguard.core.config.SecurityChainConfig;
import shipguard.core.model.chain.Rejection;
import shipguard.core.model.chain.SecurityRequest;
import shipguard.core.model.chain.StageResult;
import shipguard.core.service.chain.SecurityChainService;

/**
 * JAX-RS filter pair that runs the security chain for every matched request.
 *
 * <p>The request filter builds a {@link SecurityRequest} from the request line,
 * headers, query parameters and JSON body, runs the chain, and either aborts
 * with the rejection or lets the request through with the (possibly
 * sanitized) body. The response filter adds the headers the chain collected,
 * rejected requests included.
 *
 * <p>Endpoints behind this filter must be blocking: the chain run is awaited
 * for at most {@code shipguard.security.chain-timeout}.
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class SecurityChainFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(SecurityChainFilter.class);

    static final String SECURITY_REQUEST_ATTR = "shipguard.security.request";
    static final String CORRELATION_HEADER = "X-Correlation-ID";

    private final SecurityChainService chainService;
    private final ObjectMapper objectMapper;
    private final CurrentSecurityRequest currentRequest;
    private final Duration chainTimeout;

    @Inject
    public SecurityChainFilter(
            SecurityChainService chainService,
            ObjectMapper objectMapper,
            CurrentSecurityRequest currentRequest,
            SecurityChainConfig config) {
        this(chainService, objectMapper, currentRequest, config.chainTimeout());
    }

    SecurityChainFilter(
            SecurityChainService chainService,
            ObjectMapper objectMapper,
            CurrentSecurityRequest currentRequest,
            Duration chainTimeout) {
        this.chainService = chainService;
        this.objectMapper = objectMapper;
        this.currentRequest = currentRequest;
        this.chainTimeout = chainTimeout;
    }

    @Override
    public void filter(ContainerRequestContext ctx) {
        if (!chainService.isEnabled()) {
            return;
        }

        final var request = toSecurityRequest(ctx);
        ctx.setProperty(SECURITY_REQUEST_ATTR, request);
        currentRequest.set(request);

        final StageResult result;
        try {
            result = chainService.process(request).await().atMost(chainTimeout);
        } catch (TimeoutException e) {
            LOG.warnf("Security chain timed out after %s for %s %s", chainTimeout, request.method(), request.path());
            ctx.abortWith(json(503, Map.of("error", "Security check timed out")));
            return;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Security chain failed for %s %s", request.method(), request.path());
            ctx.abortWith(json(500, Map.of("error", "Internal server error")));
            return;
        }

        if (result instanceof StageResult.ShortCircuit shortCircuit) {
            ctx.abortWith(toResponse(shortCircuit.rejection()));
            return;
        }

        if (request.isBodyModified()) {
            request.body().ifPresent(body -> replaceEntity(ctx, body));
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        final var request = (SecurityRequest) requestContext.getProperty(SECURITY_REQUEST_ATTR);
        if (request == null) {
            return;
        }
        final var headers = responseContext.getHeaders();
        request.responseHeaders().forEach((name, value) -> {
            if (!headers.containsKey(name)) {
                headers.putSingle(name, value);
            }
        });
    }

    private SecurityRequest toSecurityRequest(ContainerRequestContext ctx) {
        final var correlationId = firstNonBlank(
                ctx.getHeaderString(CORRELATION_HEADER), ctx.getHeaderString("X-Request-ID"));

        final var builder = SecurityRequest.builder(ctx.getMethod(), normalizePath(ctx.getUriInfo().getPath()))
                .clientIp(ClientIpResolver.resolve(ctx::getHeaderString))
                .correlationId(correlationId != null ? correlationId : UUID.randomUUID().toString());

        ctx.getHeaders().forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                builder.header(name, String.join(",", values));
            }
        });
        ctx.getUriInfo().getQueryParameters().forEach(builder::queryParam);
        readJsonBody(ctx).ifPresent(builder::body);

        final var request = builder.build();
        request.addResponseHeader(CORRELATION_HEADER, request.correlationId());
        return request;
    }

    private Optional<JsonNode> readJsonBody(ContainerRequestContext ctx) {
        if (!ctx.hasEntity() || !isJson(ctx.getMediaType())) {
            return Optional.empty();
        }
        final byte[] bytes;
        try {
            bytes = ctx.getEntityStream().readAllBytes();
        } catch (IOException e) {
            LOG.debugf("Could not read request body: %s", e.getMessage());
            return Optional.empty();
        }
        ctx.setEntityStream(new ByteArrayInputStream(bytes));
        if (bytes.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readTree(bytes));
        } catch (IOException e) {
            // Malformed JSON is left for the endpoint to reject
            LOG.debugf("Request body is not valid JSON: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private void replaceEntity(ContainerRequestContext ctx, JsonNode body) {
        try {
            ctx.setEntityStream(new ByteArrayInputStream(objectMapper.writeValueAsBytes(body)));
        } catch (IOException e) {
            LOG.warnf("Could not re-encode sanitized body: %s", e.getMessage());
        }
    }

    private static boolean isJson(MediaType mediaType) {
        return mediaType != null
                && ("json".equalsIgnoreCase(mediaType.getSubtype())
                        || mediaType.getSubtype().toLowerCase(Locale.ROOT).endsWith("+json"));
    }

    private static Response toResponse(Rejection rejection) {
        final var response = Response.status(rejection.status())
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(rejection.body());
        rejection.headers().forEach(response::header);
        return response.build();
    }

    private static Response json(int status, Map<String, Object> body) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(body)
                .build();
    }

    private static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
