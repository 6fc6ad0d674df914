package shipguard.core.model.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;

import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.auth.AuthenticatedPrincipal;

/**
 * Per-request view handed through the security chain.
 *
 * <p>The request line, headers and query parameters are fixed at construction.
 * The JSON body may be rewritten in place by sanitization. Stages record the
 * verified principal and the response headers to add on the way out.
 */
public final class SecurityRequest {

    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final Map<String, List<String>> queryParams;
    private final String clientIp;
    private final String correlationId;
    private final Map<String, String> responseHeaders = new LinkedHashMap<>();

    private JsonNode body;
    private boolean bodyModified;
    private RouteProfile routeProfile;
    private AuthenticatedPrincipal principal;

    private SecurityRequest(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.path = Objects.requireNonNull(builder.path, "path must not be null");
        final var headerCopy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        headerCopy.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(headerCopy);
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParams));
        this.clientIp = builder.clientIp != null ? builder.clientIp : "unknown";
        this.correlationId = builder.correlationId;
        this.body = builder.body;
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public Map<String, List<String>> queryParams() {
        return queryParams;
    }

    public String clientIp() {
        return clientIp;
    }

    public Optional<String> userAgent() {
        return header("User-Agent");
    }

    public String correlationId() {
        return correlationId;
    }

    public NetworkOrigin origin() {
        return new NetworkOrigin(clientIp, userAgent().orElse(null));
    }

    public Optional<JsonNode> body() {
        return Optional.ofNullable(body);
    }

    public void replaceBody(JsonNode newBody) {
        this.body = newBody;
        this.bodyModified = true;
    }

    public void markBodyModified() {
        this.bodyModified = true;
    }

    public boolean isBodyModified() {
        return bodyModified;
    }

    public RouteProfile routeProfile() {
        return routeProfile;
    }

    public void routeProfile(RouteProfile routeProfile) {
        this.routeProfile = routeProfile;
    }

    public Optional<AuthenticatedPrincipal> principal() {
        return Optional.ofNullable(principal);
    }

    public void authenticate(AuthenticatedPrincipal principal) {
        this.principal = principal;
    }

    public void addResponseHeader(String name, String value) {
        responseHeaders.put(name, value);
    }

    public Map<String, String> responseHeaders() {
        return Collections.unmodifiableMap(responseHeaders);
    }

    public static final class Builder {
        private final String method;
        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, List<String>> queryParams = new LinkedHashMap<>();
        private String clientIp;
        private String correlationId;
        private JsonNode body;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder queryParam(String name, List<String> values) {
            queryParams.put(name, List.copyOf(values));
            return this;
        }

        public Builder queryParam(String name, String value) {
            return queryParam(name, List.of(value));
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder body(JsonNode body) {
            this.body = body;
            return this;
        }

        public SecurityRequest build() {
            return new SecurityRequest(this);
        }
    }
}
