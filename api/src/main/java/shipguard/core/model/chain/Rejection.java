package shipguard.core.model.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal response produced by a stage that stops the chain.
 *
 * @param status HTTP status code
 * @param headers extra response headers
 * @param body JSON body
 */
public record Rejection(int status, Map<String, String> headers, Map<String, Object> body) {

    public Rejection {
        Objects.requireNonNull(body, "body must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public static Rejection of(int status, String error) {
        return new Rejection(status, Map.of(), Map.of("error", error));
    }

    public String error() {
        return String.valueOf(body.get("error"));
    }
}
