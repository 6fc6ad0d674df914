package shipguard.adapter.out.alert;

import java.time.Duration;
import java.util.LinkedHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.SecurityAlert;
import shipguard.spi.AlertChannel;

/**
 * Alert channel that POSTs alerts as JSON to a configured URL.
 *
 * <p>Delivery is fire-and-forget: non-2xx responses and transport errors are
 * logged and the alert is not retried.
 *
 * <pre>{@code
 * POST <url>
 * {
 *   "rule": "repeated-login-failure",
 *   "level": "error",
 *   "summary": "...",
 *   "eventCount": 3,
 *   "windowMinutes": 15,
 *   "event": { ... }
 * }
 * }</pre>
 */
public class WebhookAlertChannel implements AlertChannel {

    public static final String NAME = "webhook";

    private static final Logger LOG = Logger.getLogger(WebhookAlertChannel.class);
    private static final int PRIORITY = 10;

    private final WebClient webClient;
    private final String url;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public WebhookAlertChannel(WebClient webClient, String url, Duration timeout, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.url = url;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return url != null && !url.isBlank();
    }

    @Override
    public void send(SecurityAlert alert) {
        final String body;
        try {
            body = objectMapper.writeValueAsString(payload(alert));
        } catch (JsonProcessingException e) {
            LOG.warnf("Could not encode alert for rule %s: %s", alert.rule(), e.getMessage());
            return;
        }

        webClient
                .postAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .sendBuffer(Buffer.buffer(body))
                .subscribe()
                .with(
                        response -> {
                            if (response.statusCode() >= 300) {
                                LOG.warnf(
                                        "Alert webhook returned status %d for rule %s",
                                        response.statusCode(), alert.rule());
                            }
                        },
                        failure -> LOG.warnf("Alert webhook delivery failed: %s", failure.getMessage()));
    }

    static LinkedHashMap<String, Object> payload(SecurityAlert alert) {
        final var payload = new LinkedHashMap<String, Object>();
        payload.put("rule", alert.rule());
        payload.put("level", alert.level().wireName());
        payload.put("summary", alert.summary());
        payload.put("eventCount", alert.eventCount());
        payload.put("windowMinutes", alert.window().toMinutes());
        payload.put("event", alert.event());
        return payload;
    }

    @Override
    public void close() {
        webClient.close();
    }
}
