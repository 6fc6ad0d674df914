package shipguard.adapter.out.alert;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import shipguard.core.config.AnomalyConfig;
import shipguard.core.model.audit.SecurityAlert;
import shipguard.core.port.out.AlertPublisher;
import shipguard.spi.AlertChannel;

/**
 * Publishes security alerts to the registered alert channels.
 *
 * <p>Channels are invoked asynchronously in priority order (highest first) on a
 * single background thread. A failing channel is logged and does not stop the
 * others.
 */
@ApplicationScoped
public class AlertDispatcher implements AlertPublisher {

    private static final Logger LOG = Logger.getLogger(AlertDispatcher.class);

    private final AnomalyConfig config;
    private final Vertx vertx;
    private final ObjectMapper objectMapper;

    private List<AlertChannel> channels = List.of();
    private ExecutorService executor;

    @Inject
    public AlertDispatcher(AnomalyConfig config, Vertx vertx, ObjectMapper objectMapper) {
        this.config = config;
        this.vertx = vertx;
        this.objectMapper = objectMapper;
    }

    AlertDispatcher(List<AlertChannel> channels) {
        this.config = null;
        this.vertx = null;
        this.objectMapper = null;
        start(channels);
    }

    @PostConstruct
    void init() {
        final var loaded = new ArrayList<AlertChannel>();
        loaded.add(new LoggingAlertChannel());
        config.webhook().url().ifPresent(url -> loaded.add(
                new WebhookAlertChannel(WebClient.create(vertx), url, config.webhook().timeout(), objectMapper)));
        ServiceLoader.load(AlertChannel.class).stream()
                .map(ServiceLoader.Provider::get)
                .forEach(loaded::add);

        start(loaded);
    }

    private void start(List<AlertChannel> candidates) {
        channels = candidates.stream()
                .filter(AlertChannel::isAvailable)
                .sorted(Comparator.comparingInt(AlertChannel::priority).reversed())
                .toList();

        LOG.infof(
                "Loaded %d alert channel(s): %s",
                channels.size(),
                channels.stream()
                        .map(c -> c.name() + "(priority=" + c.priority() + ")")
                        .toList());

        executor = Executors.newSingleThreadExecutor(r -> {
            final var thread = new Thread(r, "security-alert-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        channels.forEach(channel -> {
            try {
                channel.close();
            } catch (Exception e) {
                LOG.warnf("Error closing alert channel %s: %s", channel.name(), e.getMessage());
            }
        });
    }

    @Override
    public void publish(SecurityAlert alert) {
        if (executor == null || channels.isEmpty()) {
            return;
        }

        executor.submit(() -> {
            for (var channel : channels) {
                try {
                    channel.send(alert);
                } catch (Exception e) {
                    LOG.warnf("Alert channel %s failed for rule %s: %s", channel.name(), alert.rule(), e.getMessage());
                }
            }
        });
    }

    public List<AlertChannel> getChannels() {
        return channels;
    }

    ExecutorService executor() {
        return executor;
    }
}
