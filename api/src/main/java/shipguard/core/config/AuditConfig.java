package shipguard.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the audit event log and its durable sinks.
 */
@ConfigMapping(prefix = "shipguard.audit")
public interface AuditConfig {

    /**
     * Maximum number of events kept in memory. Oldest events are evicted first.
     */
    @WithName("buffer-capacity")
    @WithDefault("1000")
    int bufferCapacity();

    /**
     * Maximum number of events waiting for the sink worker. Events offered
     * to a full queue are not forwarded (they stay in the in-memory buffer).
     */
    @WithName("sink-queue-capacity")
    @WithDefault("10000")
    int sinkQueueCapacity();

    /**
     * JSON-line logging sink.
     */
    @WithName("logging-sink")
    LoggingSinkConfig loggingSink();

    /**
     * JSON-lines file sink.
     */
    @WithName("file-sink")
    FileSinkConfig fileSink();

    interface LoggingSinkConfig {
        @WithDefault("true")
        boolean enabled();
    }

    interface FileSinkConfig {
        @WithDefault("false")
        boolean enabled();

        /**
         * File the events are appended to. Parent directories are created.
         */
        @WithDefault("logs/audit.jsonl")
        String path();
    }
}
