package shipguard.adapter.out.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEvent;
import shipguard.core.model.audit.AuditLevel;
import shipguard.spi.AuditSink;
import shipguard.spi.AuditSinkException;

/**
 * Audit sink that writes one JSON line per event on the {@code shipguard.audit}
 * log category. Warn and above are logged at WARN, the rest at INFO.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String NAME = "logging";

    private static final Logger LOG = Logger.getLogger("shipguard.audit");

    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void append(AuditEvent event) throws AuditSinkException {
        final String line;
        try {
            line = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AuditSinkException("Could not encode audit event " + event.sequence(), e);
        }

        if (event.level().isAtLeast(AuditLevel.WARN)) {
            LOG.warn(line);
        } else {
            LOG.info(line);
        }
    }
}
