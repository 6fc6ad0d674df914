package shipguard.adapter.out.audit;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import shipguard.core.model.audit.AuditEvent;
import shipguard.spi.AuditSink;
import shipguard.spi.AuditSinkException;

/**
 * Audit sink that appends events as JSON lines to a local file.
 *
 * <p>The file is opened lazily on the first event; parent directories are
 * created as needed.
 */
public class FileAuditSink implements AuditSink {

    public static final String NAME = "file";

    private static final Logger LOG = Logger.getLogger(FileAuditSink.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    private BufferedWriter writer;

    public FileAuditSink(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void append(AuditEvent event) throws AuditSinkException {
        try {
            if (writer == null) {
                writer = open();
            }
            writer.write(objectMapper.writeValueAsString(event));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new AuditSinkException("Could not append audit event " + event.sequence() + " to " + path, e);
        }
    }

    private BufferedWriter open() throws IOException {
        final var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        LOG.infof("Appending audit events to %s", path.toAbsolutePath());
        return Files.newBufferedWriter(
                path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            LOG.warnf("Error closing audit file %s: %s", path, e.getMessage());
        } finally {
            writer = null;
        }
    }
}
