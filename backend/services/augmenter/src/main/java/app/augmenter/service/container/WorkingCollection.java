package app.augmenter.service.container;

import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Extracted package plus the decompressed, query-able copy of its collection.
 */
public class WorkingCollection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkingCollection.class);

    private final Path workDir;
    private final Path databasePath;
    private final PayloadForm sourceForm;

    private Connection connection;

    WorkingCollection(Path workDir, Path databasePath, PayloadForm sourceForm) {
        this.workDir = workDir;
        this.databasePath = databasePath;
        this.sourceForm = sourceForm;
    }

    public Path workDir() {
        return workDir;
    }

    public Path databasePath() {
        return databasePath;
    }

    public PayloadForm sourceForm() {
        return sourceForm;
    }

    public synchronized Connection connection() {
        try {
            if (connection == null || connection.isClosed()) {
                connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
            }
            return connection;
        } catch (SQLException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to open collection sqlite: " + databasePath, ex);
        }
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException ex) {
            log.warn("Failed to close working collection path={} error={}", databasePath, ex.getMessage());
        } finally {
            connection = null;
        }
    }
}
