package app.augmenter.service.writeback;

import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.domain.NoteUpdate;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes generated field values into the working collection in one transaction.
 */
@Component
public class CollectionWriteBack {

    private static final Logger log = LoggerFactory.getLogger(CollectionWriteBack.class);

    private final Clock clock;

    public CollectionWriteBack(Clock clock) {
        this.clock = clock;
    }

    public List<NoteUpdate> buildUpdates(List<CollectionNote> notes,
                                         Map<Long, String> contents,
                                         FieldMap fieldMap,
                                         String targetField) {
        int target = fieldMap.ordinal(targetField)
                .orElseThrow(() -> new AugmentException(AugmentError.FIELD_NOT_FOUND, "Target field '" + targetField + "' not found"));
        long mod = clock.instant().getEpochSecond();
        List<NoteUpdate> updates = new ArrayList<>();
        for (CollectionNote note : notes) {
            String content = contents.get(note.id());
            if (content == null) {
                continue;
            }
            updates.add(new NoteUpdate(note.id(), note.withValue(target, content, fieldMap.arity()), mod));
        }
        return updates;
    }

    public int apply(Connection connection, List<NoteUpdate> updates) {
        if (updates.isEmpty()) {
            log.info("No updates needed");
            return 0;
        }
        log.info("Updating {} notes in collection", updates.size());
        try {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement stmt = connection.prepareStatement("update notes set flds = ?, mod = ? where id = ?")) {
                for (NoteUpdate update : updates) {
                    stmt.setString(1, update.flds());
                    stmt.setLong(2, update.mod());
                    stmt.setLong(3, update.noteId());
                    stmt.addBatch();
                }
                int[] counts = stmt.executeBatch();
                connection.commit();
                return sum(counts);
            } catch (SQLException ex) {
                connection.rollback();
                throw ex;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException ex) {
            throw new AugmentException(AugmentError.WRITE_FAILED, "Failed to update notes", ex);
        }
    }

    private int sum(int[] counts) {
        int total = 0;
        for (int count : counts) {
            total += Math.max(count, 0);
        }
        return total;
    }
}
