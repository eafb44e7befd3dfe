package app.augmenter.service.selection;

import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Component
public class RecordSelector {

    public List<CollectionNote> loadNotes(Connection connection, long noteTypeId) {
        List<CollectionNote> notes = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(
                "select id, mid, flds, mod from notes where mid = ? order by id")) {
            stmt.setLong(1, noteTypeId);
            ResultSet rs = stmt.executeQuery();
            while (rs.next()) {
                notes.add(new CollectionNote(
                        rs.getLong("id"),
                        rs.getLong("mid"),
                        rs.getString("flds"),
                        rs.getLong("mod")
                ));
            }
        } catch (SQLException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to query notes of note type " + noteTypeId, ex);
        }
        return notes;
    }

    /**
     * Splits {@code notes} into those whose target field is absent or blank and the rest, keeping input order.
     */
    public Selection selectPending(List<CollectionNote> notes, FieldMap fieldMap, String targetField) {
        int target = fieldMap.ordinal(targetField)
                .orElseThrow(() -> new AugmentException(
                        AugmentError.FIELD_NOT_FOUND,
                        "Target field '" + targetField + "' not found. Available fields: " + fieldMap.names()
                ));
        List<CollectionNote> pending = new ArrayList<>();
        List<CollectionNote> done = new ArrayList<>();
        for (CollectionNote note : notes) {
            if (isPending(note, target)) {
                pending.add(note);
            } else {
                done.add(note);
            }
        }
        return new Selection(pending, done);
    }

    private boolean isPending(CollectionNote note, int target) {
        List<String> values = note.values();
        return values.size() <= target || isBlank(values.get(target));
    }

    /**
     * Blank when every character is whitespace, non-breaking spaces included.
     */
    static boolean isBlank(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) {
                return false;
            }
        }
        return true;
    }
}
