package app.augmenter.client.ankiconnect;

import java.util.Map;

/**
 * One entry of a {@code notesInfo} response.
 *
 * @param fields field name to value and ordinal
 */
public record AnkiNoteInfo(
        long noteId,
        String modelName,
        Map<String, FieldValue> fields
) {

    public record FieldValue(String value, int order) {
    }
}
