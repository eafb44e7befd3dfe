package app.augmenter.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One row of the collection's {@code notes} table.
 *
 * @param id         note id
 * @param noteTypeId id of the note type the note belongs to
 * @param flds       all field values joined with {@link #FIELD_SEPARATOR}
 * @param mod        last modification time in epoch seconds
 */
public record CollectionNote(long id, long noteTypeId, String flds, long mod) {

    public static final String FIELD_SEPARATOR = "\u001f";

    public CollectionNote {
        if (flds == null) {
            flds = "";
        }
    }

    public static CollectionNote of(long id, long noteTypeId, List<String> values, long mod) {
        return new CollectionNote(id, noteTypeId, String.join(FIELD_SEPARATOR, values), mod);
    }

    public List<String> values() {
        return Arrays.asList(flds.split(FIELD_SEPARATOR, -1));
    }

    public int valueCount() {
        return values().size();
    }

    /**
     * Value at {@code ordinal}, or an empty string when the note stores fewer values.
     */
    public String value(int ordinal) {
        List<String> values = values();
        return ordinal >= 0 && ordinal < values.size() ? values.get(ordinal) : "";
    }

    /**
     * Field string with {@code ordinal} replaced by {@code value}, padded to at least {@code arity} values.
     */
    public String withValue(int ordinal, String value, int arity) {
        List<String> values = new ArrayList<>(values());
        int size = Math.max(arity, ordinal + 1);
        while (values.size() < size) {
            values.add("");
        }
        values.set(ordinal, value);
        return String.join(FIELD_SEPARATOR, values);
    }
}
