package app.augmenter.domain;

public record FieldUpdate(long noteId, String fieldName, String value) {
}
