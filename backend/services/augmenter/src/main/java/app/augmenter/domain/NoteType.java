package app.augmenter.domain;

public record NoteType(long id, String name, FieldMap fields) {
}
