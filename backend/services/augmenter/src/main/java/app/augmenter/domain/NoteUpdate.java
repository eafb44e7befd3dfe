package app.augmenter.domain;

public record NoteUpdate(long noteId, String flds, long mod) {
}
