package app.augmenter.service;

public enum AugmentError {
    INVALID_ARGUMENTS(2),
    INVALID_CONTAINER(3),
    MISSING_PAYLOAD(3),
    WRITE_FAILED(3),
    NOTE_TYPE_NOT_FOUND(4),
    FIELD_NOT_FOUND(4),
    MISSING_SOURCE_FIELD(4),
    ANKI_CONNECT_UNREACHABLE(5),
    ANKI_CONNECT_ERROR(5),
    MISSING_CREDENTIALS(5);

    private final int exitCode;

    AugmentError(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
