package app.augmenter.service.container;

/**
 * Database payload slots an Anki package can carry, in order of preference.
 */
public enum PayloadForm {
    MODERN("collection.anki21b", true),
    LEGACY_21("collection.anki21", false),
    LEGACY("collection.anki2", false);

    private final String entryName;
    private final boolean compressed;

    PayloadForm(String entryName, boolean compressed) {
        this.entryName = entryName;
        this.compressed = compressed;
    }

    public String entryName() {
        return entryName;
    }

    public boolean compressed() {
        return compressed;
    }
}
