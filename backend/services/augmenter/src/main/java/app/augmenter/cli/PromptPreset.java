package app.augmenter.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in prompts bundled under {@code prompts/} with the note type and field they were written for.
 */
public enum PromptPreset {
    CLOZE_NOTES("cloze-notes", "Cloze", "Notes", "prompts/cloze-notes.txt"),
    MNEMONIC("mnemonic", "Lapis", "Mnemonic", "prompts/mnemonic.txt");

    private final String key;
    private final String noteType;
    private final String targetField;
    private final String resource;

    PromptPreset(String key, String noteType, String targetField, String resource) {
        this.key = key;
        this.noteType = noteType;
        this.targetField = targetField;
        this.resource = resource;
    }

    public String key() {
        return key;
    }

    public String noteType() {
        return noteType;
    }

    public String targetField() {
        return targetField;
    }

    public String resource() {
        return resource;
    }

    public static Optional<PromptPreset> fromKey(String key) {
        return Arrays.stream(values())
                .filter(preset -> preset.key.equalsIgnoreCase(key))
                .findFirst();
    }
}
