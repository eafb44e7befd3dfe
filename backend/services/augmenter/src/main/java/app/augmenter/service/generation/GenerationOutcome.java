package app.augmenter.service.generation;

import java.util.List;
import java.util.Map;

/**
 * Generated HTML keyed by note id, plus the notes that produced nothing.
 */
public record GenerationOutcome(
        Map<Long, String> contents,
        List<Long> failedNoteIds,
        List<Long> skippedNoteIds
) {

    public GenerationOutcome {
        contents = Map.copyOf(contents);
        failedNoteIds = List.copyOf(failedNoteIds);
        skippedNoteIds = List.copyOf(skippedNoteIds);
    }

    public static GenerationOutcome empty() {
        return new GenerationOutcome(Map.of(), List.of(), List.of());
    }
}
