package app.augmenter.service;

import app.augmenter.client.ankiconnect.AnkiConnectClient;
import app.augmenter.client.ankiconnect.AnkiNoteInfo;
import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.domain.FieldUpdate;
import app.augmenter.service.generation.GenerationOrchestrator;
import app.augmenter.service.generation.GenerationOutcome;
import app.augmenter.service.generation.GenerationProgressListener;
import app.augmenter.service.selection.RecordSelector;
import app.augmenter.service.selection.Selection;
import app.augmenter.service.writeback.LiveWriteBack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Augments notes of a running Anki through AnkiConnect.
 */
@Service
public class LiveAugmentPipeline {

    private static final Logger log = LoggerFactory.getLogger(LiveAugmentPipeline.class);
    private static final long UNKNOWN_NOTE_TYPE_ID = 0L;

    private final AnkiConnectClient ankiConnectClient;
    private final RecordSelector recordSelector;
    private final GenerationOrchestrator orchestrator;
    private final LiveWriteBack writeBack;
    private final PendingPreview preview;

    public LiveAugmentPipeline(AnkiConnectClient ankiConnectClient,
                               RecordSelector recordSelector,
                               GenerationOrchestrator orchestrator,
                               LiveWriteBack writeBack,
                               PendingPreview preview) {
        this.ankiConnectClient = ankiConnectClient;
        this.recordSelector = recordSelector;
        this.orchestrator = orchestrator;
        this.writeBack = writeBack;
        this.preview = preview;
    }

    public AugmentReport run(AugmentRequest request) {
        return run(request, GenerationProgressListener.NONE);
    }

    public AugmentReport run(AugmentRequest request, GenerationProgressListener listener) {
        log.info("Querying Anki for note type '{}'", request.noteType());
        List<Long> noteIds = ankiConnectClient.findNotes(searchQuery(request.noteType()));
        if (noteIds.isEmpty()) {
            log.info("No notes found for this query");
            return AugmentReport.nothingFound(true, request.dryRun());
        }
        log.info("Found {} notes. Fetching details", noteIds.size());

        List<AnkiNoteInfo> first = ankiConnectClient.notesInfo(noteIds.subList(0, 1));
        if (first.isEmpty()) {
            throw new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "Could not retrieve note info");
        }
        FieldMap fieldMap = fieldMap(first.get(0));
        if (!fieldMap.contains(request.targetField())) {
            throw new AugmentException(
                    AugmentError.FIELD_NOT_FOUND,
                    "Target field '" + request.targetField() + "' not found in note type '" + request.noteType()
                            + "'. Available fields: " + fieldMap.names()
            );
        }
        request.prompt().validate(fieldMap);
        log.info("Verified fields: target='{}', source={}", request.targetField(), request.prompt().requiredFields());

        List<CollectionNote> notes = new ArrayList<>();
        for (AnkiNoteInfo info : ankiConnectClient.notesInfo(noteIds)) {
            notes.add(toNote(info, fieldMap));
        }
        Selection selection = recordSelector.selectPending(notes, fieldMap, request.targetField());
        log.info("Found {} notes that require augmentation", selection.pending().size());

        if (request.dryRun()) {
            preview.print(selection.pending(), request.prompt(), fieldMap, request.targetField());
            return AugmentReport.dryRun(true, selection.total(), selection.pending().size());
        }
        if (selection.pending().isEmpty()) {
            log.info("No updates needed");
            return new AugmentReport(true, false, selection.total(), 0, 0, 0, 0, 0);
        }

        GenerationOutcome outcome = orchestrator.generate(
                selection.pending(),
                request.prompt(),
                fieldMap,
                request.workers(),
                listener
        );
        List<FieldUpdate> updates = new ArrayList<>();
        for (CollectionNote note : selection.pending()) {
            String content = outcome.contents().get(note.id());
            if (content != null) {
                updates.add(new FieldUpdate(note.id(), request.targetField(), content));
            }
        }
        int written = writeBack.apply(updates);
        log.info("Done! Updated {} notes", written);
        return new AugmentReport(
                true,
                false,
                selection.total(),
                selection.pending().size(),
                outcome.contents().size(),
                outcome.failedNoteIds().size(),
                outcome.skippedNoteIds().size(),
                written
        );
    }

    static String searchQuery(String noteType) {
        return "note:\"" + noteType.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private FieldMap fieldMap(AnkiNoteInfo info) {
        Map<String, Integer> ordinals = new LinkedHashMap<>();
        info.fields().forEach((name, value) -> ordinals.put(name, value.order()));
        return FieldMap.of(ordinals);
    }

    private CollectionNote toNote(AnkiNoteInfo info, FieldMap fieldMap) {
        String[] values = new String[fieldMap.arity()];
        Arrays.fill(values, "");
        info.fields().forEach((name, value) -> {
            Integer ordinal = fieldMap.ordinal(name).orElse(null);
            if (ordinal != null && ordinal < values.length) {
                values[ordinal] = value.value();
            }
        });
        return CollectionNote.of(info.noteId(), UNKNOWN_NOTE_TYPE_ID, Arrays.asList(values), 0L);
    }
}
