package app.augmenter.service;

import app.augmenter.domain.FieldMap;
import app.augmenter.domain.NoteType;
import app.augmenter.domain.NoteUpdate;
import app.augmenter.service.container.ApkgContainerCodec;
import app.augmenter.service.container.WorkingCollection;
import app.augmenter.service.generation.GenerationOrchestrator;
import app.augmenter.service.generation.GenerationOutcome;
import app.augmenter.service.generation.GenerationProgressListener;
import app.augmenter.service.schema.SchemaResolver;
import app.augmenter.service.selection.RecordSelector;
import app.augmenter.service.selection.Selection;
import app.augmenter.service.writeback.CollectionWriteBack;
import app.augmenter.domain.CollectionNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.util.List;

/**
 * Augments an .apkg file: open, resolve, select, generate, write back, repackage.
 */
@Service
public class FileAugmentPipeline {

    private static final Logger log = LoggerFactory.getLogger(FileAugmentPipeline.class);

    private final ApkgContainerCodec codec;
    private final SchemaResolver schemaResolver;
    private final RecordSelector recordSelector;
    private final GenerationOrchestrator orchestrator;
    private final CollectionWriteBack writeBack;
    private final PendingPreview preview;

    public FileAugmentPipeline(ApkgContainerCodec codec,
                               SchemaResolver schemaResolver,
                               RecordSelector recordSelector,
                               GenerationOrchestrator orchestrator,
                               CollectionWriteBack writeBack,
                               PendingPreview preview) {
        this.codec = codec;
        this.schemaResolver = schemaResolver;
        this.recordSelector = recordSelector;
        this.orchestrator = orchestrator;
        this.writeBack = writeBack;
        this.preview = preview;
    }

    public AugmentReport run(AugmentRequest request) {
        return run(request, GenerationProgressListener.NONE);
    }

    public AugmentReport run(AugmentRequest request, GenerationProgressListener listener) {
        WorkingCollection collection = codec.open(request.input());
        try {
            Connection connection = collection.connection();
            NoteType noteType = schemaResolver.resolve(connection, request.noteType());
            log.info("Resolved note type '{}' to id {}", noteType.name(), noteType.id());

            FieldMap fieldMap = noteType.fields();
            if (!fieldMap.contains(request.targetField())) {
                throw new AugmentException(
                        AugmentError.FIELD_NOT_FOUND,
                        "Target field '" + request.targetField() + "' not found in note type '" + noteType.name()
                                + "'. Available fields: " + fieldMap.names()
                );
            }
            request.prompt().validate(fieldMap);
            log.info("Target field: {} (index {}), required source fields: {}",
                    request.targetField(), fieldMap.ordinal(request.targetField()).orElse(-1), request.prompt().requiredFields());

            List<CollectionNote> notes = recordSelector.loadNotes(connection, noteType.id());
            log.info("Found {} total notes", notes.size());
            Selection selection = recordSelector.selectPending(notes, fieldMap, request.targetField());
            log.info("Found {} notes that require augmentation", selection.pending().size());

            if (request.dryRun()) {
                preview.print(selection.pending(), request.prompt(), fieldMap, request.targetField());
                return AugmentReport.dryRun(false, selection.total(), selection.pending().size());
            }

            GenerationOutcome outcome = orchestrator.generate(
                    selection.pending(),
                    request.prompt(),
                    fieldMap,
                    request.workers(),
                    listener
            );
            List<NoteUpdate> updates = writeBack.buildUpdates(
                    selection.pending(),
                    outcome.contents(),
                    fieldMap,
                    request.targetField()
            );
            int written = writeBack.apply(connection, updates);

            codec.close(collection, request.output());
            log.info("Done! Created {}", request.output());
            return new AugmentReport(
                    false,
                    false,
                    selection.total(),
                    selection.pending().size(),
                    outcome.contents().size(),
                    outcome.failedNoteIds().size(),
                    outcome.skippedNoteIds().size(),
                    written
            );
        } finally {
            collection.close();
        }
    }
}
