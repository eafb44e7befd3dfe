package app.augmenter.service;

import app.augmenter.config.AugmentProps;
import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.service.generation.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Dry-run listing of pending notes, showing the first field the prompt reads.
 */
@Component
public class PendingPreview {

    private static final Logger log = LoggerFactory.getLogger(PendingPreview.class);

    private final AugmentProps props;

    public PendingPreview(AugmentProps props) {
        this.props = props;
    }

    public List<Line> lines(List<CollectionNote> pending, PromptTemplate prompt, FieldMap fieldMap, String targetField) {
        String previewField = prompt.requiredFields().isEmpty() ? targetField : prompt.requiredFields().get(0);
        int ordinal = fieldMap.ordinal(previewField).orElse(0);
        List<Line> lines = new ArrayList<>();
        for (CollectionNote note : pending) {
            String text = note.valueCount() > ordinal ? note.value(ordinal) : "[Empty]";
            String flat = text.replace('\n', ' ');
            if (flat.length() > props.previewLength()) {
                flat = flat.substring(0, props.previewLength());
            }
            lines.add(new Line(note.id(), previewField, flat));
        }
        return lines;
    }

    public void print(List<CollectionNote> pending, PromptTemplate prompt, FieldMap fieldMap, String targetField) {
        log.info("--- Dry run: notes to be updated ---");
        for (Line line : lines(pending, prompt, fieldMap, targetField)) {
            log.info("ID: {} | {}: {}...", line.noteId(), line.field(), line.text());
        }
        log.info("Dry run complete. No changes made.");
    }

    public record Line(long noteId, String field, String text) {
    }
}
