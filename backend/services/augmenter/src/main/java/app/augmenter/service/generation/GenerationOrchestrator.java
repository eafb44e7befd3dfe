package app.augmenter.service.generation;

import app.augmenter.config.AugmentProps;
import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans generation calls for pending notes out over a fixed-size worker pool.
 * <p>
 * Failed calls are logged and left out of the outcome; they are never retried.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);
    private static final int LOG_SOURCE_LENGTH = 40;

    private final GenerationService generationService;
    private final MarkdownHtmlConverter htmlConverter;
    private final AugmentProps props;

    public GenerationOrchestrator(GenerationService generationService,
                                  MarkdownHtmlConverter htmlConverter,
                                  AugmentProps props) {
        this.generationService = generationService;
        this.htmlConverter = htmlConverter;
        this.props = props;
    }

    public GenerationOutcome generate(List<CollectionNote> notes,
                                      PromptTemplate template,
                                      FieldMap fieldMap) {
        return generate(notes, template, fieldMap, props.workers(), GenerationProgressListener.NONE);
    }

    public GenerationOutcome generate(List<CollectionNote> notes,
                                      PromptTemplate template,
                                      FieldMap fieldMap,
                                      int workers,
                                      GenerationProgressListener listener) {
        if (notes.isEmpty()) {
            return GenerationOutcome.empty();
        }
        template.validate(fieldMap);
        generationService.ensureReady();

        List<CollectionNote> dispatched = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        for (CollectionNote note : notes) {
            if (props.skipBlankSources() && hasOnlyBlankSources(note, template, fieldMap)) {
                log.debug("Skipping note with blank source fields noteId={}", note.id());
                skipped.add(note.id());
            } else {
                dispatched.add(note);
            }
        }
        if (!skipped.isEmpty()) {
            log.info("Skipping {} notes whose source fields are empty", skipped.size());
        }

        Map<Long, String> contents = new ConcurrentHashMap<>();
        List<Long> failed = Collections.synchronizedList(new ArrayList<>());
        int poolSize = Math.max(1, workers);
        log.info("Starting parallel generation notes={} workers={}", dispatched.size(), poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            ExecutorCompletionService<Boolean> completion = new ExecutorCompletionService<>(executor);
            for (CollectionNote note : dispatched) {
                completion.submit(() -> generateOne(note, template, fieldMap, contents, failed));
            }
            int total = dispatched.size();
            for (int completed = 1; completed <= total; completed++) {
                try {
                    completion.take().get();
                } catch (ExecutionException ex) {
                    log.error("Generation task crashed error={}", ex.getCause() == null ? ex.getMessage() : ex.getCause().toString());
                }
                listener.onProgress(completed, total);
                if (completed % props.progressEvery() == 0 || completed == total) {
                    log.info("Augmenting notes: {}/{}", completed, total);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Generation interrupted", ex);
        } finally {
            executor.shutdownNow();
        }

        List<Long> failedIds = new ArrayList<>(failed);
        for (CollectionNote note : dispatched) {
            if (!contents.containsKey(note.id()) && !failedIds.contains(note.id())) {
                failedIds.add(note.id());
            }
        }
        log.info("Generation finished generated={} failed={} skipped={}", contents.size(), failedIds.size(), skipped.size());
        return new GenerationOutcome(contents, failedIds, skipped);
    }

    private boolean generateOne(CollectionNote note,
                                PromptTemplate template,
                                FieldMap fieldMap,
                                Map<Long, String> contents,
                                List<Long> failed) {
        String prompt = template.fill(note, fieldMap);
        try {
            String markdown = generationService.generate(prompt);
            if (markdown == null || markdown.isBlank()) {
                throw new GenerationException("empty response");
            }
            String html = htmlConverter.toHtml(markdown.strip());
            if (html.isEmpty()) {
                throw new GenerationException("empty response after conversion");
            }
            if (html.contains(CollectionNote.FIELD_SEPARATOR)) {
                throw new GenerationException("generated content contains the field separator");
            }
            contents.put(note.id(), html);
            return true;
        } catch (GenerationException | RuntimeException ex) {
            log.warn("Error generating content noteId={} source='{}' error={}",
                    note.id(), sourcePreview(note, template, fieldMap), ex.getMessage());
            failed.add(note.id());
            return false;
        }
    }

    private boolean hasOnlyBlankSources(CollectionNote note, PromptTemplate template, FieldMap fieldMap) {
        if (template.requiredFields().isEmpty()) {
            return false;
        }
        for (String field : template.requiredFields()) {
            int ordinal = fieldMap.ordinal(field).orElse(-1);
            if (ordinal >= 0 && !note.value(ordinal).isBlank()) {
                return false;
            }
        }
        return true;
    }

    private String sourcePreview(CollectionNote note, PromptTemplate template, FieldMap fieldMap) {
        String value = "";
        if (!template.requiredFields().isEmpty()) {
            value = fieldMap.ordinal(template.requiredFields().get(0)).map(note::value).orElse("");
        }
        String flat = value.replace('\n', ' ');
        return flat.length() > LOG_SOURCE_LENGTH ? flat.substring(0, LOG_SOURCE_LENGTH) + "..." : flat;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "augment-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
