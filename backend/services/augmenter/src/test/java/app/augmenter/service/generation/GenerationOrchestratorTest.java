package app.augmenter.service.generation;

import app.augmenter.config.AugmentProps;
import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationOrchestratorTest {

    private static final FieldMap FIELDS = FieldMap.ofNames(List.of("Text", "Notes"));
    private static final PromptTemplate PROMPT = PromptTemplate.parse("Explain {Text}");

    private final AugmentProps props = new AugmentProps(null, null, null, null, null);

    @Test
    void neverExceedsWorkerCount() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        GenerationService service = prompt -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return "ok " + prompt;
        };
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);

        GenerationOutcome outcome = orchestrator.generate(notes(100), PROMPT, FIELDS);

        assertThat(outcome.contents()).hasSize(100);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(AugmentProps.DEFAULT_WORKERS);
        assertThat(maxInFlight.get()).isGreaterThan(1);
    }

    @Test
    void failingNoteIsLeftOutAndOthersSucceed() {
        GenerationService service = prompt -> {
            if (prompt.endsWith("sentence 4")) {
                throw new GenerationException("boom");
            }
            return "*note* for " + prompt;
        };
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);

        GenerationOutcome outcome = orchestrator.generate(notes(10), PROMPT, FIELDS, 3, GenerationProgressListener.NONE);

        assertThat(outcome.contents()).hasSize(9).doesNotContainKey(4L);
        assertThat(outcome.failedNoteIds()).containsExactly(4L);
        assertThat(outcome.contents().get(1L)).isEqualTo("<p><em>note</em> for Explain sentence 1</p>");
    }

    @Test
    void contentWithFieldSeparatorIsRejected() {
        GenerationService service = prompt -> prompt.endsWith("sentence 2") ? "bad\u001fvalue" : "fine";
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);

        GenerationOutcome outcome = orchestrator.generate(notes(3), PROMPT, FIELDS);

        assertThat(outcome.contents()).containsOnlyKeys(1L, 3L);
        assertThat(outcome.failedNoteIds()).containsExactly(2L);
    }

    @Test
    void blankResponseCountsAsFailure() {
        GenerationService service = prompt -> "   ";
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);

        GenerationOutcome outcome = orchestrator.generate(notes(2), PROMPT, FIELDS);

        assertThat(outcome.contents()).isEmpty();
        assertThat(outcome.failedNoteIds()).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void notesWithBlankSourcesAreSkipped() throws Exception {
        GenerationService service = mock(GenerationService.class);
        when(service.generate(anyString())).thenReturn("generated");
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);
        List<CollectionNote> notes = List.of(
                CollectionNote.of(1L, 1L, List.of("Bonjour", ""), 0L),
                CollectionNote.of(2L, 1L, List.of("  ", ""), 0L)
        );

        GenerationOutcome outcome = orchestrator.generate(notes, PROMPT, FIELDS);

        assertThat(outcome.contents()).containsOnlyKeys(1L);
        assertThat(outcome.skippedNoteIds()).containsExactly(2L);
        verify(service).generate("Explain Bonjour");
    }

    @Test
    void reportsProgressForEveryCompletion() {
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(prompt -> "x", new MarkdownHtmlConverter(), props);
        List<Integer> progress = new ArrayList<>();

        orchestrator.generate(notes(4), PROMPT, FIELDS, 1, (completed, total) -> progress.add(completed));

        assertThat(progress).containsExactly(1, 2, 3, 4);
    }

    @Test
    void emptyInputNeverChecksCredentials() {
        GenerationService service = mock(GenerationService.class);
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);

        GenerationOutcome outcome = orchestrator.generate(List.of(), PROMPT, FIELDS);

        assertThat(outcome.contents()).isEmpty();
        verify(service, never()).ensureReady();
    }

    @Test
    void missingCredentialsAbortBeforeDispatch() throws Exception {
        GenerationService service = mock(GenerationService.class);
        doThrow(new AugmentException(AugmentError.MISSING_CREDENTIALS, "GEMINI_API_KEY environment variable not set"))
                .when(service).ensureReady();
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(service, new MarkdownHtmlConverter(), props);

        assertThatThrownBy(() -> orchestrator.generate(notes(2), PROMPT, FIELDS))
                .isInstanceOf(AugmentException.class)
                .hasMessageContaining("GEMINI_API_KEY");
        verify(service, never()).generate(anyString());
    }

    private static List<CollectionNote> notes(int count) {
        List<CollectionNote> notes = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            notes.add(CollectionNote.of(i, 1L, List.of("sentence " + i, ""), 0L));
        }
        return notes;
    }
}
