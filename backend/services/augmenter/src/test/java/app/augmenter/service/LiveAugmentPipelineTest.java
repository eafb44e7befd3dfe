package app.augmenter.service;

import app.augmenter.client.ankiconnect.AnkiConnectClient;
import app.augmenter.client.ankiconnect.AnkiNoteInfo;
import app.augmenter.config.AugmentProps;
import app.augmenter.service.generation.GenerationOrchestrator;
import app.augmenter.service.generation.MarkdownHtmlConverter;
import app.augmenter.service.generation.PromptTemplate;
import app.augmenter.service.selection.RecordSelector;
import app.augmenter.service.writeback.LiveWriteBack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LiveAugmentPipelineTest {

    private static final PromptTemplate MNEMONIC_PROMPT =
            PromptTemplate.parse("Mnemonic for {Expression} ({ExpressionReading})");

    private final AnkiConnectClient client = mock(AnkiConnectClient.class);
    private LiveAugmentPipeline pipeline;

    @BeforeEach
    void setUp() {
        AugmentProps props = new AugmentProps(null, 2, null, null, null);
        pipeline = new LiveAugmentPipeline(
                client,
                new RecordSelector(),
                new GenerationOrchestrator(prompt -> "Story about " + prompt, new MarkdownHtmlConverter(), props),
                new LiveWriteBack(client),
                new PendingPreview(props)
        );
    }

    private AugmentRequest request(String targetField, boolean dryRun) {
        return new AugmentRequest(null, null, true, "Lapis", targetField, MNEMONIC_PROMPT, dryRun, 2);
    }

    @Test
    void updatesOnlyNotesWithEmptyTarget() {
        when(client.findNotes("note:\"Lapis\"")).thenReturn(List.of(1L, 2L));
        when(client.notesInfo(List.of(1L))).thenReturn(List.of(lapis(1L, "皿", "さら", "")));
        when(client.notesInfo(List.of(1L, 2L))).thenReturn(List.of(
                lapis(1L, "皿", "さら", ""),
                lapis(2L, "猫", "ねこ", "<p>existing</p>")
        ));

        AugmentReport report = pipeline.run(request("Mnemonic", false));

        assertThat(report.liveMode()).isTrue();
        assertThat(report.totalNotes()).isEqualTo(2);
        assertThat(report.written()).isEqualTo(1);
        verify(client).updateNoteFields(1L, Map.of("Mnemonic", "<p>Story about Mnemonic for 皿 (さら)</p>"));
        verify(client, never()).updateNoteFields(2L, Map.of("Mnemonic", "<p>Story about Mnemonic for 猫 (ねこ)</p>"));
    }

    @Test
    void ankiConnectErrorDuringUpdateAbortsTheRun() {
        when(client.findNotes("note:\"Lapis\"")).thenReturn(List.of(1L));
        when(client.notesInfo(List.of(1L))).thenReturn(List.of(lapis(1L, "皿", "さら", "")));
        doThrow(new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "cannot create note because it is empty"))
                .when(client).updateNoteFields(anyLong(), anyMap());

        assertThatThrownBy(() -> pipeline.run(request("Mnemonic", false)))
                .isInstanceOf(AugmentException.class)
                .extracting(ex -> ((AugmentException) ex).getError())
                .isEqualTo(AugmentError.ANKI_CONNECT_ERROR);
    }

    @Test
    void noMatchingNotesIsASuccessfulNoOp() {
        when(client.findNotes("note:\"Lapis\"")).thenReturn(List.of());

        AugmentReport report = pipeline.run(request("Mnemonic", false));

        assertThat(report.totalNotes()).isZero();
        verify(client, never()).notesInfo(anyList());
    }

    @Test
    void unknownTargetFieldIsDetectedOnFirstNote() {
        when(client.findNotes("note:\"Lapis\"")).thenReturn(List.of(1L, 2L));
        when(client.notesInfo(List.of(1L))).thenReturn(List.of(lapis(1L, "皿", "さら", "")));

        assertThatThrownBy(() -> pipeline.run(request("Story", false)))
                .isInstanceOf(AugmentException.class)
                .extracting(ex -> ((AugmentException) ex).getError())
                .isEqualTo(AugmentError.FIELD_NOT_FOUND);
        verify(client, never()).notesInfo(List.of(1L, 2L));
    }

    @Test
    void dryRunSendsNoUpdates() {
        when(client.findNotes("note:\"Lapis\"")).thenReturn(List.of(1L));
        when(client.notesInfo(List.of(1L))).thenReturn(List.of(lapis(1L, "皿", "さら", "")));

        AugmentReport report = pipeline.run(request("Mnemonic", true));

        assertThat(report.dryRun()).isTrue();
        assertThat(report.pendingNotes()).isEqualTo(1);
        verify(client, never()).updateNoteFields(anyLong(), anyMap());
    }

    @Test
    void quotesInNoteTypeNamesAreEscaped() {
        assertThat(LiveAugmentPipeline.searchQuery("My \"Deck\"")).isEqualTo("note:\"My \\\"Deck\\\"\"");
    }

    private static AnkiNoteInfo lapis(long id, String expression, String reading, String mnemonic) {
        Map<String, AnkiNoteInfo.FieldValue> fields = new LinkedHashMap<>();
        fields.put("Expression", new AnkiNoteInfo.FieldValue(expression, 0));
        fields.put("ExpressionReading", new AnkiNoteInfo.FieldValue(reading, 1));
        fields.put("Mnemonic", new AnkiNoteInfo.FieldValue(mnemonic, 2));
        return new AnkiNoteInfo(id, "Lapis", fields);
    }
}
