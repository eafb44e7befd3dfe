package app.augmenter.service.writeback;

import app.augmenter.client.ankiconnect.AnkiConnectClient;
import app.augmenter.domain.FieldUpdate;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class LiveWriteBackTest {

    private final AnkiConnectClient client = mock(AnkiConnectClient.class);
    private final LiveWriteBack writeBack = new LiveWriteBack(client);

    @Test
    void sendsOneUpdatePerNote() {
        int applied = writeBack.apply(List.of(
                new FieldUpdate(1L, "Mnemonic", "<p>a</p>"),
                new FieldUpdate(2L, "Mnemonic", "<p>b</p>")
        ));

        assertThat(applied).isEqualTo(2);
        verify(client).updateNoteFields(1L, Map.of("Mnemonic", "<p>a</p>"));
        verify(client).updateNoteFields(2L, Map.of("Mnemonic", "<p>b</p>"));
    }

    @Test
    void ankiConnectErrorAbortsAfterEarlierUpdates() {
        doThrow(new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "AnkiConnect updateNoteFields error: note was not found"))
                .when(client).updateNoteFields(2L, Map.of("Mnemonic", "<p>b</p>"));

        assertThatThrownBy(() -> writeBack.apply(List.of(
                new FieldUpdate(1L, "Mnemonic", "<p>a</p>"),
                new FieldUpdate(2L, "Mnemonic", "<p>b</p>"),
                new FieldUpdate(3L, "Mnemonic", "<p>c</p>")
        )))
                .isInstanceOf(AugmentException.class)
                .hasMessageContaining("note was not found")
                .extracting(ex -> ((AugmentException) ex).getError())
                .isEqualTo(AugmentError.ANKI_CONNECT_ERROR);

        verify(client).updateNoteFields(1L, Map.of("Mnemonic", "<p>a</p>"));
        verify(client, never()).updateNoteFields(eq(3L), anyMap());
    }

    @Test
    void lostConnectionAborts() {
        doThrow(new AugmentException(AugmentError.ANKI_CONNECT_UNREACHABLE, "down"))
                .when(client).updateNoteFields(1L, Map.of("Mnemonic", "<p>a</p>"));

        assertThatThrownBy(() -> writeBack.apply(List.of(new FieldUpdate(1L, "Mnemonic", "<p>a</p>"))))
                .isInstanceOf(AugmentException.class)
                .hasMessage("down");
    }

    @Test
    void nothingToSend() {
        assertThat(writeBack.apply(List.of())).isZero();
    }
}
