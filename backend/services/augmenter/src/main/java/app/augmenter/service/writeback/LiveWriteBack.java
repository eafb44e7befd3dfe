package app.augmenter.service.writeback;

import app.augmenter.client.ankiconnect.AnkiConnectClient;
import app.augmenter.domain.FieldUpdate;
import app.augmenter.service.AugmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Sends generated field values to a running Anki, one note at a time.
 * The first AnkiConnect failure aborts the run; notes updated before it stay updated.
 */
@Component
public class LiveWriteBack {

    private static final Logger log = LoggerFactory.getLogger(LiveWriteBack.class);

    private final AnkiConnectClient ankiConnectClient;

    public LiveWriteBack(AnkiConnectClient ankiConnectClient) {
        this.ankiConnectClient = ankiConnectClient;
    }

    /**
     * @return number of notes updated
     */
    public int apply(List<FieldUpdate> updates) {
        if (updates.isEmpty()) {
            log.info("No notes generated");
            return 0;
        }
        log.info("Updating {} notes via AnkiConnect", updates.size());
        int applied = 0;
        for (FieldUpdate update : updates) {
            try {
                ankiConnectClient.updateNoteFields(update.noteId(), Map.of(update.fieldName(), update.value()));
            } catch (AugmentException ex) {
                log.error("Aborting live update noteId={} applied={} remaining={}",
                        update.noteId(), applied, updates.size() - applied);
                throw ex;
            }
            applied++;
        }
        return applied;
    }
}
