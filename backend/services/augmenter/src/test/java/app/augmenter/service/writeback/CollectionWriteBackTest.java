package app.augmenter.service.writeback;

import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.domain.NoteUpdate;
import app.augmenter.support.ApkgFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionWriteBackTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final FieldMap CLOZE = FieldMap.ofNames(List.of("Text", "Back Extra", "Notes"));

    private final CollectionWriteBack writeBack = new CollectionWriteBack(Clock.fixed(NOW, ZoneOffset.UTC));

    @TempDir
    Path tmp;

    @Test
    void buildsUpdatesOnlyForGeneratedNotes() {
        List<CollectionNote> notes = List.of(
                CollectionNote.of(1L, 1L, List.of("a", "x", ""), 5L),
                CollectionNote.of(2L, 1L, List.of("b", "y", ""), 5L)
        );

        List<NoteUpdate> updates = writeBack.buildUpdates(notes, Map.of(2L, "<p>hi</p>"), CLOZE, "Notes");

        assertThat(updates).containsExactly(new NoteUpdate(2L, "b\u001fy\u001f<p>hi</p>", NOW.getEpochSecond()));
    }

    @Test
    void padsShortNotesToFieldCount() {
        List<CollectionNote> notes = List.of(CollectionNote.of(1L, 1L, List.of("only"), 5L));

        List<NoteUpdate> updates = writeBack.buildUpdates(notes, Map.of(1L, "gen"), CLOZE, "Notes");

        assertThat(updates.get(0).flds()).isEqualTo("only\u001f\u001fgen");
    }

    @Test
    void appliesUpdatesAndLeavesOtherNotesUntouched() throws Exception {
        Path db = tmp.resolve("c.db");
        try (ApkgFixtures.Collection collection = ApkgFixtures.collection(db)) {
            collection.note(1L, 1L, ApkgFixtures.flds("a", "", ""))
                    .note(2L, 1L, ApkgFixtures.flds("b", "", ""));
            Connection conn = collection.connection();

            int written = writeBack.apply(conn, List.of(new NoteUpdate(1L, ApkgFixtures.flds("a", "", "<p>n</p>"), 99L)));

            assertThat(written).isEqualTo(1);
            assertThat(conn.getAutoCommit()).isTrue();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("select id, flds, mod from notes order by id")) {
                rs.next();
                assertThat(rs.getString("flds")).isEqualTo("a\u001f\u001f<p>n</p>");
                assertThat(rs.getLong("mod")).isEqualTo(99L);
                rs.next();
                assertThat(rs.getString("flds")).isEqualTo("b\u001f\u001f");
                assertThat(rs.getLong("mod")).isEqualTo(1L);
            }
        }
    }

    @Test
    void emptyUpdateListWritesNothing() throws Exception {
        try (ApkgFixtures.Collection collection = ApkgFixtures.collection(tmp.resolve("c.db"))) {
            assertThat(writeBack.apply(collection.connection(), List.of())).isZero();
        }
    }
}
