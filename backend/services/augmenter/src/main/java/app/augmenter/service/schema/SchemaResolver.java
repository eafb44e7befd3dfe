package app.augmenter.service.schema;

import app.augmenter.domain.FieldMap;
import app.augmenter.domain.NoteType;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Resolves note types and their field layout, preferring the notetypes table and
 * falling back to the legacy models blob.
 */
@Component
public class SchemaResolver {

    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    private final List<SchemaSource> sources;

    @Autowired
    public SchemaResolver(ObjectMapper objectMapper) {
        this(List.of(new NotetypesTableSource(), new ModelsBlobSource(objectMapper)));
    }

    public SchemaResolver(List<SchemaSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public NoteType resolve(Connection connection, String noteTypeName) {
        try {
            for (SchemaSource source : sources) {
                if (!source.isAvailable(connection)) {
                    continue;
                }
                List<Long> ids = source.findNoteTypeIds(connection, noteTypeName);
                if (ids.isEmpty()) {
                    continue;
                }
                if (ids.size() > 1) {
                    log.warn("Note type name is ambiguous, using first match name='{}' ids={} source={}",
                            noteTypeName, ids, source.name());
                }
                long id = ids.get(0);
                return new NoteType(id, noteTypeName, source.resolveFieldMap(connection, id));
            }
        } catch (SQLException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to read note types", ex);
        }
        throw notFound(noteTypeName);
    }

    public long resolveNoteTypeId(Connection connection, String noteTypeName) {
        return resolve(connection, noteTypeName).id();
    }

    /**
     * Field layout of {@code noteTypeId} from the first source that knows it; empty when none does.
     */
    public FieldMap resolveFieldMap(Connection connection, long noteTypeId) {
        try {
            for (SchemaSource source : sources) {
                if (!source.isAvailable(connection)) {
                    continue;
                }
                FieldMap fieldMap = source.resolveFieldMap(connection, noteTypeId);
                if (!fieldMap.isEmpty()) {
                    return fieldMap;
                }
            }
            return FieldMap.empty();
        } catch (SQLException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to read fields of note type " + noteTypeId, ex);
        }
    }

    private AugmentException notFound(String noteTypeName) {
        return new AugmentException(
                AugmentError.NOTE_TYPE_NOT_FOUND,
                "Could not find note type with name '" + noteTypeName + "' in the collection"
        );
    }
}
