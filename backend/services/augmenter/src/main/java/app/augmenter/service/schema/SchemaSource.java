package app.augmenter.service.schema;

import app.augmenter.domain.FieldMap;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * One place a collection stores its note type definitions.
 */
public interface SchemaSource {

    String name();

    /**
     * Whether this collection carries the storage this source reads.
     */
    boolean isAvailable(Connection connection) throws SQLException;

    /**
     * Ids of every note type named exactly {@code name}, in storage order.
     */
    List<Long> findNoteTypeIds(Connection connection, String name) throws SQLException;

    FieldMap resolveFieldMap(Connection connection, long noteTypeId) throws SQLException;
}
