package app.augmenter.service.schema;

import app.augmenter.domain.FieldMap;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the {@code notetypes} and {@code fields} tables of schema 15+ collections.
 * <p>
 * Names are compared in Java: the name columns use Anki's {@code unicase} collation,
 * which plain SQLite drivers do not register.
 */
public class NotetypesTableSource implements SchemaSource {

    @Override
    public String name() {
        return "notetypes table";
    }

    @Override
    public boolean isAvailable(Connection connection) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "select 1 from sqlite_master where type = 'table' and name = 'notetypes'")) {
            ResultSet rs = stmt.executeQuery();
            return rs.next();
        }
    }

    @Override
    public List<Long> findNoteTypeIds(Connection connection, String name) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement("select id, name from notetypes")) {
            ResultSet rs = stmt.executeQuery();
            while (rs.next()) {
                if (name.equals(rs.getString("name"))) {
                    ids.add(rs.getLong("id"));
                }
            }
        }
        return ids;
    }

    @Override
    public FieldMap resolveFieldMap(Connection connection, long noteTypeId) throws SQLException {
        Map<String, Integer> ordinals = new LinkedHashMap<>();
        try (PreparedStatement stmt = connection.prepareStatement(
                "select name, ord from fields where ntid = ? order by ord")) {
            stmt.setLong(1, noteTypeId);
            ResultSet rs = stmt.executeQuery();
            while (rs.next()) {
                String fieldName = rs.getString("name");
                if (fieldName == null || fieldName.isBlank()) {
                    continue;
                }
                ordinals.putIfAbsent(fieldName, rs.getInt("ord"));
            }
        }
        return FieldMap.of(ordinals);
    }
}
