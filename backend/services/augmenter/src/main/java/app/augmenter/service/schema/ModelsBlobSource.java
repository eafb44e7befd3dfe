package app.augmenter.service.schema;

import app.augmenter.domain.FieldMap;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads note types from the JSON {@code models} column of the {@code col} table (schema 11 collections).
 */
public class ModelsBlobSource implements SchemaSource {

    private final ObjectMapper objectMapper;

    public ModelsBlobSource(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "col.models blob";
    }

    @Override
    public boolean isAvailable(Connection connection) throws SQLException {
        return !readModels(connection).isEmpty();
    }

    @Override
    public List<Long> findNoteTypeIds(Connection connection, String name) throws SQLException {
        List<Long> ids = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> models = readModels(connection).fields();
        while (models.hasNext()) {
            Map.Entry<String, JsonNode> entry = models.next();
            if (name.equals(entry.getValue().path("name").asText(null))) {
                Long id = modelId(entry);
                if (id != null) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    @Override
    public FieldMap resolveFieldMap(Connection connection, long noteTypeId) throws SQLException {
        Iterator<Map.Entry<String, JsonNode>> models = readModels(connection).fields();
        while (models.hasNext()) {
            Map.Entry<String, JsonNode> entry = models.next();
            Long id = modelId(entry);
            if (id == null || id != noteTypeId) {
                continue;
            }
            Map<String, Integer> ordinals = new LinkedHashMap<>();
            int position = 0;
            for (JsonNode field : entry.getValue().path("flds")) {
                String fieldName = field.path("name").asText("");
                int ordinal = field.path("ord").isInt() ? field.path("ord").asInt() : position;
                position++;
                if (!fieldName.isBlank()) {
                    ordinals.putIfAbsent(fieldName, ordinal);
                }
            }
            return FieldMap.of(ordinals);
        }
        return FieldMap.empty();
    }

    private JsonNode readModels(Connection connection) throws SQLException {
        if (!hasColTable(connection)) {
            return objectMapper.createObjectNode();
        }
        try (PreparedStatement stmt = connection.prepareStatement("select models from col limit 1")) {
            ResultSet rs = stmt.executeQuery();
            if (!rs.next()) {
                return objectMapper.createObjectNode();
            }
            byte[] raw = rs.getBytes(1);
            if (raw == null || raw.length == 0) {
                return objectMapper.createObjectNode();
            }
            String json = new String(raw, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return objectMapper.createObjectNode();
            }
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? node : objectMapper.createObjectNode();
        } catch (IOException ex) {
            throw new SQLException("col.models is not valid JSON", ex);
        }
    }

    private boolean hasColTable(Connection connection) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "select 1 from sqlite_master where type = 'table' and name = 'col'")) {
            return stmt.executeQuery().next();
        }
    }

    private Long modelId(Map.Entry<String, JsonNode> entry) {
        try {
            return Long.parseLong(entry.getKey());
        } catch (NumberFormatException ex) {
            JsonNode id = entry.getValue().path("id");
            return id.canConvertToLong() ? id.asLong() : null;
        }
    }
}
