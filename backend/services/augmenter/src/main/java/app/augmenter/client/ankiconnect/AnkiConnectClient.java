package app.augmenter.client.ankiconnect;

import app.augmenter.config.AnkiConnectProps;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-over-HTTP client for the AnkiConnect add-on of a running Anki instance.
 */
@Component
public class AnkiConnectClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AnkiConnectProps props;

    public AnkiConnectClient(@Qualifier("ankiConnectRestClientBuilder") RestClient.Builder restClientBuilder,
                             AnkiConnectProps props,
                             ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.baseUrl(props.baseUrl()).build();
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public int version() {
        return invoke("version", objectMapper.createObjectNode()).asInt();
    }

    public List<Long> findNotes(String query) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("query", query);
        JsonNode result = invoke("findNotes", params);
        List<Long> ids = new ArrayList<>();
        for (JsonNode id : result) {
            ids.add(id.asLong());
        }
        return ids;
    }

    /**
     * Fetches note details in batches of {@code app.anki-connect.batch-size}.
     */
    public List<AnkiNoteInfo> notesInfo(List<Long> noteIds) {
        List<AnkiNoteInfo> infos = new ArrayList<>();
        int batchSize = props.batchSize();
        for (int start = 0; start < noteIds.size(); start += batchSize) {
            List<Long> batch = noteIds.subList(start, Math.min(start + batchSize, noteIds.size()));
            ObjectNode params = objectMapper.createObjectNode();
            ArrayNode notes = params.putArray("notes");
            batch.forEach(notes::add);
            for (JsonNode info : invoke("notesInfo", params)) {
                if (info == null || info.isNull() || !info.hasNonNull("noteId")) {
                    continue;
                }
                infos.add(toNoteInfo(info));
            }
        }
        return infos;
    }

    public void updateNoteFields(long noteId, Map<String, String> fields) {
        ObjectNode params = objectMapper.createObjectNode();
        ObjectNode note = params.putObject("note");
        note.put("id", noteId);
        ObjectNode fieldsNode = note.putObject("fields");
        fields.forEach(fieldsNode::put);
        invoke("updateNoteFields", params);
    }

    JsonNode invoke(String action, ObjectNode params) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("action", action);
        payload.put("version", props.version());
        payload.set("params", params);

        String body;
        try {
            body = restClient.post()
                    .uri("/")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(payload))
                    .retrieve()
                    .body(String.class);
        } catch (ResourceAccessException ex) {
            throw new AugmentException(
                    AugmentError.ANKI_CONNECT_UNREACHABLE,
                    "Could not connect to AnkiConnect at " + props.baseUrl() + ". Is Anki running and AnkiConnect installed?",
                    ex
            );
        } catch (JsonProcessingException | RestClientException ex) {
            throw new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "AnkiConnect " + action + " failed: " + ex.getMessage(), ex);
        }
        return unwrap(action, body);
    }

    private JsonNode unwrap(String action, String body) {
        JsonNode response;
        try {
            response = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "AnkiConnect " + action + " returned invalid JSON", ex);
        }
        if (response == null || !response.isObject() || response.size() != 2
                || !response.has("result") || !response.has("error")) {
            throw new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "AnkiConnect response has an unexpected number of fields");
        }
        JsonNode error = response.get("error");
        if (!error.isNull()) {
            throw new AugmentException(AugmentError.ANKI_CONNECT_ERROR, "AnkiConnect " + action + " error: " + error.asText());
        }
        return response.get("result");
    }

    private AnkiNoteInfo toNoteInfo(JsonNode info) {
        Map<String, AnkiNoteInfo.FieldValue> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = info.path("fields").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), new AnkiNoteInfo.FieldValue(
                    entry.getValue().path("value").asText(""),
                    entry.getValue().path("order").asInt()
            ));
        }
        return new AnkiNoteInfo(info.path("noteId").asLong(), info.path("modelName").asText(null), fields);
    }
}
