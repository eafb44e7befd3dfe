package app.augmenter.client.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class GeminiClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public GeminiClient(@Qualifier("geminiRestClientBuilder") RestClient.Builder restClientBuilder,
                        GeminiProps props,
                        ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.baseUrl(props.baseUrl()).build();
        this.objectMapper = objectMapper;
    }

    public GeminiResponseResult createResponse(String apiKey, GeminiResponseRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        ArrayNode parts = user.putArray("parts");
        parts.addObject().put("text", request.input());

        if (request.maxOutputTokens() != null && request.maxOutputTokens() > 0) {
            ObjectNode generationConfig = payload.putObject("generationConfig");
            generationConfig.put("maxOutputTokens", request.maxOutputTokens());
        }

        JsonNode response = restClient.post()
                .uri("/v1beta/models/{model}:generateContent", request.model())
                .header("x-goog-api-key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("Gemini response is empty");
        }

        String outputText = GeminiResponseParser.extractText(response);
        String model = response.path("modelVersion").asText(null);
        if (model == null || model.isBlank()) {
            model = request.model();
        }
        JsonNode usage = response.path("usageMetadata");
        Integer inputTokens = usage.hasNonNull("promptTokenCount") ? usage.get("promptTokenCount").asInt() : null;
        Integer outputTokens = usage.hasNonNull("candidatesTokenCount") ? usage.get("candidatesTokenCount").asInt() : null;
        return new GeminiResponseResult(
                outputText,
                model,
                inputTokens,
                outputTokens,
                GeminiResponseParser.extractFinishReason(response)
        );
    }
}
