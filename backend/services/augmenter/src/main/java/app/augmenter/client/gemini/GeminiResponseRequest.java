package app.augmenter.client.gemini;

public record GeminiResponseRequest(
        String model,
        String input,
        Integer maxOutputTokens
) {
}
