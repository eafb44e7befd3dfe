package app.augmenter.client.gemini;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ai.gemini")
public record GeminiProps(
        String baseUrl,
        String apiKey,
        String defaultModel,
        Integer maxOutputTokens,
        Integer timeoutSeconds
) {

    public GeminiProps {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://generativelanguage.googleapis.com";
        }
        if (defaultModel == null || defaultModel.isBlank()) {
            defaultModel = "gemini-3-flash-preview";
        }
        if (timeoutSeconds == null || timeoutSeconds < 1) {
            timeoutSeconds = 120;
        }
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
