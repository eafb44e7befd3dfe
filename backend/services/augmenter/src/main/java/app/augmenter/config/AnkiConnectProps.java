package app.augmenter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.anki-connect")
public record AnkiConnectProps(
        String baseUrl,
        Integer version,
        Integer batchSize,
        Integer timeoutSeconds
) {

    public AnkiConnectProps {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8765";
        }
        if (version == null) {
            version = 6;
        }
        if (batchSize == null || batchSize < 1) {
            batchSize = 500;
        }
        if (timeoutSeconds == null || timeoutSeconds < 1) {
            timeoutSeconds = 30;
        }
    }
}
