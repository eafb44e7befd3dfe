package app.augmenter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.augment")
public record AugmentProps(
        String workDir,
        Integer workers,
        Integer progressEvery,
        Integer previewLength,
        Boolean skipBlankSources
) {

    public static final int DEFAULT_WORKERS = 15;

    public AugmentProps {
        if (workDir == null || workDir.isBlank()) {
            workDir = "temp_augment";
        }
        if (workers == null || workers < 1) {
            workers = DEFAULT_WORKERS;
        }
        if (progressEvery == null || progressEvery < 1) {
            progressEvery = 10;
        }
        if (previewLength == null || previewLength < 1) {
            previewLength = 80;
        }
        if (skipBlankSources == null) {
            skipBlankSources = true;
        }
    }
}
