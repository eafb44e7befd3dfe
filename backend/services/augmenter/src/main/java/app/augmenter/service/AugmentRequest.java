package app.augmenter.service;

import app.augmenter.service.generation.PromptTemplate;

import java.nio.file.Path;

/**
 * One augmentation run.
 *
 * @param input       package to read; unused in live mode
 * @param output      package to write; unused in live mode
 * @param workers     concurrent generation calls
 */
public record AugmentRequest(
        Path input,
        Path output,
        boolean liveMode,
        String noteType,
        String targetField,
        PromptTemplate prompt,
        boolean dryRun,
        int workers
) {
}
