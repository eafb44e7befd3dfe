package app.augmenter.service.generation;

@FunctionalInterface
public interface GenerationProgressListener {

    GenerationProgressListener NONE = (completed, total) -> {
    };

    void onProgress(int completed, int total);
}
