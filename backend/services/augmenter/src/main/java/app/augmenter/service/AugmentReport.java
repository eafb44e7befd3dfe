package app.augmenter.service;

public record AugmentReport(
        boolean liveMode,
        boolean dryRun,
        int totalNotes,
        int pendingNotes,
        int generated,
        int failed,
        int skipped,
        int written
) {

    public static AugmentReport nothingFound(boolean liveMode, boolean dryRun) {
        return new AugmentReport(liveMode, dryRun, 0, 0, 0, 0, 0, 0);
    }

    public static AugmentReport dryRun(boolean liveMode, int totalNotes, int pendingNotes) {
        return new AugmentReport(liveMode, true, totalNotes, pendingNotes, 0, 0, 0, 0);
    }
}
