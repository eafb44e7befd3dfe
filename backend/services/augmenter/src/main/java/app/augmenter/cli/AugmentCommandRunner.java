package app.augmenter.cli;

import app.augmenter.config.AugmentProps;
import app.augmenter.service.AugmentException;
import app.augmenter.service.AugmentReport;
import app.augmenter.service.AugmentRequest;
import app.augmenter.service.FileAugmentPipeline;
import app.augmenter.service.LiveAugmentPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Entry point: parses options, runs the file or live pipeline and records the exit code.
 */
@Component
public class AugmentCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AugmentCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;

    private final FileAugmentPipeline filePipeline;
    private final LiveAugmentPipeline livePipeline;
    private final AugmentProps props;

    private volatile int exitCode = EXIT_OK;
    private volatile AugmentReport lastReport;

    public AugmentCommandRunner(FileAugmentPipeline filePipeline,
                                LiveAugmentPipeline livePipeline,
                                AugmentProps props) {
        this.filePipeline = filePipeline;
        this.livePipeline = livePipeline;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (AugmentArguments.helpRequested(args)) {
            log.info("\n{}", AugmentArguments.USAGE);
            exitCode = EXIT_OK;
            return;
        }
        try {
            AugmentRequest request = AugmentArguments.parse(args, props);
            AugmentReport report = request.liveMode()
                    ? livePipeline.run(request)
                    : filePipeline.run(request);
            logSummary(report);
            lastReport = report;
            exitCode = EXIT_OK;
        } catch (AugmentException ex) {
            log.error("{}", ex.getMessage());
            exitCode = ex.getError().exitCode();
        } catch (RuntimeException ex) {
            log.error("Unexpected failure: {}", ex.getMessage(), ex);
            exitCode = EXIT_UNEXPECTED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    AugmentReport lastReport() {
        return lastReport;
    }

    private void logSummary(AugmentReport report) {
        log.info("Summary mode={} dryRun={} total={} pending={} generated={} failed={} skipped={} written={}",
                report.liveMode() ? "live" : "file",
                report.dryRun(),
                report.totalNotes(),
                report.pendingNotes(),
                report.generated(),
                report.failed(),
                report.skipped(),
                report.written());
    }
}
