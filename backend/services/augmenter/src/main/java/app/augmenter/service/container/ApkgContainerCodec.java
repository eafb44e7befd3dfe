package app.augmenter.service.container;

import app.augmenter.config.AugmentProps;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Opens .apkg packages into a scratch directory and packs them back.
 */
@Component
public class ApkgContainerCodec {

    private static final Logger log = LoggerFactory.getLogger(ApkgContainerCodec.class);

    static final String WORKING_DB_NAME = "collection_working.db";
    private static final Set<String> SCRATCH_NAMES = Set.of(
            WORKING_DB_NAME,
            "collection_legacy.anki2",
            "collection_new.anki2"
    );
    private static final List<String> SQLITE_SIDE_SUFFIXES = List.of("-journal", "-wal", "-shm");

    private final Path workDir;

    public ApkgContainerCodec(AugmentProps props) {
        this.workDir = Path.of(props.workDir()).toAbsolutePath().normalize();
    }

    public WorkingCollection open(Path packagePath) {
        if (packagePath == null || !Files.isRegularFile(packagePath)) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Input file '" + packagePath + "' not found");
        }
        resetWorkDir();

        log.info("Extracting {}", packagePath);
        try (ZipFile zipFile = new ZipFile(packagePath.toFile())) {
            extractAll(zipFile);
        } catch (ZipException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "'" + packagePath + "' is not a valid zip archive", ex);
        } catch (IOException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to read '" + packagePath + "'", ex);
        }

        PayloadForm form = detectPayload();
        Path workingDb = workDir.resolve(WORKING_DB_NAME);
        Path payload = workDir.resolve(form.entryName());
        try {
            if (form.compressed()) {
                log.info("Decompressing {} to use as working collection", form.entryName());
                try (InputStream in = Files.newInputStream(payload);
                     ZstdInputStream zstd = new ZstdInputStream(in)) {
                    Files.copy(zstd, workingDb, StandardCopyOption.REPLACE_EXISTING);
                }
            } else {
                log.info("Using {} as working collection", form.entryName());
                Files.copy(payload, workingDb, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to materialize " + form.entryName(), ex);
        }
        return new WorkingCollection(workDir, workingDb, form);
    }

    /**
     * Mirrors the working collection into every payload slot and zips the scratch directory into {@code outputPath}.
     */
    public void close(WorkingCollection collection, Path outputPath) {
        collection.close();
        Path workingDb = collection.databasePath();
        Path root = collection.workDir();
        try {
            log.info("Preparing output files");
            Files.copy(workingDb, root.resolve(PayloadForm.LEGACY.entryName()), StandardCopyOption.REPLACE_EXISTING);
            Path legacy21 = root.resolve(PayloadForm.LEGACY_21.entryName());
            if (Files.exists(legacy21)) {
                Files.copy(workingDb, legacy21, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Compressing to {}", PayloadForm.MODERN.entryName());
            try (InputStream in = Files.newInputStream(workingDb);
                 OutputStream out = Files.newOutputStream(root.resolve(PayloadForm.MODERN.entryName()));
                 ZstdOutputStream zstd = new ZstdOutputStream(out)) {
                in.transferTo(zstd);
            }

            Path target = outputPath.toAbsolutePath().normalize();
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            log.info("Creating {}", target);
            zipWorkDir(root, target);
        } catch (IOException ex) {
            throw new AugmentException(AugmentError.WRITE_FAILED, "Failed to write package '" + outputPath + "'", ex);
        }
    }

    Path workDir() {
        return workDir;
    }

    private void extractAll(ZipFile zipFile) throws IOException {
        Enumeration<? extends ZipEntry> entries = zipFile.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            Path target = workDir.resolve(entry.getName()).normalize();
            if (!target.startsWith(workDir)) {
                throw new AugmentException(AugmentError.INVALID_CONTAINER, "Archive entry escapes package root: " + entry.getName());
            }
            if (entry.isDirectory()) {
                Files.createDirectories(target);
                continue;
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (InputStream in = zipFile.getInputStream(entry)) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    private PayloadForm detectPayload() {
        for (PayloadForm form : PayloadForm.values()) {
            if (Files.isRegularFile(workDir.resolve(form.entryName()))) {
                return form;
            }
        }
        throw new AugmentException(
                AugmentError.MISSING_PAYLOAD,
                "Missing collection.anki21b/collection.anki21/collection.anki2 in package"
        );
    }

    private void zipWorkDir(Path root, Path target) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> !isScratch(path.getFileName().toString()))
                    .filter(path -> !path.toAbsolutePath().normalize().equals(target))
                    .sorted(Comparator.comparing(path -> root.relativize(path).toString()))
                    .toList();
        }
        try (ZipOutputStream zos = new ZipOutputStream(Files.newOutputStream(target))) {
            zos.setMethod(ZipOutputStream.DEFLATED);
            for (Path file : files) {
                String entryName = root.relativize(file).toString().replace('\\', '/');
                zos.putNextEntry(new ZipEntry(entryName));
                Files.copy(file, zos);
                zos.closeEntry();
            }
        }
    }

    private boolean isScratch(String fileName) {
        if (SCRATCH_NAMES.contains(fileName)) {
            return true;
        }
        for (String suffix : SQLITE_SIDE_SUFFIXES) {
            if (fileName.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private void resetWorkDir() {
        try {
            if (Files.exists(workDir)) {
                try (Stream<Path> walk = Files.walk(workDir)) {
                    for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                        Files.delete(path);
                    }
                }
            }
            Files.createDirectories(workDir);
        } catch (IOException ex) {
            throw new AugmentException(AugmentError.INVALID_CONTAINER, "Failed to reset work directory " + workDir, ex);
        }
    }
}
