package app.augmenter.cli;

import app.augmenter.config.AugmentProps;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import app.augmenter.service.AugmentRequest;
import app.augmenter.service.generation.PromptTemplate;
import org.springframework.boot.ApplicationArguments;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns command-line options into an {@link AugmentRequest}.
 */
final class AugmentArguments {

    static final String INPUT = "input";
    static final String OUTPUT = "output";
    static final String ANKI_CONNECT = "anki-connect";
    static final String NOTE_TYPE = "note-type";
    static final String TARGET_FIELD = "target-field";
    static final String PROMPT_FILE = "prompt-file";
    static final String PRESET = "preset";
    static final String DRY_RUN = "dry-run";
    static final String WORKERS = "workers";
    static final String HELP = "help";

    private static final Set<String> KNOWN = Set.of(
            INPUT, OUTPUT, ANKI_CONNECT, NOTE_TYPE, TARGET_FIELD, PROMPT_FILE, PRESET, DRY_RUN, WORKERS, HELP
    );

    static final String USAGE = String.join("\n",
            "Usage: augmenter [--input=<deck.apkg> --output=<out.apkg> | --anki-connect]",
            "                 --note-type=<name> --target-field=<name> --prompt-file=<path>",
            "                 [--preset=<" + presetKeys() + ">] [--dry-run] [--workers=<n>] [--help]",
            "",
            "  --input          package to read (file mode)",
            "  --output         package to write (file mode)",
            "  --anki-connect   update notes in a running Anki through AnkiConnect",
            "  --note-type      note type whose notes are augmented",
            "  --target-field   field to fill with generated content",
            "  --prompt-file    prompt template, {FieldName} placeholders, {{ and }} for braces",
            "  --preset         built-in prompt with its default note type and target field",
            "  --dry-run        list notes that would be updated without generating",
            "  --workers        concurrent generation calls",
            "",
            "The Gemini API key is read from GEMINI_API_KEY.");

    private AugmentArguments() {
    }

    static boolean helpRequested(ApplicationArguments args) {
        return args.containsOption(HELP);
    }

    static AugmentRequest parse(ApplicationArguments args, AugmentProps props) {
        if (!args.getNonOptionArgs().isEmpty()) {
            throw usage("Unexpected arguments: " + args.getNonOptionArgs());
        }
        for (String name : args.getOptionNames()) {
            // dotted names are Spring property overrides
            if (!KNOWN.contains(name) && !name.contains(".")) {
                throw usage("Unknown option --" + name);
            }
        }

        PromptPreset preset = null;
        String presetKey = single(args, PRESET);
        if (presetKey != null) {
            preset = PromptPreset.fromKey(presetKey)
                    .orElseThrow(() -> usage("Unknown preset '" + presetKey + "'. Available presets: " + presetKeys()));
        }

        boolean live = args.containsOption(ANKI_CONNECT);
        Path input = path(single(args, INPUT));
        Path output = path(single(args, OUTPUT));
        if (!live && (input == null || output == null)) {
            throw usage("--input and --output are required unless --anki-connect is given");
        }

        String noteType = orDefault(single(args, NOTE_TYPE), preset == null ? null : preset.noteType());
        String targetField = orDefault(single(args, TARGET_FIELD), preset == null ? null : preset.targetField());
        if (noteType == null) {
            throw usage("--note-type is required");
        }
        if (targetField == null) {
            throw usage("--target-field is required");
        }

        String promptFile = single(args, PROMPT_FILE);
        String promptText;
        if (promptFile != null) {
            promptText = readPromptFile(Path.of(promptFile));
        } else if (preset != null) {
            promptText = readPresetPrompt(preset);
        } else {
            throw usage("--prompt-file is required");
        }
        PromptTemplate prompt = PromptTemplate.parse(promptText);

        int workers = props.workers();
        String workersValue = single(args, WORKERS);
        if (workersValue != null) {
            try {
                workers = Integer.parseInt(workersValue.trim());
            } catch (NumberFormatException ex) {
                throw usage("--workers must be a number, got '" + workersValue + "'");
            }
            if (workers < 1) {
                throw usage("--workers must be at least 1");
            }
        }

        return new AugmentRequest(
                input,
                output,
                live,
                noteType,
                targetField,
                prompt,
                args.containsOption(DRY_RUN),
                workers
        );
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw usage("--" + name + " given more than once");
        }
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value;
    }

    private static Path path(String value) {
        return value == null ? null : Path.of(value);
    }

    private static String orDefault(String explicit, String fallback) {
        return explicit != null ? explicit : fallback;
    }

    private static String readPromptFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw usage("Prompt file not found: " + path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new AugmentException(AugmentError.INVALID_ARGUMENTS, "Could not read prompt file " + path, ex);
        }
    }

    private static String readPresetPrompt(PromptPreset preset) {
        try {
            return new ClassPathResource(preset.resource()).getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new AugmentException(AugmentError.INVALID_ARGUMENTS, "Could not load preset " + preset.key(), ex);
        }
    }

    private static String presetKeys() {
        return Arrays.stream(PromptPreset.values()).map(PromptPreset::key).collect(Collectors.joining("|"));
    }

    private static AugmentException usage(String message) {
        return new AugmentException(AugmentError.INVALID_ARGUMENTS, message);
    }
}
