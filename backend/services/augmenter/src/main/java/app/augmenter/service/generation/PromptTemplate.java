package app.augmenter.service.generation;

import app.augmenter.domain.CollectionNote;
import app.augmenter.domain.FieldMap;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Prompt text with <code>{FieldName}</code> placeholders. Doubled braces stand for a literal brace;
 * braces around anything that is not a field name are kept as they are.
 */
public final class PromptTemplate {

    private static final Pattern FIELD_NAME = Pattern.compile("\\w[\\w \\-]*", Pattern.UNICODE_CHARACTER_CLASS);

    private final String source;
    private final List<Segment> segments;
    private final List<String> requiredFields;

    private PromptTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
        Set<String> names = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment.placeholder()) {
                names.add(segment.text());
            }
        }
        this.requiredFields = List.copyOf(names);
    }

    public static PromptTemplate parse(String template) {
        String text = template == null ? "" : template;
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
                continue;
            }
            if (c == '}' && i + 1 < text.length() && text.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
                continue;
            }
            if (c == '{') {
                int close = text.indexOf('}', i + 1);
                if (close > i + 1) {
                    String name = text.substring(i + 1, close);
                    if (FIELD_NAME.matcher(name).matches() && !name.endsWith(" ")) {
                        if (!literal.isEmpty()) {
                            segments.add(Segment.literal(literal.toString()));
                            literal.setLength(0);
                        }
                        segments.add(Segment.placeholder(name));
                        i = close + 1;
                        continue;
                    }
                }
            }
            literal.append(c);
            i++;
        }
        if (!literal.isEmpty()) {
            segments.add(Segment.literal(literal.toString()));
        }
        return new PromptTemplate(text, segments);
    }

    public String source() {
        return source;
    }

    /**
     * Field names the template reads, in order of first use.
     */
    public List<String> requiredFields() {
        return requiredFields;
    }

    public void validate(FieldMap fieldMap) {
        for (String field : requiredFields) {
            if (!fieldMap.contains(field)) {
                throw new AugmentException(
                        AugmentError.MISSING_SOURCE_FIELD,
                        "Required field '" + field + "' (from prompt) not found. Available fields: " + fieldMap.names()
                );
            }
        }
    }

    public String fill(CollectionNote note, FieldMap fieldMap) {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (!segment.placeholder()) {
                sb.append(segment.text());
                continue;
            }
            int ordinal = fieldMap.ordinal(segment.text())
                    .orElseThrow(() -> new AugmentException(
                            AugmentError.MISSING_SOURCE_FIELD,
                            "Required field '" + segment.text() + "' (from prompt) not found"
                    ));
            sb.append(note.value(ordinal));
        }
        return sb.toString();
    }

    private record Segment(String text, boolean placeholder) {

        static Segment literal(String text) {
            return new Segment(text, false);
        }

        static Segment placeholder(String name) {
            return new Segment(name, true);
        }
    }
}
