package app.augmenter.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field name to ordinal lookup for one note type.
 */
public final class FieldMap {

    private static final FieldMap EMPTY = new FieldMap(Map.of());

    private final Map<String, Integer> ordinals;

    private FieldMap(Map<String, Integer> ordinals) {
        this.ordinals = Collections.unmodifiableMap(new LinkedHashMap<>(ordinals));
    }

    public static FieldMap of(Map<String, Integer> ordinals) {
        if (ordinals == null || ordinals.isEmpty()) {
            return EMPTY;
        }
        return new FieldMap(ordinals);
    }

    public static FieldMap ofNames(List<String> names) {
        Map<String, Integer> ordinals = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            ordinals.putIfAbsent(names.get(i), i);
        }
        return of(ordinals);
    }

    public static FieldMap empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return ordinals.isEmpty();
    }

    public boolean contains(String fieldName) {
        return ordinals.containsKey(fieldName);
    }

    public Optional<Integer> ordinal(String fieldName) {
        return Optional.ofNullable(ordinals.get(fieldName));
    }

    /**
     * Number of positional slots the note type declares.
     */
    public int arity() {
        int max = -1;
        for (int ordinal : ordinals.values()) {
            max = Math.max(max, ordinal);
        }
        return max + 1;
    }

    public List<String> names() {
        return List.copyOf(ordinals.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldMap other)) {
            return false;
        }
        return ordinals.equals(other.ordinals);
    }

    @Override
    public int hashCode() {
        return ordinals.hashCode();
    }

    @Override
    public String toString() {
        return ordinals.toString();
    }
}
