package org.pragmatica.json.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * What the parser expected to find at an offset.
 *
 * <p>Merging keeps the expectation at the further offset, even a silent one; at equal
 * offsets the descriptions are combined, so alternatives that all failed on the same
 * character report together ("',' or ']'").
 */
public record Expectation(int offset, List<String> alternatives) {

    public static final Expectation NONE = new Expectation(-1, List.of());

    public Expectation {
        alternatives = List.copyOf(alternatives);
    }

    /**
     * Expectation of a single description. An empty description is silent.
     */
    public static Expectation at(int offset, String description) {
        return description.isEmpty()
               ? new Expectation(offset, List.of())
               : new Expectation(offset, List.of(description));
    }

    public boolean isEmpty() {
        return alternatives.isEmpty();
    }

    public Expectation merge(Expectation other) {
        if (other.offset > offset) {
            return other;
        }
        if (other.offset < offset || other.isEmpty()) {
            return this;
        }
        var merged = new ArrayList<>(alternatives);
        for (var alternative : other.alternatives) {
            if (!merged.contains(alternative)) {
                merged.add(alternative);
            }
        }
        return new Expectation(offset, merged);
    }

    /**
     * Same offset, descriptions replaced by {@code description}.
     */
    public Expectation relabel(String description) {
        return at(offset, description);
    }

    public String describe() {
        return alternatives.isEmpty()
               ? "input"
               : String.join(" or ", alternatives);
    }

    @Override
    public String toString() {
        return describe() + " at " + offset;
    }
}
