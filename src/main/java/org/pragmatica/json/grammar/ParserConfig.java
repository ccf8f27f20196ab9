package org.pragmatica.json.grammar;

/**
 * Configuration for the JSON grammar.
 *
 * @param maxDepth      maximum number of nested arrays and objects
 * @param strictNumbers reject integer parts with leading zeros ({@code 01}) when true
 */
public record ParserConfig(int maxDepth, boolean strictNumbers) {
    public static final int UNLIMITED_DEPTH = Integer.MAX_VALUE;

    public static final ParserConfig DEFAULT = new ParserConfig(UNLIMITED_DEPTH, false);

    public ParserConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }
}
