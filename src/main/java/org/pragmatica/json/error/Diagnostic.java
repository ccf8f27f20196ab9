package org.pragmatica.json.error;

import org.pragmatica.json.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected input
 *   --> config.json:3:15
 *    |
 *  3 |     "port": 80 80,
 *    |                ^ expected ',' or '}'
 *    |
 * </pre>
 *
 * @param message  Primary error message
 * @param location Where the error occurred
 * @param label    Text shown next to the caret, may be empty
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    String message,
    SourceLocation location,
    String label,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceLocation location) {
        return new Diagnostic(message, location, "", List.of());
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(message, location, label, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, location, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be null
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(location.line()).append(":").append(location.column()).append("\n");

        int gutterWidth = String.valueOf(location.line()).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (location.line() >= 1 && location.line() <= lines.length) {
            var lineContent = stripCarriageReturn(lines[location.line() - 1]);
            sb.append(location.line()).append(" | ").append(lineContent).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ");
            sb.append(" ".repeat(location.column() - 1)).append('^');
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return String.format("input:%d:%d: error: %s%s",
                             location.line(),
                             location.column(),
                             message,
                             label.isEmpty() ? "" : ", " + label);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r")
               ? line.substring(0, line.length() - 1)
               : line;
    }
}
