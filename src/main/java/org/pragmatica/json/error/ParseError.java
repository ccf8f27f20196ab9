package org.pragmatica.json.error;

import org.pragmatica.json.tree.SourceLocation;

/**
 * Parse error with location and what was expected there.
 */
public sealed interface ParseError {

    SourceLocation location();

    String expected();

    String message();

    default int offset() {
        return location().offset();
    }

    /**
     * Rust-style diagnostic pointing at the error location.
     */
    default Diagnostic diagnostic() {
        var diagnostic = Diagnostic.error(this instanceof UnexpectedEof ? "unexpected end of input" : "unexpected input",
                                          location())
                                   .withLabel("expected " + expected());
        return this instanceof TrailingInput
               ? diagnostic.withHelp("a JSON text holds exactly one value")
               : diagnostic;
    }

    /**
     * Input does not match any production at the location.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended while a production was incomplete.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * A complete value was followed by more non-whitespace input.
     */
    record TrailingInput(
    SourceLocation location,
    String found) implements ParseError {
        @Override
        public String expected() {
            return "end of input";
        }

        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected end of input";
        }
    }
}
