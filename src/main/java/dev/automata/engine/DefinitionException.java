package dev.automata.engine;

/**
 * Single exception raised while building an automaton definition. The code identifies the
 * class of failure; the message names the record, line or identifiers involved.
 */
public final class DefinitionException extends Exception {
    private static final long serialVersionUID = 1L;
    private final Code code;

    public DefinitionException(Code code) {
        super(code.description());
        this.code = code;
    }

    public DefinitionException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public DefinitionException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code code() {
        return code;
    }

    public enum Code {
        MALFORMED_RECORD("Input does not match the expected record shape"),
        MALFORMED_KEY("Composite transition key cannot be split into state and symbol"),
        UNKNOWN_STATE("Referenced state is not a member of the state set"),
        UNKNOWN_SYMBOL("Referenced symbol is not a member of the alphabet"),
        DUPLICATE_TRANSITION("Deterministic (state, symbol) pair is defined more than once"),
        INCONSISTENT_DETERMINISM("Classified kind disagrees with the reconstructed transitions"),
        MISSING_INITIAL_STATE("No initial state designation found"),
        INTERNAL_ERROR("Builder produced a structurally impossible transition");

        private final String description;

        Code(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }
}
