package dev.automata.model;

/**
 * Which variant an automaton definition is. Carried explicitly on every definition
 * from the moment it is built.
 */
public enum Kind {
    DETERMINISTIC("dfa"),
    NONDETERMINISTIC("nfa");

    private final String code;

    Kind(String code) {
        this.code = code;
    }

    /** Short code used in persisted records and on the command line. */
    public String code() {
        return code;
    }

    /**
     * Look up a kind by its persisted code, case-insensitively.
     *
     * @throws IllegalArgumentException if the code names no kind
     */
    public static Kind fromCode(String code) {
        for (Kind kind : values()) {
            if (kind.code.equalsIgnoreCase(code == null ? "" : code.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown automaton kind: " + code);
    }
}
