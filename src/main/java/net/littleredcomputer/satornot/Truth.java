package net.littleredcomputer.satornot;

/**
 * The value of a variable or literal under a partial assignment.
 */
public enum Truth {
    TRUE('T'),
    FALSE('F'),
    UNASSIGNED('U');

    private final char code;

    Truth(char code) {
        this.code = code;
    }

    /** The single-character form used by {@link Assignment#encode()}. */
    char code() { return code; }

    public static Truth of(boolean b) { return b ? TRUE : FALSE; }

    static Truth fromCode(char c) {
        switch (c) {
            case 'T': return TRUE;
            case 'F': return FALSE;
            case 'U': return UNASSIGNED;
            default: throw new IllegalArgumentException("invalid truth value code: " + c);
        }
    }

    /** Logical negation; an unassigned value stays unassigned. */
    public Truth not() {
        switch (this) {
            case TRUE: return FALSE;
            case FALSE: return TRUE;
            default: return UNASSIGNED;
        }
    }
}
