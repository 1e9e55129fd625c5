package net.littleredcomputer.boolsat;

/**
 * The state of a variable in an {@link Assignment}. UNSET marks a variable the search has not
 * yet decided; it is never a truth value.
 */
public enum Value {
    UNSET,
    FALSE,
    TRUE;

    public static Value of(boolean b) { return b ? TRUE : FALSE; }

    public boolean isSet() { return this != UNSET; }

    /**
     * @return the truth value of a decided variable
     * @throws IllegalStateException if this is UNSET
     */
    public boolean toBoolean() {
        if (this == UNSET) throw new IllegalStateException("UNSET has no truth value");
        return this == TRUE;
    }

    /**
     * @return the opposite truth value; UNSET stays UNSET
     */
    public Value negate() {
        switch (this) {
            case TRUE: return FALSE;
            case FALSE: return TRUE;
            default: return UNSET;
        }
    }
}
