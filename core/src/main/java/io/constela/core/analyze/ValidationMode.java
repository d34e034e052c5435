package io.constela.core.analyze;

/**
 * Which expression checks apply where an expression appears.
 *
 * <p>View expressions are checked in {@link #FULL} mode. Action steps run with whatever variables
 * the dispatching event provides, so their {@code var} references cannot be resolved statically
 * ({@link #STATE_ONLY}); the same holds for event-handler payloads ({@link #EVENT_PAYLOAD}).
 */
public enum ValidationMode {
    FULL(VarTrustLevel.LEXICAL),
    STATE_ONLY(VarTrustLevel.RUNTIME_OPAQUE),
    EVENT_PAYLOAD(VarTrustLevel.RUNTIME_OPAQUE);

    /** How {@code var} references are treated. */
    public enum VarTrustLevel {
        /** Names must be bound by an enclosing {@code each} or {@code lambda}. */
        LEXICAL,
        /** Names are bound at runtime and accepted unchecked. */
        RUNTIME_OPAQUE
    }

    private final VarTrustLevel varTrust;

    ValidationMode(VarTrustLevel varTrust) {
        this.varTrust = varTrust;
    }

    public VarTrustLevel varTrust() {
        return varTrust;
    }
}
