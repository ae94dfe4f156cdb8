package org.propensa.compiler;

/**
 * Thrown when a reaction model cannot be compiled. Compilation is aborted on the first
 * violation; no partial output is produced.
 * <p>
 * Every exception carries an {@link ErrorCode} identifying the violated condition and, where
 * applicable, the 1-based reaction position and the offending name.
 */
public class CompilationException extends Exception {

    /**
     * Distinguishes the conditions under which compilation fails.
     */
    public enum ErrorCode {
        /** A species entry is null or empty. */
        INVALID_SPECIES,
        /** Rates are not well-formed name/value pairs. */
        INVALID_RATES,
        /** A name occurs twice among the species or among the rates. */
        DUPLICATE_NAME,
        /** A name is used both as species and as rate. */
        NAME_CLASH,
        /** A name collides with an argument or a file-scope name of the generated code. */
        RESERVED_NAME,
        /** A name is not a plain identifier or is a C keyword. */
        INVALID_IDENTIFIER,
        /** A reaction does not contain exactly two separators. */
        MALFORMED_REACTION,
        /** A reactant or product is not a declared species. */
        UNKNOWN_SPECIES
    }

    private final ErrorCode code;
    private final int reactionPosition;
    private final String offendingName;

    public CompilationException(ErrorCode code, String message) {
        this(code, message, 0, null);
    }

    public CompilationException(ErrorCode code, String message, String offendingName) {
        this(code, message, 0, offendingName);
    }

    public CompilationException(ErrorCode code, String message, int reactionPosition, String offendingName) {
        super(message);
        this.code = code;
        this.reactionPosition = reactionPosition;
        this.offendingName = offendingName;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * @return The 1-based position of the failing reaction, or 0 if the error is not tied to a reaction.
     */
    public int getReactionPosition() {
        return reactionPosition;
    }

    /**
     * @return The offending species, rate or token, or {@code null} if none applies.
     */
    public String getOffendingName() {
        return offendingName;
    }
}
