package com.e2eq.skos.exceptions;

/**
 * Thrown when a cleaning run aborts.
 * <p>
 * Parsing defects never raise this exception; they are repaired and counted.
 * It is raised when an unexpected failure occurs inside a pipeline phase such as
 * the hierarchy autofix or one of the validation rules, in which case no cleaned
 * document is produced.
 * </p>
 */
public class CleaningException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String phase;

    public CleaningException(String message) {
        super(message);
        this.phase = null;
    }

    public CleaningException(String message, Throwable cause) {
        super(message, cause);
        this.phase = null;
    }

    public CleaningException(String phase, String message, Throwable cause) {
        super(buildMessage(phase, message), cause);
        this.phase = phase;
    }

    private static String buildMessage(String phase, String message) {
        return String.format("Cleaning run aborted in phase '%s': %s", phase, message);
    }

    /**
     * The pipeline phase that failed, or null when the failure is not tied to a phase.
     */
    public String getPhase() {
        return phase;
    }
}
