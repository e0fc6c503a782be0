package me.golemcore.archivist.domain.model;

/**
 * Raised when the summarization backend fails or returns unusable output.
 */
public class SummarizationException extends RuntimeException {

    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
