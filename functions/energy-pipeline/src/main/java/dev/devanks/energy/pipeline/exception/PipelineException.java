package dev.devanks.energy.pipeline.exception;

/**
 * Fatal run failure: unreadable or structurally invalid input, or a failed output write.
 * Field-level coercion problems never surface as this exception.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
