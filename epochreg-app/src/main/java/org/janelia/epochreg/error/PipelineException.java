package org.janelia.epochreg.error;

/**
 * This exception class serves as the base class for all pipeline exceptions.
 *
 * @author Eric Trautman
 */
public class PipelineException
        extends RuntimeException {

    public PipelineException(final String message) {
        super(message);
    }

    public PipelineException(final String message,
                             final Throwable cause) {
        super(message, cause);
    }
}
