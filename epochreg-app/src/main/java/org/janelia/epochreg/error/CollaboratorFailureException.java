package org.janelia.epochreg.error;

/**
 * This exception is thrown when an external alignment, combination or pixel operation fails.
 *
 * @author Eric Trautman
 */
public class CollaboratorFailureException
        extends PipelineException {

    public CollaboratorFailureException(final String message) {
        super(message);
    }

    public CollaboratorFailureException(final String message,
                                        final Throwable cause) {
        super(message, cause);
    }
}
