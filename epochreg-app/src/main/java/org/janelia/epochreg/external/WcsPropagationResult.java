package org.janelia.epochreg.external;

/**
 * Outcome of a {@link BackPropagator#propagate} call.
 *
 * @author Eric Trautman
 */
public class WcsPropagationResult {

    public enum Status {
        /** Solution was written to every constituent exposure. */
        PROPAGATED,
        /** A different solution already uses the requested name, an alternate name can be used instead. */
        WCS_NAME_COLLISION,
        /** Headers could not be interpreted. */
        HEADER_CORRUPTED
    }

    private final Status status;
    private final String alternateWcsName;
    private final String message;

    private WcsPropagationResult(final Status status,
                                 final String alternateWcsName,
                                 final String message) {
        this.status = status;
        this.alternateWcsName = alternateWcsName;
        this.message = message;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isPropagated() {
        return Status.PROPAGATED.equals(status);
    }

    /**
     * @return unused name suggested for a collision or null.
     */
    public String getAlternateWcsName() {
        return alternateWcsName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return status + (message == null ? "" : ": " + message);
    }

    public static WcsPropagationResult propagated() {
        return new WcsPropagationResult(Status.PROPAGATED, null, null);
    }

    public static WcsPropagationResult nameCollision(final String alternateWcsName,
                                                     final String message) {
        return new WcsPropagationResult(Status.WCS_NAME_COLLISION, alternateWcsName, message);
    }

    public static WcsPropagationResult headerCorrupted(final String message) {
        return new WcsPropagationResult(Status.HEADER_CORRUPTED, null, message);
    }
}
