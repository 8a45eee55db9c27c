package org.janelia.epochreg.error;

/**
 * This exception is thrown when no visit satisfies the reference frame requirements.
 *
 * @author Eric Trautman
 */
public class NoCandidateExposuresException
        extends MissingInputException {

    public NoCandidateExposuresException(final Integer epoch,
                                         final String filter) {
        super("no visits satisfy the reference image requirements: filter = " + filter + ", epoch = " + epoch);
    }
}
