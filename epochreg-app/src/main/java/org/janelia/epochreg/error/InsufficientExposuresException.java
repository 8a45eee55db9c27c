package org.janelia.epochreg.error;

/**
 * This exception is thrown when no exposures match a resolved reference (epoch, filter, visit).
 *
 * @author Eric Trautman
 */
public class InsufficientExposuresException
        extends MissingInputException {

    public InsufficientExposuresException(final Integer epoch,
                                          final String filter,
                                          final String visit) {
        super("not enough exposures for reference image with epoch " + epoch + ", filter " + filter +
              ", visit " + visit);
    }
}
