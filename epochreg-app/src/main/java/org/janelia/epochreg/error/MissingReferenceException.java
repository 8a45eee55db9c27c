package org.janelia.epochreg.error;

import java.io.File;
import java.util.Collections;

/**
 * This exception is thrown when an explicitly specified reference image does not exist.
 *
 * @author Eric Trautman
 */
public class MissingReferenceException
        extends MissingInputException {

    public MissingReferenceException(final File referenceImage) {
        super("reference image " + referenceImage.getAbsolutePath() + " does not exist",
              Collections.singletonList(referenceImage));
    }
}
