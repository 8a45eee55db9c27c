package org.janelia.epochreg.error;

import java.io.File;

/**
 * This exception is thrown when required header keywords cannot be read from an image file.
 *
 * @author Eric Trautman
 */
public class HeaderReadException
        extends PipelineException {

    public HeaderReadException(final File imageFile,
                               final String message) {
        super("failed to read header of " + imageFile.getAbsolutePath() + ": " + message);
    }

    public HeaderReadException(final File imageFile,
                               final Throwable cause) {
        super("failed to read header of " + imageFile.getAbsolutePath(), cause);
    }
}
