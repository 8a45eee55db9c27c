package org.janelia.epochreg.external;

import java.io.File;

import org.janelia.epochreg.error.CollaboratorFailureException;

/**
 * Removes cosmic ray flags that appear in only one of two exposures,
 * leaving the flags that are likely hot pixels because they appear in both.
 *
 * @author Eric Trautman
 */
public interface HotPixelCleaner {

    void cleanHotPixels(final File workingDirectory,
                        final String firstImageName,
                        final String secondImageName)
            throws CollaboratorFailureException;

}
