package org.janelia.epochreg.external;

import java.io.File;

import org.janelia.epochreg.error.CollaboratorFailureException;

/**
 * Synthesizes a template for one bandpass by flux scaling template images taken with other filters.
 *
 * @author Eric Trautman
 */
public interface TemplateScaler {

    /**
     * @param  targetBandpass  camera and filter of the images to be differenced (e.g. 'WFC3-IR,f140w').
     * @param  firstTemplate   first source template science image.
     * @param  secondTemplate  second source template science image (null if only one is used).
     * @param  output          science image to write (weight and mask siblings are written too).
     * @param  clobber         replace existing output.
     *
     * @return the scaled template science image.
     *
     * @throws CollaboratorFailureException
     *   if the template cannot be built.
     */
    File makeScaledTemplate(final String targetBandpass,
                            final File firstTemplate,
                            final File secondTemplate,
                            final File output,
                            final boolean clobber)
            throws CollaboratorFailureException;

}
