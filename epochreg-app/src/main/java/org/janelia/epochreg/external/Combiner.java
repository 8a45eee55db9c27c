package org.janelia.epochreg.external;

import java.io.File;
import java.util.List;

import org.janelia.epochreg.error.CollaboratorFailureException;

/**
 * Drizzle engine that combines exposures into science, weight, context and bad pixel mask images.
 *
 * @author Eric Trautman
 */
public interface Combiner {

    /**
     * Combines the specified images.
     * Products are written to the working directory and named with the output root,
     * e.g. [outputRoot]_drz_sci.fits and [outputRoot]_[exposure]_single_sci.fits.
     *
     * @param  workingDirectory  directory that contains the images and receives the products.
     * @param  imageNames        names of the images to combine.
     * @param  outputRoot        name prefix for all products.
     * @param  options           combination options.
     *
     * @return the products.
     *
     * @throws CollaboratorFailureException
     *   if the combination fails.
     */
    CombineProducts combine(final File workingDirectory,
                            final List<String> imageNames,
                            final String outputRoot,
                            final CombineOptions options)
            throws CollaboratorFailureException;

}
