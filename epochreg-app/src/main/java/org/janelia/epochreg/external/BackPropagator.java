package org.janelia.epochreg.external;

import java.io.File;
import java.util.List;

import org.janelia.epochreg.error.CollaboratorFailureException;

/**
 * Copies a WCS solution fitted on a combined image back into its constituent exposures.
 *
 * @author Eric Trautman
 */
public interface BackPropagator {

    /**
     * @param  workingDirectory     directory that contains the combined image and its exposures.
     * @param  combinedImageName    name of the registered combined image.
     * @param  exposureNames        names of the constituent exposures.
     * @param  originalWcsName      name of the combined image's WCS before registration.
     * @param  solutionWcsName      name of the fitted solution in the combined image.
     * @param  targetWcsName        name for the solution in the exposure headers.
     * @param  force                overwrite existing solutions with the same name.
     *
     * @return the propagation outcome (never null).
     *
     * @throws CollaboratorFailureException
     *   if the tool cannot be run.
     */
    WcsPropagationResult propagate(final File workingDirectory,
                                   final String combinedImageName,
                                   final List<String> exposureNames,
                                   final String originalWcsName,
                                   final String solutionWcsName,
                                   final String targetWcsName,
                                   final boolean force)
            throws CollaboratorFailureException;

}
