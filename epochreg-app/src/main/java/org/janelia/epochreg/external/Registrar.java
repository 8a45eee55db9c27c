package org.janelia.epochreg.external;

import java.io.File;

import org.janelia.epochreg.error.CollaboratorFailureException;
import org.janelia.epochreg.parameters.RegistrationParameters;

/**
 * Source detection, matching and geometric fitting tool.
 *
 * @author Eric Trautman
 */
public interface Registrar {

    /**
     * Fits a new WCS solution for each requested image and stores it in the image headers.
     *
     * @return name of the WCS solution that was written.
     *
     * @throws CollaboratorFailureException
     *   if the registration fails (e.g. fewer sources were matched than required).
     */
    String align(final RegistrationRequest request)
            throws CollaboratorFailureException;

    /**
     * Detects sources in an image and writes them to a catalog file in the working directory.
     *
     * @return the catalog file.
     *
     * @throws CollaboratorFailureException
     *   if the catalog cannot be built.
     */
    File makeSourceCatalog(final File workingDirectory,
                           final String imageName,
                           final RegistrationParameters detection)
            throws CollaboratorFailureException;

}
