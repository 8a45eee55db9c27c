package org.janelia.epochreg.error;

import java.io.File;
import java.util.Collections;

/**
 * This exception is thrown when an artifact that a prior stage should have produced does not exist.
 *
 * @author Eric Trautman
 */
public class MissingArtifactException
        extends MissingInputException {

    private final File artifact;

    public MissingArtifactException(final File artifact,
                                    final String producingStageDescription) {
        super("missing " + artifact.getAbsolutePath() + ", maybe you should re-run with " + producingStageDescription,
              Collections.singletonList(artifact));
        this.artifact = artifact;
    }

    public File getArtifact() {
        return artifact;
    }
}
