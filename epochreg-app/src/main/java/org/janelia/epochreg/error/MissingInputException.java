package org.janelia.epochreg.error;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This exception is thrown when exposures, files or directories needed by a unit of work are not available.
 *
 * @author Eric Trautman
 */
public class MissingInputException
        extends PipelineException {

    private final List<File> missingFiles;

    public MissingInputException(final String message) {
        this(message, Collections.emptyList());
    }

    public MissingInputException(final String message,
                                 final List<File> missingFiles) {
        super(message);
        this.missingFiles = new ArrayList<>(missingFiles);
    }

    public List<File> getMissingFiles() {
        return Collections.unmodifiableList(missingFiles);
    }
}
