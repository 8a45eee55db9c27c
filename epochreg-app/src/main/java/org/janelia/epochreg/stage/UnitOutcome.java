package org.janelia.epochreg.stage;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one unit of work (e.g. one group) within a stage.
 *
 * @author Eric Trautman
 */
public class UnitOutcome {

    public enum Status {
        COMPLETED,
        SKIPPED_EXISTING,
        SKIPPED_MISSING_INPUT
    }

    private final PipelineStage stage;
    private final String unitKey;
    private final Status status;
    private final String message;
    private final List<File> missingFiles;

    public UnitOutcome(final PipelineStage stage,
                       final String unitKey,
                       final Status status,
                       final String message,
                       final List<File> missingFiles) {
        this.stage = stage;
        this.unitKey = unitKey;
        this.status = status;
        this.message = message;
        this.missingFiles = missingFiles == null ? new ArrayList<>() : new ArrayList<>(missingFiles);
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String getUnitKey() {
        return unitKey;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public List<File> getMissingFiles() {
        return Collections.unmodifiableList(missingFiles);
    }

    @Override
    public String toString() {
        return stage + " " + unitKey + ": " + status + (message == null ? "" : " (" + message + ")");
    }
}
