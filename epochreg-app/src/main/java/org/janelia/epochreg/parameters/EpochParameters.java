package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for sorting exposures into epochs.
 *
 * @author Eric Trautman
 */
public class EpochParameters
        implements Serializable {

    @Parameter(
            names = "--epochListFile",
            description = "Exposure and epoch list file (default is <root>_epochs.txt)")
    public String epochListFile;

    @Parameter(
            names = "--epochSpan",
            description = "Maximum number of days between the first and last exposures of an epoch")
    public Double epochSpan = 5.0;

    @Parameter(
            names = "--mjdMin",
            description = "All exposures taken before this MJD are put into epoch 0")
    public Double mjdMin = 0.0;

    @Parameter(
            names = "--mjdMax",
            description = "All exposures taken after this MJD are put into the last epoch (0 for no limit)")
    public Double mjdMax = 0.0;

}
