package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for selecting or building the WCS reference image.
 *
 * @author Eric Trautman
 */
public class ReferenceParameters
        implements Serializable {

    @Parameter(
            names = "--refImage",
            description = "Existing image that defines the reference WCS (skips reference selection)")
    public String refImage;

    @Parameter(
            names = "--refEpoch",
            description = "Epoch of the exposures used to build the reference image (default is the first epoch)")
    public Integer refEpoch;

    @Parameter(
            names = "--refFilter",
            description = "Filter of the exposures used to build the reference image " +
                          "(default is the first filter of the reference epoch)")
    public String refFilter;

    @Parameter(
            names = "--refVisit",
            description = "Visit (PID.visit, e.g. 12099.A1) of the exposures used to build the reference image " +
                          "(default is the visit with the most exposures)")
    public String refVisit;

    @Parameter(
            names = "--refCat",
            description = "Source catalog used to register the reference image")
    public String refCat;

    /**
     * @return true if an explicit epoch, filter or visit was requested for the reference image.
     */
    public boolean hasSelectionOverride() {
        return (refEpoch != null) || (refFilter != null) || (refVisit != null);
    }

}
