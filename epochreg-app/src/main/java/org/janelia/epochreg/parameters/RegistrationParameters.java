package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Source detection and matching parameters for registrations.
 *
 * @author Eric Trautman
 */
public class RegistrationParameters
        implements Serializable {

    public enum FitGeometry {
        /** Shift only. */
        SHIFT,
        /** Shift, rotation and scale. */
        RSCALE
    }

    @Parameter(
            names = "--threshold",
            description = "Detection threshold (sigmas) for source detection")
    public Double threshold = 5.0;

    @Parameter(
            names = "--peakMin",
            description = "Minimum peak flux for detected sources")
    public Double peakMin;

    @Parameter(
            names = "--peakMax",
            description = "Maximum peak flux for detected sources")
    public Double peakMax;

    @Parameter(
            names = "--searchRad",
            description = "Search radius (arcseconds) for catalog matching")
    public Double searchRadius = 1.5;

    @Parameter(
            names = "--minObj",
            description = "Minimum number of matched sources for a registration")
    public Integer minObj = 10;

    @Parameter(
            names = "--nBright",
            description = "Number of brightest sources used from each image catalog")
    public Integer nBright;

    @Parameter(
            names = "--refNBright",
            description = "Number of brightest sources used from the reference catalog " +
                          "(a catalog is derived from the reference image when no --refCat is given)")
    public Integer refNBright;

    @Parameter(
            names = "--rFluxMin",
            description = "Exclude reference catalog sources brighter than this magnitude")
    public Double rFluxMin;

    @Parameter(
            names = "--rFluxMax",
            description = "Exclude reference catalog sources fainter than this magnitude")
    public Double rFluxMax;

    @Parameter(
            names = "--nClip",
            description = "Number of sigma clipping iterations for catalog matching")
    public Integer nClip = 3;

    @Parameter(
            names = "--sigmaClip",
            description = "Clipping limit (sigmas) for catalog matching")
    public Double sigmaClip = 3.0;

    @Parameter(
            names = "--shiftOnly",
            description = "Fit shifts only (no rotation or scale)",
            arity = 0)
    public boolean shiftOnly = false;

    @Parameter(
            names = "--intravisitReg",
            description = "Register exposures within each visit before the first combination",
            arity = 0)
    public boolean intravisitReg = false;

    public FitGeometry getFitGeometry() {
        return shiftOnly ? FitGeometry.SHIFT : FitGeometry.RSCALE;
    }

}
