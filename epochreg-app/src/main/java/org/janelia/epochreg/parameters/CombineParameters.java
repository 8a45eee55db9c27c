package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Parameters for drizzle combinations.
 *
 * @author Eric Trautman
 */
public class CombineParameters
        implements Serializable {

    public static final List<String> WEIGHT_TYPES = Arrays.asList("IVM", "EXP", "ERR");

    @Parameter(
            names = "--drizCr",
            description = "Cosmic ray rejection: " +
                          "-1 removes flags and adds no more, " +
                          "0 keeps existing flags, " +
                          "1 removes flags and rejects within each visit, " +
                          "2 also rejects in multi-visit combinations and stacks")
    public Integer drizCr = 1;

    @Parameter(
            names = "--drizCrSnr",
            description = "Sigma thresholds for cosmic ray rejection (e.g. '5,4.5')")
    public String drizCrSnr = "5,4.5";

    @Parameter(
            names = "--rot",
            description = "Rotation (degrees) of registered images")
    public Double rot = 0.0;

    @Parameter(
            names = "--imSize",
            description = "Size (arcseconds) of registered images")
    public Double imSizeArcsec;

    @Parameter(
            names = "--naxis12",
            description = "Size (pixels, e.g. '1000,1000') of registered images")
    public String naxis12;

    @Parameter(
            names = "--pixScale",
            description = "Pixel scale (arcseconds) of registered images")
    public Double pixScale;

    @Parameter(
            names = "--pixFrac",
            description = "Drizzle pixel fraction for registered images")
    public Double pixFrac;

    @Parameter(
            names = "--whtType",
            description = "Weight map type (IVM, EXP, or ERR)")
    public String whtType = "IVM";

    @Parameter(
            names = "--singleSci",
            description = "Also produce registered single exposure images",
            arity = 0)
    public boolean singleSci = false;

    public CosmicRayMode getCosmicRayMode() {
        return CosmicRayMode.fromLevel(drizCr);
    }

    /**
     * @return cosmic ray thresholds as a space separated list (e.g. '5 4.5').
     */
    public String getCosmicRaySnrList() {
        return drizCrSnr == null ? null : drizCrSnr.replace(',', ' ').trim();
    }

}
