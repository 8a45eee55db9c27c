package org.janelia.epochreg.external;

import java.io.Serializable;

import org.janelia.epochreg.parameters.CosmicRayMode;
import org.janelia.epochreg.spec.SkyPosition;

/**
 * Options for a {@link Combiner#combine} call.
 * Combinations use the native orientation and grid of their inputs unless a registered grid is requested.
 *
 * @author Eric Trautman
 */
public class CombineOptions
        implements Serializable {

    private boolean registeredGrid;
    private SkyPosition outputCenter;
    private Double rotation;
    private Double imageSizeArcsec;
    private String naxis12;
    private Double pixelScale;
    private Double pixelFraction;
    private String weightType;
    private CombineType combineType;
    private CosmicRayMode cosmicRayMode;
    private String cosmicRaySnr;
    private String wcsKey;
    private boolean singleExposureProducts;
    private boolean clobber;

    public CombineOptions() {
        this.registeredGrid = false;
        this.combineType = CombineType.MINMED;
        this.cosmicRayMode = CosmicRayMode.WITHIN_VISIT;
        this.weightType = "EXP";
        this.singleExposureProducts = false;
        this.clobber = false;
    }

    public boolean isRegisteredGrid() {
        return registeredGrid;
    }

    /**
     * @return center of a registered grid or null to let the combiner choose it.
     */
    public SkyPosition getOutputCenter() {
        return outputCenter;
    }

    public Double getRotation() {
        return rotation;
    }

    public Double getImageSizeArcsec() {
        return imageSizeArcsec;
    }

    public String getNaxis12() {
        return naxis12;
    }

    public Double getPixelScale() {
        return pixelScale;
    }

    public Double getPixelFraction() {
        return pixelFraction;
    }

    public String getWeightType() {
        return weightType;
    }

    public CombineType getCombineType() {
        return combineType;
    }

    public CosmicRayMode getCosmicRayMode() {
        return cosmicRayMode;
    }

    public String getCosmicRaySnr() {
        return cosmicRaySnr;
    }

    /**
     * @return alternate WCS key to combine with (e.g. 'INTRAVIS') or null for the primary WCS.
     */
    public String getWcsKey() {
        return wcsKey;
    }

    public boolean isSingleExposureProducts() {
        return singleExposureProducts;
    }

    public boolean isClobber() {
        return clobber;
    }

    public CombineOptions withRegisteredGrid(final SkyPosition outputCenter,
                                             final Double rotation,
                                             final Double imageSizeArcsec,
                                             final String naxis12) {
        this.registeredGrid = true;
        this.outputCenter = outputCenter;
        this.rotation = rotation;
        this.imageSizeArcsec = imageSizeArcsec;
        this.naxis12 = naxis12;
        return this;
    }

    public CombineOptions withPixels(final Double pixelScale,
                                     final Double pixelFraction) {
        this.pixelScale = pixelScale;
        this.pixelFraction = pixelFraction;
        return this;
    }

    public CombineOptions withWeightType(final String weightType) {
        this.weightType = weightType;
        return this;
    }

    public CombineOptions withCombineType(final CombineType combineType) {
        this.combineType = combineType;
        return this;
    }

    public CombineOptions withCosmicRays(final CosmicRayMode cosmicRayMode,
                                         final String cosmicRaySnr) {
        this.cosmicRayMode = cosmicRayMode;
        this.cosmicRaySnr = cosmicRaySnr;
        return this;
    }

    public CombineOptions withWcsKey(final String wcsKey) {
        this.wcsKey = wcsKey;
        return this;
    }

    public CombineOptions withSingleExposureProducts(final boolean singleExposureProducts) {
        this.singleExposureProducts = singleExposureProducts;
        return this;
    }

    public CombineOptions withClobber(final boolean clobber) {
        this.clobber = clobber;
        return this;
    }

    @Override
    public String toString() {
        return "{grid: " + (registeredGrid ? outputCenter + ", rot " + rotation : "native") +
               ", combineType: " + combineType +
               ", cosmicRayMode: " + cosmicRayMode +
               (wcsKey == null ? "" : ", wcsKey: " + wcsKey) +
               ", single: " + singleExposureProducts +
               ", clobber: " + clobber + '}';
    }
}
