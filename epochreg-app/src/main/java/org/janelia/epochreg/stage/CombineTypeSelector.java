package org.janelia.epochreg.stage;

import org.janelia.epochreg.external.CombineType;
import org.janelia.epochreg.spec.Camera;

/**
 * Chooses the pixel combination statistic for registered combinations.
 *
 * @author Eric Trautman
 */
public class CombineTypeSelector {

    /** Minimum number of exposures in a non-infrared epoch group for a median combination. */
    public static final int MIN_EXPOSURES_FOR_MEDIAN = 7;

    /** Stacks need more than this many exposures for a median combination. */
    public static final int STACK_MEDIAN_THRESHOLD = 7;

    /**
     * @return {@link CombineType#MEDIAN} when the camera is not infrared, the run is not a
     *         single bright source run and there are at least 7 exposures;
     *         otherwise {@link CombineType#MINMED}.
     */
    public static CombineType forEpochGroup(final Camera camera,
                                            final boolean singleStar,
                                            final int exposureCount) {
        final boolean infrared = (camera != null) && camera.isInfrared();
        return ((! infrared) && (! singleStar) && (exposureCount >= MIN_EXPOSURES_FOR_MEDIAN)) ?
               CombineType.MEDIAN : CombineType.MINMED;
    }

    /**
     * @return {@link CombineType#MEDIAN} for single bright source runs or stacks
     *         of more than 7 exposures; otherwise {@link CombineType#MINMED}.
     */
    public static CombineType forStack(final boolean singleStar,
                                       final int exposureCount) {
        return (singleStar || (exposureCount > STACK_MEDIAN_THRESHOLD)) ? CombineType.MEDIAN : CombineType.MINMED;
    }

    private CombineTypeSelector() {
    }
}
