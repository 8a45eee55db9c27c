package org.janelia.epochreg.external;

/**
 * Pixel combination statistic used when building median images for cosmic ray rejection.
 *
 * @author Eric Trautman
 */
public enum CombineType {

    /** Rejection tolerant minimum/median combination that does not bias faint source flux. */
    MINMED("iminmed"),

    /** Flux preserving median combination. */
    MEDIAN("imedian");

    private final String toolName;

    CombineType(final String toolName) {
        this.toolName = toolName;
    }

    /**
     * @return name used by the drizzle engine for this combination type.
     */
    public String getToolName() {
        return toolName;
    }
}
