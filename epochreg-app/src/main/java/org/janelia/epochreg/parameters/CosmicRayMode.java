package org.janelia.epochreg.parameters;

/**
 * Cosmic ray rejection policy for combinations.
 *
 * @author Eric Trautman
 */
public enum CosmicRayMode {

    /** Remove existing flags and do not add any more. */
    REMOVE_FLAGS(-1),

    /** Keep existing flags without running any new rejection. */
    KEEP_FLAGS(0),

    /** Remove existing flags and run rejection within each visit. */
    WITHIN_VISIT(1),

    /** Also rerun rejection for multi-visit combinations and stacks. */
    MULTI_VISIT(2);

    private final int level;

    CosmicRayMode(final int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isRejectionEnabled() {
        return level > 0;
    }

    public boolean isMultiVisitRejection() {
        return level > 1;
    }

    public static CosmicRayMode fromLevel(final int level)
            throws IllegalArgumentException {
        for (final CosmicRayMode mode : values()) {
            if (mode.level == level) {
                return mode;
            }
        }
        throw new IllegalArgumentException("cosmic ray mode must be -1, 0, 1, or 2 but was " + level);
    }
}
