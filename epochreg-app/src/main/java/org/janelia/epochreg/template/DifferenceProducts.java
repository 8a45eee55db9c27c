package org.janelia.epochreg.template;

import java.io.File;

/**
 * Artifacts of one template subtraction.
 *
 * @author Eric Trautman
 */
public class DifferenceProducts {

    private final File maskedScience;
    private final File weight;

    public DifferenceProducts(final File maskedScience,
                              final File weight) {
        this.maskedScience = maskedScience;
        this.weight = weight;
    }

    /**
     * @return canonical difference image.
     */
    public File getMaskedScience() {
        return maskedScience;
    }

    public File getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return maskedScience.getName();
    }
}
