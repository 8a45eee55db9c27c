package org.janelia.epochreg.external;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Artifacts written by a {@link Combiner#combine} call.
 *
 * @author Eric Trautman
 */
public class CombineProducts {

    private final File science;
    private final File weight;
    private final File context;
    private final File badPixelMask;
    private final List<File> singleScienceList;

    public CombineProducts(final File science,
                           final File weight,
                           final File context,
                           final File badPixelMask,
                           final List<File> singleScienceList) {
        this.science = science;
        this.weight = weight;
        this.context = context;
        this.badPixelMask = badPixelMask;
        this.singleScienceList = singleScienceList == null ? new ArrayList<>() : new ArrayList<>(singleScienceList);
    }

    public File getScience() {
        return science;
    }

    public File getWeight() {
        return weight;
    }

    /**
     * @return context image or null if none was produced.
     */
    public File getContext() {
        return context;
    }

    /**
     * @return bad pixel mask or null if none was produced.
     */
    public File getBadPixelMask() {
        return badPixelMask;
    }

    public List<File> getSingleScienceList() {
        return Collections.unmodifiableList(singleScienceList);
    }

    @Override
    public String toString() {
        return String.valueOf(science);
    }
}
