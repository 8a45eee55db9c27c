package org.janelia.epochreg.reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.epochreg.spec.Exposure;

/**
 * The (epoch, filter, visit) triple chosen for the reference image along with its exposures.
 *
 * @author Eric Trautman
 */
public class ReferenceSelection {

    private final int epoch;
    private final String filter;
    private final String visit;
    private final List<Exposure> exposures;

    public ReferenceSelection(final int epoch,
                              final String filter,
                              final String visit,
                              final List<Exposure> exposures) {
        this.epoch = epoch;
        this.filter = filter;
        this.visit = visit;
        this.exposures = new ArrayList<>(exposures);
    }

    public int getEpoch() {
        return epoch;
    }

    public String getFilter() {
        return filter;
    }

    public String getVisit() {
        return visit;
    }

    public List<Exposure> getExposures() {
        return Collections.unmodifiableList(exposures);
    }

    @Override
    public String toString() {
        return "epoch " + epoch + ", filter " + filter + ", visit " + visit + " (" + exposures.size() + " exposures)";
    }
}
