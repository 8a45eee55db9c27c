package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.SkyPosition;

/**
 * Parameters that restrict which exposures are processed.
 *
 * @author Eric Trautman
 */
public class SelectionParameters
        implements Serializable {

    @Parameter(
            names = "--filters",
            description = "Process only these filters (comma separated list, e.g. F125W,F160W)")
    public List<String> filters = new ArrayList<>();

    @Parameter(
            names = "--epochs",
            description = "Process only these epochs (comma separated list)")
    public List<Integer> epochs = new ArrayList<>();

    @Parameter(
            names = "--ra",
            description = "Target right ascension in decimal degrees, also used as center of registered images")
    public Double ra;

    @Parameter(
            names = "--dec",
            description = "Target declination in decimal degrees, also used as center of registered images")
    public Double dec;

    @Parameter(
            names = "--targetMatchRadius",
            description = "Maximum separation (arcseconds) between an exposure's target and --ra/--dec " +
                          "for the exposure to be considered on target (default is the camera field radius)")
    public Double targetMatchRadius;

    public boolean hasTargetPosition() {
        return (ra != null) && (dec != null);
    }

    /**
     * @return target position or null if none was specified.
     */
    public SkyPosition getTargetPosition() {
        return hasTargetPosition() ? new SkyPosition(ra, dec) : null;
    }

    public boolean isFilterSelected(final String filter) {
        return filters.isEmpty() || filters.contains(filter);
    }

    public boolean isEpochSelected(final int epoch) {
        return epochs.isEmpty() || epochs.contains(epoch);
    }

    /**
     * @return true if the exposure can be processed and matches the filter and epoch restrictions.
     */
    public boolean isSelected(final Exposure exposure) {
        return exposure.isProcessable() &&
               isFilterSelected(exposure.getFilter()) &&
               isEpochSelected(exposure.getEpoch());
    }

    void normalizeFilters() {
        final List<String> normalizedFilters = new ArrayList<>(filters.size());
        for (final String filter : filters) {
            final String normalizedFilter = Exposure.normalizeFilter(filter);
            if (! normalizedFilters.contains(normalizedFilter)) {
                normalizedFilters.add(normalizedFilter);
            }
        }
        filters = normalizedFilters;
    }

}
