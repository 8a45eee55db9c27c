package org.janelia.epochreg.template;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.epochreg.spec.FilterCombination;

/**
 * Collects the difference images of an averaging filter combination for each epoch
 * until all of an epoch's filters have been differenced.
 *
 * @author Eric Trautman
 */
public class FilterCombinationAccumulator {

    /** Difference image and weight map for one filter. */
    public static class FilterDifference {

        private final String filter;
        private final File science;
        private final File weight;

        public FilterDifference(final String filter,
                                final File science,
                                final File weight) {
            this.filter = filter;
            this.science = science;
            this.weight = weight;
        }

        public String getFilter() {
            return filter;
        }

        public File getScience() {
            return science;
        }

        public File getWeight() {
            return weight;
        }
    }

    private final FilterCombination filterCombination;
    private final Map<Integer, Map<String, FilterDifference>> epochToDifferences;

    public FilterCombinationAccumulator(final FilterCombination filterCombination) {
        this.filterCombination = filterCombination;
        this.epochToDifferences = new HashMap<>();
    }

    /**
     * @return true if the filter's difference images should be accumulated.
     */
    public boolean accepts(final String filter) {
        return filterCombination.isAverage() && filterCombination.includes(filter);
    }

    /**
     * Records a filter's difference image for an epoch, replacing any previous one for the same filter.
     *
     * @return true if the difference was recorded (false if the filter is not part of the combination).
     */
    public boolean add(final int epoch,
                       final String filter,
                       final File science,
                       final File weight) {
        final boolean accepted = accepts(filter);
        if (accepted) {
            epochToDifferences.computeIfAbsent(epoch, e -> new LinkedHashMap<>())
                    .put(filter, new FilterDifference(filter, science, weight));
        }
        return accepted;
    }

    /**
     * Removes and returns the differences accumulated for an epoch, ordered by the combination's filter list.
     * A second call for the same epoch returns an empty list.
     */
    public List<FilterDifference> consume(final int epoch) {
        final Map<String, FilterDifference> filterToDifference = epochToDifferences.remove(epoch);
        if (filterToDifference == null) {
            return Collections.emptyList();
        }
        final List<FilterDifference> differences = new ArrayList<>();
        for (final String filter : filterCombination.getFilterList()) {
            final FilterDifference difference = filterToDifference.get(filter);
            if (difference != null) {
                differences.add(difference);
            }
        }
        return differences;
    }

    public boolean isEmpty() {
        return epochToDifferences.isEmpty();
    }

}
