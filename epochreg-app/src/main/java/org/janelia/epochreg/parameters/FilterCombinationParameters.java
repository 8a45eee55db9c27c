package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.spec.FilterCombination;

/**
 * Parameters for combining several filters into one pseudo-filter.
 *
 * @author Eric Trautman
 */
public class FilterCombinationParameters
        implements Serializable {

    @Parameter(
            names = "--combineFilterList",
            description = "Filters to combine (comma separated list, e.g. F125W,F160W)")
    public List<String> combineFilterList = new ArrayList<>();

    @Parameter(
            names = "--combineFilterMethod",
            description = "Combination method: 'avg' averages difference images, " +
                          "'driz' drizzles exposures of all listed filters together")
    public String combineFilterMethod;

    @Parameter(
            names = "--combineFilterName",
            description = "Pseudo-filter name for the combination (e.g. JH)")
    public String combineFilterName;

    public boolean isDefined() {
        return (combineFilterList != null) && (! combineFilterList.isEmpty());
    }

    /**
     * @return combination policy for these parameters ({@link FilterCombination#NONE} if none is defined).
     *
     * @throws ConfigurationException
     *   if a filter list is specified without a valid method and name.
     */
    public FilterCombination toFilterCombination()
            throws ConfigurationException {

        if (! isDefined()) {
            return FilterCombination.NONE;
        }

        if ((combineFilterName == null) || (combineFilterMethod == null)) {
            throw new ConfigurationException(
                    "when specifying filters to combine (--combineFilterList) you must also specify a name " +
                    "(--combineFilterName) and method (--combineFilterMethod), e.g. " +
                    "--combineFilterList F125W,F160W --combineFilterName JH --combineFilterMethod avg");
        }

        final FilterCombination.Method method;
        try {
            method = FilterCombination.Method.valueOf(combineFilterMethod.trim().toUpperCase());
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException("--combineFilterMethod must be 'avg' or 'driz' but was '" +
                                             combineFilterMethod + "'");
        }

        return new FilterCombination(method, combineFilterName, combineFilterList);
    }

}
