package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for template subtraction.
 *
 * @author Eric Trautman
 */
public class DifferenceParameters
        implements Serializable {

    @Parameter(
            names = "--tempEpoch",
            description = "Template epoch")
    public Integer tempEpoch = 0;

    @Parameter(
            names = "--tempFilters",
            description = "Build a composite template for the (single) processed filter " +
                          "by scaling template epoch images in these filters (at most two, e.g. F125W,F160W)")
    public List<String> tempFilters = new ArrayList<>();

    @Parameter(
            names = "--singleSubs",
            description = "Also produce difference images for registered single exposure images " +
                          "(implies --singleSci)",
            arity = 0)
    public boolean singleSubs = false;

    public boolean hasTemplateFilters() {
        return (tempFilters != null) && (! tempFilters.isEmpty());
    }

}
