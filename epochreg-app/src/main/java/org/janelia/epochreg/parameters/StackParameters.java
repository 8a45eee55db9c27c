package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for multi-epoch stacks.
 *
 * @author Eric Trautman
 */
public class StackParameters
        implements Serializable {

    @Parameter(
            names = "--stackEpochs",
            description = "Epochs to stack (default is --epochs or all epochs)")
    public List<Integer> stackEpochs = new ArrayList<>();

    @Parameter(
            names = "--stackTemplate",
            description = "Include the template epoch in stacks",
            arity = 0)
    public boolean stackTemplate = false;

    @Parameter(
            names = "--stackPixScale",
            description = "Pixel scale (arcseconds) for stacks (default is --pixScale)")
    public Double stackPixScale;

    @Parameter(
            names = "--stackPixFrac",
            description = "Drizzle pixel fraction for stacks (default is --pixFrac)")
    public Double stackPixFrac;

}
