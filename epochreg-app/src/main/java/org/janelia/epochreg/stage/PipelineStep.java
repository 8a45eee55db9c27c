package org.janelia.epochreg.stage;

import java.io.IOException;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.parameters.PipelineParameters;

/**
 * Anything that can be run as a stage of the registration pipeline.
 *
 * @author Eric Trautman
 */
public interface PipelineStep {

    /**
     * Validates the specified pipeline parameters are sufficient for this step.
     * This method quietly completes (doing nothing) if the parameters are valid
     * but will throw an exception it finds a problem.
     *
     * @param  pipelineParameters  parameters to validate.
     *                             Parameters are simply read and should not be mutated during validation.
     *
     * @throws ConfigurationException
     *   if any of the parameters are invalid or missing.
     */
    void validatePipelineParameters(final PipelineParameters pipelineParameters)
            throws ConfigurationException;

    /**
     * Runs the step for every unit of work selected by the context.
     * Units with missing inputs are recorded in the context's report and skipped.
     *
     * @param  context  state for the run.
     *
     * @throws IOException
     *   if the run fails.
     */
    void runPipelineStep(final PipelineContext context)
            throws IOException;

}
