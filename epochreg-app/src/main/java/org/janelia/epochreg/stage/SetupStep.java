package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.Collections;

import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies pristine exposures into their epoch working directories.
 *
 * @author Eric Trautman
 */
public class SetupStep
        implements PipelineStep {

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters) {
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        LOG.info("runPipelineStep: copying {} exposures into epoch directories",
                 context.getSelectedExposures().size());

        final RunReport report = context.getReport();

        for (final Exposure exposure : context.getSelectedExposures()) {
            final File source = exposure.getFile();
            final File epochDirectory = context.getNamer().getEpochDirectory(exposure.getEpoch());
            final File workingCopy = context.getNamer().getWorkingCopy(exposure);
            try {
                if (! source.exists()) {
                    throw new MissingInputException("missing pristine exposure " + source,
                                                    Collections.singletonList(source));
                }
                if (FileUtil.copyToDirectory(source, epochDirectory, context.isClobber())) {
                    report.addCompleted(PipelineStage.SETUP, exposure.getFilename(), workingCopy);
                } else {
                    report.addSkippedExisting(PipelineStage.SETUP, exposure.getFilename(), workingCopy);
                }
            } catch (final MissingInputException e) {
                report.addSkippedMissingInput(PipelineStage.SETUP, exposure.getFilename(), e);
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SetupStep.class);
}
