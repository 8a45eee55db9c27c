package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.ReferenceFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the enabled stages of a pipeline in stage order.
 * Every step validates the run parameters before any step runs.
 *
 * @author Eric Trautman
 */
public class StageScheduler {

    private final List<PipelineStage> stages;

    public StageScheduler(final List<PipelineStage> stages) {
        this.stages = new ArrayList<>(stages);
        this.stages.sort(null);
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    /**
     * @throws ConfigurationException
     *   if any enabled step rejects the run parameters.
     *
     * @throws IOException
     *   if any step fails.
     */
    public RunReport run(final PipelineContext context)
            throws ConfigurationException, IOException {

        LOG.info("run: entry, stages={}", stages);

        final PipelineParameters parameters = context.getParameters();

        final List<PipelineStep> steps = new ArrayList<>(stages.size());
        for (final PipelineStage stage : stages) {
            final PipelineStep step = stage.toStep();
            step.validatePipelineParameters(parameters);
            steps.add(step);
        }

        for (int i = 0; i < steps.size(); i++) {
            final PipelineStage stage = stages.get(i);

            if ((stage == PipelineStage.NATIVE_COMBINE) || (stage == PipelineStage.REGISTER)) {
                prepareReferenceCatalog(context);
            }

            LOG.info("run: starting stage {}", stage);
            steps.get(i).runPipelineStep(context);
        }

        LOG.info("run: exit");

        return context.getReport();
    }

    /**
     * Derives a source catalog from the reference image when bright reference sources were requested
     * without an explicit catalog.
     */
    void prepareReferenceCatalog(final PipelineContext context) {

        final PipelineParameters parameters = context.getParameters();
        final ReferenceFrame referenceFrame = context.getReferenceFrame();

        if ((parameters.registration.refNBright != null) &&
            (! referenceFrame.hasCatalog()) &&
            (! context.isSingleStar()) &&
            referenceFrame.exists()) {

            final File referenceImage = referenceFrame.getImageFile();
            final File catalog = context.getCollaborators().getRegistrar().makeSourceCatalog(
                    referenceImage.getParentFile(),
                    referenceImage.getName(),
                    parameters.registration);

            LOG.info("prepareReferenceCatalog: using {} brightest sources from {}",
                     parameters.registration.refNBright, catalog);

            context.setReferenceFrame(referenceFrame.withCatalog(catalog));
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StageScheduler.class);
}
