package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.external.CombineOptions;
import org.janelia.epochreg.external.CombineType;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.CombineParameters;
import org.janelia.epochreg.parameters.CosmicRayMode;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.ExposureGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the registered exposures of every visit in an epoch (FE group) onto a common grid.
 *
 * @author Eric Trautman
 */
public class RegisteredCombineStep
        implements PipelineStep {

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters) {
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        final List<ExposureGroup> groups = context.getFeGroups();
        LOG.info("runPipelineStep: combining {} epoch groups", groups.size());

        for (final ExposureGroup group : groups) {
            try {
                combineGroup(context, group);
            } catch (final MissingInputException e) {
                context.getReport().addSkippedMissingInput(PipelineStage.REGISTERED_COMBINE, group.getKey(), e);
            }
        }
    }

    private void combineGroup(final PipelineContext context,
                              final ExposureGroup group)
            throws IOException, MissingInputException {

        final ArtifactNamer namer = context.getNamer();
        final File science = namer.getRegisteredProduct(group, ArtifactKind.SCIENCE);

        if (! context.getArtifactStore().needsRun(science, context.isClobber())) {
            context.getReport().addSkippedExisting(PipelineStage.REGISTERED_COMBINE, group.getKey(), science);
            return;
        }

        context.verifyWorkingCopies(group);

        final PipelineParameters parameters = context.getParameters();
        final CombineParameters combine = parameters.combine;
        final CosmicRayMode cosmicRayMode = combine.getCosmicRayMode();
        final CombineType combineType = CombineTypeSelector.forEpochGroup(group.getCamera(),
                                                                          context.isSingleStar(),
                                                                          group.size());

        final CombineOptions options = new CombineOptions()
                .withRegisteredGrid(context.getOutputCenter(), combine.rot, combine.imSizeArcsec, combine.naxis12)
                .withPixels(combine.pixScale, combine.pixFrac)
                .withWeightType(combine.whtType)
                .withCombineType(combineType)
                .withCosmicRays(cosmicRayMode.isMultiVisitRejection() ? cosmicRayMode : CosmicRayMode.KEEP_FLAGS,
                                combine.getCosmicRaySnrList())
                .withSingleExposureProducts(parameters.isSingleExposureProducts())
                .withClobber(context.isClobber());

        final Collaborators collaborators = context.getCollaborators();
        final File workingDirectory = context.getWorkingDirectory(group);
        final List<String> imageNames = group.getFilenames();
        final String outputRoot = namer.getRegisteredOutputRoot(group.getKey());

        collaborators.getCombiner().combine(workingDirectory, imageNames, outputRoot, options);

        // two infrared frames cannot reliably separate cosmic rays from hot pixels
        if (cosmicRayMode.isMultiVisitRejection() && group.isInfraredPair()) {
            collaborators.getHotPixelCleaner().cleanHotPixels(workingDirectory, imageNames.get(0), imageNames.get(1));
            options.withCosmicRays(CosmicRayMode.KEEP_FLAGS, combine.getCosmicRaySnrList()).withClobber(true);
            collaborators.getCombiner().combine(workingDirectory, imageNames, outputRoot, options);
        }

        context.getReport().addCompleted(PipelineStage.REGISTERED_COMBINE, group.getKey(), science);
    }

    private static final Logger LOG = LoggerFactory.getLogger(RegisteredCombineStep.class);
}
