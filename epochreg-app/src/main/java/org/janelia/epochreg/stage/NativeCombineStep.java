package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.external.CombineOptions;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.external.RegistrationRequest;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.CosmicRayMode;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.ExposureGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the exposures of each visit (FEV group) in their native orientation,
 * optionally aligning them to each other first.
 *
 * @author Eric Trautman
 */
public class NativeCombineStep
        implements PipelineStep {

    public static final String INTRAVISIT_WCS_NAME = "INTRAVIS";

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters) {
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        final List<ExposureGroup> groups = context.getFevGroups();
        LOG.info("runPipelineStep: combining {} visit groups", groups.size());

        for (final ExposureGroup group : groups) {
            try {
                combineGroup(context, group);
            } catch (final MissingInputException e) {
                context.getReport().addSkippedMissingInput(PipelineStage.NATIVE_COMBINE, group.getKey(), e);
            }
        }
    }

    private void combineGroup(final PipelineContext context,
                              final ExposureGroup group)
            throws IOException, MissingInputException {

        final ArtifactNamer namer = context.getNamer();
        final PipelineParameters parameters = context.getParameters();
        final Collaborators collaborators = context.getCollaborators();
        final File science = namer.getNativeProduct(group, ArtifactKind.SCIENCE);

        if (! context.getArtifactStore().needsRun(science, context.isClobber())) {
            context.getReport().addSkippedExisting(PipelineStage.NATIVE_COMBINE, group.getKey(), science);
            return;
        }

        context.verifyWorkingCopies(group);

        final File workingDirectory = context.getWorkingDirectory(group);
        final List<String> imageNames = group.getFilenames();
        final boolean intravisit = parameters.registration.intravisitReg;

        if (intravisit) {
            final RegistrationRequest request = new RegistrationRequest(workingDirectory,
                                                                        imageNames,
                                                                        null,
                                                                        context.getReferenceFrame().getCatalogFile(),
                                                                        null,
                                                                        INTRAVISIT_WCS_NAME,
                                                                        parameters.registration,
                                                                        context.isClobber());
            collaborators.getRegistrar().align(request);
        }

        final CosmicRayMode cosmicRayMode = parameters.combine.getCosmicRayMode();
        final CombineOptions options = new CombineOptions()
                .withCosmicRays(cosmicRayMode, parameters.combine.getCosmicRaySnrList())
                .withWcsKey(intravisit ? INTRAVISIT_WCS_NAME : null)
                .withClobber(context.isClobber());

        collaborators.getCombiner().combine(workingDirectory,
                                            imageNames,
                                            namer.getNativeOutputRoot(group.getKey()),
                                            options);

        if (cosmicRayMode.isRejectionEnabled() && group.isInfraredPair()) {
            collaborators.getHotPixelCleaner().cleanHotPixels(workingDirectory, imageNames.get(0), imageNames.get(1));
        }

        context.getReport().addCompleted(PipelineStage.NATIVE_COMBINE, group.getKey(), science);
    }

    private static final Logger LOG = LoggerFactory.getLogger(NativeCombineStep.class);
}
