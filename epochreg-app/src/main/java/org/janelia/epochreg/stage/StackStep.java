package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.error.MissingArtifactException;
import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.external.CombineOptions;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.CombineParameters;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.parameters.StackParameters;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines registered exposures from several epochs into one stack per filter
 * and subtracts the template from each stack.
 *
 * @author Eric Trautman
 */
public class StackStep
        implements PipelineStep {

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters)
            throws ConfigurationException {
        final Double pixFrac = pipelineParameters.stack.stackPixFrac;
        if ((pixFrac != null) && ((pixFrac <= 0) || (pixFrac > 1))) {
            throw new ConfigurationException("--stackPixFrac must be greater than 0 and no more than 1");
        }
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        final PipelineParameters parameters = context.getParameters();
        final StackParameters stack = parameters.stack;
        final int templateEpoch = parameters.difference.tempEpoch;

        final List<Integer> stackEpochs = stack.stackEpochs.isEmpty() ? parameters.selection.epochs : stack.stackEpochs;
        final boolean includeTemplate = stack.stackTemplate || stackEpochs.contains(templateEpoch);

        final File stackDirectory = context.getNamer().getStackDirectory();
        FileUtil.ensureWritableDirectory(stackDirectory);

        LOG.info("runPipelineStep: stacking epochs {} (template included: {})",
                 stackEpochs.isEmpty() ? "ALL" : stackEpochs, includeTemplate);

        for (final String filter : context.getSelectedFilters()) {

            final List<Exposure> exposures = new ArrayList<>();
            for (final Exposure exposure : context.getSelectedExposures()) {
                final int epoch = exposure.getEpoch();
                if (filter.equals(exposure.getFilter()) &&
                    (stackEpochs.isEmpty() || stackEpochs.contains(epoch)) &&
                    ((epoch != templateEpoch) || includeTemplate)) {
                    exposures.add(exposure);
                }
            }

            final String unitKey = filter + "_stack";
            try {
                if (exposures.isEmpty()) {
                    throw new MissingInputException(
                            "no non-template images available for filter " + filter +
                            ", use --stackTemplate to include template images or specify epochs with --stackEpochs");
                }
                stackFilter(context, filter, exposures, stackDirectory, unitKey, templateEpoch);
            } catch (final MissingInputException e) {
                context.getReport().addSkippedMissingInput(PipelineStage.STACK, unitKey, e);
            }
        }
    }

    private void stackFilter(final PipelineContext context,
                             final String filter,
                             final List<Exposure> exposures,
                             final File stackDirectory,
                             final String unitKey,
                             final int templateEpoch)
            throws IOException, MissingInputException {

        final ArtifactNamer namer = context.getNamer();
        final List<String> imageNames = new ArrayList<>();
        for (final Exposure exposure : exposures) {
            final File workingCopy = namer.getWorkingCopy(exposure);
            if (! workingCopy.exists()) {
                throw new MissingArtifactException(workingCopy, "--doSetup");
            }
            FileUtil.copyToDirectory(workingCopy, stackDirectory, false);
            imageNames.add(exposure.getFilename());
        }

        final String drzSuffix = exposures.get(0).getDrzSuffix();
        final File science = namer.getStackProduct(filter, drzSuffix, ArtifactKind.SCIENCE);

        if (! context.getArtifactStore().needsRun(science, context.isClobber())) {
            context.getReport().addSkippedExisting(PipelineStage.STACK, unitKey, science);
            return;
        }

        final PipelineParameters parameters = context.getParameters();
        final CombineParameters combine = parameters.combine;
        final StackParameters stack = parameters.stack;

        final CombineOptions options = new CombineOptions()
                .withRegisteredGrid(context.getOutputCenter(), combine.rot, combine.imSizeArcsec, combine.naxis12)
                .withPixels(stack.stackPixScale == null ? combine.pixScale : stack.stackPixScale,
                            stack.stackPixFrac == null ? combine.pixFrac : stack.stackPixFrac)
                .withWeightType(combine.whtType)
                .withCombineType(CombineTypeSelector.forStack(context.isSingleStar(), imageNames.size()))
                .withCosmicRays(combine.getCosmicRayMode(), combine.getCosmicRaySnrList())
                .withClobber(context.isClobber());

        context.getCollaborators().getCombiner().combine(stackDirectory,
                                                         imageNames,
                                                         namer.getStackOutputRoot(filter),
                                                         options);

        context.getReport().addCompleted(PipelineStage.STACK, unitKey, science);

        final File templateScience = namer.getRegisteredProduct(filter, templateEpoch, drzSuffix, ArtifactKind.SCIENCE);
        if (templateScience.exists()) {
            final File difference = namer.getStackDifferenceProduct(filter, templateEpoch);
            LOG.info("stackFilter: making difference image {} from the stack", difference.getName());
            context.getCollaborators().getPixelArithmetic().subtract(templateScience,
                                                                     science,
                                                                     difference,
                                                                     context.isClobber());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StackStep.class);
}
