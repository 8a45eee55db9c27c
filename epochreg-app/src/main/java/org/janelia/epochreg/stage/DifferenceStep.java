package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.error.MissingArtifactException;
import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.FilterCombination;
import org.janelia.epochreg.store.ArtifactStore;
import org.janelia.epochreg.template.DifferenceImageBuilder;
import org.janelia.epochreg.template.DifferenceProducts;
import org.janelia.epochreg.template.FilterCombinationAccumulator;
import org.janelia.epochreg.template.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtracts the template epoch from every other epoch of each filter.
 * For averaging filter combinations, the masked differences of the member filters
 * are averaged into one pseudo-filter difference per epoch.
 *
 * @author Eric Trautman
 */
public class DifferenceStep
        implements PipelineStep {

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters)
            throws ConfigurationException {
        if ((pipelineParameters.difference.tempEpoch == null) || (pipelineParameters.difference.tempEpoch < 0)) {
            throw new ConfigurationException("--tempEpoch must be a non-negative epoch number");
        }
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        final PipelineParameters parameters = context.getParameters();
        final int templateEpoch = parameters.difference.tempEpoch;

        final TemplateResolver templateResolver =
                new TemplateResolver(context.getNamer(),
                                     context.getCollaborators().getTemplateScaler(),
                                     templateEpoch,
                                     parameters.difference.tempFilters,
                                     context.isClobber());

        final DifferenceImageBuilder builder =
                new DifferenceImageBuilder(context.getCollaborators().getPixelArithmetic(),
                                           context.getArtifactStore(),
                                           context.isClobber(),
                                           parameters.getCleanLevel() > 0);

        final FilterCombinationAccumulator accumulator =
                new FilterCombinationAccumulator(context.getFilterCombination());

        LOG.info("runPipelineStep: subtracting template epoch {} from epochs {} for filters {}",
                 templateEpoch, context.getSelectedEpochs(), context.getSelectedFilters());

        for (final Integer epoch : context.getSelectedEpochs()) {

            if (epoch == templateEpoch) {
                continue;
            }

            for (final String filter : context.getSelectedFilters()) {
                final List<Exposure> exposures = context.getSelectedExposures(filter, epoch);
                if (! exposures.isEmpty()) {
                    differenceEpoch(context, templateResolver, builder, accumulator, exposures);
                }
            }

            if (context.getFilterCombination().isAverage()) {
                averageFilters(context, accumulator, epoch, templateEpoch);
            }
        }
    }

    private void differenceEpoch(final PipelineContext context,
                                 final TemplateResolver templateResolver,
                                 final DifferenceImageBuilder builder,
                                 final FilterCombinationAccumulator accumulator,
                                 final List<Exposure> exposures)
            throws IOException {

        final ArtifactNamer namer = context.getNamer();
        final Exposure first = exposures.get(0);
        final String filter = first.getFilter();
        final int epoch = first.getEpoch();
        final int templateEpoch = templateResolver.getTemplateEpoch();
        final String drzSuffix = first.getDrzSuffix();
        final String unitKey = first.getFeGroup() + "-" + Exposure.formatEpoch(templateEpoch);

        final File templateScience;
        try {
            final File science = namer.getRegisteredProduct(filter, epoch, drzSuffix, ArtifactKind.SCIENCE);
            if (! science.exists()) {
                throw new MissingArtifactException(science, "--doDriz2");
            }

            templateScience = templateResolver.resolve(filter, drzSuffix, first.getCamera());

            final DifferenceProducts products =
                    buildIfNeeded(context, builder, unitKey, science, templateScience,
                                  namer.getDifferenceProduct(filter, epoch, templateEpoch, ArtifactKind.SCIENCE, false),
                                  namer.getDifferenceProduct(filter, epoch, templateEpoch, ArtifactKind.SCIENCE, true));

            accumulator.add(epoch, filter, products.getMaskedScience(), products.getWeight());

        } catch (final MissingInputException e) {
            context.getReport().addSkippedMissingInput(PipelineStage.DIFFERENCE, unitKey, e);
            return;
        }

        if (context.getParameters().difference.singleSubs) {
            for (final Exposure exposure : exposures) {
                final String singleUnitKey = unitKey + "_" + exposure.getRootname();
                try {
                    buildIfNeeded(context, builder, singleUnitKey,
                                  namer.getSingleExposureProduct(exposure, ArtifactKind.SCIENCE),
                                  templateScience,
                                  namer.getSingleDifferenceProduct(exposure, templateEpoch, ArtifactKind.SCIENCE, false),
                                  namer.getSingleDifferenceProduct(exposure, templateEpoch, ArtifactKind.SCIENCE, true));
                } catch (final MissingInputException e) {
                    context.getReport().addSkippedMissingInput(PipelineStage.DIFFERENCE, singleUnitKey, e);
                }
            }
        }
    }

    private DifferenceProducts buildIfNeeded(final PipelineContext context,
                                             final DifferenceImageBuilder builder,
                                             final String unitKey,
                                             final File science,
                                             final File templateScience,
                                             final File unmaskedOutput,
                                             final File maskedOutput)
            throws IOException, MissingInputException {

        final ArtifactStore store = context.getArtifactStore();
        final DifferenceProducts products;

        if (store.needsRun(maskedOutput, context.isClobber())) {
            if (context.isClobber()) {
                store.invalidate(unmaskedOutput);
            }
            products = builder.build(science, templateScience, unmaskedOutput, maskedOutput);
            context.getReport().addCompleted(PipelineStage.DIFFERENCE, unitKey, products.getMaskedScience());
        } else {
            products = new DifferenceProducts(maskedOutput, store.pathFor(unmaskedOutput, ArtifactKind.WEIGHT));
            context.getReport().addSkippedExisting(PipelineStage.DIFFERENCE, unitKey, maskedOutput);
        }

        return products;
    }

    private void averageFilters(final PipelineContext context,
                                final FilterCombinationAccumulator accumulator,
                                final int epoch,
                                final int templateEpoch)
            throws IOException {

        final FilterCombination combination = context.getFilterCombination();
        final List<FilterCombinationAccumulator.FilterDifference> differences = accumulator.consume(epoch);

        if (differences.isEmpty()) {
            LOG.info("averageFilters: no suitable difference images for combination in epoch {}", epoch);
            return;
        }

        final ArtifactNamer namer = context.getNamer();
        final ArtifactStore store = context.getArtifactStore();
        final String name = combination.getName();
        final String unitKey = name + "_" + Exposure.formatEpoch(epoch) + "-" + Exposure.formatEpoch(templateEpoch);
        final File output = namer.getDifferenceProduct(name, epoch, templateEpoch, ArtifactKind.SCIENCE, true);
        final File outputWeight = store.pathFor(
                namer.getDifferenceProduct(name, epoch, templateEpoch, ArtifactKind.SCIENCE, false),
                ArtifactKind.WEIGHT);

        if (! store.needsRun(output, context.isClobber())) {
            context.getReport().addSkippedExisting(PipelineStage.DIFFERENCE, unitKey, output);
            return;
        }

        final List<File> scienceList = new ArrayList<>();
        final List<File> weightList = new ArrayList<>();
        final List<String> filters = new ArrayList<>();
        for (final FilterCombinationAccumulator.FilterDifference difference : differences) {
            scienceList.add(difference.getScience());
            weightList.add(difference.getWeight());
            filters.add(difference.getFilter());
        }

        context.getCollaborators().getPixelArithmetic().weightedAverage(scienceList,
                                                                        weightList,
                                                                        output,
                                                                        outputWeight,
                                                                        context.isClobber());

        LOG.info("averageFilters: created composite difference image {} from filters {} in epoch {}",
                 output.getName(), filters, epoch);

        context.getReport().addCompleted(PipelineStage.DIFFERENCE, unitKey, output);
    }

    private static final Logger LOG = LoggerFactory.getLogger(DifferenceStep.class);
}
