package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

import org.janelia.epochreg.catalog.HeaderReader;
import org.janelia.epochreg.error.CollaboratorFailureException;
import org.janelia.epochreg.error.MissingArtifactException;
import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.error.MissingReferenceException;
import org.janelia.epochreg.external.BackPropagator;
import org.janelia.epochreg.external.RegistrationRequest;
import org.janelia.epochreg.external.WcsPropagationResult;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.ExposureGroup;
import org.janelia.epochreg.spec.ReferenceFrame;
import org.janelia.epochreg.spec.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers each visit combination to the reference (or to a single bright source position)
 * and propagates the fitted WCS solution back to the visit's exposures.
 *
 * @author Eric Trautman
 */
public class RegisterStep
        implements PipelineStep {

    public static final String WCS_NAME_KEYWORD = "WCSNAME";

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters) {
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        final String targetWcsName;
        if (context.isSingleStar()) {
            targetWcsName = getSingleStarWcsName(context.getParameters().selection.getTargetPosition());
        } else {
            final ReferenceFrame referenceFrame = context.getReferenceFrame();
            if (! referenceFrame.exists()) {
                throw new MissingReferenceException(referenceFrame.getImageFile());
            }
            targetWcsName = getReferenceWcsName(referenceFrame);
        }

        final List<ExposureGroup> groups = context.getFevGroups();
        LOG.info("runPipelineStep: registering {} visit groups to {}", groups.size(), targetWcsName);

        for (final ExposureGroup group : groups) {
            try {
                registerGroup(context, group, targetWcsName);
            } catch (final MissingInputException e) {
                context.getReport().addSkippedMissingInput(PipelineStage.REGISTER, group.getKey(), e);
            }
        }
    }

    private void registerGroup(final PipelineContext context,
                               final ExposureGroup group,
                               final String targetWcsName)
            throws MissingInputException {

        final File combinedImage = context.getNamer().getNativeProduct(group, ArtifactKind.SCIENCE);
        if (! combinedImage.exists()) {
            throw new MissingArtifactException(combinedImage, "--doDriz1");
        }

        final String originalWcsName = getWcsName(context.getHeaderReader(), combinedImage);

        if (targetWcsName.equals(originalWcsName) && (! context.isClobber())) {
            LOG.info("registerGroup: {} is already registered to {}, not clobbering",
                     combinedImage.getName(), targetWcsName);
            context.getReport().addSkippedExisting(PipelineStage.REGISTER, group.getKey(), combinedImage);
            return;
        }

        context.verifyWorkingCopies(group);

        final File workingDirectory = context.getWorkingDirectory(group);
        final ReferenceFrame referenceFrame = context.getReferenceFrame();
        final SkyPosition singleSourcePosition =
                context.isSingleStar() ? context.getParameters().selection.getTargetPosition() : null;

        final RegistrationRequest request =
                new RegistrationRequest(workingDirectory,
                                        Collections.singletonList(combinedImage.getName()),
                                        context.isSingleStar() ? null : referenceFrame.getImageFile(),
                                        context.isSingleStar() ? null : referenceFrame.getCatalogFile(),
                                        singleSourcePosition,
                                        targetWcsName,
                                        context.getParameters().registration,
                                        context.isClobber());

        final String solutionWcsName = context.getCollaborators().getRegistrar().align(request);

        propagate(context.getCollaborators().getBackPropagator(),
                  workingDirectory,
                  combinedImage.getName(),
                  group.getFilenames(),
                  originalWcsName,
                  solutionWcsName,
                  context.isClobber());

        context.getReport().addCompleted(PipelineStage.REGISTER, group.getKey(), combinedImage);
    }

    /**
     * Propagates the solution, retrying once under an alternate name when the requested name collides.
     *
     * @throws CollaboratorFailureException
     *   if the solution cannot be propagated.
     */
    static WcsPropagationResult propagate(final BackPropagator backPropagator,
                                          final File workingDirectory,
                                          final String combinedImageName,
                                          final List<String> exposureNames,
                                          final String originalWcsName,
                                          final String solutionWcsName,
                                          final boolean force)
            throws CollaboratorFailureException {

        WcsPropagationResult result = backPropagator.propagate(workingDirectory, combinedImageName, exposureNames,
                                                               originalWcsName, solutionWcsName, solutionWcsName,
                                                               force);

        if (WcsPropagationResult.Status.WCS_NAME_COLLISION.equals(result.getStatus()) &&
            (result.getAlternateWcsName() != null)) {
            LOG.warn("propagate: {} for {}, retrying with {}",
                     result, combinedImageName, result.getAlternateWcsName());
            result = backPropagator.propagate(workingDirectory, combinedImageName, exposureNames,
                                              originalWcsName, solutionWcsName, result.getAlternateWcsName(),
                                              force);
        }

        if (! result.isPropagated()) {
            throw new CollaboratorFailureException("failed to propagate " + solutionWcsName + " from " +
                                                   combinedImageName + " to " + exposureNames + ", " + result);
        }

        return result;
    }

    public static String getReferenceWcsName(final ReferenceFrame referenceFrame) {
        return "REFIM:" + referenceFrame.getImageFile().getName();
    }

    public static String getSingleStarWcsName(final SkyPosition position) {
        return String.format("SINGLESTAR:%.6f,%.6f", position.getRa(), position.getDec());
    }

    private static String getWcsName(final HeaderReader headerReader,
                                     final File image) {
        final String wcsName = headerReader.getStringValue(image, WCS_NAME_KEYWORD);
        return wcsName == null ? "" : wcsName.trim();
    }

    private static final Logger LOG = LoggerFactory.getLogger(RegisterStep.class);
}
