package org.janelia.epochreg.stage;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.epochreg.external.CombineOptions;
import org.janelia.epochreg.external.CombineProducts;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.external.RegistrationRequest;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.parameters.ReferenceParameters;
import org.janelia.epochreg.reference.ReferenceFrameSelector;
import org.janelia.epochreg.reference.ReferenceSelection;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.ReferenceFrame;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the image that defines the common WCS for a run.
 *
 * An existing reference image is kept unless clobbering with an explicit epoch, filter or visit.
 * Single bright source runs register each image on the source position instead, so they need no reference.
 *
 * @author Eric Trautman
 */
public class BuildReferenceStep
        implements PipelineStep {

    public static final String UNIT_KEY = "reference";

    @Override
    public void validatePipelineParameters(final PipelineParameters pipelineParameters) {
    }

    @Override
    public void runPipelineStep(final PipelineContext context)
            throws IOException {

        if (context.isSingleStar()) {
            LOG.info("runPipelineStep: single bright source runs do not need a reference image");
            return;
        }

        final ReferenceParameters referenceParameters = context.getParameters().reference;
        final ReferenceFrame defaultFrame = context.getReferenceFrame();
        final File referenceImage = defaultFrame.getImageFile();

        if (referenceParameters.refImage != null) {
            LOG.info("runPipelineStep: using specified reference image {}", referenceImage);
            context.getReport().addSkippedExisting(PipelineStage.BUILD_REFERENCE, UNIT_KEY, referenceImage);
            return;
        }
        final boolean rebuild = context.isClobber() && referenceParameters.hasSelectionOverride();

        if (! context.getArtifactStore().needsRun(referenceImage, rebuild)) {
            if (context.isClobber()) {
                LOG.info("runPipelineStep: to rebuild the reference image, " +
                         "specify at least one of --refFilter, --refEpoch, or --refVisit");
            }
            context.getReport().addSkippedExisting(PipelineStage.BUILD_REFERENCE, UNIT_KEY, referenceImage);
            return;
        }

        final ReferenceFrameSelector selector = new ReferenceFrameSelector(context.getSelectedExposures(),
                                                                           context.getAllExposures());
        final ReferenceSelection selection = selector.select(referenceParameters.refEpoch,
                                                             referenceParameters.refFilter,
                                                             referenceParameters.refVisit);

        final ArtifactNamer namer = context.getNamer();
        final File referenceDirectory = referenceImage.getParentFile();
        FileUtil.ensureWritableDirectory(referenceDirectory);
        for (final Exposure exposure : selection.getExposures()) {
            final File pristineExposure = new File(namer.getExposureDirectory(), exposure.getFilename());
            FileUtil.copyToDirectory(pristineExposure, referenceDirectory, true);
        }

        final List<String> imageNames = selection.getExposures().stream()
                .map(Exposure::getFilename)
                .collect(Collectors.toList());

        final Collaborators collaborators = context.getCollaborators();
        final CombineOptions options = new CombineOptions()
                .withCosmicRays(context.getParameters().combine.getCosmicRayMode(),
                                context.getParameters().combine.getCosmicRaySnrList())
                .withClobber(true);

        final CombineProducts products = collaborators.getCombiner().combine(referenceDirectory,
                                                                             imageNames,
                                                                             namer.getReferenceOutputRoot(),
                                                                             options);

        final ReferenceFrame referenceFrame = new ReferenceFrame(products.getScience(),
                                                                 selection.getEpoch(),
                                                                 selection.getFilter(),
                                                                 selection.getVisit(),
                                                                 defaultFrame.getCatalogFile());

        if (referenceFrame.hasCatalog()) {
            final String wcsName = "REFCAT:" + referenceFrame.getCatalogFile().getName();
            LOG.info("runPipelineStep: registering reference image {} to catalog {}",
                     referenceFrame.getImageFile().getName(), referenceFrame.getCatalogFile());
            final RegistrationRequest request =
                    new RegistrationRequest(referenceDirectory,
                                            Collections.singletonList(referenceFrame.getImageFile().getName()),
                                            referenceFrame.getImageFile(),
                                            referenceFrame.getCatalogFile(),
                                            null,
                                            wcsName,
                                            context.getParameters().registration,
                                            context.isClobber());
            collaborators.getRegistrar().align(request);
        }

        context.setReferenceFrame(referenceFrame);
        context.getReport().addCompleted(PipelineStage.BUILD_REFERENCE, UNIT_KEY, referenceFrame.getImageFile());
    }

    private static final Logger LOG = LoggerFactory.getLogger(BuildReferenceStep.class);
}
