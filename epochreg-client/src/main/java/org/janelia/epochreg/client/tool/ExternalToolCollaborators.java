package org.janelia.epochreg.client.tool;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.epochreg.error.CollaboratorFailureException;
import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.external.BackPropagator;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.external.CombineOptions;
import org.janelia.epochreg.external.CombineProducts;
import org.janelia.epochreg.external.Combiner;
import org.janelia.epochreg.external.HotPixelCleaner;
import org.janelia.epochreg.external.PixelArithmetic;
import org.janelia.epochreg.external.Registrar;
import org.janelia.epochreg.external.RegistrationRequest;
import org.janelia.epochreg.external.TemplateScaler;
import org.janelia.epochreg.external.WcsPropagationResult;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.RegistrationParameters;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.SkyPosition;

/**
 * Implements every collaborator contract by running the external program configured for each operation.
 *
 * @author Eric Trautman
 */
public class ExternalToolCollaborators
        implements Combiner, HotPixelCleaner, Registrar, BackPropagator, PixelArithmetic, TemplateScaler {

    private final ExternalToolConfiguration configuration;

    public ExternalToolCollaborators(final ExternalToolConfiguration configuration) {
        this.configuration = configuration;
    }

    public Collaborators toCollaborators() {
        return new Collaborators(this, this, this, this, this, this);
    }

    @Override
    public CombineProducts combine(final File workingDirectory,
                                   final List<String> imageNames,
                                   final String outputRoot,
                                   final CombineOptions options)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("images", imageNames);
        request.put("outputRoot", outputRoot);
        request.put("registeredGrid", options.isRegisteredGrid());
        putPosition(request, "outputCenter", options.getOutputCenter());
        request.put("rotation", options.getRotation());
        request.put("imageSizeArcsec", options.getImageSizeArcsec());
        request.put("naxis12", options.getNaxis12());
        request.put("pixelScale", options.getPixelScale());
        request.put("pixelFraction", options.getPixelFraction());
        request.put("weightType", options.getWeightType());
        request.put("combineType", options.getCombineType().getToolName());
        request.put("cosmicRayLevel", options.getCosmicRayMode().getLevel());
        request.put("cosmicRaySnr", options.getCosmicRaySnr());
        request.put("wcsKey", options.getWcsKey());
        request.put("singleExposureProducts", options.isSingleExposureProducts());
        request.put("clobber", options.isClobber());

        final ExternalToolResponse response = run(ExternalToolConfiguration.COMBINE, workingDirectory, request);

        final File science = response.getFile("science",
                                              workingDirectory,
                                              findDefaultScience(workingDirectory, outputRoot));

        final List<File> singleScienceList = new ArrayList<>();
        for (final String name : response.getFiles()) {
            final File file = new File(name);
            singleScienceList.add(file.isAbsolute() ? file : new File(workingDirectory, name));
        }

        return new CombineProducts(science,
                                   ArtifactNamer.getSibling(science, ArtifactKind.WEIGHT),
                                   ArtifactNamer.getSibling(science, ArtifactKind.CONTEXT),
                                   ArtifactNamer.getSibling(science, ArtifactKind.BAD_PIXEL_MASK),
                                   singleScienceList);
    }

    @Override
    public void cleanHotPixels(final File workingDirectory,
                               final String firstImageName,
                               final String secondImageName)
            throws CollaboratorFailureException {
        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("firstImage", firstImageName);
        request.put("secondImage", secondImageName);
        run(ExternalToolConfiguration.CLEAN_HOT_PIXELS, workingDirectory, request);
    }

    @Override
    public String align(final RegistrationRequest registrationRequest)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("images", registrationRequest.getImageNames());
        putFile(request, "referenceImage", registrationRequest.getReferenceImage());
        putFile(request, "referenceCatalog", registrationRequest.getReferenceCatalog());
        putPosition(request, "singleSourcePosition", registrationRequest.getSingleSourcePosition());
        request.put("wcsName", registrationRequest.getWcsName());
        putMatching(request, registrationRequest.getMatching());
        request.put("clobber", registrationRequest.isClobber());

        final ExternalToolResponse response = run(ExternalToolConfiguration.ALIGN,
                                                  registrationRequest.getWorkingDirectory(),
                                                  request);

        final String wcsName = response.getValue("wcsName");
        return wcsName == null ? registrationRequest.getWcsName() : wcsName;
    }

    @Override
    public File makeSourceCatalog(final File workingDirectory,
                                  final String imageName,
                                  final RegistrationParameters detection)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("image", imageName);
        putMatching(request, detection);

        final ExternalToolResponse response = run(ExternalToolConfiguration.MAKE_SOURCE_CATALOG,
                                                  workingDirectory,
                                                  request);

        final File catalog = response.getFile("catalog", workingDirectory, null);
        if (catalog == null) {
            throw new CollaboratorFailureException("no catalog was reported for " + imageName);
        }
        return catalog;
    }

    @Override
    public WcsPropagationResult propagate(final File workingDirectory,
                                          final String combinedImageName,
                                          final List<String> exposureNames,
                                          final String originalWcsName,
                                          final String solutionWcsName,
                                          final String targetWcsName,
                                          final boolean force)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("combinedImage", combinedImageName);
        request.put("exposures", exposureNames);
        request.put("originalWcsName", originalWcsName);
        request.put("solutionWcsName", solutionWcsName);
        request.put("targetWcsName", targetWcsName);
        request.put("force", force);

        final ExternalToolResponse response = run(ExternalToolConfiguration.PROPAGATE_WCS, workingDirectory, request);

        final String result = response.getValue("result");
        final WcsPropagationResult propagationResult;
        if ((result == null) || WcsPropagationResult.Status.PROPAGATED.name().equals(result)) {
            propagationResult = WcsPropagationResult.propagated();
        } else if (WcsPropagationResult.Status.WCS_NAME_COLLISION.name().equals(result)) {
            propagationResult = WcsPropagationResult.nameCollision(response.getValue("alternateWcsName"),
                                                                   response.getMessage());
        } else {
            propagationResult = WcsPropagationResult.headerCorrupted(response.getMessage());
        }
        return propagationResult;
    }

    @Override
    public File subtract(final File templateScience,
                         final File science,
                         final File output,
                         final boolean clobber)
            throws CollaboratorFailureException {
        return runFileOperation(ExternalToolConfiguration.SUBTRACT, templateScience, science, output, clobber);
    }

    @Override
    public File combineWeights(final File weight,
                               final File templateWeight,
                               final File output,
                               final boolean clobber)
            throws CollaboratorFailureException {
        return runFileOperation(ExternalToolConfiguration.COMBINE_WEIGHTS, weight, templateWeight, output, clobber);
    }

    @Override
    public File unionMask(final File templateMask,
                          final File mask,
                          final File output,
                          final boolean clobber)
            throws CollaboratorFailureException {
        return runFileOperation(ExternalToolConfiguration.UNION_MASK, templateMask, mask, output, clobber);
    }

    @Override
    public File applyMask(final File science,
                          final File mask,
                          final File output,
                          final boolean clobber)
            throws CollaboratorFailureException {
        return runFileOperation(ExternalToolConfiguration.APPLY_MASK, science, mask, output, clobber);
    }

    @Override
    public File weightedAverage(final List<File> scienceList,
                                final List<File> weightList,
                                final File output,
                                final File outputWeight,
                                final boolean clobber)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("science", toPaths(scienceList));
        request.put("weights", toPaths(weightList));
        putFile(request, "output", output);
        putFile(request, "outputWeight", outputWeight);
        request.put("clobber", clobber);

        run(ExternalToolConfiguration.WEIGHTED_AVERAGE, output.getParentFile(), request);

        return output;
    }

    @Override
    public File makeScaledTemplate(final String targetBandpass,
                                   final File firstTemplate,
                                   final File secondTemplate,
                                   final File output,
                                   final boolean clobber)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("targetBandpass", targetBandpass);
        putFile(request, "firstTemplate", firstTemplate);
        putFile(request, "secondTemplate", secondTemplate);
        putFile(request, "output", output);
        request.put("clobber", clobber);

        run(ExternalToolConfiguration.MAKE_SCALED_TEMPLATE, output.getParentFile(), request);

        return output;
    }

    private File runFileOperation(final String operationName,
                                  final File first,
                                  final File second,
                                  final File output,
                                  final boolean clobber)
            throws CollaboratorFailureException {

        final Map<String, Object> request = new LinkedHashMap<>();
        putFile(request, "first", first);
        putFile(request, "second", second);
        putFile(request, "output", output);
        request.put("clobber", clobber);

        run(operationName, output.getParentFile(), request);

        return output;
    }

    private ExternalToolResponse run(final String operationName,
                                     final File workingDirectory,
                                     final Map<String, Object> request)
            throws ConfigurationException, CollaboratorFailureException {
        return configuration.getTool(operationName).run(workingDirectory, request);
    }

    static File findDefaultScience(final File workingDirectory,
                                   final String outputRoot) {
        final File drcFile = new File(workingDirectory,
                                      ArtifactNamer.productName(outputRoot, "drc", ArtifactKind.SCIENCE));
        return drcFile.exists() ? drcFile :
               new File(workingDirectory, ArtifactNamer.productName(outputRoot, "drz", ArtifactKind.SCIENCE));
    }

    private static void putMatching(final Map<String, Object> request,
                                    final RegistrationParameters matching) {
        if (matching != null) {
            request.put("fitGeometry", matching.getFitGeometry().name());
            request.put("threshold", matching.threshold);
            request.put("peakMin", matching.peakMin);
            request.put("peakMax", matching.peakMax);
            request.put("searchRadius", matching.searchRadius);
            request.put("minObj", matching.minObj);
            request.put("nBright", matching.nBright);
            request.put("refNBright", matching.refNBright);
            request.put("rFluxMin", matching.rFluxMin);
            request.put("rFluxMax", matching.rFluxMax);
            request.put("nClip", matching.nClip);
            request.put("sigmaClip", matching.sigmaClip);
        }
    }

    private static void putFile(final Map<String, Object> request,
                                final String key,
                                final File file) {
        request.put(key, file == null ? null : file.getAbsolutePath());
    }

    private static void putPosition(final Map<String, Object> request,
                                    final String key,
                                    final SkyPosition position) {
        if (position != null) {
            final Map<String, Object> value = new LinkedHashMap<>();
            value.put("ra", position.getRa());
            value.put("dec", position.getDec());
            request.put(key, value);
        }
    }

    private static List<String> toPaths(final List<File> files) {
        final List<String> paths = new ArrayList<>(files.size());
        files.forEach(file -> paths.add(file.getAbsolutePath()));
        return paths;
    }
}
