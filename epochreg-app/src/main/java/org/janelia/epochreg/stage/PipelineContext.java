package org.janelia.epochreg.stage;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.janelia.epochreg.catalog.HeaderReader;
import org.janelia.epochreg.error.MissingArtifactException;
import org.janelia.epochreg.error.MissingReferenceException;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.ExposureGroup;
import org.janelia.epochreg.spec.FilterCombination;
import org.janelia.epochreg.spec.ReferenceFrame;
import org.janelia.epochreg.spec.SkyPosition;
import org.janelia.epochreg.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State shared by the stages of one pipeline run.
 *
 * @author Eric Trautman
 */
public class PipelineContext {

    private final ArtifactNamer namer;
    private final PipelineParameters parameters;
    private final FilterCombination filterCombination;
    private final List<Exposure> allExposures;
    private final List<Exposure> selectedExposures;
    private final Collaborators collaborators;
    private final ArtifactStore artifactStore;
    private final HeaderReader headerReader;
    private final RunReport report;

    private ReferenceFrame referenceFrame;
    private SkyPosition outputCenter;

    /**
     * @param  namer              names artifacts for the run's root.
     * @param  parameters         validated run parameters.
     * @param  allExposures       every catalogued exposure (epochs assigned).
     * @param  collaborators      external operations.
     * @param  artifactStore      decides which units need to run.
     * @param  headerReader       reads image header keywords.
     *
     * @throws MissingReferenceException
     *   if an explicitly specified reference image does not exist.
     */
    public PipelineContext(final ArtifactNamer namer,
                           final PipelineParameters parameters,
                           final List<Exposure> allExposures,
                           final Collaborators collaborators,
                           final ArtifactStore artifactStore,
                           final HeaderReader headerReader)
            throws MissingReferenceException {

        this.namer = namer;
        this.parameters = parameters;
        this.filterCombination = parameters.getFilterCombination();
        this.allExposures = new ArrayList<>(allExposures);
        this.selectedExposures = allExposures.stream()
                .filter(parameters.selection::isSelected)
                .collect(Collectors.toList());
        this.collaborators = collaborators;
        this.artifactStore = artifactStore;
        this.headerReader = headerReader;
        this.report = new RunReport();

        final String refImage = parameters.reference.refImage;
        final File refCat = parameters.reference.refCat == null ? null :
                            new File(parameters.reference.refCat).getAbsoluteFile();
        if (refImage == null) {
            this.referenceFrame = new ReferenceFrame(namer.getDefaultReferenceImage(), null, null, null, refCat);
        } else {
            final File refImageFile = new File(refImage).getAbsoluteFile();
            if (! refImageFile.exists()) {
                throw new MissingReferenceException(refImageFile);
            }
            this.referenceFrame = new ReferenceFrame(refImageFile, null, null, null, refCat);
        }

        this.outputCenter = parameters.selection.getTargetPosition();
    }

    public ArtifactNamer getNamer() {
        return namer;
    }

    public PipelineParameters getParameters() {
        return parameters;
    }

    public FilterCombination getFilterCombination() {
        return filterCombination;
    }

    public List<Exposure> getAllExposures() {
        return Collections.unmodifiableList(allExposures);
    }

    /**
     * @return processable exposures that match the run's filter and epoch restrictions.
     */
    public List<Exposure> getSelectedExposures() {
        return Collections.unmodifiableList(selectedExposures);
    }

    public List<ExposureGroup> getFevGroups() {
        return ExposureGroup.byFevGroup(selectedExposures);
    }

    public List<ExposureGroup> getFeGroups() {
        return ExposureGroup.byFeGroup(selectedExposures);
    }

    public List<Integer> getSelectedEpochs() {
        return new ArrayList<>(selectedExposures.stream().map(Exposure::getEpoch)
                                       .collect(Collectors.toCollection(TreeSet::new)));
    }

    public List<String> getSelectedFilters() {
        return new ArrayList<>(selectedExposures.stream().map(Exposure::getFilter)
                                       .collect(Collectors.toCollection(TreeSet::new)));
    }

    /**
     * @return selected exposures with the specified (group) filter and epoch.
     */
    public List<Exposure> getSelectedExposures(final String filter,
                                               final int epoch) {
        return selectedExposures.stream()
                .filter(e -> e.getFilter().equals(filter) && (e.getEpoch() == epoch))
                .collect(Collectors.toList());
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public HeaderReader getHeaderReader() {
        return headerReader;
    }

    public RunReport getReport() {
        return report;
    }

    public boolean isClobber() {
        return parameters.isClobber();
    }

    public boolean isSingleStar() {
        return parameters.singleStar;
    }

    public ReferenceFrame getReferenceFrame() {
        return referenceFrame;
    }

    public void setReferenceFrame(final ReferenceFrame referenceFrame) {
        this.referenceFrame = referenceFrame;
    }

    /**
     * @return center for registered grids: the target position when one was specified,
     *         otherwise the reference image center (CRVAL1, CRVAL2) once the reference exists;
     *         null if neither is available.
     */
    public SkyPosition getOutputCenter() {
        if ((outputCenter == null) && (! isSingleStar()) && referenceFrame.exists()) {
            final File image = referenceFrame.getImageFile();
            final Double ra = headerReader.getDoubleValue(image, "CRVAL1");
            final Double dec = headerReader.getDoubleValue(image, "CRVAL2");
            if ((ra != null) && (dec != null)) {
                outputCenter = new SkyPosition(ra, dec);
                LOG.info("getOutputCenter: using reference image center {} for registered images", outputCenter);
            }
        }
        return outputCenter;
    }

    /**
     * @return working directory for the group's epoch.
     */
    public File getWorkingDirectory(final ExposureGroup group) {
        return namer.getEpochDirectory(group.getEpoch());
    }

    /**
     * @throws MissingArtifactException
     *   if any of the group's exposures has not been copied into its working directory.
     */
    public void verifyWorkingCopies(final ExposureGroup group)
            throws MissingArtifactException {
        for (final Exposure exposure : group.getExposures()) {
            final File workingCopy = namer.getWorkingCopy(exposure);
            if (! workingCopy.exists()) {
                throw new MissingArtifactException(workingCopy, "--doSetup");
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PipelineContext.class);
}
