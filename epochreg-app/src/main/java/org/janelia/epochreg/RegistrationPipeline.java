package org.janelia.epochreg;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.janelia.epochreg.catalog.EpochListFile;
import org.janelia.epochreg.catalog.ExposureCatalog;
import org.janelia.epochreg.catalog.HeaderReader;
import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.EpochParameters;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.FilterCombination;
import org.janelia.epochreg.stage.PipelineContext;
import org.janelia.epochreg.stage.RunReport;
import org.janelia.epochreg.stage.StageScheduler;
import org.janelia.epochreg.store.ArtifactStore;
import org.janelia.epochreg.store.FileArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running the registration pipeline over one root.
 * Loads (or builds) the epoch list for the root's exposures and then runs the enabled stages.
 *
 * @author Eric Trautman
 */
public class RegistrationPipeline {

    private final HeaderReader headerReader;
    private final Collaborators collaborators;
    private final ArtifactStore artifactStore;

    public RegistrationPipeline(final HeaderReader headerReader,
                                final Collaborators collaborators) {
        this(headerReader, collaborators, new FileArtifactStore());
    }

    public RegistrationPipeline(final HeaderReader headerReader,
                                final Collaborators collaborators,
                                final ArtifactStore artifactStore) {
        this.headerReader = headerReader;
        this.collaborators = collaborators;
        this.artifactStore = artifactStore;
    }

    /**
     * Runs the enabled stages for the specified root.
     *
     * @param  topDirectory  directory that contains the root's exposure directory.
     * @param  rootName      name of the root.
     * @param  parameters    run parameters (validated by this method).
     *
     * @return outcomes of every unit of work.
     *
     * @throws ConfigurationException
     *   if the parameters are invalid.
     *
     * @throws IOException
     *   if the epoch list cannot be read or written or any stage fails.
     */
    public RunReport run(final File topDirectory,
                         final String rootName,
                         final PipelineParameters parameters)
            throws ConfigurationException, IOException {

        LOG.info("run: entry, rootName={}, topDirectory={}", rootName, topDirectory);

        parameters.validateAndSetDefaults();

        final ArtifactNamer namer = new ArtifactNamer(topDirectory, rootName);
        final List<Exposure> exposures = loadExposures(namer, parameters);

        final PipelineContext context = new PipelineContext(namer,
                                                            parameters,
                                                            exposures,
                                                            collaborators,
                                                            artifactStore,
                                                            headerReader);

        LOG.info("run: {} of {} exposures selected for processing",
                 context.getSelectedExposures().size(), exposures.size());

        final StageScheduler scheduler = new StageScheduler(parameters.stages.getEnabledStages());
        final RunReport report = scheduler.run(context);

        report.logSummary();

        LOG.info("run: exit, rootName={}", rootName);

        return report;
    }

    /**
     * @return exposures from the persisted epoch list, building and persisting the list first if necessary.
     */
    List<Exposure> loadExposures(final ArtifactNamer namer,
                                 final PipelineParameters parameters)
            throws IOException {

        final File exposureDirectory = namer.getExposureDirectory();
        final List<File> exposureFiles = ExposureCatalog.findExposureFiles(exposureDirectory);

        final EpochParameters epochParameters = parameters.epoch;
        final File file = epochParameters.epochListFile == null ?
                          namer.getDefaultEpochListFile() : new File(epochParameters.epochListFile);
        final EpochListFile epochListFile = new EpochListFile(file);

        final FilterCombination filterCombination = parameters.getFilterCombination();
        final ExposureCatalog catalog = new ExposureCatalog(headerReader,
                                                            filterCombination,
                                                            parameters.selection.targetMatchRadius);

        List<Exposure> exposures;
        if (epochListFile.exists()) {

            exposures = epochListFile.load(exposureDirectory, filterCombination);

            if ((parameters.getClobberLevel() > 1) || (exposures.size() < exposureFiles.size())) {
                if (parameters.isClobber()) {
                    exposures = catalog.mergeNewExposures(exposures,
                                                          exposureFiles,
                                                          parameters.selection.getTargetPosition(),
                                                          epochParameters.epochSpan,
                                                          epochParameters.mjdMin,
                                                          epochParameters.mjdMax);
                    epochListFile.persist(exposures);
                } else if (exposures.size() < exposureFiles.size()) {
                    LOG.info("loadExposures: {} has {} exposures but {} contains {} files, " +
                             "use --clobber to add the new files",
                             file, exposures.size(), exposureDirectory, exposureFiles.size());
                }
            }

        } else {

            exposures = catalog.buildCatalog(exposureFiles, parameters.selection.getTargetPosition());
            ExposureCatalog.assignEpochs(exposures,
                                         epochParameters.epochSpan,
                                         epochParameters.mjdMin,
                                         epochParameters.mjdMax);
            epochListFile.persist(exposures);
        }

        return exposures;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RegistrationPipeline.class);
}
