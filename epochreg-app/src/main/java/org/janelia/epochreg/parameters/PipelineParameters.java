package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.json.JsonUtils;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.FilterCombination;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All parameters for a registration pipeline run.
 *
 * @author Eric Trautman
 */
public class PipelineParameters
        implements Serializable {

    @ParametersDelegate
    public StageParameters stages = new StageParameters();

    @ParametersDelegate
    public SelectionParameters selection = new SelectionParameters();

    @ParametersDelegate
    public EpochParameters epoch = new EpochParameters();

    @ParametersDelegate
    public ReferenceParameters reference = new ReferenceParameters();

    @ParametersDelegate
    public CombineParameters combine = new CombineParameters();

    @ParametersDelegate
    public RegistrationParameters registration = new RegistrationParameters();

    @ParametersDelegate
    public DifferenceParameters difference = new DifferenceParameters();

    @ParametersDelegate
    public StackParameters stack = new StackParameters();

    @ParametersDelegate
    public FilterCombinationParameters filterCombination = new FilterCombinationParameters();

    @Parameter(
            names = "--singleStar",
            description = "Register images that contain only a single bright source (e.g. standard stars), " +
                          "requires --ra and --dec",
            arity = 0)
    public boolean singleStar = false;

    @Parameter(
            names = "--clobber",
            description = "Rebuild existing products (same as --clobberLevel 1)",
            arity = 0)
    public boolean clobber = false;

    @Parameter(
            names = "--clobberLevel",
            description = "Clobber level: 0 keeps existing products, 1 rebuilds them, " +
                          "2 and higher also merge newly discovered exposures into the epoch list")
    public Integer clobberLevel = 0;

    @Parameter(
            names = "--clean",
            description = "Clean level: 0 keeps all intermediate files, " +
                          "1 and higher removes unmasked difference images")
    public Integer clean = 1;

    public int getClobberLevel() {
        final int level = clobberLevel == null ? 0 : clobberLevel;
        return clobber ? Math.max(1, level) : level;
    }

    public boolean isClobber() {
        return getClobberLevel() > 0;
    }

    public int getCleanLevel() {
        return clean == null ? 0 : clean;
    }

    /**
     * @return true if the registered combination stage should also produce single exposure images.
     */
    public boolean isSingleExposureProducts() {
        return combine.singleSci || difference.singleSubs;
    }

    public FilterCombination getFilterCombination()
            throws ConfigurationException {
        return filterCombination.toFilterCombination();
    }

    /**
     * Checks for incompatible parameters and applies derived defaults.
     * This must be called once before any stage runs.
     *
     * @throws ConfigurationException
     *   if any parameters are incompatible.
     */
    public void validateAndSetDefaults()
            throws ConfigurationException {

        final RegistrationParameters reg = registration;
        final int minObj = reg.minObj == null ? 0 : reg.minObj;

        if ((reg.nBright != null) && (reg.minObj != null) && (reg.nBright < (minObj - 1))) {
            throw new ConfigurationException("--nBright " + reg.nBright + " must not be less than --minObj " +
                                             minObj + " minus one");
        }

        if (RegistrationParameters.FitGeometry.RSCALE.equals(reg.getFitGeometry()) &&
            (((reg.nBright != null) && (reg.nBright < 3)) || (minObj < 3))) {
            throw new ConfigurationException(
                    "rotation and scale fits require at least 3 sources but --nBright is " + reg.nBright +
                    " and --minObj is " + minObj + ", try again with --shiftOnly");
        }

        selection.normalizeFilters();

        if (difference.hasTemplateFilters()) {
            if (selection.filters.size() != 1) {
                throw new ConfigurationException(
                        "--tempFilters composite templates require processing to be limited to a single filter " +
                        "with --filters X");
            }
            if (difference.tempFilters.size() > 2) {
                throw new ConfigurationException("--tempFilters accepts at most two filters but " +
                                                 difference.tempFilters.size() + " were specified");
            }
            final List<String> normalizedTemplateFilters = new ArrayList<>();
            difference.tempFilters.forEach(f -> normalizedTemplateFilters.add(Exposure.normalizeFilter(f)));
            difference.tempFilters = normalizedTemplateFilters;
        }

        if (singleStar && (! selection.hasTargetPosition())) {
            throw new ConfigurationException(
                    "--singleStar processing requires a target position specified with --ra and --dec");
        }

        try {
            combine.getCosmicRayMode();
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException("invalid --drizCr value: " + e.getMessage());
        }

        if ((combine.whtType == null) || (! CombineParameters.WEIGHT_TYPES.contains(combine.whtType.toUpperCase()))) {
            throw new ConfigurationException("--whtType must be one of " + CombineParameters.WEIGHT_TYPES +
                                             " but was '" + combine.whtType + "'");
        }
        combine.whtType = combine.whtType.toUpperCase();

        if ((epoch.epochSpan == null) || (epoch.epochSpan <= 0)) {
            throw new ConfigurationException("--epochSpan must be positive");
        }

        final FilterCombination combination = getFilterCombination();
        if (combination.isDrizzle() && (! selection.filters.isEmpty()) &&
            (! selection.filters.contains(combination.getName()))) {
            selection.filters.add(combination.getName());
        }

        if (reference.refFilter != null) {
            reference.refFilter = Exposure.normalizeFilter(reference.refFilter);
        }
        if (reference.refVisit != null) {
            reference.refVisit = Exposure.normalizeVisit(reference.refVisit);
        }

        if (singleStar) {
            applySingleStarDefaults();
        }
    }

    /*
     * @return JSON representation of these parameters.
     */
    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static PipelineParameters fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static PipelineParameters fromJsonFile(final String dataFile)
            throws IOException {
        final PipelineParameters parameters;
        final File file = new File(dataFile).getAbsoluteFile();
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(file)) {
            parameters = fromJson(reader);
        }
        return parameters;
    }

    private void applySingleStarDefaults() {

        if (registration.searchRadius == null) {
            registration.searchRadius = 10.0;
        }

        // threshold becomes the minimum threshold so it can only be lowered
        if ((registration.threshold == null) || (registration.threshold > 0.5)) {
            registration.threshold = 0.5;
        }

        if ("ERR".equals(combine.whtType)) {
            LOG.warn("applySingleStarDefaults: forcing EXP weight maps instead of ERR for bright source images");
            combine.whtType = "EXP";
        }

        if (CosmicRayMode.WITHIN_VISIT.equals(combine.getCosmicRayMode())) {
            LOG.warn("applySingleStarDefaults: forcing cosmic ray rejection for multi-visit combinations " +
                     "to avoid suppressing bright source flux");
            combine.drizCr = CosmicRayMode.MULTI_VISIT.getLevel();
        }
    }

    private static final JsonUtils.Helper<PipelineParameters> JSON_HELPER =
            new JsonUtils.Helper<>(PipelineParameters.class);

    private static final Logger LOG = LoggerFactory.getLogger(PipelineParameters.class);
}
