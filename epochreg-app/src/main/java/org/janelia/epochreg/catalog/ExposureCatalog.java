package org.janelia.epochreg.catalog;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import org.janelia.epochreg.error.HeaderReadException;
import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.FilterCombination;
import org.janelia.epochreg.spec.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds exposure records from image headers and sorts them into epochs.
 *
 * @author Eric Trautman
 */
public class ExposureCatalog {

    private static final Pattern EXPOSURE_FILE_NAME_PATTERN = Pattern.compile(".*fl.\\.fits");

    private final HeaderReader headerReader;
    private final FilterCombination filterCombination;
    private final Double matchRadiusArcsec;

    /**
     * @param  headerReader        reads exposure metadata.
     * @param  filterCombination   drizzle combinations relabel member filters when exposures are built.
     * @param  matchRadiusArcsec   maximum target separation for on-target exposures
     *                             (null to use each camera's field radius).
     */
    public ExposureCatalog(final HeaderReader headerReader,
                           final FilterCombination filterCombination,
                           final Double matchRadiusArcsec) {
        this.headerReader = headerReader;
        this.filterCombination = filterCombination == null ? FilterCombination.NONE : filterCombination;
        this.matchRadiusArcsec = matchRadiusArcsec;
    }

    /**
     * Builds one exposure for each readable file.
     * Files with missing or malformed header keywords are logged and excluded.
     * Epochs of returned exposures are not yet assigned.
     *
     * @param  fileList  exposure files.
     * @param  target    target position (null if every exposure is on target).
     *
     * @return exposures in file list order.
     */
    public List<Exposure> buildCatalog(final List<File> fileList,
                                       final SkyPosition target) {

        final List<Exposure> exposureList = new ArrayList<>(fileList.size());

        for (final File file : fileList) {
            try {
                final ExposureHeader header = ExposureHeader.fromKeywords(file,
                                                                          headerReader.readPrimaryHeader(file));
                final boolean onTarget = isOnTarget(header, target);
                if (! onTarget) {
                    LOG.info("buildCatalog: {} is off target", file.getName());
                }
                exposureList.add(header.toExposure(filterCombination.getGroupFilter(header.getFilter()),
                                                   onTarget,
                                                   Exposure.EXCLUDED_EPOCH));
            } catch (final HeaderReadException e) {
                LOG.warn("buildCatalog: excluding exposure", e);
            }
        }

        LOG.info("buildCatalog: built {} exposures from {} files", exposureList.size(), fileList.size());

        return exposureList;
    }

    /**
     * Adds exposures for files that are not yet part of an existing (epoch assigned) list.
     * Existing assignments are never changed.
     * A new exposure joins the existing epoch whose first exposure was taken no more than
     * epochSpanDays before it.  Remaining new exposures are sorted into fresh epochs numbered
     * after the last existing epoch.
     *
     * @return merged list sorted by mjd.
     */
    public List<Exposure> mergeNewExposures(final List<Exposure> existingList,
                                            final List<File> fileList,
                                            final SkyPosition target,
                                            final double epochSpanDays,
                                            final double mjdMin,
                                            final double mjdMax) {

        final Set<String> existingNames = new HashSet<>();
        existingList.forEach(exposure -> existingNames.add(exposure.getFilename()));

        final List<File> newFiles = new ArrayList<>();
        for (final File file : fileList) {
            if (! existingNames.contains(file.getName())) {
                newFiles.add(file);
            }
        }

        final List<Exposure> mergedList = new ArrayList<>(existingList);

        if (newFiles.isEmpty()) {
            LOG.info("mergeNewExposures: no new exposures found");
        } else {

            final Map<Integer, Double> epochToStartMjd = new TreeMap<>();
            for (final Exposure exposure : existingList) {
                if (exposure.getEpoch() >= 0) {
                    final Double startMjd = epochToStartMjd.get(exposure.getEpoch());
                    if ((startMjd == null) || (exposure.getMjd() < startMjd)) {
                        epochToStartMjd.put(exposure.getEpoch(), exposure.getMjd());
                    }
                }
            }

            final int lastExistingEpoch = epochToStartMjd.isEmpty() ? -1 :
                                          Collections.max(epochToStartMjd.keySet());

            final List<Exposure> unmatchedList = new ArrayList<>();
            for (final Exposure exposure : buildCatalog(newFiles, target)) {
                if (! exposure.isOnTarget()) {
                    exposure.setEpoch(Exposure.EXCLUDED_EPOCH);
                } else if ((mjdMin > 0) && (exposure.getMjd() < mjdMin)) {
                    exposure.setEpoch(0);
                } else if ((mjdMax > 0) && (exposure.getMjd() > mjdMax) && (lastExistingEpoch >= 0)) {
                    exposure.setEpoch(lastExistingEpoch);
                } else {
                    exposure.setEpoch(findExistingEpoch(epochToStartMjd, exposure.getMjd(), epochSpanDays));
                }

                if ((exposure.getEpoch() == Exposure.EXCLUDED_EPOCH) && exposure.isOnTarget()) {
                    unmatchedList.add(exposure);
                } else {
                    mergedList.add(exposure);
                }
            }

            unmatchedList.sort(Exposure.MJD_COMPARATOR);
            walkEpochs(unmatchedList, epochSpanDays, lastExistingEpoch + 1);
            mergedList.addAll(unmatchedList);

            LOG.info("mergeNewExposures: added {} exposures, {} of them in new epochs",
                     newFiles.size(), unmatchedList.size());
        }

        mergedList.sort(Exposure.MJD_COMPARATOR);

        return mergedList;
    }

    /**
     * Sorts exposures chronologically and assigns epoch numbers.
     * A new epoch starts whenever an exposure was taken more than epochSpanDays after the
     * first exposure of the current epoch.
     *
     * <ul>
     *     <li>Off-target exposures are excluded (epoch {@link Exposure#EXCLUDED_EPOCH}).</li>
     *     <li>When mjdMin is positive, exposures taken before it are forced into epoch 0
     *         and the remaining epochs are numbered from 1.</li>
     *     <li>When mjdMax is positive, exposures taken after it are forced into a single final epoch.</li>
     * </ul>
     *
     * The same list and parameters always produce the same numbering.
     */
    public static void assignEpochs(final List<Exposure> exposureList,
                                    final double epochSpanDays,
                                    final double mjdMin,
                                    final double mjdMax) {

        final List<Exposure> sortedList = new ArrayList<>(exposureList);
        sortedList.sort(Exposure.MJD_COMPARATOR);

        final List<Exposure> earlyList = new ArrayList<>();
        final List<Exposure> windowList = new ArrayList<>();
        final List<Exposure> lateList = new ArrayList<>();

        for (final Exposure exposure : sortedList) {
            if (! exposure.isOnTarget()) {
                exposure.setEpoch(Exposure.EXCLUDED_EPOCH);
            } else if ((mjdMin > 0) && (exposure.getMjd() < mjdMin)) {
                earlyList.add(exposure);
            } else if ((mjdMax > 0) && (exposure.getMjd() > mjdMax)) {
                lateList.add(exposure);
            } else {
                windowList.add(exposure);
            }
        }

        int nextEpoch = 0;
        if (! earlyList.isEmpty()) {
            earlyList.forEach(exposure -> exposure.setEpoch(0));
            nextEpoch = 1;
        }

        nextEpoch = walkEpochs(windowList, epochSpanDays, nextEpoch);

        final int lateEpoch = nextEpoch;
        lateList.forEach(exposure -> exposure.setEpoch(lateEpoch));

        LOG.info("assignEpochs: assigned {} on-target exposures to epochs, epochSpanDays={}, mjdMin={}, mjdMax={}",
                 earlyList.size() + windowList.size() + lateList.size(), epochSpanDays, mjdMin, mjdMax);
    }

    /**
     * @return list of exposure files (flt, flc or flm) in the specified directory sorted by name.
     *
     * @throws MissingInputException
     *   if the directory does not exist or contains no exposure files.
     */
    public static List<File> findExposureFiles(final File exposureDirectory)
            throws MissingInputException {

        final File[] files = exposureDirectory.listFiles(
                (dir, name) -> EXPOSURE_FILE_NAME_PATTERN.matcher(name).matches());

        if ((files == null) || (files.length == 0)) {
            throw new MissingInputException("there are no flt/flc/flm files in " + exposureDirectory.getAbsolutePath(),
                                            Collections.singletonList(exposureDirectory));
        }

        Arrays.sort(files);

        return Arrays.asList(files);
    }

    private boolean isOnTarget(final ExposureHeader header,
                               final SkyPosition target) {
        boolean onTarget = true;
        if ((target != null) && (header.getTarget() != null)) {
            Double radius = matchRadiusArcsec;
            if ((radius == null) && (header.getCamera() != null)) {
                radius = header.getCamera().getFieldRadiusArcsec();
            }
            if (radius != null) {
                onTarget = target.getSeparationArcsec(header.getTarget()) <= radius;
            }
        }
        return onTarget;
    }

    /**
     * Assigns epochs to a chronologically sorted list, starting with firstEpoch.
     *
     * @return the next unused epoch number.
     */
    private static int walkEpochs(final List<Exposure> sortedList,
                                  final double epochSpanDays,
                                  final int firstEpoch) {
        int epoch = firstEpoch - 1;
        Double epochStartMjd = null;
        for (final Exposure exposure : sortedList) {
            if ((epochStartMjd == null) || ((exposure.getMjd() - epochStartMjd) > epochSpanDays)) {
                epoch++;
                epochStartMjd = exposure.getMjd();
            }
            exposure.setEpoch(epoch);
        }
        return epoch + 1;
    }

    private static int findExistingEpoch(final Map<Integer, Double> epochToStartMjd,
                                         final double mjd,
                                         final double epochSpanDays) {
        int epoch = Exposure.EXCLUDED_EPOCH;
        for (final Map.Entry<Integer, Double> entry : epochToStartMjd.entrySet()) {
            final double delta = mjd - entry.getValue();
            if ((delta >= 0) && (delta <= epochSpanDays)) {
                epoch = entry.getKey();
                break;
            }
        }
        return epoch;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ExposureCatalog.class);
}
