package org.janelia.epochreg.reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.janelia.epochreg.error.InsufficientExposuresException;
import org.janelia.epochreg.error.NoCandidateExposuresException;
import org.janelia.epochreg.spec.Exposure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the exposures used to build the reference image.
 *
 * <ul>
 *     <li>The default epoch is the first epoch of the processed exposures.</li>
 *     <li>The default filter is the alphabetically first filter processed in that epoch.</li>
 *     <li>The default visit is the deepest one (most exposures) for that epoch and filter,
 *         with ties going to the alphabetically first visit.</li>
 * </ul>
 *
 * Explicit epoch, filter and visit overrides always win over the defaults.
 *
 * @author Eric Trautman
 */
public class ReferenceFrameSelector {

    private final List<Exposure> processedExposures;
    private final List<Exposure> allExposures;

    /**
     * @param  processedExposures  exposures selected for processing (used to derive default epoch and filter).
     * @param  allExposures        every catalogued exposure (used to find visits and reference exposures).
     */
    public ReferenceFrameSelector(final List<Exposure> processedExposures,
                                  final List<Exposure> allExposures) {
        this.processedExposures = processedExposures;
        this.allExposures = allExposures;
    }

    /**
     * @param  refEpoch   epoch override (or null).
     * @param  refFilter  filter override (or null).
     * @param  refVisit   visit override (or null).
     *
     * @return the resolved selection.
     *
     * @throws NoCandidateExposuresException
     *   if no exposures can supply a default epoch, filter or visit.
     *
     * @throws InsufficientExposuresException
     *   if no exposures match the resolved (epoch, filter, visit).
     */
    public ReferenceSelection select(final Integer refEpoch,
                                     final String refFilter,
                                     final String refVisit)
            throws NoCandidateExposuresException, InsufficientExposuresException {

        final int epoch = refEpoch == null ? getDefaultEpoch() : refEpoch;
        final String filter = refFilter == null ? getDefaultFilter(epoch) : Exposure.normalizeFilter(refFilter);
        final String visit = refVisit == null ? getDeepestVisit(epoch, filter) : Exposure.normalizeVisit(refVisit);

        final List<Exposure> referenceExposures = new ArrayList<>();
        for (final Exposure exposure : allExposures) {
            if ((exposure.getEpoch() == epoch) &&
                filter.equals(exposure.getFilter()) &&
                visit.equals(exposure.getPidVisit())) {
                referenceExposures.add(exposure);
            }
        }

        if (referenceExposures.isEmpty()) {
            throw new InsufficientExposuresException(epoch, filter, visit);
        }

        referenceExposures.sort(Exposure.MJD_COMPARATOR);

        final ReferenceSelection selection = new ReferenceSelection(epoch, filter, visit, referenceExposures);

        LOG.info("select: selected {}", selection);

        return selection;
    }

    private int getDefaultEpoch()
            throws NoCandidateExposuresException {
        return processedExposures.stream()
                .filter(Exposure::isProcessable)
                .mapToInt(Exposure::getEpoch)
                .min()
                .orElseThrow(() -> new NoCandidateExposuresException(null, null));
    }

    private String getDefaultFilter(final int epoch)
            throws NoCandidateExposuresException {
        return processedExposures.stream()
                .filter(e -> e.getEpoch() == epoch)
                .map(Exposure::getFilter)
                .sorted()
                .findFirst()
                .orElseThrow(() -> new NoCandidateExposuresException(epoch, null));
    }

    private String getDeepestVisit(final int epoch,
                                   final String filter)
            throws NoCandidateExposuresException {

        final Map<String, Long> visitToCount = new TreeMap<>(
                allExposures.stream()
                        .filter(e -> (e.getEpoch() == epoch) && filter.equals(e.getFilter()))
                        .collect(Collectors.groupingBy(Exposure::getPidVisit, Collectors.counting())));

        if (visitToCount.isEmpty()) {
            throw new NoCandidateExposuresException(epoch, filter);
        }

        String deepestVisit = null;
        long deepestCount = 0;
        for (final Map.Entry<String, Long> entry : visitToCount.entrySet()) {
            if (entry.getValue() > deepestCount) {
                deepestVisit = entry.getKey();
                deepestCount = entry.getValue();
            }
        }

        if (visitToCount.size() > 1) {
            LOG.info("getDeepestVisit: chose {} with {} exposures from visits {}",
                     deepestVisit, deepestCount, visitToCount);
        }

        return deepestVisit;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceFrameSelector.class);
}
