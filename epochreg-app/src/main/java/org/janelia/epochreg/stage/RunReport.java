package org.janelia.epochreg.stage;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.epochreg.error.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcomes of every unit of work in a pipeline run.
 *
 * @author Eric Trautman
 */
public class RunReport {

    private final List<UnitOutcome> outcomes;

    public RunReport() {
        this.outcomes = new ArrayList<>();
    }

    public void addCompleted(final PipelineStage stage,
                             final String unitKey,
                             final File product) {
        add(new UnitOutcome(stage, unitKey, UnitOutcome.Status.COMPLETED,
                            product == null ? null : product.getName(), null));
    }

    public void addSkippedExisting(final PipelineStage stage,
                                   final String unitKey,
                                   final File existingProduct) {
        add(new UnitOutcome(stage, unitKey, UnitOutcome.Status.SKIPPED_EXISTING,
                            existingProduct.getName() + " exists", null));
    }

    public void addSkippedMissingInput(final PipelineStage stage,
                                       final String unitKey,
                                       final MissingInputException cause) {
        LOG.warn("{} {}: skipping, {}, missing files are {}",
                 stage, unitKey, cause.getMessage(), cause.getMissingFiles());
        outcomes.add(new UnitOutcome(stage, unitKey, UnitOutcome.Status.SKIPPED_MISSING_INPUT,
                                     cause.getMessage(), cause.getMissingFiles()));
    }

    public List<UnitOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<UnitOutcome> getOutcomes(final PipelineStage stage) {
        return outcomes.stream().filter(o -> o.getStage() == stage).collect(Collectors.toList());
    }

    public List<UnitOutcome> getOutcomes(final UnitOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).collect(Collectors.toList());
    }

    public int getCount(final UnitOutcome.Status status) {
        return getOutcomes(status).size();
    }

    /**
     * @return true if nothing was built during the run.
     */
    public boolean isUnchanged() {
        return getCount(UnitOutcome.Status.COMPLETED) == 0;
    }

    public void logSummary() {
        LOG.info("logSummary: {} completed, {} skipped because products exist, {} skipped because inputs are missing",
                 getCount(UnitOutcome.Status.COMPLETED),
                 getCount(UnitOutcome.Status.SKIPPED_EXISTING),
                 getCount(UnitOutcome.Status.SKIPPED_MISSING_INPUT));
        for (final UnitOutcome outcome : getOutcomes(UnitOutcome.Status.SKIPPED_MISSING_INPUT)) {
            LOG.info("logSummary: {}, missing {}", outcome, outcome.getMissingFiles());
        }
    }

    private void add(final UnitOutcome outcome) {
        LOG.info("{}", outcome);
        outcomes.add(outcome);
    }

    private static final Logger LOG = LoggerFactory.getLogger(RunReport.class);
}
