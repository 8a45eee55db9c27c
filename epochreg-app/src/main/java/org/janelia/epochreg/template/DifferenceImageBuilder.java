package org.janelia.epochreg.template;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.external.PixelArithmetic;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.store.ArtifactStore;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtracts a template from a registered image, combines their weights and masks,
 * and masks the result.
 *
 * @author Eric Trautman
 */
public class DifferenceImageBuilder {

    private final PixelArithmetic pixelArithmetic;
    private final ArtifactStore artifactStore;
    private final boolean clobber;
    private final boolean removeUnmasked;

    /**
     * @param  pixelArithmetic  pixel operations.
     * @param  artifactStore    locates weight and mask siblings.
     * @param  clobber          replace existing outputs.
     * @param  removeUnmasked   remove the unmasked difference once the masked one has been written.
     */
    public DifferenceImageBuilder(final PixelArithmetic pixelArithmetic,
                                  final ArtifactStore artifactStore,
                                  final boolean clobber,
                                  final boolean removeUnmasked) {
        this.pixelArithmetic = pixelArithmetic;
        this.artifactStore = artifactStore;
        this.clobber = clobber;
        this.removeUnmasked = removeUnmasked;
    }

    /**
     * @param  science          registered science image.
     * @param  templateScience  template science image.
     * @param  unmaskedOutput   unmasked difference science image (weight and mask are written as its siblings).
     * @param  maskedOutput     masked difference science image.
     *
     * @return the products.
     *
     * @throws MissingInputException
     *   if the science or template image does not exist.
     *
     * @throws IOException
     *   if the unmasked difference cannot be removed.
     */
    public DifferenceProducts build(final File science,
                                    final File templateScience,
                                    final File unmaskedOutput,
                                    final File maskedOutput)
            throws MissingInputException, IOException {

        final List<File> missingList = new ArrayList<>();
        if (! templateScience.exists()) {
            missingList.add(templateScience);
        }
        if (! science.exists()) {
            missingList.add(science);
        }
        if (! missingList.isEmpty()) {
            throw new MissingInputException("can't create difference image " + maskedOutput.getName(), missingList);
        }

        final File difference = pixelArithmetic.subtract(templateScience, science, unmaskedOutput, clobber);

        final File weight = pixelArithmetic.combineWeights(artifactStore.pathFor(science, ArtifactKind.WEIGHT),
                                                           artifactStore.pathFor(templateScience, ArtifactKind.WEIGHT),
                                                           artifactStore.pathFor(unmaskedOutput, ArtifactKind.WEIGHT),
                                                           clobber);

        final File mask = pixelArithmetic.unionMask(artifactStore.pathFor(templateScience, ArtifactKind.BAD_PIXEL_MASK),
                                                    artifactStore.pathFor(science, ArtifactKind.BAD_PIXEL_MASK),
                                                    artifactStore.pathFor(unmaskedOutput, ArtifactKind.BAD_PIXEL_MASK),
                                                    clobber);

        final File maskedDifference = pixelArithmetic.applyMask(difference, mask, maskedOutput, clobber);

        if (removeUnmasked) {
            FileUtil.deleteIfExists(difference);
        }

        LOG.info("build: created difference image {} using image {}, template {}, weight {}, and mask {}",
                 maskedDifference.getName(), science.getName(), templateScience.getName(), weight.getName(),
                 mask.getName());

        return new DifferenceProducts(maskedDifference, weight);
    }

    private static final Logger LOG = LoggerFactory.getLogger(DifferenceImageBuilder.class);
}
