package org.janelia.epochreg.naming;

import java.io.File;

import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.ExposureGroup;

/**
 * <p>
 *     Derives canonical directory and artifact paths for a pipeline root.
 *     Every stage locates its inputs and outputs through this class, so existence of a derived
 *     science path is all that is needed to decide whether a unit of work has already been done.
 * </p>
 *
 * <p>
 *     Derived paths have the form:
 * <pre>
 *     [top]/[root].flt/                                     pristine input exposures
 *     [top]/[root]_epochs.txt                               persisted epoch list
 *     [top]/[root].e[NN]/                                   working directory for epoch NN
 *     [top]/[root].refim/[root]_wcsref_drz_sci.fits         reference frame
 *     [top]/[root].stack/                                   multi-epoch stacks
 *
 *     [root]_[filter]_e[NN]_[visit]_nat_drz_sci.fits        native single visit combination
 *     [root]_[filter]_e[NN]_reg_drz_sci.fits                registered single epoch combination
 *     [root]_[filter]_e[NN]_reg_[exposure]_single_sci.fits  registered single exposure product
 *     [root]_~[filter]_e[TT]_reg_drz_sci.fits               scaled multi-filter template
 *     [root]_[filter]_e[NN]-e[TT]_sub_masked_sci.fits       difference against template epoch TT
 *     [root]_[filter]_stack_drz_sci.fits                    multi-epoch stack
 * </pre>
 *     with 'drc' replacing 'drz' for CTE corrected inputs and wht, ctx or bpx replacing sci for the other kinds.
 * </p>
 *
 * @author Eric Trautman
 */
public class ArtifactNamer {

    public static final String SCALED_TEMPLATE_PREFIX = "~";

    private final File topDirectory;
    private final String rootName;

    public ArtifactNamer(final File topDirectory,
                         final String rootName)
            throws IllegalArgumentException {
        if ((rootName == null) || rootName.isEmpty()) {
            throw new IllegalArgumentException("root name must be specified");
        }
        this.topDirectory = topDirectory.getAbsoluteFile();
        this.rootName = rootName;
    }

    public String getRootName() {
        return rootName;
    }

    public File getExposureDirectory() {
        return new File(topDirectory, rootName + ".flt");
    }

    public File getDefaultEpochListFile() {
        return new File(topDirectory, rootName + "_epochs.txt");
    }

    public File getEpochDirectory(final int epoch) {
        return new File(topDirectory, rootName + "." + Exposure.formatEpoch(epoch));
    }

    public File getWorkingCopy(final Exposure exposure) {
        return new File(getEpochDirectory(exposure.getEpoch()), exposure.getFilename());
    }

    public File getReferenceDirectory() {
        return new File(topDirectory, rootName + ".refim");
    }

    public String getReferenceOutputRoot() {
        return rootName + "_wcsref";
    }

    /**
     * @return default reference image, preferring an existing 'drc' product over the 'drz' default.
     */
    public File getDefaultReferenceImage() {
        final File drzFile = new File(getReferenceDirectory(),
                                      productName(getReferenceOutputRoot(), "drz", ArtifactKind.SCIENCE));
        final File drcFile = new File(getReferenceDirectory(),
                                      productName(getReferenceOutputRoot(), "drc", ArtifactKind.SCIENCE));
        return drcFile.exists() ? drcFile : drzFile;
    }

    public File getStackDirectory() {
        return new File(topDirectory, rootName + ".stack");
    }

    public String getNativeOutputRoot(final String fevGroup) {
        return rootName + "_" + fevGroup + "_nat";
    }

    public File getNativeProduct(final ExposureGroup fevGroup,
                                 final ArtifactKind kind) {
        return new File(getEpochDirectory(fevGroup.getEpoch()),
                        productName(getNativeOutputRoot(fevGroup.getKey()), fevGroup.getDrzSuffix(), kind));
    }

    public String getRegisteredOutputRoot(final String feGroup) {
        return rootName + "_" + feGroup + "_reg";
    }

    public File getRegisteredProduct(final String filter,
                                     final int epoch,
                                     final String drzSuffix,
                                     final ArtifactKind kind) {
        final String feGroup = filter + "_" + Exposure.formatEpoch(epoch);
        return new File(getEpochDirectory(epoch),
                        productName(getRegisteredOutputRoot(feGroup), drzSuffix, kind));
    }

    public File getRegisteredProduct(final ExposureGroup feGroup,
                                     final ArtifactKind kind) {
        return getRegisteredProduct(feGroup.getFilter(), feGroup.getEpoch(), feGroup.getDrzSuffix(), kind);
    }

    public File getSingleExposureProduct(final Exposure exposure,
                                         final ArtifactKind kind) {
        final String name = getRegisteredOutputRoot(exposure.getFeGroup()) + "_" + exposure.getRootname() +
                            "_single" + kind.getFileNameEnding();
        return new File(getEpochDirectory(exposure.getEpoch()), name);
    }

    public File getScaledTemplateProduct(final String filter,
                                         final int templateEpoch,
                                         final String drzSuffix,
                                         final ArtifactKind kind) {
        return getRegisteredProduct(SCALED_TEMPLATE_PREFIX + filter, templateEpoch, drzSuffix, kind);
    }

    public File getDifferenceProduct(final String filter,
                                     final int epoch,
                                     final int templateEpoch,
                                     final ArtifactKind kind,
                                     final boolean masked) {
        final String name = differenceRoot(filter, epoch, templateEpoch) + "_sub" + maskedInfix(masked) +
                            kind.getFileNameEnding();
        return new File(getEpochDirectory(epoch), name);
    }

    public File getSingleDifferenceProduct(final Exposure exposure,
                                           final int templateEpoch,
                                           final ArtifactKind kind,
                                           final boolean masked) {
        final String name = differenceRoot(exposure.getFilter(), exposure.getEpoch(), templateEpoch) + "_" +
                            exposure.getRootname() + "_single_sub" + maskedInfix(masked) + kind.getFileNameEnding();
        return new File(getEpochDirectory(exposure.getEpoch()), name);
    }

    public String getStackOutputRoot(final String filter) {
        return rootName + "_" + filter.toLowerCase() + "_stack";
    }

    public File getStackProduct(final String filter,
                                final String drzSuffix,
                                final ArtifactKind kind) {
        return new File(getStackDirectory(), productName(getStackOutputRoot(filter), drzSuffix, kind));
    }

    public File getStackDifferenceProduct(final String filter,
                                          final int templateEpoch) {
        return new File(getStackDirectory(),
                        getStackOutputRoot(filter) + "-" + Exposure.formatEpoch(templateEpoch) + "_sub" +
                        ArtifactKind.SCIENCE.getFileNameEnding());
    }

    private String differenceRoot(final String filter,
                                  final int epoch,
                                  final int templateEpoch) {
        return rootName + "_" + filter + "_" + Exposure.formatEpoch(epoch) + "-" + Exposure.formatEpoch(templateEpoch);
    }

    /**
     * @return name for a drizzle product, e.g. 'root_f160w_e01_reg_drz_sci.fits'.
     */
    public static String productName(final String outputRoot,
                                     final String drzSuffix,
                                     final ArtifactKind kind) {
        return outputRoot + "_" + drzSuffix + kind.getFileNameEnding();
    }

    /**
     * @return sibling of the specified science artifact with a different kind
     *         (e.g. 'x_reg_drz_wht.fits' for 'x_reg_drz_sci.fits').
     *
     * @throws IllegalArgumentException
     *   if the file is not a science artifact.
     */
    public static File getSibling(final File scienceArtifact,
                                  final ArtifactKind kind)
            throws IllegalArgumentException {
        final String name = scienceArtifact.getName();
        final String scienceEnding = ArtifactKind.SCIENCE.getFileNameEnding();
        if (! name.endsWith(scienceEnding)) {
            throw new IllegalArgumentException(scienceArtifact + " is not a science artifact");
        }
        final String siblingName = name.substring(0, name.length() - scienceEnding.length()) + kind.getFileNameEnding();
        return new File(scienceArtifact.getParentFile(), siblingName);
    }

    private static String maskedInfix(final boolean masked) {
        return masked ? "_masked" : "";
    }

}
