package org.janelia.epochreg.naming;

import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Exposure;

/**
 * Components recovered from the canonical name of a difference artifact.
 *
 * @author Eric Trautman
 */
public class DifferenceArtifactName {

    private static final Pattern DIFFERENCE_NAME_PATTERN = Pattern.compile(
            "^(.+)_([^_]+)_e(-?\\d+)-e(-?\\d+)(?:_([^_]+)_single)?_sub(_masked)?_(sci|wht|ctx|bpx)\\.fits$");

    private final String rootName;
    private final String filter;
    private final int epoch;
    private final int templateEpoch;
    private final String exposureRootname;
    private final boolean masked;
    private final ArtifactKind kind;

    private DifferenceArtifactName(final String rootName,
                                   final String filter,
                                   final int epoch,
                                   final int templateEpoch,
                                   final String exposureRootname,
                                   final boolean masked,
                                   final ArtifactKind kind) {
        this.rootName = rootName;
        this.filter = filter;
        this.epoch = epoch;
        this.templateEpoch = templateEpoch;
        this.exposureRootname = exposureRootname;
        this.masked = masked;
        this.kind = kind;
    }

    public String getRootName() {
        return rootName;
    }

    public String getFilter() {
        return filter;
    }

    public int getEpoch() {
        return epoch;
    }

    public int getTemplateEpoch() {
        return templateEpoch;
    }

    /**
     * @return the (filter, epoch) group key of the differenced image.
     */
    public String getFeGroup() {
        return filter + "_" + Exposure.formatEpoch(epoch);
    }

    /**
     * @return rootname of the single exposure differenced or null for epoch level differences.
     */
    public String getExposureRootname() {
        return exposureRootname;
    }

    public boolean isSingleExposure() {
        return exposureRootname != null;
    }

    public boolean isMasked() {
        return masked;
    }

    public ArtifactKind getKind() {
        return kind;
    }

    public static boolean isDifferenceName(final String name) {
        return DIFFERENCE_NAME_PATTERN.matcher(name).matches();
    }

    /**
     * @return components parsed from the specified file's name.
     *
     * @throws IllegalArgumentException
     *   if the name is not a canonical difference artifact name.
     */
    public static DifferenceArtifactName parse(final File file)
            throws IllegalArgumentException {
        return parse(file.getName());
    }

    public static DifferenceArtifactName parse(final String name)
            throws IllegalArgumentException {
        final Matcher m = DIFFERENCE_NAME_PATTERN.matcher(name);
        if (! m.matches()) {
            throw new IllegalArgumentException("'" + name + "' is not a difference artifact name");
        }
        return new DifferenceArtifactName(m.group(1),
                                          m.group(2),
                                          Integer.parseInt(m.group(3)),
                                          Integer.parseInt(m.group(4)),
                                          m.group(5),
                                          m.group(6) != null,
                                          ArtifactKind.fromSuffix(m.group(7)));
    }

    @Override
    public String toString() {
        return rootName + "/" + getFeGroup() + " - " + Exposure.formatEpoch(templateEpoch) +
               (isSingleExposure() ? " (" + exposureRootname + ")" : "");
    }
}
