package org.janelia.epochreg.spec;

import java.io.File;
import java.io.Serializable;
import java.util.Comparator;

/**
 * One observed image file along with the metadata needed to sort it into epochs and groups.
 *
 * The group keys ({@link #getFevGroup()} and {@link #getFeGroup()}) are always derived from
 * the filter, epoch and visit values and can never be set independently.
 *
 * @author Eric Trautman
 */
public class Exposure
        implements Serializable {

    public static final int EXCLUDED_EPOCH = -1;

    /** Maximum number of characters retained in normalized filter names. */
    public static final int MAX_FILTER_LENGTH = 5;

    private final String filename;
    private final String path;
    private final String observedFilter;
    private final String filter;
    private final Camera camera;
    private final double mjd;
    private final String pidVisit;
    private final boolean onTarget;
    private int epoch;

    public Exposure(final String path,
                    final String observedFilter,
                    final String filter,
                    final Camera camera,
                    final double mjd,
                    final String pidVisit,
                    final boolean onTarget,
                    final int epoch) {
        final File file = new File(path);
        this.filename = file.getName();
        this.path = file.getAbsolutePath();
        this.observedFilter = normalizeFilter(observedFilter);
        this.filter = normalizeFilter(filter);
        this.camera = camera;
        this.mjd = mjd;
        this.pidVisit = normalizeVisit(pidVisit);
        this.onTarget = onTarget;
        this.epoch = epoch;
    }

    public String getFilename() {
        return filename;
    }

    public String getPath() {
        return path;
    }

    public File getFile() {
        return new File(path);
    }

    /**
     * @return filter recorded in the exposure's metadata.
     */
    public String getObservedFilter() {
        return observedFilter;
    }

    /**
     * @return filter used for grouping, which differs from the observed filter when
     *         several filters are drizzled together under a pseudo-filter name.
     */
    public String getFilter() {
        return filter;
    }

    public Camera getCamera() {
        return camera;
    }

    public boolean isInfrared() {
        return (camera != null) && camera.isInfrared();
    }

    public double getMjd() {
        return mjd;
    }

    public String getPidVisit() {
        return pidVisit;
    }

    public boolean isOnTarget() {
        return onTarget;
    }

    public int getEpoch() {
        return epoch;
    }

    public void setEpoch(final int epoch) {
        this.epoch = epoch;
    }

    public boolean isProcessable() {
        return (epoch >= 0) && onTarget;
    }

    /**
     * @return filename prefix before the first underscore (e.g. 'ibsd01abq' for 'ibsd01abq_flt.fits').
     */
    public String getRootname() {
        final int underscoreIndex = filename.indexOf('_');
        return underscoreIndex > 0 ? filename.substring(0, underscoreIndex) : filename.replace(".fits", "");
    }

    /**
     * @return 'drc' for CTE corrected (flc) inputs, otherwise 'drz'.
     */
    public String getDrzSuffix() {
        return filename.endsWith("flc.fits") ? "drc" : "drz";
    }

    /**
     * @return (filter, epoch, visit) key, e.g. 'f160w_e01_12099_A1'.
     */
    public String getFevGroup() {
        return getFeGroup() + "_" + pidVisit;
    }

    /**
     * @return (filter, epoch) key, e.g. 'f160w_e01'.
     */
    public String getFeGroup() {
        return filter + "_" + formatEpoch(epoch);
    }

    @Override
    public String toString() {
        return filename + " (" + getFevGroup() + ", mjd " + mjd + ")";
    }

    public static String formatEpoch(final int epoch) {
        return String.format("e%02d", epoch);
    }

    public static String normalizeFilter(final String filter) {
        String normalized = null;
        if (filter != null) {
            normalized = filter.trim().toLowerCase();
            if (normalized.length() > MAX_FILTER_LENGTH) {
                normalized = normalized.substring(0, MAX_FILTER_LENGTH);
            }
        }
        return normalized;
    }

    /**
     * @return upper case visit identifier with '.' separators replaced by '_' (e.g. '12099.a1' becomes '12099_A1').
     */
    public static String normalizeVisit(final String pidVisit) {
        return pidVisit == null ? null : pidVisit.trim().toUpperCase().replace('.', '_');
    }

    public static final Comparator<Exposure> MJD_COMPARATOR =
            Comparator.comparingDouble(Exposure::getMjd).thenComparing(Exposure::getFilename);

}
