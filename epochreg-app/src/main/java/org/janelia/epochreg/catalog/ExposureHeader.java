package org.janelia.epochreg.catalog;

import java.io.File;
import java.util.Map;

import org.janelia.epochreg.error.HeaderReadException;
import org.janelia.epochreg.spec.Camera;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.SkyPosition;

/**
 * Exposure metadata extracted from primary header keywords.
 *
 * <pre>
 *     filter      FILTER, or the non-CLEAR value of FILTER1/FILTER2 (required)
 *     mjd         EXPSTART (required)
 *     visit       PROPOSID + '_' + visit code from LINENUM (required)
 *     camera      INSTRUME/DETECTOR, falling back to legacy naming conventions
 *     target      RA_TARG/DEC_TARG (optional)
 *     rootname    ROOTNAME, falling back to the filename prefix
 * </pre>
 *
 * @author Eric Trautman
 */
public class ExposureHeader {

    private final File file;
    private final String filter;
    private final double mjd;
    private final String pidVisit;
    private final Camera camera;
    private final SkyPosition target;
    private final String rootname;

    public ExposureHeader(final File file,
                          final String filter,
                          final double mjd,
                          final String pidVisit,
                          final Camera camera,
                          final SkyPosition target,
                          final String rootname) {
        this.file = file;
        this.filter = filter;
        this.mjd = mjd;
        this.pidVisit = pidVisit;
        this.camera = camera;
        this.target = target;
        this.rootname = rootname;
    }

    public File getFile() {
        return file;
    }

    public String getFilter() {
        return filter;
    }

    public double getMjd() {
        return mjd;
    }

    public String getPidVisit() {
        return pidVisit;
    }

    public Camera getCamera() {
        return camera;
    }

    /**
     * @return target position recorded in the header or null if none was recorded.
     */
    public SkyPosition getTarget() {
        return target;
    }

    public String getRootname() {
        return rootname;
    }

    /**
     * @return an exposure built from this header's metadata.
     */
    public Exposure toExposure(final String groupFilter,
                               final boolean onTarget,
                               final int epoch) {
        return new Exposure(file.getAbsolutePath(), filter, groupFilter, camera, mjd, pidVisit, onTarget, epoch);
    }

    /**
     * @return header parsed from the specified keyword values.
     *
     * @throws HeaderReadException
     *   if any required keywords are missing or malformed.
     */
    public static ExposureHeader fromKeywords(final File file,
                                              final Map<String, String> keywordValues)
            throws HeaderReadException {

        final String filter = Exposure.normalizeFilter(getFilter(file, keywordValues));

        final String expStart = getRequiredValue(file, keywordValues, "EXPSTART");
        final double mjd = parseDouble(file, "EXPSTART", expStart);

        final String proposalId = getRequiredValue(file, keywordValues, "PROPOSID");
        final String lineNumber = getRequiredValue(file, keywordValues, "LINENUM");
        final int dotIndex = lineNumber.indexOf('.');
        final String visitCode = dotIndex > 0 ? lineNumber.substring(0, dotIndex) : lineNumber;
        final String pidVisit = Exposure.normalizeVisit(proposalId + "_" + visitCode);

        String rootname = keywordValues.get("ROOTNAME");
        if ((rootname == null) || rootname.isEmpty()) {
            final String name = file.getName();
            final int underscoreIndex = name.indexOf('_');
            rootname = underscoreIndex > 0 ? name.substring(0, underscoreIndex) : name;
        }
        rootname = rootname.toLowerCase();

        final Camera camera = Camera.resolve(keywordValues.get("INSTRUME"),
                                             keywordValues.get("DETECTOR"),
                                             rootname,
                                             file.getName(),
                                             filter);

        SkyPosition target = null;
        final String raTarget = keywordValues.get("RA_TARG");
        final String decTarget = keywordValues.get("DEC_TARG");
        if ((raTarget != null) && (decTarget != null)) {
            target = new SkyPosition(parseDouble(file, "RA_TARG", raTarget),
                                     parseDouble(file, "DEC_TARG", decTarget));
        }

        return new ExposureHeader(file, filter, mjd, pidVisit, camera, target, rootname);
    }

    private static String getFilter(final File file,
                                    final Map<String, String> keywordValues)
            throws HeaderReadException {
        String filter = keywordValues.get("FILTER");
        if ((filter == null) || filter.isEmpty()) {
            final String filter1 = keywordValues.get("FILTER1");
            final String filter2 = keywordValues.get("FILTER2");
            if ((filter1 != null) && (! filter1.toUpperCase().startsWith("CLEAR"))) {
                filter = filter1;
            } else if ((filter2 != null) && (! filter2.toUpperCase().startsWith("CLEAR"))) {
                filter = filter2;
            }
        }
        if ((filter == null) || filter.isEmpty()) {
            throw new HeaderReadException(file, "missing FILTER or FILTER1/FILTER2 keywords");
        }
        return filter;
    }

    private static String getRequiredValue(final File file,
                                           final Map<String, String> keywordValues,
                                           final String keyword)
            throws HeaderReadException {
        final String value = keywordValues.get(keyword);
        if ((value == null) || value.isEmpty()) {
            throw new HeaderReadException(file, "missing " + keyword + " keyword");
        }
        return value;
    }

    private static double parseDouble(final File file,
                                      final String keyword,
                                      final String value)
            throws HeaderReadException {
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw new HeaderReadException(file, keyword + " value '" + value + "' is not numeric");
        }
    }
}
