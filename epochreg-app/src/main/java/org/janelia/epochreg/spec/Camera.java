package org.janelia.epochreg.spec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capabilities of the supported camera channels, keyed by the instrument and detector
 * identifiers found in exposure metadata.
 *
 * @author Eric Trautman
 */
public enum Camera {

    WFC3_IR("WFC3-IR", "WFC3", "IR", true, 90.0),
    WFC3_UVIS("WFC3-UVIS", "WFC3", "UVIS", false, 115.0),
    ACS_WFC("ACS-WFC", "ACS", "WFC", false, 145.0);

    private final String label;
    private final String instrument;
    private final String detector;
    private final boolean infrared;
    private final double fieldRadiusArcsec;

    Camera(final String label,
           final String instrument,
           final String detector,
           final boolean infrared,
           final double fieldRadiusArcsec) {
        this.label = label;
        this.instrument = instrument;
        this.detector = detector;
        this.infrared = infrared;
        this.fieldRadiusArcsec = fieldRadiusArcsec;
    }

    public String getLabel() {
        return label;
    }

    public boolean isInfrared() {
        return infrared;
    }

    /**
     * @return approximate radius (in arcseconds) of the camera's field of view,
     *         used to decide whether a target falls on an exposure.
     */
    public double getFieldRadiusArcsec() {
        return fieldRadiusArcsec;
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * @return camera with the specified label (e.g. 'WFC3-IR').
     *
     * @throws IllegalArgumentException
     *   if no camera has the label.
     */
    public static Camera fromLabel(final String label)
            throws IllegalArgumentException {
        for (final Camera camera : values()) {
            if (camera.label.equalsIgnoreCase(label)) {
                return camera;
            }
        }
        throw new IllegalArgumentException("unknown camera label '" + label + "'");
    }

    /**
     * @return camera identified by the specified metadata values or null if they do not identify a known camera.
     */
    public static Camera fromInstrument(final String instrument,
                                        final String detector) {
        Camera match = null;
        if ((instrument != null) && (detector != null)) {
            for (final Camera camera : values()) {
                if (camera.instrument.equalsIgnoreCase(instrument.trim()) &&
                    camera.detector.equalsIgnoreCase(detector.trim())) {
                    match = camera;
                    break;
                }
            }
        }
        return match;
    }

    /**
     * Infers the camera from file naming conventions.
     * This only exists for legacy inputs whose headers lack instrument or detector keywords.
     *
     * <pre>
     *     rootname starting with 'i' : WFC3, IR for 'f1..' filters unless the file is CTE corrected (flc)
     *     rootname starting with 'j' : ACS-WFC
     * </pre>
     *
     * @return inferred camera or null if nothing could be inferred.
     */
    public static Camera fromLegacyNames(final String rootname,
                                         final String filename,
                                         final String filter) {
        Camera camera = null;
        final String lowerRootname = rootname == null ? "" : rootname.toLowerCase();
        if (lowerRootname.startsWith("i")) {
            if ((filename != null) && filename.endsWith("flc.fits")) {
                camera = WFC3_UVIS;
            } else if ((filter != null) && filter.toLowerCase().startsWith("f1")) {
                camera = WFC3_IR;
            } else {
                camera = WFC3_UVIS;
            }
        } else if (lowerRootname.startsWith("j")) {
            camera = ACS_WFC;
        }
        return camera;
    }

    /**
     * @return camera identified by metadata, falling back to {@link #fromLegacyNames} when metadata is insufficient.
     */
    public static Camera resolve(final String instrument,
                                 final String detector,
                                 final String rootname,
                                 final String filename,
                                 final String filter) {
        Camera camera = fromInstrument(instrument, detector);
        if (camera == null) {
            camera = fromLegacyNames(rootname, filename, filter);
            LOG.debug("resolve: instrument={}, detector={} not recognized, inferred {} from names of {}",
                      instrument, detector, camera, filename);
        }
        return camera;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Camera.class);
}
