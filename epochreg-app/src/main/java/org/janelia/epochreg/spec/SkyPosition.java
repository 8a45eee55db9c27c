package org.janelia.epochreg.spec;

import java.io.Serializable;

/**
 * Equatorial sky coordinates in decimal degrees.
 *
 * @author Eric Trautman
 */
public class SkyPosition
        implements Serializable {

    private final double ra;
    private final double dec;

    public SkyPosition(final double ra,
                       final double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    /**
     * @return great circle distance in arcseconds between this position and the other position (haversine).
     */
    public double getSeparationArcsec(final SkyPosition that) {
        final double ra1 = Math.toRadians(this.ra);
        final double ra2 = Math.toRadians(that.ra);
        final double dec1 = Math.toRadians(this.dec);
        final double dec2 = Math.toRadians(that.dec);
        final double sinHalfDeltaDec = Math.sin((dec2 - dec1) / 2.0);
        final double sinHalfDeltaRa = Math.sin((ra2 - ra1) / 2.0);
        final double a = (sinHalfDeltaDec * sinHalfDeltaDec) +
                         (Math.cos(dec1) * Math.cos(dec2) * sinHalfDeltaRa * sinHalfDeltaRa);
        final double radians = 2.0 * Math.asin(Math.min(1.0, Math.sqrt(a)));
        return Math.toDegrees(radians) * 3600.0;
    }

    @Override
    public String toString() {
        return String.format("%.6f,%.6f", ra, dec);
    }
}
