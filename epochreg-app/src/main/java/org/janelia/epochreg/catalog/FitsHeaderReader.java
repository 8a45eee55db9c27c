package org.janelia.epochreg.catalog;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;

import org.janelia.epochreg.error.HeaderReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads primary header keywords from FITS files.
 *
 * @author Eric Trautman
 */
public class FitsHeaderReader
        implements HeaderReader {

    @Override
    public Map<String, String> readPrimaryHeader(final File imageFile)
            throws HeaderReadException {

        if (! imageFile.canRead()) {
            throw new HeaderReadException(imageFile, "file is not readable");
        }

        final Map<String, String> keywordValues = new LinkedHashMap<>();

        try (final Fits fits = new Fits(imageFile)) {

            final BasicHDU<?> primaryHdu = fits.getHDU(0);
            if (primaryHdu == null) {
                throw new HeaderReadException(imageFile, "no primary HDU found");
            }

            final Header header = primaryHdu.getHeader();
            final Cursor<String, HeaderCard> cursor = header.iterator();
            while (cursor.hasNext()) {
                final HeaderCard card = cursor.next();
                final String key = card.getKey() == null ? null : card.getKey().trim().toUpperCase();
                final String value = card.getValue();
                // first occurrence wins for repeated keywords
                if ((key != null) && (value != null) && (! keywordValues.containsKey(key))) {
                    keywordValues.put(key, value.trim());
                }
            }

        } catch (final FitsException | IOException e) {
            throw new HeaderReadException(imageFile, e);
        }

        LOG.debug("readPrimaryHeader: read {} keywords from {}", keywordValues.size(), imageFile);

        return keywordValues;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitsHeaderReader.class);
}
