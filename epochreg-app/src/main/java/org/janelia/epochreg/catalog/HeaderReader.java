package org.janelia.epochreg.catalog;

import java.io.File;
import java.util.Map;

import org.janelia.epochreg.error.HeaderReadException;

/**
 * Reads primary header keywords from an image file.
 *
 * @author Eric Trautman
 */
public interface HeaderReader {

    /**
     * @param  imageFile  image file to read.
     *
     * @return map of upper case keyword names to trimmed (unquoted) values for the file's primary header.
     *
     * @throws HeaderReadException
     *   if the file cannot be read.
     */
    Map<String, String> readPrimaryHeader(final File imageFile)
            throws HeaderReadException;

    /**
     * @return value of the specified keyword or null if the header does not contain it.
     */
    default String getStringValue(final File imageFile,
                                  final String keyword)
            throws HeaderReadException {
        return readPrimaryHeader(imageFile).get(keyword);
    }

    /**
     * @return numeric value of the specified keyword or null if the header does not contain it.
     *
     * @throws HeaderReadException
     *   if the value is not numeric.
     */
    default Double getDoubleValue(final File imageFile,
                                  final String keyword)
            throws HeaderReadException {
        final String value = getStringValue(imageFile, keyword);
        try {
            return value == null ? null : Double.valueOf(value);
        } catch (final NumberFormatException e) {
            throw new HeaderReadException(imageFile, keyword + " value '" + value + "' is not numeric");
        }
    }

}
