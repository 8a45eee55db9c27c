package org.janelia.epochreg.catalog;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.spec.Camera;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.FilterCombination;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persisted exposure and epoch list that caches epoch assignment between runs.
 *
 * <pre>
 *     # filename            filter camera    epoch pidvisit  mjd               ontarget FEVgroup              FEgroup
 *     ibsd01abq_flt.fits    f160w  WFC3-IR   0     12099_A1  55300.2345        1        f160w_e00_12099_A1    f160w_e00
 * </pre>
 *
 * Exposures are restored from the persisted columns alone (headers are not read again).
 * The group key columns are written for people reading the file and are checked on load.
 *
 * @author Eric Trautman
 */
public class EpochListFile {

    static final String HEADER_LINE =
            "# filename            filter camera    epoch pidvisit  mjd               ontarget FEVgroup              FEgroup";

    private static final String NO_CAMERA = "-";

    private final File file;

    public EpochListFile(final File file) {
        this.file = file.getAbsoluteFile();
    }

    public File getFile() {
        return file;
    }

    public boolean exists() {
        return file.exists();
    }

    /**
     * Writes the specified exposures sorted by mjd, replacing any existing file.
     *
     * @throws IOException
     *   if the file cannot be written.
     */
    public void persist(final List<Exposure> exposureList)
            throws IOException {

        final List<Exposure> sortedList = new ArrayList<>(exposureList);
        sortedList.sort(Exposure.MJD_COMPARATOR);

        final File parentDirectory = file.getParentFile();
        if (parentDirectory != null) {
            FileUtil.ensureWritableDirectory(parentDirectory);
        }

        try (final Writer writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(file)) {
            writer.write(HEADER_LINE);
            writer.write('\n');
            for (final Exposure exposure : sortedList) {
                writer.write(formatRow(exposure));
                writer.write('\n');
            }
        }

        LOG.info("persist: saved {} exposures to {}", sortedList.size(), file);
    }

    /**
     * @param  exposureDirectory  directory that holds the listed exposure files.
     * @param  filterCombination  drizzle combinations relabel member filters.
     *
     * @return exposures restored from this file.
     *
     * @throws IOException
     *   if the file cannot be read or contains malformed rows.
     */
    public List<Exposure> load(final File exposureDirectory,
                               final FilterCombination filterCombination)
            throws IOException {

        final FilterCombination combination = filterCombination == null ? FilterCombination.NONE : filterCombination;
        final List<Exposure> exposureList = new ArrayList<>();

        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(file);
             final BufferedReader bufferedReader = new BufferedReader(reader)) {

            String line;
            int lineNumber = 0;
            while ((line = bufferedReader.readLine()) != null) {
                lineNumber++;
                final String trimmedLine = line.trim();
                if (trimmedLine.isEmpty() || trimmedLine.startsWith("#")) {
                    continue;
                }
                exposureList.add(parseRow(trimmedLine, lineNumber, exposureDirectory, combination));
            }
        }

        LOG.info("load: loaded {} exposures from {}", exposureList.size(), file);

        return exposureList;
    }

    static String formatRow(final Exposure exposure) {
        final Camera camera = exposure.getCamera();
        return String.format("%-21s %-6s %-9s %-5d %-9s %-17s %-8d %-21s %s",
                             exposure.getFilename(),
                             exposure.getObservedFilter(),
                             camera == null ? NO_CAMERA : camera.getLabel(),
                             exposure.getEpoch(),
                             exposure.getPidVisit(),
                             Double.toString(exposure.getMjd()),
                             exposure.isOnTarget() ? 1 : 0,
                             exposure.getFevGroup(),
                             exposure.getFeGroup());
    }

    private Exposure parseRow(final String line,
                              final int lineNumber,
                              final File exposureDirectory,
                              final FilterCombination combination)
            throws IOException {

        final String[] columns = line.split("\\s+");
        if (columns.length < 7) {
            throw new IOException("line " + lineNumber + " of " + file + " has " + columns.length +
                                  " columns but at least 7 are required");
        }

        final Exposure exposure;
        try {
            final String observedFilter = columns[1];
            final Camera camera = NO_CAMERA.equals(columns[2]) ? null : Camera.fromLabel(columns[2]);
            exposure = new Exposure(new File(exposureDirectory, columns[0]).getAbsolutePath(),
                                    observedFilter,
                                    combination.getGroupFilter(observedFilter),
                                    camera,
                                    Double.parseDouble(columns[5]),
                                    columns[4],
                                    ! "0".equals(columns[6]),
                                    Integer.parseInt(columns[3]));
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse line " + lineNumber + " of " + file, e);
        }

        if ((columns.length > 8) && (! combination.isActive())) {
            if (! (columns[7].equals(exposure.getFevGroup()) && columns[8].equals(exposure.getFeGroup()))) {
                LOG.warn("parseRow: persisted groups {} and {} on line {} differ from derived groups {} and {}",
                         columns[7], columns[8], lineNumber, exposure.getFevGroup(), exposure.getFeGroup());
            }
        }

        return exposure;
    }

    private static final Logger LOG = LoggerFactory.getLogger(EpochListFile.class);
}
