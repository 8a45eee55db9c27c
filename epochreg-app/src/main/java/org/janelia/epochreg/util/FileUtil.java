package org.janelia.epochreg.util;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    public static final FileUtil DEFAULT_INSTANCE = new FileUtil();

    private final int bufferSize;

    public FileUtil() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public FileUtil(final int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public Reader getExtensionBasedReader(final File file)
            throws IOException {

        final InputStream inputStream;

        if (file.getName().endsWith(".gz")) {
            inputStream = new GZIPInputStream(new FileInputStream(file));
        } else {
            inputStream = new BufferedInputStream(new FileInputStream(file), bufferSize);
        }

        return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
    }

    public Writer getExtensionBasedWriter(final File file)
            throws IOException {

        final OutputStream outputStream;

        if (file.getName().endsWith(".gz")) {
            outputStream = new GZIPOutputStream(new FileOutputStream(file));
        } else {
            outputStream = new BufferedOutputStream(new FileOutputStream(file), bufferSize);
        }

        return new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Copies the source file into the target directory.
     *
     * @param  sourceFile       file to copy.
     * @param  targetDirectory  directory for the copy (created if necessary).
     * @param  overwrite        if true, replace an existing copy; otherwise leave it alone.
     *
     * @return true if the file was copied; false if an existing copy was kept.
     *
     * @throws IOException
     *   if the copy fails.
     */
    public static boolean copyToDirectory(final File sourceFile,
                                          final File targetDirectory,
                                          final boolean overwrite)
            throws IOException {

        final File targetFile = new File(targetDirectory, sourceFile.getName());

        if (targetFile.exists() && (! overwrite)) {
            LOG.debug("copyToDirectory: keeping existing {}", targetFile);
            return false;
        }

        ensureWritableDirectory(targetDirectory);
        FileUtils.copyFile(sourceFile, targetFile);

        LOG.debug("copyToDirectory: copied {} to {}", sourceFile, targetDirectory);

        return true;
    }

    /**
     * Removes the specified file if it exists.
     *
     * @return true if a file was removed.
     *
     * @throws IOException
     *   if an existing file cannot be removed.
     */
    public static boolean deleteIfExists(final File file)
            throws IOException {
        boolean deleted = false;
        if (file.exists()) {
            FileUtils.forceDelete(file);
            LOG.info("deleted {}", file.getAbsolutePath());
            deleted = true;
        }
        return deleted;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int DEFAULT_BUFFER_SIZE = 65536;

}
