package org.janelia.epochreg.client.tool;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.epochreg.json.JsonUtils;

/**
 * Values written by an external tool to its response file.
 *
 * <pre>
 *     { "status": "OK", "values": { "science": "..." }, "files": [ ... ] }
 * </pre>
 *
 * @author Eric Trautman
 */
public class ExternalToolResponse
        implements Serializable {

    public static final String OK = "OK";

    private final String status;
    private final String message;
    private final Map<String, String> values;
    private final List<String> files;

    public ExternalToolResponse() {
        this(OK, null, new HashMap<>(), new ArrayList<>());
    }

    public ExternalToolResponse(final String status,
                                final String message,
                                final Map<String, String> values,
                                final List<String> files) {
        this.status = status;
        this.message = message;
        this.values = values;
        this.files = files;
    }

    public String getStatus() {
        return status == null ? OK : status;
    }

    public String getMessage() {
        return message;
    }

    public String getValue(final String key) {
        return values == null ? null : values.get(key);
    }

    /**
     * @return the named value as a file (resolved against the working directory when relative),
     *         or the default file if the value is missing.
     */
    public File getFile(final String key,
                        final File workingDirectory,
                        final File defaultFile) {
        final String value = getValue(key);
        final File file;
        if (value == null) {
            file = defaultFile;
        } else {
            final File valueFile = new File(value);
            file = valueFile.isAbsolute() ? valueFile : new File(workingDirectory, value);
        }
        return file;
    }

    public List<String> getFiles() {
        return files == null ? new ArrayList<>() : files;
    }

    public static ExternalToolResponse fromJsonFile(final File file)
            throws IOException {
        return JSON_HELPER.fromJsonFile(file);
    }

    private static final JsonUtils.Helper<ExternalToolResponse> JSON_HELPER =
            new JsonUtils.Helper<>(ExternalToolResponse.class);
}
