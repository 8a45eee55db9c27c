package org.janelia.epochreg.client.tool;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.json.JsonUtils;

/**
 * Maps each external operation name to the command that performs it.
 *
 * <pre>
 *     {
 *       "tools": {
 *         "combine": { "command": [ "/opt/hst/bin/run_combine.sh" ], "timeoutSeconds": 7200 },
 *         "align":   { "command": [ "python", "/opt/hst/bin/align.py" ] },
 *         ...
 *       }
 *     }
 * </pre>
 *
 * Each command is invoked with two extra arguments: the request file and the response file.
 *
 * @author Eric Trautman
 */
public class ExternalToolConfiguration
        implements Serializable {

    public static final String COMBINE = "combine";
    public static final String CLEAN_HOT_PIXELS = "cleanHotPixels";
    public static final String ALIGN = "align";
    public static final String MAKE_SOURCE_CATALOG = "makeSourceCatalog";
    public static final String PROPAGATE_WCS = "propagateWcs";
    public static final String SUBTRACT = "subtract";
    public static final String COMBINE_WEIGHTS = "combineWeights";
    public static final String UNION_MASK = "unionMask";
    public static final String APPLY_MASK = "applyMask";
    public static final String WEIGHTED_AVERAGE = "weightedAverage";
    public static final String MAKE_SCALED_TEMPLATE = "makeScaledTemplate";

    public static class ToolCommand
            implements Serializable {

        private final List<String> command;
        private final Long timeoutSeconds;

        @SuppressWarnings("unused")
        private ToolCommand() {
            this(new ArrayList<>(), null);
        }

        public ToolCommand(final List<String> command,
                           final Long timeoutSeconds) {
            this.command = command;
            this.timeoutSeconds = timeoutSeconds;
        }

        public List<String> getCommand() {
            return command;
        }

        /**
         * @return maximum run time in seconds or null if the command may run indefinitely.
         */
        public Long getTimeoutSeconds() {
            return timeoutSeconds;
        }
    }

    private final Map<String, ToolCommand> tools;

    public ExternalToolConfiguration() {
        this.tools = new TreeMap<>();
    }

    public void addTool(final String operationName,
                        final ToolCommand toolCommand) {
        tools.put(operationName, toolCommand);
    }

    /**
     * @throws ConfigurationException
     *   if no command is configured for the operation.
     */
    public ExternalTool getTool(final String operationName)
            throws ConfigurationException {
        final ToolCommand toolCommand = tools.get(operationName);
        if ((toolCommand == null) || (toolCommand.getCommand() == null) || toolCommand.getCommand().isEmpty()) {
            throw new ConfigurationException("no command is configured for the '" + operationName +
                                             "' operation, configured operations are " + tools.keySet());
        }
        return new ExternalTool(operationName, toolCommand.getCommand(), toolCommand.getTimeoutSeconds());
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static ExternalToolConfiguration fromJsonFile(final File file)
            throws IOException {
        return JSON_HELPER.fromJsonFile(file.getAbsoluteFile());
    }

    private static final JsonUtils.Helper<ExternalToolConfiguration> JSON_HELPER =
            new JsonUtils.Helper<>(ExternalToolConfiguration.class);
}
