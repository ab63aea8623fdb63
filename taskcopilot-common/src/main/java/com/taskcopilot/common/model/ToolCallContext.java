package com.taskcopilot.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.infra.ToolClassifier;
import com.taskcopilot.common.infra.ToolInputs;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single intercepted tool call. Handed to pre-action hooks and to security
 * rules; immutable for the lifetime of one dispatch.
 * <p>
 * The tool input is held as a JSON tree (strings, numbers, nested objects,
 * arrays). Callers get a copy, never the instance held by the context.
 */
@Value
@Builder(toBuilder = true)
public class ToolCallContext {

    String toolName;

    JsonNode toolInput;

    @Builder.Default
    Instant timestamp = Instant.now();

    String agentId;

    String taskId;

    String initiativeId;

    Map<String, Object> metadata;

    /**
     * Shorthand for a context with only a tool name and its input.
     */
    public static ToolCallContext of(String toolName, Map<String, ?> toolInput) {
        return builder().toolName(toolName).toolInput(toolInput).build();
    }

    public JsonNode getToolInput() {
        return toolInput == null ? ToolInputs.empty() : toolInput.deepCopy();
    }

    public Map<String, Object> getMetadata() {
        return metadata == null ? Map.of() : metadata;
    }

    /** File paths named by the input ({@code file_path}, {@code path}, {@code files[]}). */
    public List<String> getFilePaths() {
        return ToolInputs.extractFilePaths(toolInput);
    }

    public boolean isWriteOperation() {
        return ToolClassifier.isFileWriteTool(toolName);
    }

    public boolean isCommandExecution() {
        return ToolClassifier.isCommandExecutionTool(toolName);
    }

    /** Every string value in the input, depth-first. */
    public List<String> extractStrings() {
        return ToolInputs.extractStrings(toolInput);
    }

    public static class ToolCallContextBuilder {

        public ToolCallContextBuilder toolInput(JsonNode toolInput) {
            this.toolInput = ToolInputs.copyOf(toolInput);
            return this;
        }

        public ToolCallContextBuilder toolInput(Map<String, ?> toolInput) {
            this.toolInput = ToolInputs.of(toolInput);
            return this;
        }

        public ToolCallContextBuilder metadata(Map<String, ?> metadata) {
            this.metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
            return this;
        }
    }
}
