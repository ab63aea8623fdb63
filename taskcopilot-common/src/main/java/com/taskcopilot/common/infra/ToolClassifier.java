package com.taskcopilot.common.infra;

import java.util.Set;

/**
 * Classifies tools by name using explicit allow-lists. Rules only fire for
 * the class of tool they target; anything unlisted is "other".
 */
public final class ToolClassifier {

    private ToolClassifier() {
    }

    public enum ToolClass {
        FILE_WRITE,
        COMMAND_EXECUTION,
        OTHER
    }

    private static final Set<String> FILE_WRITE_TOOLS = Set.of("Edit", "Write", "work_product_store");

    private static final Set<String> COMMAND_TOOLS = Set.of("Bash", "Run", "Execute");

    public static boolean isFileWriteTool(String toolName) {
        return toolName != null && FILE_WRITE_TOOLS.contains(toolName);
    }

    public static boolean isCommandExecutionTool(String toolName) {
        return toolName != null && COMMAND_TOOLS.contains(toolName);
    }

    public static ToolClass classify(String toolName) {
        if (isFileWriteTool(toolName))
            return ToolClass.FILE_WRITE;
        if (isCommandExecutionTool(toolName))
            return ToolClass.COMMAND_EXECUTION;
        return ToolClass.OTHER;
    }
}
