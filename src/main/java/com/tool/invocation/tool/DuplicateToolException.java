package com.tool.invocation.tool;

/**
 * Thrown when a tool is registered under a name that is already taken.
 */
public class DuplicateToolException extends IllegalStateException {

    private final String toolName;

    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
