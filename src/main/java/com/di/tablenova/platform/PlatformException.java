package com.di.tablenova.platform;

/** A tool call against the tabular-data platform failed. */
public class PlatformException extends RuntimeException {

    private final String tool;

    public PlatformException(String tool, String message, Throwable cause) {
        super("Platform tool " + tool + " failed: " + message, cause);
        this.tool = tool;
    }

    public String getTool() {
        return tool;
    }
}
