package com.publishpipe.publisher.plugin;

/**
 * Thrown by a plugin when one of its hooks cannot complete
 * (missing source file, unwritable publish folder, ...).
 *
 * Unchecked: work units pass it through untouched and only the pipeline
 * driver decides whether a failure aborts the run.
 */
public class PluginException extends RuntimeException {

    public enum Stage { ACCEPT, VALIDATE, PUBLISH, FINALIZE }

    private final Stage stage;

    public PluginException(Stage stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public PluginException(Stage stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public Stage getStage() { return stage; }
}
