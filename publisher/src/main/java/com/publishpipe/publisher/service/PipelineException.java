package com.publishpipe.publisher.service;

import com.publishpipe.publisher.model.WorkUnit;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link PublishPipeline} when a run has to stop: validation
 * failed for one or more units, or a publish/finalize hook threw.
 */
public class PipelineException extends RuntimeException {

    public enum Stage { VALIDATE, PUBLISH, FINALIZE }

    private final Stage stage;
    private final List<WorkUnit> failedUnits;

    public PipelineException(Stage stage, List<WorkUnit> failedUnits) {
        super("[" + stage + "] failed for " + describe(failedUnits));
        this.stage       = stage;
        this.failedUnits = List.copyOf(failedUnits);
    }

    public PipelineException(Stage stage, WorkUnit failedUnit, Throwable cause) {
        super("[" + stage + "] failed for " + failedUnit + ": " + cause.getMessage(), cause);
        this.stage       = stage;
        this.failedUnits = List.of(failedUnit);
    }

    public Stage          getStage()       { return stage; }
    public List<WorkUnit> getFailedUnits() { return failedUnits; }

    private static String describe(List<WorkUnit> units) {
        return units.stream().map(WorkUnit::toString).collect(Collectors.joining(", "));
    }
}
