package com.publishpipe.publisher.service;

import com.publishpipe.publisher.item.PublishItem;
import com.publishpipe.publisher.model.WorkUnit;
import com.publishpipe.publisher.plugin.PublishPlugin;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sequential driver for a set of work units.
 *
 * Stage order for one run:
 * <pre>
 *   accept (any number of times) → validate → publish → finalize
 * </pre>
 * Only units that are both accepted and checked take part in validate and
 * later stages. Publish and finalize abort the run on the first exception;
 * whether a failed validation stops the run is configurable with
 * {@code publisher.pipeline.stop-on-validation-failure}.
 *
 * <p>Every validate/publish/finalize call is timed and counted:
 * <pre>
 *   publisher.stage.calls{stage, plugin, status="success|failed|error"}
 *   publisher.stage.duration{stage, plugin}
 * </pre>
 *
 * Units stay bound until {@link #unbind} or {@link #clear()}; a session
 * that is done publishing should clear the pipeline.
 *
 * <p>Not thread-safe: one thread owns the pipeline, as it owns the units.
 */
@Service
public class PublishPipeline {

    private static final Logger log = LoggerFactory.getLogger(PublishPipeline.class);

    private final MeterRegistry meterRegistry;
    private final boolean       stopOnValidationFailure;

    private final List<WorkUnit> units = new ArrayList<>();

    public PublishPipeline(
            MeterRegistry meterRegistry,
            @Value("${publisher.pipeline.stop-on-validation-failure:true}") boolean stopOnValidationFailure) {
        this.meterRegistry           = meterRegistry;
        this.stopOnValidationFailure = stopOnValidationFailure;
    }

    // ------------------------------------------------------------------
    // Units
    // ------------------------------------------------------------------

    /** Pair a plugin with an item and keep the resulting unit. */
    public WorkUnit bind(PublishPlugin plugin, PublishItem item, Map<String, Object> settings) {
        WorkUnit unit = WorkUnit.create(plugin, item, settings);
        units.add(unit);
        return unit;
    }

    public List<WorkUnit> units() {
        return Collections.unmodifiableList(units);
    }

    /**
     * Drop a unit from the pipeline and from its plugin's bound units.
     *
     * @return false if the unit was not bound through this pipeline
     */
    public boolean unbind(WorkUnit unit) {
        if (!units.remove(unit)) {
            return false;
        }
        unit.getPlugin().removeWorkUnit(unit);
        return true;
    }

    /**
     * Unbind every unit. Call between publish sessions: the pipeline and its
     * plugins are singletons, so units left bound would run again next time.
     */
    public void clear() {
        for (WorkUnit unit : List.copyOf(units)) {
            unbind(unit);
        }
        log.debug("Pipeline cleared");
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    /**
     * Re-run acceptance on every unit. Call again after changing settings.
     *
     * @return number of units accepted after this pass
     */
    public int acceptAll() {
        units.forEach(WorkUnit::accept);
        int accepted = countAccepted();
        log.info("Acceptance pass: {}/{} units accepted", accepted, units.size());
        return accepted;
    }

    /**
     * Validate every accepted, checked unit.
     *
     * A validation hook that throws counts as a failure here; the exception is
     * logged and the remaining units are still validated.
     *
     * @return units that did not pass, in pipeline order
     */
    public List<WorkUnit> validateAll() {
        List<WorkUnit> failed = new ArrayList<>();
        for (WorkUnit unit : runnable()) {
            Timer.Sample sample = Timer.start(meterRegistry);
            String status = "success";
            try {
                if (!unit.validate()) {
                    status = "failed";
                    failed.add(unit);
                    log.warn("Validation failed for {}", unit);
                }
            } catch (RuntimeException e) {
                status = "error";
                failed.add(unit);
                log.warn("Validation of {} threw: {}", unit, e.getMessage(), e);
            } finally {
                record("validate", unit, sample, status);
            }
        }
        return failed;
    }

    /**
     * Validate, then publish and finalize every unit that passed.
     *
     * @throws PipelineException if validation failed and the pipeline is set
     *                           to stop on it, or a publish/finalize hook threw
     */
    public PipelineReport publishAll() {
        List<WorkUnit> candidates = runnable();
        List<WorkUnit> failed     = validateAll();

        if (!failed.isEmpty() && stopOnValidationFailure) {
            throw new PipelineException(PipelineException.Stage.VALIDATE, failed);
        }

        List<WorkUnit> ready = candidates.stream()
                .filter(u -> !failed.contains(u))
                .toList();

        for (WorkUnit unit : ready) {
            runStage(PipelineException.Stage.PUBLISH, unit, unit::execute);
        }
        for (WorkUnit unit : ready) {
            runStage(PipelineException.Stage.FINALIZE, unit, unit::finalizeUnit);
        }

        PipelineReport report = new PipelineReport(
                countAccepted(), ready.size(), failed.size(), ready.size(), ready.size());
        log.info("Publish run complete: {}", report);
        return report;
    }

    /** One full pass: accept everything, then {@link #publishAll()}. */
    public PipelineReport run() {
        acceptAll();
        return publishAll();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<WorkUnit> runnable() {
        return units.stream()
                .filter(u -> u.isAccepted() && u.isChecked())
                .toList();
    }

    private int countAccepted() {
        return (int) units.stream().filter(WorkUnit::isAccepted).count();
    }

    private void runStage(PipelineException.Stage stage, WorkUnit unit, Runnable action) {
        String stageTag = stage.name().toLowerCase(Locale.ROOT);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            action.run();
        } catch (RuntimeException e) {
            status = "error";
            log.error("{} failed for {}", stageTag, unit, e);
            throw new PipelineException(stage, unit, e);
        } finally {
            record(stageTag, unit, sample, status);
        }
    }

    private void record(String stage, WorkUnit unit, Timer.Sample sample, String status) {
        String plugin = unit.getPlugin().name();
        sample.stop(meterRegistry.timer("publisher.stage.duration",
                "stage", stage, "plugin", plugin));
        meterRegistry.counter("publisher.stage.calls",
                "stage", stage, "plugin", plugin, "status", status).increment();
    }
}
