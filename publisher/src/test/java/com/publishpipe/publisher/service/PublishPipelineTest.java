package com.publishpipe.publisher.service;

import com.publishpipe.publisher.item.PublishItem;
import com.publishpipe.publisher.item.SimplePublishItem;
import com.publishpipe.publisher.model.AcceptResult;
import com.publishpipe.publisher.model.WorkUnit;
import com.publishpipe.publisher.plugin.AbstractPublishPlugin;
import com.publishpipe.publisher.plugin.PluginException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PublishPipeline.
 * No Spring context; the plugin is a scripted in-test implementation.
 */
class PublishPipelineTest {

    /** Accepts items whose name is not in {@code rejected}; records every call. */
    static class ScriptedPlugin extends AbstractPublishPlugin {
        final Set<String>  rejected      = new HashSet<>();
        final Set<String>  failValidate  = new HashSet<>();
        final Set<String>  throwValidate = new HashSet<>();
        final Set<String>  throwPublish  = new HashSet<>();
        final List<String> calls         = new ArrayList<>();

        ScriptedPlugin() { super("scripted"); }

        @Override
        public AcceptResult runAccept(Map<String, Object> settings, PublishItem item) {
            return rejected.contains(item.name()) ? AcceptResult.ofRejected() : AcceptResult.ofAccepted();
        }

        @Override
        public boolean runValidate(Map<String, Object> settings, PublishItem item) {
            calls.add("validate:" + item.name());
            if (throwValidate.contains(item.name())) {
                throw new PluginException(PluginException.Stage.VALIDATE, "boom");
            }
            return !failValidate.contains(item.name());
        }

        @Override
        public void runPublish(Map<String, Object> settings, PublishItem item) {
            calls.add("publish:" + item.name());
            if (throwPublish.contains(item.name())) {
                throw new PluginException(PluginException.Stage.PUBLISH, "upload refused");
            }
        }

        @Override
        public void runFinalize(Map<String, Object> settings, PublishItem item) {
            calls.add("finalize:" + item.name());
        }
    }

    SimpleMeterRegistry meterRegistry;
    ScriptedPlugin      plugin;
    PublishPipeline     pipeline;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        plugin        = new ScriptedPlugin();
        pipeline      = new PublishPipeline(meterRegistry, true);
    }

    private WorkUnit bind(String itemName) {
        return pipeline.bind(plugin, new SimplePublishItem(itemName, "file"), Map.of());
    }

    // ------------------------------------------------------------------
    // acceptAll()
    // ------------------------------------------------------------------

    @Test
    void acceptAll_countsAcceptedUnits() {
        bind("a");
        bind("b");
        plugin.rejected.add("b");

        assertThat(pipeline.acceptAll()).isEqualTo(1);
        assertThat(pipeline.units()).hasSize(2);
        assertThat(plugin.workUnits()).hasSize(2);
    }

    // ------------------------------------------------------------------
    // run()
    // ------------------------------------------------------------------

    @Test
    void run_happyPath_publishesThenFinalizesInOrder() {
        bind("a");
        bind("b");

        PipelineReport report = pipeline.run();

        assertThat(plugin.calls).containsExactly(
                "validate:a", "validate:b",
                "publish:a", "publish:b",
                "finalize:a", "finalize:b");
        assertThat(report).isEqualTo(new PipelineReport(2, 2, 0, 2, 2));
    }

    @Test
    void run_uncheckedAndRejectedUnits_skipped() {
        bind("a");
        WorkUnit b = bind("b");
        bind("c");
        plugin.rejected.add("c");
        pipeline.acceptAll();
        b.setChecked(false);

        PipelineReport report = pipeline.publishAll();

        assertThat(plugin.calls).containsExactly("validate:a", "publish:a", "finalize:a");
        assertThat(report.accepted()).isEqualTo(2);
        assertThat(report.published()).isEqualTo(1);
    }

    @Test
    void run_neverAcceptedUnit_skipped() {
        bind("a");

        PipelineReport report = pipeline.publishAll();

        assertThat(plugin.calls).isEmpty();
        assertThat(report.published()).isZero();
    }

    // ------------------------------------------------------------------
    // Validation failures
    // ------------------------------------------------------------------

    @Test
    void publishAll_validationFails_stopsBeforePublishing() {
        bind("a");
        WorkUnit b = bind("b");
        plugin.failValidate.add("b");
        pipeline.acceptAll();

        assertThatThrownBy(() -> pipeline.publishAll())
                .isInstanceOf(PipelineException.class)
                .satisfies(e -> {
                    PipelineException pe = (PipelineException) e;
                    assertThat(pe.getStage()).isEqualTo(PipelineException.Stage.VALIDATE);
                    assertThat(pe.getFailedUnits()).containsExactly(b);
                });
        assertThat(plugin.calls).noneMatch(c -> c.startsWith("publish:"));
    }

    @Test
    void publishAll_continueOnValidationFailure_publishesOthers() {
        pipeline = new PublishPipeline(meterRegistry, false);
        bind("a");
        bind("b");
        plugin.throwValidate.add("b");
        pipeline.acceptAll();

        PipelineReport report = pipeline.publishAll();

        assertThat(plugin.calls).contains("publish:a", "finalize:a")
                .doesNotContain("publish:b", "finalize:b");
        assertThat(report).isEqualTo(new PipelineReport(2, 1, 1, 1, 1));
    }

    @Test
    void validateAll_throwingHook_reportedAsFailedAndOthersStillValidated() {
        bind("a");
        bind("b");
        plugin.throwValidate.add("a");
        pipeline.acceptAll();

        List<WorkUnit> failed = pipeline.validateAll();

        assertThat(failed).extracting(u -> u.getItem().name()).containsExactly("a");
        assertThat(plugin.calls).containsExactly("validate:a", "validate:b");
    }

    // ------------------------------------------------------------------
    // Publish failures
    // ------------------------------------------------------------------

    @Test
    void publishAll_publishThrows_abortsWithoutFinalizing() {
        bind("a");
        bind("b");
        plugin.throwPublish.add("a");
        pipeline.acceptAll();

        assertThatThrownBy(() -> pipeline.publishAll())
                .isInstanceOf(PipelineException.class)
                .hasCauseInstanceOf(PluginException.class)
                .hasMessageContaining("upload refused");
        assertThat(plugin.calls).doesNotContain("publish:b")
                .noneMatch(c -> c.startsWith("finalize:"));
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    @Test
    void run_recordsStageCounters() {
        pipeline = new PublishPipeline(meterRegistry, false);
        bind("a");
        bind("b");
        plugin.failValidate.add("b");

        pipeline.run();

        assertThat(meterRegistry.counter("publisher.stage.calls",
                "stage", "validate", "plugin", "scripted", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("publisher.stage.calls",
                "stage", "validate", "plugin", "scripted", "status", "failed").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("publisher.stage.calls",
                "stage", "publish", "plugin", "scripted", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.timer("publisher.stage.duration",
                "stage", "finalize", "plugin", "scripted").count())
                .isEqualTo(1L);
    }

    @Test
    void run_turkishDefaultLocale_stageTagsStayAscii() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            bind("a");

            pipeline.run();
        } finally {
            Locale.setDefault(original);
        }

        assertThat(meterRegistry.counter("publisher.stage.calls",
                "stage", "finalize", "plugin", "scripted", "status", "success").count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // unbind() / clear()
    // ------------------------------------------------------------------

    @Test
    void clear_betweenSessions_secondRunPublishesOnlyNewItems() {
        bind("x0");
        pipeline.run();
        pipeline.clear();

        bind("x1");
        plugin.calls.clear();
        PipelineReport report = pipeline.run();

        assertThat(plugin.calls).containsExactly("validate:x1", "publish:x1", "finalize:x1");
        assertThat(report.published()).isEqualTo(1);
        assertThat(pipeline.units()).extracting(u -> u.getItem().name()).containsExactly("x1");
        assertThat(plugin.workUnits()).extracting(u -> u.getItem().name()).containsExactly("x1");
    }

    @Test
    void unbind_removesFromPipelineAndPlugin() {
        WorkUnit a = bind("a");
        bind("b");

        assertThat(pipeline.unbind(a)).isTrue();

        assertThat(pipeline.units()).doesNotContain(a);
        assertThat(plugin.workUnits()).doesNotContain(a).hasSize(1);
        assertThat(pipeline.unbind(a)).isFalse();
    }
}
