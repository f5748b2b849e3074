package com.publishpipe.publisher.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.publishpipe.publisher.item.PublishItem;
import com.publishpipe.publisher.plugin.PublishPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One plugin operating on one item: the unit the publish pipeline actually
 * accepts, validates, publishes and finalizes.
 *
 * A unit carries four flags that the UI and the driver read:
 * <pre>
 *   accepted — the plugin accepted the item in the current acceptance episode
 *   visible  — the unit is shown to the user (hidden units still run)
 *   enabled  — the user may toggle {@code checked}
 *   checked  — the unit is slated to run
 * </pre>
 *
 * Only {@link #accept()} changes them from plugin output. {@code checked} is
 * taken from the plugin once per acceptance episode, when the unit goes from
 * not-accepted to accepted; later accept passes leave the user's choice alone.
 * A rejection forces the unit off and locks it.
 *
 * <p>Not thread-safe. One driver thread owns a unit for its whole life.
 */
public class WorkUnit {

    private static final Logger log = LoggerFactory.getLogger(WorkUnit.class);

    // Shared: only used to render diagnostic payloads for the log.
    private static final ObjectMapper JSON = new ObjectMapper();

    /** MDC key carrying a plugin's diagnostic payload on accept/reject log lines. */
    public static final String EXTRA_INFO_MDC_KEY = "extra_info";

    private final PublishPlugin plugin;
    private final PublishItem   item;
    private Map<String, Object> settings;

    private boolean accepted = false;
    private boolean visible  = true;
    private boolean enabled  = true;
    private boolean checked  = true;

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    private WorkUnit(PublishPlugin plugin, PublishItem item, Map<String, Object> settings) {
        this.plugin   = Objects.requireNonNull(plugin, "plugin");
        this.item     = Objects.requireNonNull(item, "item");
        this.settings = settings == null ? new HashMap<>() : settings;
    }

    /**
     * Create a unit and register it with its plugin, then with its item.
     *
     * Registration is all-or-nothing: if the item refuses the unit, the
     * plugin registration is removed again before the failure is reported.
     *
     * @throws WorkUnitRegistrationException if either registration throws
     */
    public static WorkUnit create(PublishPlugin plugin, PublishItem item, Map<String, Object> settings) {
        WorkUnit unit = new WorkUnit(plugin, item, settings);

        try {
            plugin.addWorkUnit(unit);
        } catch (RuntimeException e) {
            throw new WorkUnitRegistrationException(
                    "Plugin '" + plugin.name() + "' refused " + unit, e);
        }

        try {
            item.addWorkUnit(unit);
        } catch (RuntimeException e) {
            WorkUnitRegistrationException failure = new WorkUnitRegistrationException(
                    "Item '" + item.name() + "' refused " + unit, e);
            try {
                plugin.removeWorkUnit(unit);
            } catch (RuntimeException rollback) {
                failure.addSuppressed(rollback);
            }
            throw failure;
        }

        log.debug("Created {}", unit);
        return unit;
    }

    /** True if both units wrap the very same plugin instance. */
    public boolean isSameType(WorkUnit other) {
        return this.plugin == other.plugin;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Ask the plugin whether it accepts the item and update the flags.
     * Safe to call any number of times, e.g. once per settings edit.
     */
    public void accept() {
        AcceptResult result = plugin.runAccept(settings, item);
        if (result == null) {
            result = AcceptResult.ofRejected();
        }

        if (result.accepted()) {
            report("Plugin: '{}' - Accepted: {}", result);

            visible = result.visibleOrDefault();
            enabled = result.enabledOrDefault();

            // Keep the user's checked-state while the unit stays accepted.
            if (!accepted) {
                accepted = true;
                checked  = result.checkedOrDefault();
            }
        } else {
            report("Plugin: '{}' - Rejected: {}", result);

            // visible is left as it was
            accepted = false;
            enabled  = false;
            checked  = false;
        }
    }

    /**
     * @return the plugin's verdict, unchanged
     */
    public boolean validate() {
        return plugin.runValidate(settings, item);
    }

    public void execute() {
        plugin.runPublish(settings, item);
    }

    /**
     * Run the plugin's finalize hook. ({@code finalize()} itself belongs to
     * {@link Object}.)
     */
    public void finalizeUnit() {
        plugin.runFinalize(settings, item);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public PublishPlugin getPlugin()   { return plugin; }
    public PublishItem   getItem()     { return item; }
    public boolean       isAccepted()  { return accepted; }
    public boolean       isVisible()   { return visible; }
    public boolean       isEnabled()   { return enabled; }
    public boolean       isChecked()   { return checked; }

    public Map<String, Object> getSettings()              { return settings; }
    public void setSettings(Map<String, Object> settings) { this.settings = settings == null ? new HashMap<>() : settings; }

    /**
     * User toggle. Ignored while the unit is disabled.
     *
     * @return true if the value was applied
     */
    public boolean setChecked(boolean checked) {
        if (!enabled) {
            log.debug("Ignoring checked={} on disabled {}", checked, this);
            return false;
        }
        this.checked = checked;
        return true;
    }

    @Override
    public String toString() {
        return "<WorkUnit: " + plugin + " for " + item + ">";
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void report(String format, AcceptResult result) {
        Logger pluginLog = plugin.logger();
        if (result.extraInfo().isEmpty()) {
            pluginLog.info(format, plugin.name(), item.name());
            return;
        }
        String previous = MDC.get(EXTRA_INFO_MDC_KEY);
        MDC.put(EXTRA_INFO_MDC_KEY, render(result.extraInfo()));
        try {
            pluginLog.info(format, plugin.name(), item.name());
        } finally {
            if (previous == null) {
                MDC.remove(EXTRA_INFO_MDC_KEY);
            } else {
                MDC.put(EXTRA_INFO_MDC_KEY, previous);
            }
        }
    }

    private static String render(Map<String, Object> extraInfo) {
        try {
            return JSON.writeValueAsString(extraInfo);
        } catch (JsonProcessingException e) {
            log.debug("Diagnostic payload is not JSON-serialisable, using toString(): {}", e.getMessage());
            return extraInfo.toString();
        }
    }
}
