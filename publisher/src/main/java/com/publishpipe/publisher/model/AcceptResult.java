package com.publishpipe.publisher.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a plugin's accept hook for one item.
 *
 * Only {@code accepted} is mandatory. The three UI flags are nullable: a
 * {@code null} means "the plugin did not say", and {@link WorkUnit#accept()}
 * falls back to {@code true} for each of them.
 *
 * @param accepted  whether the plugin wants to operate on the item
 * @param visible   whether the unit should be shown to the user (null = unset)
 * @param enabled   whether the user may toggle the unit (null = unset)
 * @param checked   initial checked-state for a newly accepted unit (null = unset)
 * @param extraInfo diagnostic payload logged with the decision; never null
 */
public record AcceptResult(
        boolean             accepted,
        Boolean             visible,
        Boolean             enabled,
        Boolean             checked,
        Map<String, Object> extraInfo) {

    public AcceptResult {
        extraInfo = extraInfo == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraInfo));
    }

    public static AcceptResult ofAccepted() {
        return new AcceptResult(true, null, null, null, Map.of());
    }

    public static AcceptResult ofRejected() {
        return new AcceptResult(false, null, null, null, Map.of());
    }

    public AcceptResult withVisible(boolean v) {
        return new AcceptResult(accepted, v, enabled, checked, extraInfo);
    }

    public AcceptResult withEnabled(boolean v) {
        return new AcceptResult(accepted, visible, v, checked, extraInfo);
    }

    public AcceptResult withChecked(boolean v) {
        return new AcceptResult(accepted, visible, enabled, v, extraInfo);
    }

    public AcceptResult withExtraInfo(Map<String, ?> info) {
        return new AcceptResult(accepted, visible, enabled, checked,
                info == null ? null : new LinkedHashMap<>(info));
    }

    public boolean visibleOrDefault() { return visible == null || visible; }
    public boolean enabledOrDefault() { return enabled == null || enabled; }
    public boolean checkedOrDefault() { return checked == null || checked; }

    // ------------------------------------------------------------------
    // Untyped form
    // ------------------------------------------------------------------

    /**
     * Read an accept result from its map form, as produced by plugins that
     * are configured rather than coded:
     * <pre>
     *   {"accepted": true, "visible": false, "checked": false,
     *    "extra_info": {"reason": "..."}}
     * </pre>
     *
     * A missing, null or non-boolean {@code accepted} reads as a rejection.
     * Non-boolean UI flags read as unset. A non-map {@code extra_info} is
     * wrapped as {@code {"value": ...}}.
     */
    public static AcceptResult fromMap(Map<String, ?> data) {
        if (data == null) {
            return ofRejected();
        }
        return new AcceptResult(
                Boolean.TRUE.equals(data.get("accepted")),
                flag(data.get("visible")),
                flag(data.get("enabled")),
                flag(data.get("checked")),
                extraInfo(data.get("extra_info")));
    }

    private static Boolean flag(Object raw) {
        return raw instanceof Boolean b ? b : null;
    }

    private static Map<String, Object> extraInfo(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (raw instanceof Map<?, ?> m) {
            Map<String, Object> copy = new LinkedHashMap<>();
            m.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return Map.of("value", raw);
    }
}
