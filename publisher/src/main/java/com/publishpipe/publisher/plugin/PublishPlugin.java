package com.publishpipe.publisher.plugin;

import com.publishpipe.publisher.item.PublishItem;
import com.publishpipe.publisher.model.AcceptResult;
import com.publishpipe.publisher.model.WorkUnit;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * A pluggable publishing strategy.
 *
 * A plugin never runs on its own: the pipeline pairs it with every item it
 * might operate on, producing one {@link WorkUnit} per pair, and then drives
 * the four hooks below through those units.
 *
 * <p>Lifecycle, per unit:
 * <ol>
 *   <li>{@link #runAccept} — may be called many times (e.g. after every
 *       settings edit) before anything else happens.</li>
 *   <li>{@link #runValidate} — only for units that ended up checked.</li>
 *   <li>{@link #runPublish} — only for units that validated.</li>
 *   <li>{@link #runFinalize} — after every publish call has completed.</li>
 * </ol>
 *
 * Failures in validate/publish/finalize are reported by throwing; the unit
 * does not catch them. {@link PluginException} is the conventional type.
 */
public interface PublishPlugin {

    /** Display name, used in acceptance/rejection log lines. */
    String name();

    /** Logger that acceptance and rejection of this plugin's units are reported to. */
    Logger logger();

    /**
     * Decide whether this plugin wants to operate on {@code item}.
     *
     * @return the decision; {@code null} is read as a rejection
     */
    AcceptResult runAccept(Map<String, Object> settings, PublishItem item);

    /** @return true if the item is ready to publish */
    boolean runValidate(Map<String, Object> settings, PublishItem item);

    void runPublish(Map<String, Object> settings, PublishItem item);

    void runFinalize(Map<String, Object> settings, PublishItem item);

    // ------------------------------------------------------------------
    // Bound units
    // ------------------------------------------------------------------

    void addWorkUnit(WorkUnit unit);

    /** Undo {@link #addWorkUnit}; unknown units are ignored. */
    void removeWorkUnit(WorkUnit unit);

    /** Units bound to this plugin, in registration order. */
    List<WorkUnit> workUnits();
}
