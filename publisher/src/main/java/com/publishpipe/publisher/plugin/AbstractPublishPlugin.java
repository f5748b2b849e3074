package com.publishpipe.publisher.plugin;

import com.publishpipe.publisher.item.PublishItem;
import com.publishpipe.publisher.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for plugins: keeps the name, a logger named after the concrete
 * class, and the list of bound work units.
 *
 * Subclasses only implement {@link #runAccept} and {@link #runPublish};
 * validation passes and finalization does nothing unless overridden.
 */
public abstract class AbstractPublishPlugin implements PublishPlugin {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    private final List<WorkUnit> units = new ArrayList<>();

    protected AbstractPublishPlugin(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override public String name()   { return name; }
    @Override public Logger logger() { return log; }

    @Override
    public boolean runValidate(Map<String, Object> settings, PublishItem item) {
        return true;
    }

    @Override
    public void runFinalize(Map<String, Object> settings, PublishItem item) {
        // nothing to clean up by default
    }

    @Override
    public void addWorkUnit(WorkUnit unit) {
        if (!units.contains(unit)) {
            units.add(unit);
        }
    }

    @Override
    public void removeWorkUnit(WorkUnit unit) {
        units.remove(unit);
    }

    @Override
    public List<WorkUnit> workUnits() {
        return Collections.unmodifiableList(units);
    }

    @Override
    public String toString() {
        return "Plugin[" + name + "]";
    }
}
