package com.publishpipe.publisher.item;

import com.publishpipe.publisher.model.WorkUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory {@link PublishItem}.
 *
 * Properties are mutable so collectors can fill them in after creation.
 */
public class SimplePublishItem implements PublishItem {

    private final String name;
    private final String type;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<WorkUnit> units = new ArrayList<>();

    public SimplePublishItem(String name, String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public SimplePublishItem(String name, String type, Map<String, ?> properties) {
        this(name, type);
        this.properties.putAll(properties);
    }

    @Override public String name() { return name; }
    @Override public String type() { return type; }
    @Override public Map<String, Object> properties() { return properties; }

    /**
     * @throws IllegalArgumentException if the unit is bound to a different item
     */
    @Override
    public void addWorkUnit(WorkUnit unit) {
        if (unit.getItem() != this) {
            throw new IllegalArgumentException(
                    "Work unit " + unit + " is bound to another item, not '" + name + "'");
        }
        if (!units.contains(unit)) {
            units.add(unit);
        }
    }

    @Override
    public List<WorkUnit> workUnits() {
        return Collections.unmodifiableList(units);
    }

    @Override
    public String toString() {
        return name;
    }
}
