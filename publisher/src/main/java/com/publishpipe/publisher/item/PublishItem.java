package com.publishpipe.publisher.item;

import com.publishpipe.publisher.model.WorkUnit;

import java.util.List;
import java.util.Map;

/**
 * A piece of content collected for publishing: a file, a scene, a render.
 *
 * Items carry free-form properties that plugins inspect during acceptance
 * and keep track of the work units bound to them.
 */
public interface PublishItem {

    String name();

    /** Item type, e.g. "file.image". Plugins may filter on it. */
    String type();

    Map<String, Object> properties();

    void addWorkUnit(WorkUnit unit);

    List<WorkUnit> workUnits();
}
