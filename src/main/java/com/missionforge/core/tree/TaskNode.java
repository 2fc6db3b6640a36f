package com.missionforge.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TaskNode: one atomic robot task as produced by the mission generator.
 *
 * The id doubles as the Promela variable name of the task, so it must be a
 * valid identifier and unique within a mission.
 */
public class TaskNode {

    private final String              id;
    private final String              actionType;
    private final Map<String, String> parameters;

    public TaskNode(String id, String actionType, Map<String, String> parameters) {
        this.id         = id;
        this.actionType = actionType;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public TaskNode(String id, String actionType) {
        this(id, actionType, Map.of());
    }

    public String getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "TaskNode{id=" + id + ", actionType=" + actionType + ", parameters=" + parameters + "}";
    }
}
