package com.libragraph.modelgate.core.dao;

import com.libragraph.modelgate.core.task.TaskFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class TaskFilterClause {

    private TaskFilterClause() {
    }

    /** Builds the WHERE clause for {@code filter}, collecting bind values into {@code binds}. */
    static String where(TaskFilter filter, Map<String, Object> binds) {
        List<String> conditions = new ArrayList<>();
        add(conditions, binds, "principal", filter.principal());
        add(conditions, binds, "status", filter.status());
        add(conditions, binds, "model", filter.model());
        add(conditions, binds, "provider", filter.provider());
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static void add(List<String> conditions, Map<String, Object> binds, String column, Object value) {
        if (value != null) {
            conditions.add(column + " = :" + column);
            binds.put(column, value);
        }
    }
}
