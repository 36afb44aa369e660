package com.libragraph.modelgate.core.dao;

import com.libragraph.modelgate.core.task.TaskStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class TaskStatusColumnMapper implements ColumnMapper<TaskStatus> {

    @Override
    public TaskStatus map(ResultSet rs, int column, StatementContext ctx) throws SQLException {
        short id = rs.getShort(column);
        return rs.wasNull() ? null : TaskStatus.fromId(id);
    }
}
