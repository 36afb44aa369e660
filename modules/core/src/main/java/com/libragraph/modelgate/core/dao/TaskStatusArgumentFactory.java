package com.libragraph.modelgate.core.dao;

import com.libragraph.modelgate.core.task.TaskStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

/** Binds {@link TaskStatus} as its SMALLINT id. */
public class TaskStatusArgumentFactory extends AbstractArgumentFactory<TaskStatus> {

    public TaskStatusArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(TaskStatus status, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) status.id());
    }
}
