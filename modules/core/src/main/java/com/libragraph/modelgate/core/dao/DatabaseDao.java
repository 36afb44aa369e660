package com.libragraph.modelgate.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

public interface DatabaseDao {

    @SqlQuery("SELECT 1")
    int ping();
}
