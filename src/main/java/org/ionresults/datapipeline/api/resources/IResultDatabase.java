package org.ionresults.datapipeline.api.resources;

import java.sql.SQLException;
import java.util.List;

/**
 * Capability for writing annotation rows to the relational store.
 */
public interface IResultDatabase {

    /**
     * Inserts all rows with one batched statement.
     * <p>
     * The statement template is opaque to callers; each row supplies one positional
     * parameter per placeholder. Either all rows are committed or none.
     *
     * @param statement SQL insert template with {@code ?} placeholders
     * @param rows      positional parameter tuples
     * @throws SQLException if the batch fails; no rows are committed in that case
     */
    void insert(String statement, List<Object[]> rows) throws SQLException;
}
