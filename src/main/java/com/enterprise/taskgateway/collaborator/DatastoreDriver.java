package com.enterprise.taskgateway.collaborator;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Access to the relational datastore for tables the gateway owns.
 * Failures complete the future with the driver's own exception, typically a
 * {@link java.sql.SQLException}.
 */
public interface DatastoreDriver {

    /**
     * Run a parameterized statement and return its rows as column-name maps
     */
    CompletableFuture<List<Map<String, Object>>> execute(String query, List<Object> params);
}
