package org.lakeshift.client;

import java.util.List;
import java.util.Map;

/**
 * Scoped connection to the SQL warehouse.
 * <p>
 * {@link #connect()} on an open client and any statement before {@link #connect()} raise
 * {@link IllegalStateException}. {@link #close()} is idempotent.
 */
public interface SqlClient extends AutoCloseable {

    void connect();

    boolean isConnected();

    void execute(String sql);

    /**
     * Rows as column label to value, labels in lower case.
     */
    List<Map<String, Object>> fetchAll(String sql);

    @Override
    void close();
}
