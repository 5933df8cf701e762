package com.segments.infrastructure.store;

import java.io.IOException;
import java.util.List;

/**
 * Receiver for streamed query results.
 */
public interface RowSink {

    void columns(List<String> names) throws IOException;

    void row(List<Object> values) throws IOException;
}
