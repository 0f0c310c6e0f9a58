package org.carball.autoindex.parser;

import org.carball.autoindex.model.telemetry.QueryRecord;

import java.io.IOException;
import java.util.List;

/**
 * Append-only feed of observed queries. Each call returns records not returned
 * before, at most {@code maxRecords} of them; an empty list means the feed is
 * drained for now.
 */
public interface QueryTelemetrySource {

    List<QueryRecord> poll(int maxRecords) throws IOException;
}
