package com.delta.jobingest.ingest.adapter;

import com.delta.jobingest.ingest.model.RawJobRecord;

import java.util.List;
import java.util.Map;

/**
 * A source of raw job records for one company career site.
 *
 * <p>{@link #fetch} returns the jobs found for each role query, keyed by the query. Throwing
 * anything marks the whole source cycle as failed.
 */
public interface JobSourceAdapter {

    String sourceName();

    Map<String, List<RawJobRecord>> fetch(List<String> roleQueries, int lookbackDays);
}
