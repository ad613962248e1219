package com.delta.jobingest.ingest.adapter;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.http.FeedHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Resolves the adapter for a configured source: an adapter bean with a matching
 * {@link JobSourceAdapter#sourceName()} first, then a {@link JsonFeedSourceAdapter} built from the
 * source's feed section.
 */
@Component
public class JobSourceRegistry {
    private final ObjectProvider<JobSourceAdapter> adapterBeans;
    private final FeedHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService detailFetchExecutor;
    private final Map<String, JobSourceAdapter> feedAdapters = new ConcurrentHashMap<>();

    public JobSourceRegistry(
        ObjectProvider<JobSourceAdapter> adapterBeans,
        FeedHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("detailFetchExecutor") ExecutorService detailFetchExecutor
    ) {
        this.adapterBeans = adapterBeans;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.detailFetchExecutor = detailFetchExecutor;
    }

    public Optional<JobSourceAdapter> resolve(IngestProperties.Source source) {
        if (source == null || source.getName() == null || source.getName().isBlank()) {
            return Optional.empty();
        }
        String name = source.getName().trim();
        Optional<JobSourceAdapter> bean = adapterBeans.orderedStream()
            .filter(adapter -> adapter.sourceName() != null && adapter.sourceName().equalsIgnoreCase(name))
            .findFirst();
        if (bean.isPresent()) {
            return bean;
        }
        if (source.getFeed() == null) {
            return Optional.empty();
        }
        JobSourceAdapter adapter = feedAdapters.computeIfAbsent(
            name.toLowerCase(Locale.ROOT),
            ignored -> new JsonFeedSourceAdapter(name, source.getFeed(), httpClient, objectMapper, detailFetchExecutor)
        );
        return Optional.of(adapter);
    }
}
