package com.delta.jobingest.ingest.adapter;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.http.FeedHttpClient;
import com.delta.jobingest.ingest.model.HttpFetchResult;
import com.delta.jobingest.ingest.model.RawJobRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Adapter for career sites that publish jobs as a JSON list endpoint, optionally with a
 * per-job detail endpoint. Field locations come from the source's {@code feed} configuration.
 *
 * <p>Detail requests run on the shared detail executor and only fetch and parse; the records
 * they return are handed back to the caller for storage.
 */
public class JsonFeedSourceAdapter implements JobSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(JsonFeedSourceAdapter.class);
    private static final String ACCEPT_JSON = "application/json";
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private final String sourceName;
    private final IngestProperties.Feed feed;
    private final FeedHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService detailExecutor;

    public JsonFeedSourceAdapter(
        String sourceName,
        IngestProperties.Feed feed,
        FeedHttpClient httpClient,
        ObjectMapper objectMapper,
        ExecutorService detailExecutor
    ) {
        this.sourceName = sourceName;
        this.feed = feed;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.detailExecutor = detailExecutor;
    }

    @Override
    public String sourceName() {
        return sourceName;
    }

    @Override
    public Map<String, List<RawJobRecord>> fetch(List<String> roleQueries, int lookbackDays) {
        if (feed == null || feed.getListUrl() == null || feed.getListUrl().isBlank()) {
            throw new AdapterFailureException(sourceName, "feed list-url is not configured");
        }
        LocalDate cutoff = LocalDate.now(ZoneOffset.UTC).minusDays(Math.max(1, lookbackDays));
        Map<String, List<RawJobRecord>> results = new LinkedHashMap<>();
        for (String query : roleQueries) {
            List<RawJobRecord> listed = fetchList(query, lookbackDays);
            List<RawJobRecord> recent = new ArrayList<>();
            for (RawJobRecord record : listed) {
                if (isWithinLookback(record, cutoff)) {
                    recent.add(record);
                }
            }
            List<RawJobRecord> detailed = fetchDetails(recent);
            log.info(
                "{}: query '{}' returned {} jobs, {} within {} days",
                sourceName,
                query,
                listed.size(),
                detailed.size(),
                lookbackDays
            );
            results.put(query, detailed);
        }
        return results;
    }

    private List<RawJobRecord> fetchList(String query, int lookbackDays) {
        String url = feed.getListUrl()
            .replace("{query}", encode(query))
            .replace("{lookbackDays}", String.valueOf(lookbackDays));
        HttpFetchResult result = httpClient.get(url, ACCEPT_JSON);
        if (!result.isSuccessful() || result.body() == null) {
            throw new AdapterFailureException(
                sourceName,
                "list fetch failed url=" + url + " status=" + result.statusCode() + " error=" + result.errorCode()
            );
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new AdapterFailureException(sourceName, "list response is not valid JSON url=" + url, e);
        }
        String pointer = feed.getItemsPointer();
        JsonNode items = (pointer == null || pointer.isBlank()) ? root : root.at(pointer);
        if (items == null || !items.isArray()) {
            throw new AdapterFailureException(sourceName, "no job array at " + pointer + " url=" + url);
        }

        List<RawJobRecord> records = new ArrayList<>();
        for (JsonNode item : items) {
            records.add(toRecord(item));
        }
        return records;
    }

    private RawJobRecord toRecord(JsonNode item) {
        Map<String, Object> attributes = item.isObject() ? objectMapper.convertValue(item, ATTRIBUTES_TYPE) : Map.of();
        return new RawJobRecord(
            text(item, feed.getIdField()),
            text(item, feed.getTitleField()),
            text(item, feed.getLocationField()),
            text(item, feed.getUrlField()),
            text(item, feed.getDatePostedField()),
            text(item, feed.getEmploymentTypeField()),
            toPlainText(text(item, feed.getDescriptionField())),
            attributes
        );
    }

    private List<RawJobRecord> fetchDetails(List<RawJobRecord> records) {
        if (feed.getDetailUrl() == null || feed.getDetailUrl().isBlank() || records.isEmpty()) {
            return records;
        }
        List<CompletableFuture<RawJobRecord>> futures = new ArrayList<>(records.size());
        for (RawJobRecord record : records) {
            futures.add(CompletableFuture.supplyAsync(() -> fetchDetail(record), detailExecutor));
        }
        List<RawJobRecord> detailed = new ArrayList<>(records.size());
        for (CompletableFuture<RawJobRecord> future : futures) {
            detailed.add(future.join());
        }
        return detailed;
    }

    private RawJobRecord fetchDetail(RawJobRecord record) {
        if (!record.hasIdentity()) {
            return record;
        }
        String url = feed.getDetailUrl().replace("{id}", encode(record.externalId().trim()));
        HttpFetchResult result = httpClient.get(url, ACCEPT_JSON);
        if (!result.isSuccessful() || result.body() == null) {
            log.warn(
                "{}: detail fetch failed for job {} status={} error={}",
                sourceName,
                record.externalId(),
                result.statusCode(),
                result.errorCode()
            );
            return record;
        }
        try {
            JsonNode detail = objectMapper.readTree(result.body());
            String description = toPlainText(text(detail, feed.getDetailDescriptionField()));
            return description == null ? record : record.withDescription(description);
        } catch (JsonProcessingException e) {
            log.warn("{}: detail response for job {} is not valid JSON", sourceName, record.externalId());
            return record;
        }
    }

    private boolean isWithinLookback(RawJobRecord record, LocalDate cutoff) {
        String value = record.datePosted();
        if (value == null || value.isBlank()) {
            return true;
        }
        String trimmed = value.trim();
        String datePart = trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed;
        try {
            return !LocalDate.parse(datePart).isBefore(cutoff);
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    static String text(JsonNode node, String dottedPath) {
        if (node == null || dottedPath == null || dottedPath.isBlank()) {
            return null;
        }
        JsonNode current = node;
        for (String segment : dottedPath.split("\\.")) {
            current = current.get(segment);
            if (current == null || current.isNull()) {
                return null;
            }
        }
        if (current.isValueNode()) {
            return current.asText();
        }
        return current.toString();
    }

    static String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return html;
        }
        return Jsoup.parse(html).text();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
