package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.RoleRecord;
import com.delta.jobingest.ingest.model.RoleStats;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Maps free-text role names onto the canonical role taxonomy.
 *
 * <p>Matching runs on a cleaned key (lower-case, punctuation stripped, whitespace collapsed):
 * an exact key match wins, then the longest canonical key contained in the raw key (ties broken
 * alphabetically). Unmatched names that are long enough and not a stop term become new roles;
 * everything else falls back to the default role.
 *
 * <p>The vocabulary maps cleaned keys to display names. It is loaded once from configuration and
 * the {@code roles} table, read without locking and only grows behind {@link #writerLock}.
 */
@Service
public class RoleClassifierService {
    private static final Logger log = LoggerFactory.getLogger(RoleClassifierService.class);
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PostingJdbcRepository repository;
    private final IngestProperties properties;
    private final StoreRetryPolicy storeRetryPolicy;
    private final Map<String, String> vocabulary = new ConcurrentHashMap<>();
    private final ReentrantLock writerLock = new ReentrantLock();
    private volatile boolean loaded;

    public RoleClassifierService(
        PostingJdbcRepository repository,
        IngestProperties properties,
        StoreRetryPolicy storeRetryPolicy
    ) {
        this.repository = repository;
        this.properties = properties;
        this.storeRetryPolicy = storeRetryPolicy;
    }

    public RoleRecord canonicalize(String rawRoleName) {
        ensureLoaded();
        String key = normalize(rawRoleName);
        IngestProperties.Taxonomy taxonomy = properties.getTaxonomy();
        if (key.isEmpty()) {
            return resolve(taxonomy.getDefaultRole());
        }

        String exact = vocabulary.get(key);
        if (exact != null) {
            return resolve(exact);
        }

        String contained = longestContainedMatch(key);
        if (contained != null) {
            log.debug("Role '{}' matched canonical role '{}' by substring", rawRoleName, contained);
            return resolve(contained);
        }

        if (key.length() > taxonomy.getMinNewRoleLength() && !isStopTerm(key)) {
            return grow(key);
        }

        log.debug("Role '{}' fell back to default role '{}'", rawRoleName, taxonomy.getDefaultRole());
        return resolve(taxonomy.getDefaultRole());
    }

    /**
     * Sorted snapshot of the canonical role names.
     */
    public List<String> vocabulary() {
        ensureLoaded();
        List<String> names = new ArrayList<>(vocabulary.values());
        Collections.sort(names);
        return Collections.unmodifiableList(names);
    }

    public List<RoleStats> roleStats() {
        return storeRetryPolicy.execute("role stats", repository::findRoleStats);
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String lowered = raw.trim().toLowerCase(Locale.ROOT);
        String spaced = NON_ALPHANUMERIC.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    static String titleCase(String key) {
        StringBuilder builder = new StringBuilder(key.length());
        for (String word : key.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return builder.toString();
    }

    private String longestContainedMatch(String key) {
        String bestKey = null;
        for (String candidate : vocabulary.keySet()) {
            if (!key.contains(candidate)) {
                continue;
            }
            if (bestKey == null
                || candidate.length() > bestKey.length()
                || (candidate.length() == bestKey.length() && candidate.compareTo(bestKey) < 0)) {
                bestKey = candidate;
            }
        }
        return bestKey == null ? null : vocabulary.get(bestKey);
    }

    private boolean isStopTerm(String key) {
        for (String stopTerm : properties.getTaxonomy().getStopTerms()) {
            if (key.equals(normalize(stopTerm))) {
                return true;
            }
        }
        return false;
    }

    private RoleRecord grow(String key) {
        writerLock.lock();
        try {
            String existing = vocabulary.get(key);
            if (existing != null) {
                return resolve(existing);
            }
            String displayName = titleCase(key);
            RoleRecord role = resolve(displayName);
            vocabulary.put(key, role.name());
            log.info("Added new role '{}' to the taxonomy", role.name());
            return role;
        } finally {
            writerLock.unlock();
        }
    }

    private RoleRecord resolve(String displayName) {
        return storeRetryPolicy.execute("resolve role " + displayName, () -> repository.findOrCreateRole(displayName));
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        writerLock.lock();
        try {
            if (loaded) {
                return;
            }
            for (String seed : properties.getTaxonomy().getSeedRoles()) {
                String key = normalize(seed);
                if (!key.isEmpty()) {
                    vocabulary.putIfAbsent(key, seed.trim());
                }
            }
            List<RoleRecord> stored = storeRetryPolicy.execute("load roles", repository::findAllRoles);
            for (RoleRecord role : stored) {
                String key = normalize(role.name());
                if (!key.isEmpty()) {
                    vocabulary.putIfAbsent(key, role.name());
                }
            }
            loaded = true;
            log.info("Loaded role taxonomy with {} canonical roles", vocabulary.size());
        } finally {
            writerLock.unlock();
        }
    }
}
