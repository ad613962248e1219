package com.delta.jobingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT = "delta-job-ingest/0.1 (+contact)";

    private List<String> defaultRoleQueries = new ArrayList<>(List.of(
        "Data Scientist",
        "Data Analyst",
        "Machine Learning Engineer"
    ));
    private int defaultLookbackDays = 7;
    private int detailFetchConcurrency = 5;
    private int staleRunMinutes = 120;
    private List<Source> sources = new ArrayList<>();
    private Taxonomy taxonomy = new Taxonomy();
    private StoreRetry storeRetry = new StoreRetry();
    private Scheduler scheduler = new Scheduler();
    private Http http = new Http();
    private Cli cli = new Cli();

    public List<String> getDefaultRoleQueries() {
        return defaultRoleQueries;
    }

    public void setDefaultRoleQueries(List<String> defaultRoleQueries) {
        this.defaultRoleQueries = defaultRoleQueries == null ? new ArrayList<>() : defaultRoleQueries;
    }

    public int getDefaultLookbackDays() {
        return Math.max(1, defaultLookbackDays);
    }

    public void setDefaultLookbackDays(int defaultLookbackDays) {
        this.defaultLookbackDays = Math.max(1, defaultLookbackDays);
    }

    public int getDetailFetchConcurrency() {
        return Math.max(1, detailFetchConcurrency);
    }

    public void setDetailFetchConcurrency(int detailFetchConcurrency) {
        this.detailFetchConcurrency = Math.max(1, detailFetchConcurrency);
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public Taxonomy getTaxonomy() {
        return taxonomy;
    }

    public void setTaxonomy(Taxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    public StoreRetry getStoreRetry() {
        return storeRetry;
    }

    public void setStoreRetry(StoreRetry storeRetry) {
        this.storeRetry = storeRetry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Source findSource(String name) {
        if (name == null) {
            return null;
        }
        for (Source source : sources) {
            if (source.getName() != null && source.getName().equalsIgnoreCase(name.trim())) {
                return source;
            }
        }
        return null;
    }

    public List<String> roleQueriesFor(Source source) {
        if (source != null && source.getRoleQueries() != null && !source.getRoleQueries().isEmpty()) {
            return source.getRoleQueries();
        }
        return getDefaultRoleQueries();
    }

    public int lookbackDaysFor(Source source) {
        if (source != null && source.getLookbackDays() != null) {
            return Math.max(1, source.getLookbackDays());
        }
        return getDefaultLookbackDays();
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Source {
        private String name;
        private String company;
        private boolean enabled = true;
        private List<String> roleQueries = new ArrayList<>();
        private Integer lookbackDays;
        private Feed feed;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        /**
         * Display name postings are stored under. Falls back to the source name with its first
         * letter capitalized.
         */
        public String getCompany() {
            if (company != null && !company.isBlank()) {
                return company.trim();
            }
            if (name == null || name.isBlank()) {
                return null;
            }
            String trimmed = name.trim();
            return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
        }

        public void setCompany(String company) {
            this.company = company;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getRoleQueries() {
            return roleQueries;
        }

        public void setRoleQueries(List<String> roleQueries) {
            this.roleQueries = roleQueries == null ? new ArrayList<>() : roleQueries;
        }

        public Integer getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(Integer lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public Feed getFeed() {
            return feed;
        }

        public void setFeed(Feed feed) {
            this.feed = feed;
        }
    }

    public static class Feed {
        private String listUrl;
        private String itemsPointer = "/jobs";
        private String idField = "id";
        private String titleField = "title";
        private String locationField = "location";
        private String urlField = "url";
        private String datePostedField = "datePosted";
        private String employmentTypeField = "employmentType";
        private String descriptionField = "description";
        private String detailUrl;
        private String detailDescriptionField = "description";

        public String getListUrl() {
            return listUrl;
        }

        public void setListUrl(String listUrl) {
            this.listUrl = listUrl;
        }

        public String getItemsPointer() {
            return itemsPointer;
        }

        public void setItemsPointer(String itemsPointer) {
            this.itemsPointer = itemsPointer;
        }

        public String getIdField() {
            return idField;
        }

        public void setIdField(String idField) {
            this.idField = idField;
        }

        public String getTitleField() {
            return titleField;
        }

        public void setTitleField(String titleField) {
            this.titleField = titleField;
        }

        public String getLocationField() {
            return locationField;
        }

        public void setLocationField(String locationField) {
            this.locationField = locationField;
        }

        public String getUrlField() {
            return urlField;
        }

        public void setUrlField(String urlField) {
            this.urlField = urlField;
        }

        public String getDatePostedField() {
            return datePostedField;
        }

        public void setDatePostedField(String datePostedField) {
            this.datePostedField = datePostedField;
        }

        public String getEmploymentTypeField() {
            return employmentTypeField;
        }

        public void setEmploymentTypeField(String employmentTypeField) {
            this.employmentTypeField = employmentTypeField;
        }

        public String getDescriptionField() {
            return descriptionField;
        }

        public void setDescriptionField(String descriptionField) {
            this.descriptionField = descriptionField;
        }

        public String getDetailUrl() {
            return detailUrl;
        }

        public void setDetailUrl(String detailUrl) {
            this.detailUrl = detailUrl;
        }

        public String getDetailDescriptionField() {
            return detailDescriptionField;
        }

        public void setDetailDescriptionField(String detailDescriptionField) {
            this.detailDescriptionField = detailDescriptionField;
        }
    }

    public static class Taxonomy {
        private List<String> seedRoles = new ArrayList<>(List.of(
            "Software Engineer",
            "Data Scientist",
            "Product Manager",
            "UX Designer",
            "DevOps Engineer",
            "Full Stack Developer",
            "Frontend Engineer",
            "Backend Engineer",
            "Machine Learning Engineer",
            "QA Engineer",
            "Data Engineer",
            "Site Reliability Engineer",
            "Technical Program Manager",
            "Research Scientist",
            "Security Engineer",
            "Cloud Engineer",
            "AI Engineer",
            "Business Analyst",
            "Technical Writer",
            "Systems Engineer",
            "Data Analyst",
            "Data Science",
            "Python Engineer",
            "SQL Developer",
            "Data Administrator",
            "MLOps Engineer",
            "AI Researcher"
        ));
        private String defaultRole = "Software Engineer";
        private int minNewRoleLength = 3;
        private List<String> stopTerms = new ArrayList<>(List.of("job", "general", "position", "opening"));

        public List<String> getSeedRoles() {
            return seedRoles;
        }

        public void setSeedRoles(List<String> seedRoles) {
            this.seedRoles = seedRoles == null ? new ArrayList<>() : seedRoles;
        }

        public String getDefaultRole() {
            if (defaultRole == null || defaultRole.isBlank()) {
                return "Software Engineer";
            }
            return defaultRole.trim();
        }

        public void setDefaultRole(String defaultRole) {
            this.defaultRole = defaultRole;
        }

        public int getMinNewRoleLength() {
            return Math.max(0, minNewRoleLength);
        }

        public void setMinNewRoleLength(int minNewRoleLength) {
            this.minNewRoleLength = Math.max(0, minNewRoleLength);
        }

        public List<String> getStopTerms() {
            return stopTerms;
        }

        public void setStopTerms(List<String> stopTerms) {
            this.stopTerms = stopTerms == null ? new ArrayList<>() : stopTerms;
        }
    }

    public static class StoreRetry {
        private int maxAttempts = 3;
        private int baseDelayMs = 100;
        private int maxDelayMs = 2000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private boolean runOnStartup = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }
    }

    public static class Http {
        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public int getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }
    }

    public static class Cli {
        private boolean run;
        private String sources = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources == null ? "" : sources;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
