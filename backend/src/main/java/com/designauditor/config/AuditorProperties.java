package com.designauditor.config;

import com.designauditor.crawl.model.AnalysisMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "auditor")
public class AuditorProperties {
    private static final String DEFAULT_USER_AGENT = "design-auditor/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 4;
    private int perHostConcurrency = 2;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Crawl crawl = new Crawl();
    private Sitemap sitemap = new Sitemap();
    private Color color = new Color();
    private Progress progress = new Progress();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Color getColor() {
        return color;
    }

    public void setColor(Color color) {
        this.color = color;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /**
     * Drops non-positive entries and sorts ascending so every retry gets a larger budget.
     * Falls back to the default 15s/20s/25s schedule when nothing usable is left.
     */
    public static List<Integer> normalizeTimeoutSchedule(List<Integer> candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return Crawl.DEFAULT_TIMEOUT_SCHEDULE_MS;
        }
        List<Integer> out = new ArrayList<>();
        for (Integer timeout : candidate) {
            if (timeout != null && timeout > 0) {
                out.add(timeout);
            }
        }
        if (out.isEmpty()) {
            return Crawl.DEFAULT_TIMEOUT_SCHEDULE_MS;
        }
        out.sort(Integer::compareTo);
        return List.copyOf(out);
    }

    public static class Crawl {
        static final List<Integer> DEFAULT_TIMEOUT_SCHEDULE_MS = List.of(15000, 20000, 25000);

        private int maxPages = 100;
        private int delayBetweenPagesMs = 2000;
        private List<Integer> timeoutScheduleMs = new ArrayList<>(DEFAULT_TIMEOUT_SCHEDULE_MS);
        private int readyPollIntervalMs = 500;
        private int settleDelayMs = 1000;
        private int cmsSettleDelayMs = 3000;
        private AnalysisMode defaultMode = AnalysisMode.DESKTOP_ONLY;
        private int maxConcurrentJobs = 1;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getDelayBetweenPagesMs() {
            return Math.max(0, delayBetweenPagesMs);
        }

        public void setDelayBetweenPagesMs(int delayBetweenPagesMs) {
            this.delayBetweenPagesMs = Math.max(0, delayBetweenPagesMs);
        }

        public List<Integer> getTimeoutScheduleMs() {
            return normalizeTimeoutSchedule(timeoutScheduleMs);
        }

        public void setTimeoutScheduleMs(List<Integer> timeoutScheduleMs) {
            this.timeoutScheduleMs = timeoutScheduleMs;
        }

        public int getReadyPollIntervalMs() {
            return Math.max(1, readyPollIntervalMs);
        }

        public void setReadyPollIntervalMs(int readyPollIntervalMs) {
            this.readyPollIntervalMs = Math.max(1, readyPollIntervalMs);
        }

        public int getSettleDelayMs() {
            return Math.max(0, settleDelayMs);
        }

        public void setSettleDelayMs(int settleDelayMs) {
            this.settleDelayMs = Math.max(0, settleDelayMs);
        }

        public int getCmsSettleDelayMs() {
            return Math.max(getSettleDelayMs(), cmsSettleDelayMs);
        }

        public void setCmsSettleDelayMs(int cmsSettleDelayMs) {
            this.cmsSettleDelayMs = Math.max(0, cmsSettleDelayMs);
        }

        public AnalysisMode getDefaultMode() {
            return defaultMode == null ? AnalysisMode.DESKTOP_ONLY : defaultMode;
        }

        public void setDefaultMode(AnalysisMode defaultMode) {
            this.defaultMode = defaultMode;
        }

        public int getMaxConcurrentJobs() {
            return Math.max(1, maxConcurrentJobs);
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
        }
    }

    public static class Sitemap {
        private int maxDepth = 3;
        private int maxSitemaps = 15;
        private int maxUrlsPerDomain = 500;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getMaxSitemaps() {
            return Math.max(1, maxSitemaps);
        }

        public void setMaxSitemaps(int maxSitemaps) {
            this.maxSitemaps = maxSitemaps;
        }

        public int getMaxUrlsPerDomain() {
            return Math.max(1, maxUrlsPerDomain);
        }

        public void setMaxUrlsPerDomain(int maxUrlsPerDomain) {
            this.maxUrlsPerDomain = maxUrlsPerDomain;
        }
    }

    public static class Color {
        private double mergeThreshold = 2.3;
        private double familyThreshold = 441 * 0.15;
        private int neutralTolerance = 15;
        private int outlierMaxCount = 2;

        public double getMergeThreshold() {
            return Math.max(0.0, mergeThreshold);
        }

        public void setMergeThreshold(double mergeThreshold) {
            this.mergeThreshold = mergeThreshold;
        }

        public double getFamilyThreshold() {
            return Math.max(getMergeThreshold(), familyThreshold);
        }

        public void setFamilyThreshold(double familyThreshold) {
            this.familyThreshold = familyThreshold;
        }

        public int getNeutralTolerance() {
            return Math.max(0, neutralTolerance);
        }

        public void setNeutralTolerance(int neutralTolerance) {
            this.neutralTolerance = neutralTolerance;
        }

        public int getOutlierMaxCount() {
            return Math.max(0, outlierMaxCount);
        }

        public void setOutlierMaxCount(int outlierMaxCount) {
            this.outlierMaxCount = outlierMaxCount;
        }
    }

    public static class Progress {
        private boolean resumeOnStartup = true;

        public boolean isResumeOnStartup() {
            return resumeOnStartup;
        }

        public void setResumeOnStartup(boolean resumeOnStartup) {
            this.resumeOnStartup = resumeOnStartup;
        }
    }
}
