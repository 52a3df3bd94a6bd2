package com.designauditor.crawl.sitemap;

import com.designauditor.config.AuditorProperties;
import com.designauditor.crawl.http.PoliteHttpClient;
import com.designauditor.crawl.model.HttpFetchResult;
import com.designauditor.crawl.model.SitemapDiscoveryResult;
import com.designauditor.crawl.model.SitemapFetchRecord;
import com.designauditor.crawl.model.SitemapUrlEntry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

@Service
public class SitemapService implements SitemapDiscovery {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final int MAX_SITEMAP_BYTES = 2_000_000;
    private static final String XML_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";
    private static final List<String> CANDIDATE_PATHS = List.of(
        "/sitemap.xml",
        "/sitemap_index.xml",
        "/sitemap-index.xml",
        "/sitemaps/sitemap.xml",
        "/sitemap/sitemap.xml",
        "/page-sitemap.xml",
        "/post-sitemap.xml",
        "/sitemap1.xml"
    );
    private static final List<String> WWW_CANDIDATE_PATHS = List.of(
        "/sitemap.xml",
        "/sitemap_index.xml",
        "/sitemap-index.xml"
    );
    private static final List<String> LOCALE_PREFIXES = List.of("en", "en-us", "en-gb", "us");

    private final PoliteHttpClient httpClient;
    private final AuditorProperties properties;

    public SitemapService(PoliteHttpClient httpClient, AuditorProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public SitemapDiscoveryResult discover(String domain) {
        String host = normalizeHost(domain);
        if (host == null) {
            return new SitemapDiscoveryResult(List.of(), List.of(), Map.of("invalid_domain", 1), noticeFor(domain));
        }
        AuditorProperties.Sitemap limits = properties.getSitemap();
        List<String> hinted = robotsHints(host);
        if (!hinted.isEmpty()) {
            SitemapDiscoveryResult result = discover(hinted, limits.getMaxDepth(), limits.getMaxSitemaps(), limits.getMaxUrlsPerDomain());
            if (!result.isEmpty()) {
                log.info("Discovered {} pages for {} via robots.txt sitemaps", result.discoveredUrls().size(), host);
                return result;
            }
        }
        for (String candidate : candidates(host)) {
            SitemapDiscoveryResult result = discover(List.of(candidate), limits.getMaxDepth(), limits.getMaxSitemaps(), limits.getMaxUrlsPerDomain());
            if (!result.isEmpty()) {
                log.info("Discovered {} pages for {} via {}", result.discoveredUrls().size(), host, candidate);
                return result;
            }
        }
        log.info("No sitemap found for {}", host);
        return new SitemapDiscoveryResult(List.of(), List.of(), Map.of("no_sitemaps", 1), noticeFor(host));
    }

    public SitemapDiscoveryResult discover(
        List<String> seedSitemaps,
        int maxDepth,
        int maxSitemaps,
        int maxUrls
    ) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null) {
                queue.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashSet<String> visitedSitemaps = new LinkedHashSet<>();
        LinkedHashMap<String, String> discoveredUrls = new LinkedHashMap<>();
        List<SitemapFetchRecord> fetchedRecords = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        while (!queue.isEmpty() && visitedSitemaps.size() < maxSitemaps) {
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth || visitedSitemaps.contains(current.url())) {
                continue;
            }
            visitedSitemaps.add(current.url());

            HttpFetchResult fetch = httpClient.get(current.url(), XML_ACCEPT, MAX_SITEMAP_BYTES);
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(current.url(), fetch);
            } catch (IOException e) {
                log.debug("Could not decode gzip sitemap {}: {}", current.url(), e.getMessage());
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }

            int urlCountFromCurrent = 0;
            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());

            List<Element> childSitemaps = xml.select("sitemap > loc");
            if (!childSitemaps.isEmpty() && current.depth() < maxDepth) {
                for (Element loc : childSitemaps) {
                    String child = normalizeSitemapUrl(loc.text());
                    if (child != null && !visitedSitemaps.contains(child) && visitedSitemaps.size() + queue.size() < maxSitemaps) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }

            for (Element urlElement : xml.select("url")) {
                Element locElement = urlElement.selectFirst("loc");
                if (locElement == null) {
                    continue;
                }
                String loc = normalizeSitemapUrl(locElement.text());
                if (loc == null || discoveredUrls.containsKey(loc) || discoveredUrls.size() >= maxUrls) {
                    continue;
                }
                Element lastmodElement = urlElement.selectFirst("lastmod");
                String lastmod = lastmodElement == null ? null : lastmodElement.text().trim();
                discoveredUrls.put(loc, lastmod);
                urlCountFromCurrent++;
            }

            fetchedRecords.add(new SitemapFetchRecord(current.url(), Instant.now(), urlCountFromCurrent));
            if (discoveredUrls.size() >= maxUrls) {
                break;
            }
        }

        List<SitemapUrlEntry> entries = discoveredUrls.entrySet().stream()
            .map(entry -> new SitemapUrlEntry(entry.getKey(), entry.getValue()))
            .toList();
        return new SitemapDiscoveryResult(fetchedRecords, entries, errors, null);
    }

    List<String> candidates(String host) {
        String bare = host.startsWith("www.") ? host.substring(4) : host;
        List<String> out = new ArrayList<>();
        for (String path : CANDIDATE_PATHS) {
            out.add("https://" + host + path);
        }
        if (!host.startsWith("www.")) {
            for (String path : WWW_CANDIDATE_PATHS) {
                out.add("https://www." + bare + path);
            }
        }
        for (String prefix : LOCALE_PREFIXES) {
            out.add("https://" + host + "/" + prefix + "/sitemap.xml");
        }
        return out;
    }

    private List<String> robotsHints(String host) {
        HttpFetchResult robots = httpClient.get("https://" + host + "/robots.txt", "text/plain,*/*;q=0.1");
        if (!robots.isSuccessful()) {
            log.debug("robots.txt unavailable for {}: {}", host, robots.describeFailure());
            return List.of();
        }
        return RobotsSitemapHints.parse(robots.body());
    }

    private static String noticeFor(String domain) {
        return "No sitemap found for " + domain + "; analyze pages individually";
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        String requestedUrl = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String resolvedUrl = fetch.finalUrlOrRequested() == null
            ? ""
            : fetch.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        if (requestedUrl.endsWith(".gz") || resolvedUrl.endsWith(".gz")) {
            return true;
        }
        if (fetch.contentEncoding() != null && fetch.contentEncoding().toLowerCase(Locale.ROOT).contains("gzip")) {
            return true;
        }
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private static String normalizeHost(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        String value = domain.trim().toLowerCase(Locale.ROOT);
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        return value.isEmpty() || value.contains(" ") ? null : value;
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
