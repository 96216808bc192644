package com.delta.leadgen.leads.enhance;

import com.delta.leadgen.config.LeadGeneratorProperties;
import com.delta.leadgen.leads.http.PoliteHttpClient;
import com.delta.leadgen.leads.model.CompanyLead;
import com.delta.leadgen.leads.model.HttpFetchResult;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.SocialMediaLinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Visits each company's website (homepage plus a few well-known contact paths) and merges the emails and social
 * links found there into the record. A company whose site cannot be reached keeps its generated data.
 */
@Service
public class WebsiteContactEnhancer implements LeadEnhancer {
    private static final Logger log = LoggerFactory.getLogger(WebsiteContactEnhancer.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final PoliteHttpClient httpClient;
    private final ContactPageExtractor extractor;
    private final LeadGeneratorProperties properties;

    public WebsiteContactEnhancer(
        PoliteHttpClient httpClient,
        ContactPageExtractor extractor,
        LeadGeneratorProperties properties
    ) {
        this.httpClient = httpClient;
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public LeadBatch enhance(LeadBatch batch) throws InterruptedException {
        List<CompanyLead> enhanced = new ArrayList<>(batch.size());
        int sitesAttempted = 0;
        int sitesReached = 0;
        for (CompanyLead company : batch.companies()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Enhancement interrupted");
            }
            if (company.websiteUrl() == null || company.websiteUrl().isBlank()) {
                enhanced.add(company);
                continue;
            }
            sitesAttempted++;
            ScrapeOutcome outcome = scrape(company.websiteUrl());
            // PoliteHttpClient reports an interrupt as an error code and restores the flag.
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Enhancement interrupted");
            }
            if (outcome.pagesFetched() > 0) {
                sitesReached++;
            }
            enhanced.add(company.withScrapedContacts(outcome.details().emails(), outcome.details().socialMedia()));
        }
        if (sitesAttempted > 0 && sitesReached == 0) {
            throw new EnhancementException("None of the " + sitesAttempted + " company websites could be fetched");
        }
        log.info("Website enhancement reached {}/{} company sites", sitesReached, sitesAttempted);
        return new LeadBatch(enhanced);
    }

    private ScrapeOutcome scrape(String websiteUrl) {
        Set<String> emails = new LinkedHashSet<>();
        SocialMediaLinks social = SocialMediaLinks.empty();
        int pagesFetched = 0;
        int maxBytes = properties.getScraper().getMaxBodyBytes();

        for (String url : candidatePages(websiteUrl)) {
            HttpFetchResult result = httpClient.get(url, HTML_ACCEPT, maxBytes);
            if (!result.isSuccessful() || !result.isHtml()) {
                log.debug("Skipping {}: status={} error={}", url, result.statusCode(), result.errorCode());
                if ("interrupted".equals(result.errorCode())) {
                    break;
                }
                continue;
            }
            pagesFetched++;
            ContactDetails details = extractor.extract(result.body(), result.finalUrlOrRequested());
            emails.addAll(details.emails());
            social = merge(social, details.socialMedia());
        }
        return new ScrapeOutcome(new ContactDetails(new ArrayList<>(emails), social), pagesFetched);
    }

    List<String> candidatePages(String websiteUrl) {
        String base = websiteUrl.trim();
        if (!base.startsWith("http://") && !base.startsWith("https://")) {
            base = "https://" + base;
        }
        List<String> pages = new ArrayList<>();
        pages.add(base);
        String root = siteRoot(base);
        if (root == null) {
            return pages;
        }
        int maxPages = properties.getScraper().getMaxPagesPerCompany();
        for (String path : properties.getScraper().getContactPaths()) {
            if (pages.size() >= maxPages) {
                break;
            }
            String normalizedPath = path.startsWith("/") ? path : "/" + path;
            String candidate = root + normalizedPath;
            if (!pages.contains(candidate)) {
                pages.add(candidate);
            }
        }
        return pages;
    }

    private String siteRoot(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getHost() == null) {
                return null;
            }
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            return uri.getScheme() + "://" + uri.getHost() + port;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private SocialMediaLinks merge(SocialMediaLinks current, SocialMediaLinks found) {
        return new SocialMediaLinks(
            firstNonNull(current.linkedin(), found.linkedin()),
            firstNonNull(current.twitter(), found.twitter()),
            firstNonNull(current.facebook(), found.facebook()),
            firstNonNull(current.instagram(), found.instagram()),
            firstNonNull(current.youtube(), found.youtube())
        );
    }

    private String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    private record ScrapeOutcome(ContactDetails details, int pagesFetched) {
    }
}
