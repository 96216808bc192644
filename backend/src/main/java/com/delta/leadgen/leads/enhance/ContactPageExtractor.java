package com.delta.leadgen.leads.enhance;

import com.delta.leadgen.leads.model.SocialMediaLinks;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls contact emails and official social media profile links out of a company web page.
 * Results keep document order and are de-duplicated.
 */
@Component
public class ContactPageExtractor {
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final List<String> IGNORED_EMAIL_SUFFIXES = List.of(".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp");
    private static final List<String> IGNORED_EMAIL_DOMAINS = List.of("example.com", "sentry.io", "wixpress.com");
    private static final List<String> SHARE_PATH_MARKERS = List.of("/intent", "/share", "/sharer", "/dialog");

    /**
     * @param html    page HTML (nullable)
     * @param baseUrl base URL used to resolve relative hrefs
     */
    public ContactDetails extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return new ContactDetails(List.of(), SocialMediaLinks.empty());
        }
        Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);

        Set<String> emails = new LinkedHashSet<>();
        for (Element anchor : doc.select("a[href^=mailto:]")) {
            addEmail(emails, anchor.attr("href").substring("mailto:".length()));
        }
        Matcher matcher = EMAIL.matcher(doc.text());
        while (matcher.find()) {
            addEmail(emails, matcher.group());
        }

        Map<String, String> social = new LinkedHashMap<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("abs:href");
            if (href == null || href.isBlank()) {
                continue;
            }
            String platform = socialPlatform(href.trim());
            if (platform != null) {
                social.putIfAbsent(platform, href.trim());
            }
        }

        return new ContactDetails(
            new ArrayList<>(emails),
            new SocialMediaLinks(
                social.get("linkedin"),
                social.get("twitter"),
                social.get("facebook"),
                social.get("instagram"),
                social.get("youtube")
            )
        );
    }

    private void addEmail(Set<String> out, String raw) {
        if (raw == null) {
            return;
        }
        String candidate = raw.trim();
        int query = candidate.indexOf('?');
        if (query >= 0) {
            candidate = candidate.substring(0, query);
        }
        candidate = candidate.toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(candidate).matches()) {
            return;
        }
        for (String suffix : IGNORED_EMAIL_SUFFIXES) {
            if (candidate.endsWith(suffix)) {
                return;
            }
        }
        String domain = candidate.substring(candidate.indexOf('@') + 1);
        for (String ignored : IGNORED_EMAIL_DOMAINS) {
            if (domain.equals(ignored) || domain.endsWith("." + ignored)) {
                return;
            }
        }
        out.add(candidate);
    }

    static String socialPlatform(String href) {
        URI uri;
        try {
            uri = URI.create(href);
        } catch (IllegalArgumentException e) {
            return null;
        }
        String host = uri.getHost();
        if (host == null) {
            return null;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (path.isEmpty() || path.equals("/")) {
            return null;
        }
        for (String marker : SHARE_PATH_MARKERS) {
            if (path.startsWith(marker)) {
                return null;
            }
        }
        String lowerHost = host.toLowerCase(Locale.ROOT);
        if (matchesHost(lowerHost, "linkedin.com")) {
            return "linkedin";
        }
        if (matchesHost(lowerHost, "twitter.com") || matchesHost(lowerHost, "x.com")) {
            return "twitter";
        }
        if (matchesHost(lowerHost, "facebook.com")) {
            return "facebook";
        }
        if (matchesHost(lowerHost, "instagram.com")) {
            return "instagram";
        }
        if (matchesHost(lowerHost, "youtube.com")) {
            return "youtube";
        }
        return null;
    }

    private static boolean matchesHost(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
