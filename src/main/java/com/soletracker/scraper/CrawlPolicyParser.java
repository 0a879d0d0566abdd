package com.soletracker.scraper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses robots.txt text into the {@link CrawlPolicy} for one user agent.
 * <p>
 * The most specific group naming our agent token wins; otherwise the {@code *} group applies.
 * Unknown directives, comments and malformed lines are ignored.
 */
public final class CrawlPolicyParser {
    private CrawlPolicyParser() {}

    private static final class Group {
        final List<String> agents = new ArrayList<>();
        final List<CrawlPolicy.Rule> rules = new ArrayList<>();
        Duration crawlDelay;
    }

    public static CrawlPolicy parse(String robotsTxt, String userAgent) {
        List<Group> groups = new ArrayList<>();
        Group current = null;
        boolean lastWasAgent = false;
        for (String rawLine : (robotsTxt == null ? "" : robotsTxt).split("\\r?\\n")) {
            int hash = rawLine.indexOf('#');
            String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String directive = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            switch (directive) {
                case "user-agent" -> {
                    if (current == null || !lastWasAgent) {
                        current = new Group();
                        groups.add(current);
                    }
                    current.agents.add(value.toLowerCase(Locale.ROOT));
                    lastWasAgent = true;
                    continue;
                }
                case "allow", "disallow" -> {
                    if (current != null) current.rules.add(new CrawlPolicy.Rule(value, directive.equals("allow")));
                }
                case "crawl-delay" -> {
                    if (current != null) current.crawlDelay = parseDelay(value);
                }
                default -> {
                    // sitemap, host and vendor extensions are not needed
                }
            }
            lastWasAgent = false;
        }

        String token = agentToken(userAgent);
        List<Group> selected = new ArrayList<>();
        int bestSpecificity = -1;
        for (Group g : groups) {
            for (String agent : g.agents) {
                int specificity = agent.equals("*") ? 0 : (!token.isEmpty() && token.contains(agent) ? agent.length() : -1);
                if (specificity < 0) continue;
                if (specificity > bestSpecificity) {
                    bestSpecificity = specificity;
                    selected.clear();
                }
                if (specificity == bestSpecificity && !selected.contains(g)) selected.add(g);
            }
        }
        List<CrawlPolicy.Rule> rules = new ArrayList<>();
        Duration delay = null;
        for (Group g : selected) {
            rules.addAll(g.rules);
            if (g.crawlDelay != null) delay = g.crawlDelay;
        }
        return new CrawlPolicy(rules, delay, true);
    }

    /**
     * Product token of a user agent string, lower-cased: {@code "Live-Sneaker-Tracker-Bot/1.0 (+url)"} gives
     * {@code "live-sneaker-tracker-bot"}.
     */
    static String agentToken(String userAgent) {
        if (userAgent == null) return "";
        String token = userAgent.trim().split("[\\s/]", 2)[0];
        return token.toLowerCase(Locale.ROOT);
    }

    private static Duration parseDelay(String value) {
        try {
            double seconds = Double.parseDouble(value);
            if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) return null;
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
