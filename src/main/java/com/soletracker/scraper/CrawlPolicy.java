package com.soletracker.scraper;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Parsed crawl policy of one domain, reduced to the rule group that applies to our user agent.
 * <p>
 * Matching follows robots.txt conventions: the longest matching rule decides, {@code Allow} wins a tie,
 * {@code *} matches any run of characters and a trailing {@code $} anchors the end of the path.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public final class CrawlPolicy {

    public record Rule(String pattern, boolean allow) {}

    private final List<Rule> rules;
    private final Duration crawlDelay;
    private final boolean verified;

    public CrawlPolicy(List<Rule> rules, Duration crawlDelay, boolean verified) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.crawlDelay = crawlDelay;
        this.verified = verified;
    }

    /** Policy of a domain that publishes no rules. */
    public static CrawlPolicy allowAll() {
        return new CrawlPolicy(List.of(), null, true);
    }

    /** Policy assumed when the policy document could not be retrieved. */
    public static CrawlPolicy unverified() {
        return new CrawlPolicy(List.of(), null, false);
    }

    public Optional<Duration> crawlDelay() {
        return Optional.ofNullable(crawlDelay);
    }

    /**
     * False when the policy could not be retrieved and everything is allowed by default.
     */
    public boolean isVerified() {
        return verified;
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * @param pathAndQuery URL path including query string, starting with {@code /}
     * @return whether the path may be fetched
     */
    public boolean isAllowed(String pathAndQuery) {
        String path = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;
        Rule best = null;
        for (Rule rule : rules) {
            if (rule.pattern().isEmpty() || !matches(rule.pattern(), path)) continue;
            if (best == null
                || rule.pattern().length() > best.pattern().length()
                || rule.pattern().length() == best.pattern().length() && rule.allow() && !best.allow()) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    static boolean matches(String pattern, String path) {
        boolean anchored = pattern.endsWith("$");
        String p = anchored ? pattern.substring(0, pattern.length() - 1) : pattern;
        return matchFrom(p, 0, path, 0, anchored);
    }

    private static boolean matchFrom(String p, int pi, String s, int si, boolean anchored) {
        while (pi < p.length()) {
            char c = p.charAt(pi);
            if (c == '*') {
                // collapse consecutive wildcards, then try every split point
                while (pi < p.length() && p.charAt(pi) == '*') pi++;
                if (pi == p.length()) return true;
                for (int k = si; k <= s.length(); k++) {
                    if (matchFrom(p, pi, s, k, anchored)) return true;
                }
                return false;
            }
            if (si >= s.length() || s.charAt(si) != c) return false;
            pi++;
            si++;
        }
        return !anchored || si == s.length();
    }
}
