package com.realestate.scraper.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;
  private final Long crawlDelaySeconds;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls, Long crawlDelaySeconds) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
    this.crawlDelaySeconds = crawlDelaySeconds;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of(), null);
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), List.of(), null);
  }

  public List<Rule> getRules() {
    return rules;
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public Long getCrawlDelaySeconds() {
    return crawlDelaySeconds;
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      int length = rule.path().length();
      if (length > bestMatchLength) {
        bestMatch = rule;
        bestMatchLength = length;
      } else if (length == bestMatchLength
          && bestMatch != null
          && rule.allow()
          && !bestMatch.allow()) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  public static RobotsRules parse(String robotsText) {
    return parse(robotsText, null);
  }

  /**
   * Parses robots.txt for {@code agentToken}. Groups whose product token equals ours
   * (case-insensitive) win; the {@code *} groups apply only when no group names the token.
   * Empty {@code User-agent} values are ignored.
   */
  public static RobotsRules parse(String robotsText, String agentToken) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String token = agentToken == null ? "" : agentToken.trim().toLowerCase(Locale.ROOT);

    List<String> sitemaps = new ArrayList<>();
    List<Rule> agentRules = new ArrayList<>();
    List<Rule> wildcardRules = new ArrayList<>();
    Long agentDelay = null;
    Long wildcardDelay = null;
    boolean agentGroupSeen = false;

    List<String> currentAgents = new ArrayList<>();
    boolean currentGroupForAgent = false;
    boolean currentGroupWildcard = false;
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        String agent = productToken(value);
        if (!agent.isEmpty()) {
          currentAgents.add(agent);
        }
        currentGroupWildcard = currentAgents.stream().anyMatch("*"::equals);
        currentGroupForAgent = !token.isEmpty() && currentAgents.contains(token);
        agentGroupSeen |= currentGroupForAgent;
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if ("sitemap".equals(key)) {
        if (!value.isBlank()) {
          sitemaps.add(value);
        }
        continue;
      }

      if (!currentGroupForAgent && !currentGroupWildcard) {
        continue;
      }
      if ("crawl-delay".equals(key)) {
        Long seconds = parseDelay(value);
        if (currentGroupForAgent) {
          agentDelay = seconds;
        } else {
          wildcardDelay = seconds;
        }
        continue;
      }
      // "Disallow:" with an empty value allows everything and adds no rule.
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        Rule rule = new Rule(value, "allow".equals(key));
        if (currentGroupForAgent) {
          agentRules.add(rule);
        } else {
          wildcardRules.add(rule);
        }
      }
    }

    if (agentGroupSeen) {
      return new RobotsRules(agentRules, sitemaps, agentDelay);
    }
    return new RobotsRules(wildcardRules, sitemaps, wildcardDelay);
  }

  private static Long parseDelay(String value) {
    try {
      double seconds = Double.parseDouble(value);
      return seconds < 0 ? null : (long) Math.ceil(seconds);
    } catch (NumberFormatException ignored) {
      return null;
    }
  }

  /**
   * Leading product token of a {@code User-agent} value: "RealEstateBot/1.0" matches the same
   * group as "realestatebot".
   */
  static String productToken(String value) {
    String trimmed = value == null ? "" : value.trim();
    int end = 0;
    while (end < trimmed.length()) {
      char c = trimmed.charAt(end);
      if (c == '/' || Character.isWhitespace(c)) {
        break;
      }
      end++;
    }
    return trimmed.substring(0, end).toLowerCase(Locale.ROOT);
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") || path.startsWith("*") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$' && i == normalizedPath.length() - 1) {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
