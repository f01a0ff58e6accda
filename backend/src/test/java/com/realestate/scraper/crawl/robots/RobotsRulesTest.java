package com.realestate.scraper.crawl.robots;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobotsRulesTest {

  @Test
  void longestMatchWinsForWildcardUserAgent() {
    String robots =
        """
            User-agent: *
            Disallow: /private
            Allow: /private/public
            Sitemap: https://example.com/sitemap.xml
            """;

    RobotsRules rules = RobotsRules.parse(robots);
    assertTrue(rules.getSitemapUrls().contains("https://example.com/sitemap.xml"));
    assertFalse(rules.isAllowed("/private/page"));
    assertTrue(rules.isAllowed("/private/public/page"));
    assertTrue(rules.isAllowed("/other"));
  }

  @Test
  void ownAgentGroupTakesPrecedenceOverWildcard() {
    String robots =
        """
            User-agent: *
            Disallow: /

            User-agent: RealEstateResearchBot
            Disallow: /admin
            Crawl-delay: 3
            """;

    RobotsRules rules = RobotsRules.parse(robots, "realestateresearchbot");
    assertTrue(rules.isAllowed("/homes/for-sale"));
    assertFalse(rules.isAllowed("/admin/users"));
    assertEquals(3L, rules.getCrawlDelaySeconds());

    RobotsRules other = RobotsRules.parse(robots, "someotherbot");
    assertFalse(other.isAllowed("/homes/for-sale"));
    assertNull(other.getCrawlDelaySeconds());
  }

  @Test
  void wildcardAndEndAnchorPatterns() {
    String robots =
        """
            User-agent: *
            Disallow: /*.pdf$
            Disallow: /search*sort=
            """;

    RobotsRules rules = RobotsRules.parse(robots);
    assertFalse(rules.isAllowed("/brochures/flat.pdf"));
    assertTrue(rules.isAllowed("/brochures/flat.pdf?download=1"));
    assertFalse(rules.isAllowed("/search?city=porto&sort=price"));
    assertTrue(rules.isAllowed("/search?city=porto"));
  }

  @Test
  void equalLengthTieFavoursAllow() {
    String robots =
        """
            User-agent: *
            Disallow: /homes
            Allow: /homes
            """;

    assertTrue(RobotsRules.parse(robots).isAllowed("/homes/1"));
  }

  @Test
  void emptyDisallowAllowsEverything() {
    RobotsRules rules = RobotsRules.parse("User-agent: *\nDisallow:\n");
    assertTrue(rules.getRules().isEmpty());
    assertTrue(rules.isAllowed("/anything"));
  }

  @Test
  void agentWhoseNameIsOnlyPartOfOurTokenDoesNotReplaceWildcardGroup() {
    String robots =
        """
            User-agent: *
            Disallow: /private

            User-agent: bot
            Allow: /
            """;

    RobotsRules rules = RobotsRules.parse(robots, "realestateresearchbot");
    assertFalse(rules.isAllowed("/private/listing"));
    assertTrue(rules.isAllowed("/homes"));
  }

  @Test
  void emptyUserAgentLineIsIgnored() {
    String robots =
        """
            User-agent: *
            Disallow: /private

            User-agent:
            Allow: /
            """;

    RobotsRules rules = RobotsRules.parse(robots, "realestateresearchbot");
    assertFalse(rules.isAllowed("/private"));
  }

  @Test
  void agentGroupWithVersionSuffixStillMatches() {
    String robots =
        """
            User-agent: *
            Disallow: /

            User-agent: RealEstateResearchBot/2.0
            Disallow: /admin
            """;

    RobotsRules rules = RobotsRules.parse(robots, "realestateresearchbot");
    assertTrue(rules.isAllowed("/homes"));
    assertFalse(rules.isAllowed("/admin"));
  }
}
