package dev.seocrawl.audit;

import static dev.seocrawl.fixture.FetchResultBuilder.fetched;
import static dev.seocrawl.fixture.FetchResultBuilder.htmlPage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import dev.seocrawl.config.CrawlerProperties;
import dev.seocrawl.fetch.FetchException;
import dev.seocrawl.fetch.RedirectFetcher;
import dev.seocrawl.fetch.RedirectHop;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IndexabilityAuditorTest {

  private static final String PAGE = "https://example.com/page";

  @Mock private RedirectFetcher fetcher;

  private IndexabilityAuditor auditor;

  @BeforeEach
  void setUp() {
    auditor = new IndexabilityAuditor(fetcher, CrawlerProperties.defaults());
  }

  private AuditResult auditPage(String html) throws FetchException {
    given(fetcher.fetch(eq(PAGE), anyString())).willReturn(htmlPage(PAGE, html));
    return auditor.audit(AuditRequest.of(PAGE)).get(0);
  }

  @Nested
  class Noindex {

    @Test
    void meta_noindex_without_header_is_a_conflict() throws FetchException {
      AuditResult result =
          auditPage("<html><head><meta name=\"robots\" content=\"noindex\"></head></html>");

      assertThat(result.noindex()).isEqualTo(new NoindexFlags(true, false));
      assertThat(result.metaRobots()).isEqualTo(RobotsDirectives.of(RobotsDirective.NOINDEX));
      assertThat(result.xRobots()).isNull();
      assertThat(result.issues()).containsExactly(AuditResult.CONFLICTING_NOINDEX);
    }

    @Test
    void indexable_meta_without_header_is_not_a_conflict() throws FetchException {
      AuditResult result = auditPage("<meta name=\"robots\" content=\"index, follow\">");

      assertThat(result.noindex()).isEqualTo(NoindexFlags.NONE);
      assertThat(result.issues()).isEmpty();
    }

    @Test
    void header_noindex_against_indexable_meta_is_a_conflict() throws FetchException {
      given(fetcher.fetch(eq(PAGE), anyString()))
          .willReturn(
              fetched(PAGE)
                  .html("<head><meta name=\"robots\" content=\"index, follow\"></head>")
                  .header(IndexabilityAuditor.X_ROBOTS_TAG, "noindex")
                  .build());

      AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

      assertThat(result.noindex()).isEqualTo(new NoindexFlags(false, true));
      assertThat(result.issues()).containsExactly(AuditResult.CONFLICTING_NOINDEX);
    }

    @Test
    void agreeing_sources_are_not_a_conflict() throws FetchException {
      given(fetcher.fetch(eq(PAGE), anyString()))
          .willReturn(
              fetched(PAGE)
                  .html("<meta name=\"robots\" content=\"noindex\">")
                  .header(IndexabilityAuditor.X_ROBOTS_TAG, "noindex, nofollow")
                  .build());

      AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

      assertThat(result.noindex()).isEqualTo(new NoindexFlags(true, true));
      assertThat(result.issues()).isEmpty();
    }

    @Test
    void multiple_header_values_and_meta_tags_are_merged() throws FetchException {
      given(fetcher.fetch(eq(PAGE), anyString()))
          .willReturn(
              fetched(PAGE)
                  .html(
                      "<meta name=\"ROBOTS\" content=\"nofollow\">"
                          + "<meta name=\"robots\" content=\"noarchive\">")
                  .header(IndexabilityAuditor.X_ROBOTS_TAG, "nosnippet")
                  .header(IndexabilityAuditor.X_ROBOTS_TAG, "noimageindex")
                  .build());

      AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

      assertThat(result.metaRobots())
          .isEqualTo(RobotsDirectives.of(RobotsDirective.NOFOLLOW, RobotsDirective.NOARCHIVE));
      assertThat(result.xRobots())
          .isEqualTo(RobotsDirectives.of(RobotsDirective.NOSNIPPET, RobotsDirective.NOIMAGEINDEX));
    }
  }

  @Nested
  class Canonical {

    @Test
    void relative_canonical_is_resolved_against_final_url() throws FetchException {
      given(fetcher.fetch(eq(PAGE), anyString()))
          .willReturn(
              fetched(PAGE)
                  .redirectedTo("https://example.com/en/page", 301)
                  .html("<link rel=\"canonical\" href=\"/en/page\">")
                  .build());

      AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

      assertThat(result.url()).isEqualTo(PAGE);
      assertThat(result.finalUrl()).isEqualTo("https://example.com/en/page");
      assertThat(result.canonical()).isEqualTo("https://example.com/en/page");
      assertThat(result.redirectChain())
          .containsExactly(new RedirectHop(PAGE, "https://example.com/en/page", 301));
      assertThat(result.issues()).isEmpty();
    }

    @Test
    void multiple_canonicals_keep_the_first() throws FetchException {
      AuditResult result =
          auditPage(
              "<link rel=\"canonical\" href=\"https://example.com/a\">"
                  + "<link rel=\"canonical\" href=\"https://example.com/b\">");

      assertThat(result.canonical()).isEqualTo("https://example.com/a");
      assertThat(result.issues()).containsExactly(AuditResult.MULTIPLE_CANONICALS);
    }

    @Test
    void canonical_on_other_registrable_domain_is_flagged() throws FetchException {
      AuditResult result = auditPage("<link rel=\"canonical\" href=\"https://other.org/page\">");

      assertThat(result.canonical()).isEqualTo("https://other.org/page");
      assertThat(result.issues()).containsExactly(AuditResult.CANONICAL_OFF_DOMAIN);
    }

    @Test
    void canonical_on_sibling_subdomain_is_not_flagged() throws FetchException {
      AuditResult result =
          auditPage("<link rel=\"canonical\" href=\"https://www.example.com/page\">");

      assertThat(result.issues()).isEmpty();
    }

    @Test
    void unresolvable_canonical_is_reported_as_invalid() throws FetchException {
      AuditResult result = auditPage("<link rel=\"canonical\" href=\"http://[broken\">");

      assertThat(result.canonical()).isNull();
      assertThat(result.issues()).containsExactly(AuditResult.INVALID_CANONICAL);
    }

    @Test
    void empty_canonical_href_is_ignored() throws FetchException {
      AuditResult result = auditPage("<link rel=\"canonical\" href=\"  \">");

      assertThat(result.canonical()).isNull();
      assertThat(result.issues()).isEmpty();
    }
  }

  @Test
  void hreflang_alternates_are_absolute_and_ordered() throws FetchException {
    AuditResult result =
        auditPage(
            "<link rel=\"alternate\" hreflang=\"es\" href=\"/es/page\">"
                + "<link rel=\"alternate\" hreflang=\"x-default\" href=\"https://example.com/\">"
                + "<link rel=\"alternate\" hreflang=\"\" href=\"/skip\">"
                + "<link rel=\"alternate\" hreflang=\"fr\" href=\"\">");

    assertThat(result.hreflang())
        .containsExactly(
            new HreflangLink("es", "https://example.com/es/page"),
            new HreflangLink("x-default", "https://example.com/"));
  }

  @Test
  void non_html_responses_only_carry_header_signals() throws FetchException {
    given(fetcher.fetch(eq(PAGE), anyString()))
        .willReturn(
            fetched(PAGE)
                .body("application/pdf", "<link rel=\"canonical\" href=\"https://other.org/\">")
                .header(IndexabilityAuditor.X_ROBOTS_TAG, "noindex")
                .build());

    AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

    assertThat(result.contentType()).isEqualTo("application/pdf");
    assertThat(result.canonical()).isNull();
    assertThat(result.metaRobots()).isNull();
    assertThat(result.noindex()).isEqualTo(new NoindexFlags(false, true));
    assertThat(result.issues()).containsExactly(AuditResult.CONFLICTING_NOINDEX);
  }

  @Test
  void no_content_response_is_not_parsed() throws FetchException {
    given(fetcher.fetch(eq(PAGE), anyString()))
        .willReturn(
            fetched(PAGE)
                .status(204)
                .html("<link rel=\"canonical\" href=\"https://other.org/\">")
                .build());

    AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

    assertThat(result.status()).isEqualTo(204);
    assertThat(result.canonical()).isNull();
  }

  @Test
  void unreachable_url_yields_fetch_failed_result() throws FetchException {
    given(fetcher.fetch(eq(PAGE), anyString())).willThrow(new FetchException("connect refused"));

    AuditResult result = auditor.audit(AuditRequest.of(PAGE)).get(0);

    assertThat(result).isEqualTo(AuditResult.fetchFailed(PAGE));
    assertThat(result.status()).isZero();
    assertThat(result.finalUrl()).isEqualTo(PAGE);
    assertThat(result.issues()).containsExactly(AuditResult.FETCH_FAILED);
  }

  @Test
  void results_follow_input_order() throws FetchException {
    List<String> urls =
        List.of("https://example.com/1", "https://example.com/2", "https://example.com/3");
    given(fetcher.fetch(eq(urls.get(0)), anyString()))
        .willThrow(new FetchException("timeout"));
    given(fetcher.fetch(eq(urls.get(1)), anyString()))
        .willReturn(htmlPage(urls.get(1), "<p>two</p>"));
    given(fetcher.fetch(eq(urls.get(2)), anyString()))
        .willReturn(fetched(urls.get(2)).status(404).build());

    List<AuditResult> results = auditor.audit(new AuditRequest(urls, null));

    assertThat(results).extracting(AuditResult::url).containsExactlyElementsOf(urls);
    assertThat(results).extracting(AuditResult::status).containsExactly(0, 200, 404);
  }

  @Test
  void user_agent_override_is_forwarded() throws FetchException {
    given(fetcher.fetch(PAGE, "AuditBot/2.0")).willReturn(htmlPage(PAGE, "<p>ok</p>"));

    auditor.audit(new AuditRequest(List.of(PAGE), "AuditBot/2.0"));

    verify(fetcher).fetch(PAGE, "AuditBot/2.0");
  }
}
