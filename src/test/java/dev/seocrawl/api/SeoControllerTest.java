package dev.seocrawl.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.seocrawl.audit.AuditResult;
import dev.seocrawl.audit.IndexabilityAuditor;
import dev.seocrawl.config.GlobalExceptionHandler;
import dev.seocrawl.crawl.CrawlEngine;
import dev.seocrawl.crawl.CrawlReports;
import dev.seocrawl.crawl.CrawlRequest;
import dev.seocrawl.crawl.CrawlResult;
import dev.seocrawl.crawl.CrawlStats;
import dev.seocrawl.crawl.StatusBuckets;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

@ExtendWith(MockitoExtension.class)
class SeoControllerTest {

  private static final CrawlResult EMPTY_CRAWL =
      new CrawlResult(
          List.of(),
          List.of(),
          List.of("https://example.com/sitemap.xml"),
          new CrawlStats(0, 0, 0, 5),
          new CrawlReports(List.of(), List.of(), new StatusBuckets(0, 0, 0, 0, 0)));

  @Mock private CrawlEngine crawlEngine;
  @Mock private IndexabilityAuditor auditor;
  @Mock private CrawlSnapshotWriter snapshotWriter;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
    validator.afterPropertiesSet();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SeoController(crawlEngine, auditor, snapshotWriter))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setValidator(validator)
            .build();
  }

  @Test
  void healthz_reports_ok() throws Exception {
    mockMvc
        .perform(get("/healthz"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true));
  }

  @Test
  void crawl_readiness_probe() throws Exception {
    mockMvc
        .perform(get("/api/crawl"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.msg").value("crawl endpoint ready"));
  }

  @Test
  void crawl_returns_output_and_snapshot_path() throws Exception {
    given(crawlEngine.crawl(any())).willReturn(EMPTY_CRAWL);
    given(snapshotWriter.enabled()).willReturn(true);
    given(snapshotWriter.write(any(), any())).willReturn(Path.of("/data/example.com-run.json"));

    mockMvc
        .perform(
            post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrl\":\"https://example.com/\",\"depth\":1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.snapshotFile").value("/data/example.com-run.json"))
        .andExpect(jsonPath("$.output.sitemap[0]").value("https://example.com/sitemap.xml"))
        .andExpect(jsonPath("$.output.reports.statusBuckets['2xx']").value(0));

    verify(crawlEngine).crawl(new CrawlRequest("https://example.com/", 1, null, null, null));
  }

  @Test
  void crawl_still_answers_when_snapshot_cannot_be_written() throws Exception {
    given(crawlEngine.crawl(any())).willReturn(EMPTY_CRAWL);
    given(snapshotWriter.enabled()).willReturn(true);
    given(snapshotWriter.write(any(), any())).willThrow(new IOException("read-only file system"));

    mockMvc
        .perform(
            post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrl\":\"https://example.com/\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.snapshotFile").value(nullValue()));
  }

  @Test
  void crawl_skips_snapshot_when_disabled() throws Exception {
    given(crawlEngine.crawl(any())).willReturn(EMPTY_CRAWL);

    mockMvc
        .perform(
            post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrl\":\"https://example.com/\"}"))
        .andExpect(status().isOk());

    verify(snapshotWriter, never()).write(any(), any());
  }

  @Test
  void crawl_rejects_depth_above_limit() throws Exception {
    mockMvc
        .perform(
            post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrl\":\"https://example.com/\",\"depth\":9}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("depth")));

    verify(crawlEngine, never()).crawl(any());
  }

  @Test
  void crawl_rejects_missing_start_url() throws Exception {
    mockMvc
        .perform(post("/api/crawl").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("startUrl")));
  }

  @Test
  void crawl_maps_invalid_start_url_to_bad_request() throws Exception {
    given(crawlEngine.crawl(any()))
        .willThrow(new IllegalArgumentException("startUrl must be an absolute http(s) URL: x"));

    mockMvc
        .perform(
            post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrl\":\"x\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("startUrl must be an absolute http(s) URL: x"));
  }

  @Test
  void audit_returns_results() throws Exception {
    given(auditor.audit(any()))
        .willReturn(List.of(AuditResult.fetchFailed("https://example.com/")));

    mockMvc
        .perform(
            post("/api/audit")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\":[\"https://example.com/\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.results[0].issues[0]").value("fetch failed"))
        .andExpect(jsonPath("$.results[0].noindex.meta").value(false));
  }

  @Test
  void audit_rejects_empty_url_list() throws Exception {
    mockMvc
        .perform(
            post("/api/audit").contentType(MediaType.APPLICATION_JSON).content("{\"urls\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("urls")));

    verify(auditor, never()).audit(any());
  }
}
