package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.Platform;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class UpworkSourceTest {

  private static final String FEED = """
      <rss version="2.0"><channel>
        <item>
          <title>Build a Spring Boot API</title>
          <link>https://www.upwork.com/jobs/~01abc?source=rss</link>
          <description>Budget: $1,500</description>
        </item>
        <item>
          <title>Fix a typo</title>
          <link>https://www.upwork.com/jobs/~01def?source=rss</link>
          <description>Budget: $20</description>
        </item>
      </channel></rss>
      """;

  private MockWebServer mockWebServer;
  private UpworkSource source;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    SourcesConfig sourcesConfig = SourceFixtures.pointingAt(Platform.UPWORK, mockWebServer.url("/").toString());
    sourcesConfig.getUpwork().setMinValue(100);
    source = new UpworkSource(WebClient.builder(), SourceFixtures.support(new SimpleMeterRegistry()), sourcesConfig);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void shouldQueryByCompanyTypeAndApplyMinimumValue() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setBody(FEED).addHeader("Content-Type", "application/rss+xml"));
    DiscoveryProfile profile = DiscoveryProfile.builder().companyType("web agency").build();

    StepVerifier.create(source.fetch(profile))
        .assertNext(opp -> {
          assertThat(opp.getId()).isEqualTo("upwork_~01abc");
          assertThat(opp.getType()).isEqualTo("freelance_gig");
          assertThat(opp.getEstimatedValue()).isEqualTo(1500);
        })
        .verifyComplete();

    RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/ab/feed/jobs/rss");
    assertThat(request.getRequestUrl().queryParameter("q")).isEqualTo("web agency");
    assertThat(request.getRequestUrl().queryParameter("sort")).isEqualTo("recency");
  }

  @Test
  void shouldFallBackThroughKeywordsToGeneralQuery() {
    assertThat(UpworkSource.query(DiscoveryProfile.builder().keywords(List.of("scraping")).build()))
        .isEqualTo("scraping");
    assertThat(UpworkSource.query(DiscoveryProfile.empty())).isEqualTo(UpworkSource.FALLBACK_QUERY);
  }

  @Test
  void shouldSkipNullAndBlankKeywords() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setBody(FEED).addHeader("Content-Type", "application/rss+xml"));
    DiscoveryProfile profile = DiscoveryProfile.builder().keywords(Arrays.asList(null, " ", "crawler")).build();
    DiscoveryProfile onlyNull = DiscoveryProfile.builder().keywords(Arrays.asList((String) null)).build();

    assertThat(UpworkSource.query(onlyNull)).isEqualTo(UpworkSource.FALLBACK_QUERY);
    StepVerifier.create(source.fetch(profile)).expectNextCount(1).verifyComplete();

    RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getRequestUrl().queryParameter("q")).isEqualTo("crawler");
  }
}
