package dev.oppscanner;

import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.DiscoveryResult;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.model.Platform;
import dev.oppscanner.service.DiscoveryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryRunnerTest {

  @Mock
  private DiscoveryService discoveryService;

  private final DiscoveryProfile profile = DiscoveryProfile.builder().name("Studio").build();

  private DiscoveryRunner discoveryRunner;

  @BeforeEach
  void setUp() {
    discoveryRunner = new DiscoveryRunner(discoveryService, profile);
    ReflectionTestUtils.setField(discoveryRunner, "caller", "batch");
    ReflectionTestUtils.setField(discoveryRunner, "sources", List.of());
  }

  @Test
  void execute_returnsNumberOfOpportunities() {
    Opportunity opportunity = Opportunity.builder()
        .source(Platform.REDDIT).nativeId("a").title("Need help").estimatedValue(500).matchScore(40).build();
    DiscoveryResult result = DiscoveryResult.builder()
        .success(true)
        .caller("batch")
        .opportunities(List.of(opportunity))
        .bySource(Map.of())
        .totalFound(1)
        .totalEstimatedValue(500)
        .sourcesAttempted(List.of("reddit"))
        .completedAt(Instant.now())
        .build();
    when(discoveryService.discover(eq("batch"), eq(profile), any())).thenReturn(Mono.just(result));

    assertThat(discoveryRunner.execute()).isEqualTo(1);
    verify(discoveryService).discover("batch", profile, List.of());
  }

  @Test
  void execute_emptyResult_returnsZero() {
    when(discoveryService.discover(any(), any(), any())).thenReturn(Mono.empty());

    assertThat(discoveryRunner.execute()).isZero();
  }

  @Test
  void execute_serviceFails_throwsIllegalState() {
    when(discoveryService.discover(any(), any(), any())).thenReturn(Mono.error(new RuntimeException("boom")));

    assertThatThrownBy(() -> discoveryRunner.execute())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Discovery run failed");
  }
}
