package dev.oppscanner;

import dev.oppscanner.model.DiscoveryProfile;
import dev.oppscanner.model.DiscoveryResult;
import dev.oppscanner.model.Opportunity;
import dev.oppscanner.service.DiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * One batch discovery for the profile loaded at startup, with the top matches logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscoveryRunner {

  private static final String SEPARATOR = "========================================";
  private static final int TOP_LOGGED = 10;

  private final DiscoveryService discoveryService;
  private final DiscoveryProfile defaultProfile;

  @Value("${scanner.caller:batch}")
  private String caller;

  @Value("${scanner.sources:}")
  private List<String> sources;

  /**
   * @return number of opportunities found
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Opportunity Scanner Starting");
    log.info(SEPARATOR);

    try {
      DiscoveryResult result = discoveryService.discover(caller, defaultProfile, sources).block();
      if (result == null) {
        return 0;
      }

      log.info(SEPARATOR);
      log.info("Opportunity Scanner Completed");
      log.info("Opportunities: {} (high relevance: {}), estimated value: ${}",
          result.getTotalFound(), result.getHighRelevanceCount(), result.getTotalEstimatedValue());
      result.getOpportunities().stream()
          .sorted(Comparator.comparingInt(Opportunity::getMatchScore).reversed())
          .limit(TOP_LOGGED)
          .forEach(o -> log.info("  - [{}] {} (${}, match {})",
              o.getSource().getKey(), o.getTitle(), o.getEstimatedValue(), o.getMatchScore()));
      log.info(SEPARATOR);

      return result.getTotalFound();
    } catch (Exception e) {
      log.error("Discovery run failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Discovery run failed", e);
    }
  }
}
