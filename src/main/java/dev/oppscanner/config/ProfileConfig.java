package dev.oppscanner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.oppscanner.model.DiscoveryProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

/**
 * Loads the default DiscoveryProfile (used by batch runs) from profile.json.
 */
@Slf4j
@Configuration
public class ProfileConfig {

  @Bean
  public DiscoveryProfile defaultProfile(ObjectMapper objectMapper,
      @Value("${scanner.profile-path:profile.json}") String profilePath) {
    File file = new File(profilePath);
    if (!file.exists()) {
      log.warn("{} not found. Using default empty profile.", profilePath);
      return DiscoveryProfile.empty();
    }

    try {
      DiscoveryProfile profile = objectMapper.readValue(file, DiscoveryProfile.class);
      log.info("Loaded discovery profile for: {}", profile.getName());
      return profile;
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the required structure.", profilePath, e);
      throw new IllegalStateException("Could not load discovery profile", e);
    }
  }
}
