package dev.oppscanner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class OpportunityScannerApplication implements CommandLineRunner {

    private final DiscoveryRunner discoveryRunner;
    private final ExitManager exitManager;

    // Batch mode: discover once for the configured profile, then exit
    @Value("${scanner.run-once:false}")
    private boolean runOnce;

    public static void main(String[] args) {
        SpringApplication.run(OpportunityScannerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        if (!runOnce) {
            log.info("Serving discovery requests on /api/discovery");
            return;
        }
        try {
            discoveryRunner.execute();
            log.info("Opportunity Scanner exiting...");
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Opportunity Scanner failed: {}", e.getMessage());
            exitManager.exit(1);
        }
    }
}
