package dev.oppscanner.api;

import dev.oppscanner.model.DiscoveryResult;
import dev.oppscanner.service.DiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Inbound HTTP surface for on-demand discovery.
 */
@Slf4j
@RestController
@RequestMapping("/api/discovery")
@RequiredArgsConstructor
public class DiscoveryController {

    private final DiscoveryService discoveryService;

    @PostMapping
    public Mono<DiscoveryResult> discover(@RequestBody DiscoveryRequest request) {
        if (request == null || request.caller() == null || request.caller().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "caller is required"));
        }
        log.info("Discovery requested by '{}' (sources: {})", request.caller(),
                request.sources() == null || request.sources().isEmpty() ? "all enabled" : request.sources());
        return discoveryService.discover(request.caller().trim(), request.profile(), request.sources());
    }

    @GetMapping("/sources")
    public List<SourceStatus> sources() {
        return discoveryService.getSources().stream()
                .map(source -> new SourceStatus(source.getName(), source.isEnabled()))
                .toList();
    }
}
