package io.electionradar.ingestion.api;

import io.electionradar.ingestion.api.dto.RunSummary;
import io.electionradar.ingestion.api.dto.SourcesInfo;
import io.electionradar.ingestion.api.service.EventPublisherService;
import io.electionradar.ingestion.api.service.IngestionPipelineService;
import io.electionradar.ingestion.config.FeedSource;
import io.electionradar.ingestion.config.IngestionConfig;
import io.electionradar.ingestion.platform.DeliveryPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final IngestionPipelineService pipelineService;
    private final EventPublisherService eventPublisher;
    private final List<DeliveryPlatform> platforms;
    private final IngestionConfig config;
    private final Clock clock;

    public PipelineController(IngestionPipelineService pipelineService,
                              EventPublisherService eventPublisher,
                              List<DeliveryPlatform> platforms,
                              IngestionConfig config,
                              Clock clock) {
        this.pipelineService = pipelineService;
        this.eventPublisher = eventPublisher;
        this.platforms = platforms;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Runs the pipeline synchronously and returns its summary. 500 only for missing configuration.
     */
    @PostMapping("/run")
    public ResponseEntity<RunSummary> run(@RequestBody(required = false) Map<String, Object> event) {
        Map<String, Object> payload = new HashMap<>();
        if (event != null) {
            payload.putAll(event);
        }
        payload.putIfAbsent("trigger", "http");

        RunSummary summary = pipelineService.run(payload, null);
        if (!summary.isSuccess()) {
            logger.error("Manual run aborted: {} {}", summary.error(), summary.missingKeys());
            return ResponseEntity.internalServerError().body(summary);
        }
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> platformStatus = new LinkedHashMap<>();
        for (DeliveryPlatform platform : platforms) {
            platformStatus.put(platform.name(), platform.isEnabled() ? "configured" : "disabled");
        }

        Map<String, Object> healthInfo = Map.of(
                "status", "UP",
                "service", "Election News Ingestion Service",
                "timestamp", Instant.now(clock),
                "platforms", platformStatus,
                "historyStore", config.history() != null && config.history().isRedis() ? "redis" : "appwrite",
                "events", eventPublisher.isEnabled()
        );
        return ResponseEntity.ok(healthInfo);
    }

    @GetMapping("/sources")
    public SourcesInfo sources() {
        List<FeedSource> all = config.sources() != null ? config.sources() : List.of();
        List<SourcesInfo.SourceView> views = all.stream()
                .map(s -> new SourcesInfo.SourceView(s.getSimpleName(), s.url(), s.trustBonus(), s.enabled()))
                .toList();
        return new SourcesInfo(views, all.size(), config.getEnabledSources().size(), Instant.now(clock));
    }
}
