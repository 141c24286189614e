package com.scholary.podsummary.ingest;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for fetching source audio by URL. */
@ConfigurationProperties(prefix = "ingest")
@Validated
public record IngestProperties(
    @NotNull Duration downloadTimeout,
    @Positive long maxDownloadBytes,
    @Positive int executorThreads) {}
