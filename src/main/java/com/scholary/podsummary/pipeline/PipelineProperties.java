package com.scholary.podsummary.pipeline;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for pipeline execution.
 *
 * <p>{@code executorThreads} bounds how many jobs run at once; {@code stageExecutorThreads} bounds
 * concurrent adapter calls. {@code stageTimeout} caps every single adapter call.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive int executorThreads,
    @PositiveOrZero int executorQueueSize,
    @Positive int stageExecutorThreads,
    @NotNull Duration stageTimeout,
    @PositiveOrZero int shutdownAwaitSeconds,
    String defaultVoice) {}
