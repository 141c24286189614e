package com.scholary.podsummary.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Response for an upload: the new job's id and initial status. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UploadResponse(String jobId, JobStatusResponse status) {}
