package com.scholary.podsummary.stage.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response body of the Whisper transcription API. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<WhisperSegment> segments, String language, Double duration) {}
