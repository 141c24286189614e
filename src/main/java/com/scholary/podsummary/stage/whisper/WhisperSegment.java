package com.scholary.podsummary.stage.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One timed segment as returned by the Whisper service. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperSegment(double start, double end, String text) {}
