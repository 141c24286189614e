package com.scholary.podsummary.transcript;

import java.util.List;

/** Summary highlights attributed to one speaker. */
public record SpeakerHighlights(String speaker, List<String> highlights) {

  public SpeakerHighlights {
    highlights = highlights == null ? List.of() : List.copyOf(highlights);
  }
}
