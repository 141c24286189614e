package com.scholary.podsummary.service;

import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.storage.ArtifactNames;
import com.scholary.podsummary.transcript.Summary;
import com.scholary.podsummary.transcript.Transcript;

/**
 * Everything a client needs once a job has run: status, transcript, summary and audio links.
 *
 * <p>All fields come from a single snapshot, so they are mutually consistent.
 */
public record JobResults(
    Job job, Transcript transcript, Summary summary, String audioUrl, String summaryAudioUrl) {

  public static JobResults from(Job job) {
    return new JobResults(
        job,
        job.transcript(),
        job.summary(),
        job.asset(ArtifactNames.SOURCE_AUDIO_ASSET).orElse(null),
        job.summaryAudioRef());
  }
}
