package com.scholary.podsummary.job;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JobStageTest {

  @Test
  void canFollow_shouldFollowPipelineOrder() {
    assertThat(JobStage.TRANSCRIBING.canFollow(JobStage.UPLOADED)).isTrue();
    assertThat(JobStage.COMPLETED.canFollow(JobStage.SUMMARIZING)).isTrue();
    assertThat(JobStage.SYNTHESIZING_SPEECH.canFollow(JobStage.SUMMARIZING)).isTrue();
    assertThat(JobStage.UPLOADED.canFollow(JobStage.TRANSCRIBING)).isFalse();
    assertThat(JobStage.SUMMARIZING.canFollow(JobStage.SUMMARIZING)).isFalse();
  }

  @Test
  void canFollow_shouldRejectEverythingAfterTerminalStage() {
    for (JobStage next : JobStage.values()) {
      assertThat(next.canFollow(JobStage.COMPLETED)).isFalse();
      assertThat(next.canFollow(JobStage.FAILED)).isFalse();
    }
  }

  @Test
  void wireName_shouldMatchApiValues() {
    assertThat(JobStage.SYNTHESIZING_SPEECH.wireName()).isEqualTo("tts");
    assertThat(JobStage.UPLOADED.wireName()).isEqualTo("uploaded");
    assertThat(JobStage.FAILED.isTerminal()).isTrue();
    assertThat(JobStage.DIARIZING.isTerminal()).isFalse();
  }
}
