package io.agenthive.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RunningJobInfoTest {

  @Test
  void normalisesOptionalJobFields() {
    Job job = new Job("job-1", JobType.PUBLISHER, null, new ParticipantInfo("PA_1", "alice", null), null);

    assertThat(job.room()).isEmpty();
    assertThat(job.metadata()).isEmpty();
    assertThat(job.participantInfo()).map(ParticipantInfo::identity).contains("alice");
  }

  @Test
  void rejectsBlankJobId() {
    assertThatThrownBy(() -> Job.room(" ", "lobby"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("id");
  }

  @Test
  void acceptArgumentsCopyAttributes() {
    Map<String, String> attributes = new HashMap<>();
    attributes.put("lang", "en");
    JobAcceptArguments arguments = new JobAcceptArguments("agent", "Agent", null, attributes);
    attributes.put("lang", "de");

    assertThat(arguments.attributes()).containsEntry("lang", "en");
    assertThat(arguments.metadata()).isEmpty();
  }

  @Test
  void defaultAcceptIdentityIsDerivedFromJobId() {
    assertThat(JobAcceptArguments.defaultsFor(Job.room("job-7", "lobby")).identity()).isEqualTo("agent-job-7");
  }

  @Test
  void requiresConnectionDetails() {
    Job job = Job.room("job-1", "lobby");

    assertThatThrownBy(() -> new RunningJobInfo(job, JobAcceptArguments.of("agent"), "", "token"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("url");
    assertThat(new RunningJobInfo(job, JobAcceptArguments.of("agent"), "wss://cp", "token").jobId())
        .isEqualTo("job-1");
  }
}
