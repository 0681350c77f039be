package io.agenthive.model;

/**
 * Participant a job was dispatched for. Only present on {@link JobType#PUBLISHER} jobs.
 */
public record ParticipantInfo(String sid, String identity, String name) {

  public ParticipantInfo {
    identity = ModelGuards.requireText(identity, "identity");
  }
}
