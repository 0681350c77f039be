package io.agenthive.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable job descriptor received from the control plane.
 *
 * <p>{@code metadata} is opaque to the worker and handed to the job process untouched.</p>
 */
public record Job(String id,
                  JobType type,
                  String room,
                  ParticipantInfo participant,
                  String metadata) {

  public Job {
    id = ModelGuards.requireText(id, "id");
    type = Objects.requireNonNull(type, "type");
    room = ModelGuards.emptyIfNull(room);
    metadata = ModelGuards.emptyIfNull(metadata);
  }

  public static Job room(String id, String room) {
    return new Job(id, JobType.ROOM, room, null, null);
  }

  public Optional<ParticipantInfo> participantInfo() {
    return Optional.ofNullable(participant);
  }
}
