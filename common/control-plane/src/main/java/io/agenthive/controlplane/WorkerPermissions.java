package io.agenthive.controlplane;

import java.util.List;

/**
 * Capabilities the worker's job participants request when joining their room.
 */
public record WorkerPermissions(boolean canPublish,
                                boolean canSubscribe,
                                boolean canPublishData,
                                boolean canUpdateMetadata,
                                List<String> canPublishSources,
                                boolean hidden) {

  public WorkerPermissions {
    canPublishSources = canPublishSources == null ? List.of() : List.copyOf(canPublishSources);
  }

  public static WorkerPermissions defaults() {
    return new WorkerPermissions(true, true, true, true, List.of(), false);
  }
}
