package io.agenthive.model;

import java.util.Map;

/**
 * Participant details the decision function chose when accepting a job.
 */
public record JobAcceptArguments(String identity,
                                 String name,
                                 String metadata,
                                 Map<String, String> attributes) {

  public JobAcceptArguments {
    identity = ModelGuards.requireText(identity, "identity");
    name = ModelGuards.emptyIfNull(name);
    metadata = ModelGuards.emptyIfNull(metadata);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static JobAcceptArguments of(String identity) {
    return new JobAcceptArguments(identity, null, null, null);
  }

  /**
   * Default identity used when a job is accepted without explicit arguments.
   */
  public static JobAcceptArguments defaultsFor(Job job) {
    return of("agent-" + job.id());
  }
}
