package io.agenthive.model;

/**
 * Kind of job the control plane dispatches to a worker.
 */
public enum JobType {
  /** One job per room, started when the room is created. */
  ROOM,
  /** One job per publishing participant. */
  PUBLISHER
}
