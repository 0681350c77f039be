package io.agenthive.controlplane.transport;

public interface SessionListener {

  void onFrame(String frame);

  /**
   * The remote side closed the session.
   */
  void onClosed(int statusCode, String reason);

  /**
   * The session failed; no further callbacks follow.
   */
  void onError(Throwable error);
}
