package io.lapse.publish;

import io.lapse.LapseException;

/** Pushes an updated document somewhere outside the local file system. */
public interface Publisher {
  /**
   * Publishes the document.
   *
   * @param request the document path and change description
   * @return true if published, false if this publisher chose to skip (e.g. no credentials)
   * @throws LapseException with kind PUBLISH if publishing was attempted and failed
   */
  boolean publish(PublishRequest request) throws LapseException;
}
