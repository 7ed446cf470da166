package dev.sirchmunk.cluster;

/**
 * A write lost a race or would silently overwrite another cluster: an insert under an existing
 * id, or an update to a cluster that became {@link Lifecycle#DEPRECATED} meanwhile. Callers fall
 * back to fresh computation.
 */
public class ClusterConflictException extends RuntimeException {

  public ClusterConflictException(String message) {
    super(message);
  }
}
