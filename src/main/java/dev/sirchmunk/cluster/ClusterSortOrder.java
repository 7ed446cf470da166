package dev.sirchmunk.cluster;

/** Sort keys for listing clusters; every order is descending. */
public enum ClusterSortOrder {
  HOTNESS("hotness"),
  CONFIDENCE("confidence"),
  LAST_MODIFIED("lastModified");

  private final String property;

  ClusterSortOrder(String property) {
    this.property = property;
  }

  /** Entity property sorted on. */
  public String property() {
    return property;
  }
}
