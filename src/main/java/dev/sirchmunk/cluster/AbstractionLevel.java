package dev.sirchmunk.cluster;

/** How general the knowledge in a cluster is, from most concrete to most abstract. */
public enum AbstractionLevel {
  TECHNIQUE,
  PRINCIPLE,
  PARADIGM,
  FOUNDATION,
  PHILOSOPHY
}
