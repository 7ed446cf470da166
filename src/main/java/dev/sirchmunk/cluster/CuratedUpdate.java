package dev.sirchmunk.cluster;

import dev.sirchmunk.evidence.EvidenceUnit;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Changes to the curated fields of a cluster. {@code null} leaves a field unchanged.
 *
 * @param name new label
 * @param description new description
 * @param content new synthesis
 * @param evidence replacement evidence list
 * @param patterns replacement patterns
 * @param constraints replacement constraints
 * @param abstractionLevel new abstraction level
 */
public record CuratedUpdate(
    @Nullable String name,
    @Nullable ClusterText description,
    @Nullable ClusterText content,
    @Nullable List<EvidenceUnit> evidence,
    @Nullable List<String> patterns,
    @Nullable List<Constraint> constraints,
    @Nullable AbstractionLevel abstractionLevel) {

  public static CuratedUpdate description(ClusterText description) {
    return new CuratedUpdate(null, description, null, null, null, null, null);
  }

  public static CuratedUpdate name(String name) {
    return new CuratedUpdate(name, null, null, null, null, null, null);
  }
}
