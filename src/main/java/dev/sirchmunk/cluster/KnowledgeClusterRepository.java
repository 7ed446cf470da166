package dev.sirchmunk.cluster;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link KnowledgeCluster} entities. */
public interface KnowledgeClusterRepository extends JpaRepository<KnowledgeCluster, String> {

  /** Clusters in any state but {@code lifecycle}; used to exclude deprecated clusters. */
  List<KnowledgeCluster> findByLifecycleNot(Lifecycle lifecycle);

  long countByLifecycle(Lifecycle lifecycle);
}
