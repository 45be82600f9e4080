package com.purchasingpower.threatgraph.repository;

import com.purchasingpower.threatgraph.model.graph.GraphNodeEntity;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisted knowledge graph nodes.
 */
@Repository
public interface GraphNodeRepository extends JpaRepository<GraphNodeEntity, String> {

    /**
     * Find nodes of one type (ARTICLE, VULNERABILITY, ...), paged.
     */
    List<GraphNodeEntity> findByNodeType(NodeType nodeType, Pageable pageable);
}
