package com.purchasingpower.threatgraph.repository;

import com.purchasingpower.threatgraph.model.graph.GraphEdgeEntity;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for persisted graph edges.
 */
@Repository
public interface GraphEdgeRepository extends JpaRepository<GraphEdgeEntity, Long> {

    /**
     * Find the single edge identified by its uniqueness triple.
     */
    Optional<GraphEdgeEntity> findBySourceIdAndTargetIdAndRelationship(
            String sourceId,
            String targetId,
            RelationshipType relationship
    );

    /**
     * Find all incoming edges to a node.
     */
    List<GraphEdgeEntity> findByTargetId(String targetId);

    /**
     * Delete every edge touching a node, in a single bulk DELETE.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM GraphEdgeEntity e WHERE e.sourceId = :nodeId OR e.targetId = :nodeId")
    int deleteByNodeId(@Param("nodeId") String nodeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM GraphEdgeEntity e WHERE e.sourceId = :sourceId AND e.targetId = :targetId "
            + "AND e.relationship = :relationship")
    int deleteByTriple(
            @Param("sourceId") String sourceId,
            @Param("targetId") String targetId,
            @Param("relationship") RelationshipType relationship
    );
}
