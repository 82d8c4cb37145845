package org.conflux.runtime.spi;

import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.model.ResourceAmount;

import java.util.List;
import java.util.Optional;

/**
 * Lookup and mutation primitives of the converter topology, owned by the flow topology service.
 * <p>
 * The engine treats the directory as the single source of truth for node state: it re-reads a
 * node before every decision and changes it only through these calls. Implementations report
 * failures as {@link NodeResult.Failure} instead of throwing.
 */
public interface IConverterDirectory {

    /**
     * Returns snapshots of all converter nodes, in a stable order.
     */
    List<ConverterNode> getNodes();

    /**
     * Returns a snapshot of one converter node.
     *
     * @param id the node id
     * @return the node, or empty if unknown or not a converter
     */
    Optional<ConverterNode> getNode(String id);

    /**
     * Checks whether the node holds at least the given amounts.
     */
    NodeResult<Boolean> checkResourcesAvailable(String converterId, List<ResourceAmount> inputs);

    /**
     * Removes the given amounts from the node's pool. Implementations must either consume all
     * amounts or none; {@code Ok(false)} means nothing was consumed.
     */
    NodeResult<Boolean> consumeResources(String converterId, List<ResourceAmount> inputs);

    /**
     * Adds the given amounts to the node's pool.
     */
    NodeResult<Void> addResources(String converterId, List<ResourceAmount> outputs);

    /**
     * Hands freshly produced amounts from one node directly to another node's pool. The source
     * pool is not debited. {@code Ok(false)} means the target did not accept the hand-off.
     */
    NodeResult<Boolean> transferResources(String fromId, String toId, List<ResourceAmount> amounts);

    /**
     * Applies a partial update to a node.
     */
    NodeResult<Void> updateNodeData(String nodeId, ConverterNodeUpdate update);
}
