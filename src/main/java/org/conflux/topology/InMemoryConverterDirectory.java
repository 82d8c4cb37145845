package org.conflux.topology;

import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.model.ResourceAmount;
import org.conflux.runtime.spi.IConverterDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Converter directory that keeps every node in memory.
 * <p>
 * Nodes are listed in registration order. Consumption is all-or-nothing across resource types.
 * A transfer hands freshly produced amounts to the target node: the target pool is credited and
 * the source pool is left as it is. Updates that would run more processes than a node's capacity
 * are rejected.
 * <p>
 * Thread Safety: all methods are synchronized.
 */
public class InMemoryConverterDirectory implements IConverterDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryConverterDirectory.class);

    private final Map<String, ConverterNode> nodes = new LinkedHashMap<>();

    /**
     * Adds a node or replaces the node with the same id.
     */
    public synchronized void register(ConverterNode node) {
        ConverterNode previous = nodes.put(node.id(), node);
        if (previous != null) {
            LOG.debug("Converter node {} replaced", node.id());
        }
    }

    public synchronized boolean remove(String id) {
        return nodes.remove(id) != null;
    }

    public synchronized Map<String, Integer> resourcesOf(String id) {
        ConverterNode node = nodes.get(id);
        return node == null ? Map.of() : node.resources();
    }

    @Override
    public synchronized List<ConverterNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    @Override
    public synchronized Optional<ConverterNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public synchronized NodeResult<Boolean> checkResourcesAvailable(String converterId, List<ResourceAmount> inputs) {
        ConverterNode node = nodes.get(converterId);
        if (node == null) {
            return unknownNode(ConversionErrorKind.CONVERTER_NOT_FOUND_OR_INVALID, converterId);
        }
        return NodeResult.ok(covers(node, inputs));
    }

    @Override
    public synchronized NodeResult<Boolean> consumeResources(String converterId, List<ResourceAmount> inputs) {
        ConverterNode node = nodes.get(converterId);
        if (node == null) {
            return unknownNode(ConversionErrorKind.CONSUME_FAILURE, converterId);
        }
        if (!covers(node, inputs)) {
            return NodeResult.ok(false);
        }
        Map<String, Integer> pool = new LinkedHashMap<>(node.resources());
        for (ResourceAmount input : inputs) {
            pool.merge(input.type(), -input.amount(), Integer::sum);
        }
        nodes.put(converterId, withResources(node, pool));
        return NodeResult.ok(true);
    }

    @Override
    public synchronized NodeResult<Void> addResources(String converterId, List<ResourceAmount> outputs) {
        ConverterNode node = nodes.get(converterId);
        if (node == null) {
            return unknownNode(ConversionErrorKind.NODE_UPDATE_FAILURE, converterId);
        }
        Optional<ConverterNode> credited = credited(node, outputs);
        if (credited.isEmpty()) {
            return overflow(ConversionErrorKind.NODE_UPDATE_FAILURE, converterId);
        }
        nodes.put(converterId, credited.get());
        return NodeResult.done();
    }

    @Override
    public synchronized NodeResult<Boolean> transferResources(String fromId, String toId, List<ResourceAmount> amounts) {
        if (!nodes.containsKey(fromId)) {
            return unknownNode(ConversionErrorKind.TRANSFER_FAILURE, fromId);
        }
        ConverterNode target = nodes.get(toId);
        if (target == null) {
            LOG.debug("Transfer from {} rejected: target node {} unknown", fromId, toId);
            return NodeResult.ok(false);
        }
        Optional<ConverterNode> credited = credited(target, amounts);
        if (credited.isEmpty()) {
            return overflow(ConversionErrorKind.TRANSFER_FAILURE, toId);
        }
        nodes.put(toId, credited.get());
        return NodeResult.ok(true);
    }

    @Override
    public synchronized NodeResult<Void> updateNodeData(String nodeId, ConverterNodeUpdate update) {
        ConverterNode node = nodes.get(nodeId);
        if (node == null) {
            return unknownNode(ConversionErrorKind.NODE_UPDATE_FAILURE, nodeId);
        }
        List<String> activeIds = update.getActiveProcessIds().orElse(node.activeProcessIds());
        int capacity = node.configuration().maxConcurrentProcesses();
        if (activeIds.size() > capacity) {
            return NodeResult.failure(ConversionErrorKind.NODE_UPDATE_FAILURE, String.format(
                    "Node %s cannot run %d processes, capacity is %d", nodeId, activeIds.size(), capacity));
        }
        OptionalDouble requested = update.getEfficiency();
        double efficiency = requested.orElse(node.efficiency());
        if (Double.isNaN(efficiency) || efficiency < 0) {
            return NodeResult.failure(ConversionErrorKind.NODE_UPDATE_FAILURE,
                    "Node " + nodeId + " efficiency must be a non-negative number, got " + efficiency);
        }
        nodes.put(nodeId, new ConverterNode(node.id(), node.supportedRecipeIds(), node.configuration(), activeIds,
                efficiency, node.resources()));
        return NodeResult.done();
    }

    private static boolean covers(ConverterNode node, List<ResourceAmount> inputs) {
        Map<String, Long> required = new LinkedHashMap<>();
        for (ResourceAmount input : inputs) {
            required.merge(input.type(), (long) input.amount(), Long::sum);
        }
        for (Map.Entry<String, Long> entry : required.entrySet()) {
            if (node.resourceAmount(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Empty when any resource total would exceed {@link Integer#MAX_VALUE}.
     */
    private static Optional<ConverterNode> credited(ConverterNode node, List<ResourceAmount> amounts) {
        Map<String, Integer> pool = new LinkedHashMap<>(node.resources());
        try {
            for (ResourceAmount amount : amounts) {
                pool.merge(amount.type(), amount.amount(), Math::addExact);
            }
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
        return Optional.of(withResources(node, pool));
    }

    private static ConverterNode withResources(ConverterNode node, Map<String, Integer> pool) {
        return new ConverterNode(node.id(), node.supportedRecipeIds(), node.configuration(), node.activeProcessIds(),
                node.efficiency(), pool);
    }

    private static <T> NodeResult<T> overflow(ConversionErrorKind kind, String id) {
        LOG.debug("Crediting converter node {} rejected: a resource total would overflow", id);
        return NodeResult.failure(kind, "Resource total on converter node " + id + " would exceed " + Integer.MAX_VALUE);
    }

    private static <T> NodeResult<T> unknownNode(ConversionErrorKind kind, String id) {
        return NodeResult.failure(kind, "Converter node " + id + " not found");
    }
}
