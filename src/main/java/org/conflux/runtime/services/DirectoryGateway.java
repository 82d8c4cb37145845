package org.conflux.runtime.services;

import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.model.ResourceAmount;
import org.conflux.runtime.spi.IConverterDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The engine's single access point to the converter directory.
 * <p>
 * Holds the injected {@link IConverterDirectory} and guarantees that every call yields a
 * {@link NodeResult}: a missing directory becomes {@link ConversionErrorKind#DIRECTORY_UNAVAILABLE}
 * and an exception thrown by the implementation becomes a failure of the call's own kind.
 */
public class DirectoryGateway {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryGateway.class);

    private IConverterDirectory directory;

    public void bind(IConverterDirectory directory) {
        this.directory = directory;
    }

    public boolean isBound() {
        return directory != null;
    }

    public List<ConverterNode> getNodes() {
        if (directory == null) {
            LOG.warn("Converter directory not set, no converter nodes visible");
            return List.of();
        }
        try {
            List<ConverterNode> nodes = directory.getNodes();
            return nodes == null ? List.of() : nodes;
        } catch (RuntimeException e) {
            LOG.warn("Converter directory failed to list nodes: {}", e.getMessage());
            LOG.debug("Directory failure details:", e);
            return List.of();
        }
    }

    public Optional<ConverterNode> getNode(String id) {
        if (directory == null || id == null) {
            return Optional.empty();
        }
        try {
            Optional<ConverterNode> node = directory.getNode(id);
            return node == null ? Optional.empty() : node;
        } catch (RuntimeException e) {
            LOG.warn("Converter directory failed to look up node {}: {}", id, e.getMessage());
            LOG.debug("Directory failure details:", e);
            return Optional.empty();
        }
    }

    public NodeResult<Boolean> checkResourcesAvailable(String converterId, List<ResourceAmount> inputs) {
        return call(ConversionErrorKind.INSUFFICIENT_RESOURCES, "checking resources on " + converterId,
                () -> directory.checkResourcesAvailable(converterId, inputs));
    }

    public NodeResult<Boolean> consumeResources(String converterId, List<ResourceAmount> inputs) {
        return call(ConversionErrorKind.CONSUME_FAILURE, "consuming resources on " + converterId,
                () -> directory.consumeResources(converterId, inputs));
    }

    public NodeResult<Void> addResources(String converterId, List<ResourceAmount> outputs) {
        return call(ConversionErrorKind.NODE_UPDATE_FAILURE, "adding resources to " + converterId,
                () -> directory.addResources(converterId, outputs));
    }

    public NodeResult<Boolean> transferResources(String fromId, String toId, List<ResourceAmount> amounts) {
        return call(ConversionErrorKind.TRANSFER_FAILURE, "transferring resources from " + fromId + " to " + toId,
                () -> directory.transferResources(fromId, toId, amounts));
    }

    public NodeResult<Void> updateNodeData(String nodeId, ConverterNodeUpdate update) {
        return call(ConversionErrorKind.NODE_UPDATE_FAILURE, "updating node " + nodeId,
                () -> directory.updateNodeData(nodeId, update));
    }

    private <T> NodeResult<T> call(ConversionErrorKind failureKind, String action, Supplier<NodeResult<T>> operation) {
        if (directory == null) {
            return NodeResult.failure(ConversionErrorKind.DIRECTORY_UNAVAILABLE,
                    "Converter directory not set while " + action);
        }
        try {
            NodeResult<T> result = operation.get();
            if (result == null) {
                return NodeResult.failure(failureKind, "Converter directory returned no result while " + action);
            }
            return result;
        } catch (RuntimeException e) {
            LOG.debug("Directory failure while {}:", action, e);
            return NodeResult.failure(failureKind, "Error " + action + ": " + e.getMessage());
        }
    }
}
