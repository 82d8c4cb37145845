package org.conflux.topology;

import org.conflux.junit.logging.LogWatchExtension;
import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.model.ResourceAmount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.conflux.runtime.TestEconomy.amount;
import static org.conflux.runtime.TestEconomy.converter;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InMemoryConverterDirectoryTest {

    private final InMemoryConverterDirectory directory = new InMemoryConverterDirectory();

    @BeforeEach
    void setUp() {
        directory.register(converter("C1", 2, Set.of("R1"), Map.of("A", 10, "B", 3)));
        directory.register(converter("C2", 1, Set.of("R2"), Map.of()));
    }

    @Test
    void getNodes_shouldKeepRegistrationOrder() {
        assertThat(directory.getNodes()).extracting(n -> n.id()).containsExactly("C1", "C2");
        assertThat(directory.getNode("C3")).isEmpty();
    }

    @Test
    @DisplayName("Consumption is all-or-nothing across resource types")
    void consumeResources_shouldBeAtomic() {
        NodeResult<Boolean> insufficient = directory.consumeResources("C1", List.of(amount("A", 5), amount("B", 4)));

        assertThat(insufficient.isOk()).isTrue();
        assertThat(insufficient.isTrue()).isFalse();
        assertThat(directory.resourcesOf("C1")).containsEntry("A", 10).containsEntry("B", 3);

        assertThat(directory.consumeResources("C1", List.of(amount("A", 5), amount("B", 3))).isTrue()).isTrue();
        assertThat(directory.resourcesOf("C1")).containsEntry("A", 5).containsEntry("B", 0);
    }

    @Test
    void checkResourcesAvailable_shouldSumRepeatedTypes() {
        assertThat(directory.checkResourcesAvailable("C1", List.of(amount("A", 6), amount("A", 6))).isTrue()).isFalse();
        assertThat(directory.checkResourcesAvailable("C1", List.of(amount("A", 5), amount("A", 5))).isTrue()).isTrue();
        assertThat(directory.checkResourcesAvailable("C9", List.of()).getError().orElseThrow().kind())
                .isEqualTo(ConversionErrorKind.CONVERTER_NOT_FOUND_OR_INVALID);
    }

    @Test
    @DisplayName("A transfer credits the target and leaves the source alone")
    void transferResources_shouldCreditTargetOnly() {
        assertThat(directory.transferResources("C1", "C2", List.of(amount("B", 5))).isTrue()).isTrue();

        assertThat(directory.resourcesOf("C2")).containsEntry("B", 5);
        assertThat(directory.resourcesOf("C1")).containsEntry("B", 3);
    }

    @Test
    void transferResources_shouldRejectUnknownNodes() {
        NodeResult<Boolean> unknownTarget = directory.transferResources("C1", "C9", List.of(amount("B", 1)));
        NodeResult<Boolean> unknownSource = directory.transferResources("C9", "C2", List.of(amount("B", 1)));

        assertThat(unknownTarget.isOk()).isTrue();
        assertThat(unknownTarget.isTrue()).isFalse();
        assertThat(unknownSource.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.TRANSFER_FAILURE);
        assertThat(directory.resourcesOf("C2")).isEmpty();
    }

    @Test
    void updateNodeData_shouldEnforceCapacity() {
        assertThat(directory.updateNodeData("C1", ConverterNodeUpdate.activeProcessIds(List.of("p1", "p2"))).isOk())
                .isTrue();

        NodeResult<Void> overfull = directory.updateNodeData("C1",
                ConverterNodeUpdate.activeProcessIds(List.of("p1", "p2", "p3")));

        assertThat(overfull.getError().orElseThrow().message()).contains("capacity is 2");
        assertThat(directory.getNode("C1").orElseThrow().activeProcessIds()).containsExactly("p1", "p2");
    }

    @Test
    void updateNodeData_shouldValidateEfficiency() {
        assertThat(directory.updateNodeData("C2", ConverterNodeUpdate.efficiency(0.5)).isOk()).isTrue();
        assertThat(directory.getNode("C2").orElseThrow().efficiency()).isEqualTo(0.5);

        assertThat(directory.updateNodeData("C2", ConverterNodeUpdate.efficiency(-1)).isOk()).isFalse();
        assertThat(directory.updateNodeData("C2", ConverterNodeUpdate.efficiency(Double.NaN)).isOk()).isFalse();
        assertThat(directory.updateNodeData("C9", ConverterNodeUpdate.efficiency(1)).getError().orElseThrow().kind())
                .isEqualTo(ConversionErrorKind.NODE_UPDATE_FAILURE);
    }

    @Test
    void addResources_shouldMergeIntoPool() {
        directory.addResources("C1", List.of(amount("B", 2), amount("C", 1)));

        assertThat(directory.resourcesOf("C1")).containsEntry("B", 5).containsEntry("C", 1);
        assertThat(directory.remove("C1")).isTrue();
        assertThat(directory.addResources("C1", List.of()).isOk()).isFalse();
    }

    @Test
    @DisplayName("Repeated inputs whose total exceeds the int range are never covered")
    void consumeResources_shouldNotWrapRepeatedTotals() {
        List<ResourceAmount> huge = List.of(amount("A", Integer.MAX_VALUE), amount("A", Integer.MAX_VALUE));

        assertThat(directory.checkResourcesAvailable("C1", huge).isTrue()).isFalse();
        assertThat(directory.consumeResources("C1", huge).isTrue()).isFalse();
        assertThat(directory.resourcesOf("C1")).containsEntry("A", 10);
    }

    @Test
    void addResources_shouldRejectOverflowingPool() {
        directory.addResources("C2", List.of(amount("B", Integer.MAX_VALUE)));

        NodeResult<Void> overflow = directory.addResources("C2", List.of(amount("A", 1), amount("B", 10)));

        assertThat(overflow.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.NODE_UPDATE_FAILURE);
        assertThat(directory.resourcesOf("C2")).containsOnly(Map.entry("B", Integer.MAX_VALUE));
    }

    @Test
    void transferResources_shouldRejectOverflowingTarget() {
        directory.addResources("C2", List.of(amount("B", Integer.MAX_VALUE)));

        NodeResult<Boolean> transfer = directory.transferResources("C1", "C2", List.of(amount("B", 1)));

        assertThat(transfer.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.TRANSFER_FAILURE);
        assertThat(directory.resourcesOf("C2")).containsEntry("B", Integer.MAX_VALUE);
    }
}
