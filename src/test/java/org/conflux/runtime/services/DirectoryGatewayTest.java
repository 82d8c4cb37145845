package org.conflux.runtime.services;

import org.conflux.junit.logging.AllowLog;
import org.conflux.junit.logging.LogLevel;
import org.conflux.junit.logging.LogWatchExtension;
import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.spi.IConverterDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.conflux.runtime.TestEconomy.amount;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class DirectoryGatewayTest {

    @Mock
    private IConverterDirectory directory;

    private DirectoryGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new DirectoryGateway();
        gateway.bind(directory);
    }

    @Test
    void calls_shouldReportUnavailableDirectory() {
        DirectoryGateway unbound = new DirectoryGateway();

        assertThat(unbound.isBound()).isFalse();
        assertThat(unbound.consumeResources("C1", List.of()).getError().orElseThrow().kind())
                .isEqualTo(ConversionErrorKind.DIRECTORY_UNAVAILABLE);
        assertThat(unbound.getNode("C1")).isEmpty();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Converter directory not set, no converter nodes visible")
    void getNodes_shouldReturnEmptyWhenUnbound() {
        assertThat(new DirectoryGateway().getNodes()).isEmpty();
    }

    @Test
    void calls_shouldTurnExceptionsIntoFailuresOfTheirKind() {
        when(directory.transferResources(anyString(), anyString(), anyList())).thenThrow(new IllegalStateException("down"));
        when(directory.updateNodeData(anyString(), any())).thenThrow(new IllegalStateException("down"));
        when(directory.consumeResources(anyString(), anyList())).thenThrow(new IllegalStateException("down"));

        NodeResult<Boolean> transfer = gateway.transferResources("C1", "C2", List.of(amount("B", 1)));
        NodeResult<Void> update = gateway.updateNodeData("C1", ConverterNodeUpdate.efficiency(1.0));
        NodeResult<Boolean> consume = gateway.consumeResources("C1", List.of(amount("A", 1)));

        assertThat(transfer.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.TRANSFER_FAILURE);
        assertThat(transfer.getError().orElseThrow().message()).contains("down");
        assertThat(update.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.NODE_UPDATE_FAILURE);
        assertThat(consume.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.CONSUME_FAILURE);
        assertThat(transfer.isTrue()).isFalse();
    }

    @Test
    void calls_shouldTreatMissingResultAsFailure() {
        when(directory.checkResourcesAvailable(anyString(), anyList())).thenReturn(null);

        NodeResult<Boolean> result = gateway.checkResourcesAvailable("C1", List.of());

        assertThat(result.isOk()).isFalse();
        assertThat(result.getError().orElseThrow().kind()).isEqualTo(ConversionErrorKind.INSUFFICIENT_RESOURCES);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Converter directory failed to .*")
    void lookups_shouldSurviveThrowingDirectory() {
        when(directory.getNodes()).thenThrow(new IllegalStateException("down"));
        when(directory.getNode("C1")).thenThrow(new IllegalStateException("down"));

        assertThat(gateway.getNodes()).isEmpty();
        assertThat(gateway.getNode("C1")).isEmpty();
    }
}
