package org.conflux.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChainStepTest {

    private final ChainStep step = new ChainStep("R1");

    @Test
    void start_shouldRecordProcessAndConverter() {
        step.start(new ProcessId("proc-1"), "C1", 100);

        StepStatus status = step.snapshot();
        assertThat(status.status()).isEqualTo(ProcessStatus.IN_PROGRESS);
        assertThat(status.processId()).isEqualTo(new ProcessId("proc-1"));
        assertThat(status.converterId()).isEqualTo("C1");
        assertThat(status.startTime()).isEqualTo(100);
    }

    @Test
    void transitions_shouldNeverRevisitAState() {
        step.start(new ProcessId("proc-1"), "C1", 100);
        step.complete(200);

        assertThatThrownBy(() -> step.fail(300)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> step.start(new ProcessId("proc-2"), "C1", 300))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMPLETED -> IN_PROGRESS");
        assertThat(step.getStatus()).isEqualTo(ProcessStatus.COMPLETED);
        assertThat(step.snapshot().endTime()).isEqualTo(200);
    }

    @Test
    void pendingStep_cannotSkipToATerminalState() {
        assertThatThrownBy(() -> step.complete(100)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> step.fail(100)).isInstanceOf(IllegalStateException.class);
        assertThat(step.getStatus()).isEqualTo(ProcessStatus.PENDING);
    }

    @Test
    void assignConverter_shouldOnlyApplyToPendingSteps() {
        step.assignConverter("C2");
        assertThat(step.getConverterId()).contains("C2");

        step.start(new ProcessId("proc-1"), "C2", 100);
        assertThatThrownBy(() -> step.assignConverter("C3")).isInstanceOf(IllegalStateException.class);
    }
}
