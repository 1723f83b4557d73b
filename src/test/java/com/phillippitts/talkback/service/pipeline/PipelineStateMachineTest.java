package com.phillippitts.talkback.service.pipeline;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineStateMachineTest {

    @Test
    void shouldStartIdle() {
        assertThat(new PipelineStateMachine().current()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void shouldFollowHappyPath() {
        PipelineStateMachine machine = new PipelineStateMachine();

        assertThat(machine.transition(PipelineState.IDLE, PipelineState.CONNECTED)).isTrue();
        assertThat(machine.transition(PipelineState.CONNECTED, PipelineState.READY)).isTrue();
        assertThat(machine.transition(PipelineState.READY, PipelineState.ACTIVE)).isTrue();
        assertThat(machine.beginCancel()).isEqualTo(PipelineState.ACTIVE);
        assertThat(machine.transition(PipelineState.CANCELLING, PipelineState.CLOSED)).isTrue();

        assertThat(machine.current()).isEqualTo(PipelineState.CLOSED);
    }

    @Test
    void shouldRejectTransitionFromWrongState() {
        PipelineStateMachine machine = new PipelineStateMachine();

        assertThat(machine.transition(PipelineState.CONNECTED, PipelineState.READY)).isFalse();
        assertThat(machine.current()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void shouldRejectSkippingStates() {
        PipelineStateMachine machine = new PipelineStateMachine();

        assertThat(machine.transition(PipelineState.IDLE, PipelineState.ACTIVE)).isFalse();
        assertThat(machine.transition(PipelineState.IDLE, PipelineState.CLOSED)).isFalse();
    }

    @Test
    void shouldCancelOnlyOnce() {
        PipelineStateMachine machine = new PipelineStateMachine();

        assertThat(machine.beginCancel()).isEqualTo(PipelineState.IDLE);
        assertThat(machine.beginCancel()).isNull();
        assertThat(machine.transition(PipelineState.CANCELLING, PipelineState.CLOSED)).isTrue();
        assertThat(machine.beginCancel()).isNull();
    }

    @Test
    void closedShouldBeTerminal() {
        for (PipelineState target : PipelineState.values()) {
            assertThat(PipelineState.CLOSED.canTransitionTo(target)).isFalse();
        }
        assertThat(PipelineState.CANCELLING.isTerminating()).isTrue();
        assertThat(PipelineState.ACTIVE.isTerminating()).isFalse();
    }

    @Test
    void shouldLetExactlyOneConcurrentCancelWin() throws Exception {
        PipelineStateMachine machine = new PipelineStateMachine();
        machine.transition(PipelineState.IDLE, PipelineState.CONNECTED);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < 8; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (machine.beginCancel() != null) {
                        winners.incrementAndGet();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(winners.get()).isEqualTo(1);
    }
}
