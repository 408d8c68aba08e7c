package com.nodewatch.rpcextractor.job;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ShutdownSignalTest {

    @Test
    void trigger_onlyFirstCallSetsTheSignal() {
        ShutdownSignal signal = new ShutdownSignal();
        assertThat(signal.isTriggered()).isFalse();

        assertThat(signal.trigger()).isTrue();
        assertThat(signal.trigger()).isFalse();
        assertThat(signal.isTriggered()).isTrue();
    }
}
