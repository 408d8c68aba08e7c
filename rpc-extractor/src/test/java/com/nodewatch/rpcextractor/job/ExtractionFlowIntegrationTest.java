package com.nodewatch.rpcextractor.job;

import com.nodewatch.rpcextractor.adapter.NodeRpcClient;
import com.nodewatch.rpcextractor.metrics.RpcMetricsRecorder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.nats.client.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Wired application with a healthy node stub: the enabled method is fetched every tick, timed, and
 * published on its own subject.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "nodewatch.rpc-extractor.rpc-user=test",
                "nodewatch.rpc-extractor.query-interval=100ms",
                "nodewatch.rpc-extractor.disabled-methods=getpeerinfo,getmempoolinfo,getnettotals,getmemoryinfo,getaddrmaninfo,getchaintxstats,getnetworkinfo,getblockchaininfo"
        })
class ExtractionFlowIntegrationTest {

    @MockBean
    Connection natsConnection;

    @MockBean
    NodeRpcClient nodeRpcClient;

    @Autowired
    MeterRegistry meterRegistry;

    @Autowired
    ExtractionScheduler extractionScheduler;

    @BeforeEach
    void stubNode() {
        when(nodeRpcClient.call("uptime"))
                .thenReturn(Mono.just("{\"result\":3600,\"error\":null,\"id\":1}").delayElement(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("healthy node: at least 3 timed fetches, no errors, events on subject uptime")
    void healthyNode_publishesEveryTick() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (durationCount() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        assertThat(durationCount()).isGreaterThanOrEqualTo(3);
        Counter errors = meterRegistry.find(RpcMetricsRecorder.FETCH_ERRORS)
                .tag(RpcMetricsRecorder.LABEL_RPC_METHOD, "uptime").counter();
        assertThat(errors).isNotNull();
        assertThat(errors.count()).isZero();
        verify(natsConnection, atLeast(2)).publish(eq("uptime"), any(byte[].class));
        verify(natsConnection, never()).publish(eq("getpeerinfo"), any(byte[].class));
        verify(nodeRpcClient, never()).call("getchaintxstats");
        assertThat(extractionScheduler.isRunning()).isTrue();
    }

    private long durationCount() {
        Timer timer = meterRegistry.find(RpcMetricsRecorder.FETCH_DURATION)
                .tag(RpcMetricsRecorder.LABEL_RPC_METHOD, "uptime").timer();
        return timer == null ? 0 : timer.count();
    }
}
