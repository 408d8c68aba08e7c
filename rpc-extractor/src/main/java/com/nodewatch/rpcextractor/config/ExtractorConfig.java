package com.nodewatch.rpcextractor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodewatch.rpcextractor.adapter.NodeRpcClient;
import com.nodewatch.rpcextractor.adapter.RpcCredentials;
import com.nodewatch.rpcextractor.adapter.WebClientNodeRpcClient;
import com.nodewatch.rpcextractor.catalog.MethodCatalog;
import com.nodewatch.rpcextractor.fetch.RpcFetcher;
import com.nodewatch.rpcextractor.job.ExtractionScheduler;
import com.nodewatch.rpcextractor.job.ShutdownSignal;
import com.nodewatch.rpcextractor.metrics.RpcMetricsRecorder;
import com.nodewatch.rpcextractor.publish.EventBus;
import com.nodewatch.rpcextractor.publish.EventPublisher;
import com.nodewatch.rpcextractor.publish.NatsEventBus;
import io.micrometer.core.instrument.MeterRegistry;
import io.nats.client.Connection;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires catalog, fetcher, publisher, metrics and scheduler from validated properties.
 */
@Configuration
@EnableConfigurationProperties({ ExtractorProperties.class, NatsProperties.class })
public class ExtractorConfig {

    @Bean
    public MethodCatalog methodCatalog(ExtractorProperties properties) {
        properties.validate();
        return MethodCatalog.fromDisabled(properties.getDisabledMethods());
    }

    @Bean
    public NodeRpcClient nodeRpcClient(WebClient.Builder webClientBuilder, ExtractorProperties properties) {
        RpcCredentials credentials = RpcCredentials.resolve(
                properties.getRpcCookieFile(), properties.getRpcUser(), properties.getRpcPassword());
        return new WebClientNodeRpcClient(webClientBuilder, properties.getRpcHost(), credentials);
    }

    @Bean
    public RpcFetcher rpcFetcher(NodeRpcClient nodeRpcClient, ObjectMapper objectMapper, ExtractorProperties properties) {
        return new RpcFetcher(nodeRpcClient, objectMapper, properties.getRpcTimeout());
    }

    @Bean
    public EventBus eventBus(Connection natsConnection) {
        return new NatsEventBus(natsConnection);
    }

    @Bean
    public EventPublisher eventPublisher(EventBus eventBus, ObjectMapper objectMapper, ExtractorProperties properties) {
        return new EventPublisher(eventBus, objectMapper, properties.getSubjectPrefix());
    }

    @Bean
    public RpcMetricsRecorder rpcMetricsRecorder(MeterRegistry meterRegistry) {
        return new RpcMetricsRecorder(meterRegistry);
    }

    @Bean
    public ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Bean
    public ExtractionScheduler extractionScheduler(MethodCatalog methodCatalog,
                                                   RpcFetcher rpcFetcher,
                                                   EventPublisher eventPublisher,
                                                   RpcMetricsRecorder rpcMetricsRecorder,
                                                   @Qualifier(SchedulerConfig.TICK_SCHEDULER) ThreadPoolTaskScheduler tickScheduler,
                                                   @Qualifier(AsyncConfig.FETCH_EXECUTOR) ThreadPoolTaskExecutor fetchExecutor,
                                                   ShutdownSignal shutdownSignal,
                                                   ExtractorProperties properties) {
        return new ExtractionScheduler(
                methodCatalog,
                rpcFetcher,
                eventPublisher,
                rpcMetricsRecorder,
                tickScheduler,
                fetchExecutor,
                shutdownSignal,
                properties.getQueryInterval(),
                properties.getRpcTimeout().plus(properties.getShutdownGrace()),
                Clock.systemUTC());
    }
}
