package com.nodewatch.rpcextractor.adapter;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Node JSON-RPC client using WebClient. Error statuses that carry a JSON-RPC body (the node answers
 * unknown methods and RPC errors with 404/500 plus an error object) are passed through for decoding.
 */
public class WebClientNodeRpcClient implements NodeRpcClient {

    private final WebClient webClient;
    private final AtomicLong requestId = new AtomicLong();

    public WebClientNodeRpcClient(WebClient.Builder builder, String rpcHost, RpcCredentials credentials) {
        this.webClient = builder
                .baseUrl(rpcHost.startsWith("http") ? rpcHost : "http://" + rpcHost)
                .defaultHeaders(h -> h.setBasicAuth(credentials.user(), credentials.password()))
                .build();
    }

    @Override
    public Mono<String> call(String method) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "1.0",
                "id", requestId.incrementAndGet(),
                "method", method,
                "params", List.of()
        );
        return webClient.post()
                .uri("/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                        return response.releaseBody()
                                .then(Mono.<String>error(new RpcAuthException("RPC authentication rejected for " + method + " (HTTP " + status + ")")));
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> {
                                if (response.statusCode().isError() && text.isBlank()) {
                                    return Mono.<String>error(new RpcException("HTTP " + status + " for " + method));
                                }
                                return Mono.just(text);
                            });
                });
    }
}
