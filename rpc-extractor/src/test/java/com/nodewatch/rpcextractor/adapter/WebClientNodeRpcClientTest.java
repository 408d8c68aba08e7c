package com.nodewatch.rpcextractor.adapter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientNodeRpcClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClientNodeRpcClient clientReturning(ClientResponse response) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(response);
        });
        return new WebClientNodeRpcClient(builder, "127.0.0.1:8332", new RpcCredentials("__cookie__", "secret"));
    }

    @Test
    @DisplayName("posts to the node root with basic auth and returns the body")
    void call_ok_returnsBody() {
        WebClientNodeRpcClient client = clientReturning(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body("{\"result\":42,\"error\":null,\"id\":1}")
                .build());

        StepVerifier.create(client.call("uptime"))
                .expectNext("{\"result\":42,\"error\":null,\"id\":1}")
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        String expectedAuth = "Basic " + Base64.getEncoder()
                .encodeToString("__cookie__:secret".getBytes(StandardCharsets.UTF_8));
        assertThat(request.url().toString()).isEqualTo("http://127.0.0.1:8332/");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo(expectedAuth);
    }

    @Test
    void call_unauthorized_errorsWithAuthException() {
        WebClientNodeRpcClient client = clientReturning(ClientResponse.create(HttpStatus.UNAUTHORIZED).build());

        StepVerifier.create(client.call("uptime"))
                .expectError(RpcAuthException.class)
                .verify();
    }

    @Test
    @DisplayName("error status with a JSON-RPC body is passed through for decoding")
    void call_serverErrorWithBody_returnsBody() {
        String body = "{\"result\":null,\"error\":{\"code\":-32601,\"message\":\"Method not found\"},\"id\":1}";
        WebClientNodeRpcClient client = clientReturning(ClientResponse.create(HttpStatus.NOT_FOUND)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build());

        StepVerifier.create(client.call("getaddrmaninfo"))
                .expectNext(body)
                .verifyComplete();
    }

    @Test
    void call_serverErrorWithoutBody_errorsWithRpcException() {
        WebClientNodeRpcClient client = clientReturning(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());

        StepVerifier.create(client.call("uptime"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(RpcException.class)
                        .isNotInstanceOf(RpcAuthException.class)
                        .hasMessageContaining("503"))
                .verify();
    }
}
