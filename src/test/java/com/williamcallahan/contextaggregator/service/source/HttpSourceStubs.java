package com.williamcallahan.contextaggregator.service.source;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * WebClient builder whose exchange answers every request with a canned response and records it.
 */
final class HttpSourceStubs {
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final HttpStatus status;
    private final String body;

    HttpSourceStubs(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
    }

    WebClient.Builder builder() {
        return WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
    }

    List<ClientRequest> requests() {
        return requests;
    }
}
