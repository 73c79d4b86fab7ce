package ae.teletronics.mediaupload.adapters.transport;

import ae.teletronics.mediaupload.application.exceptions.TransportException;
import ae.teletronics.mediaupload.domain.model.EncodedPayload;
import ae.teletronics.mediaupload.ports.UploadTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link UploadTransport} on Spring's reactive WebClient.
 *
 * The deadline is a Reactor timeout on the whole exchange (connect, send, response, body). When it fires,
 * the subscription is cancelled, which aborts the underlying HTTP request.
 */
public class WebClientUploadTransport implements UploadTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientUploadTransport.class);

    private final WebClient webClient;

    public WebClientUploadTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<TransportResponse> send(String endpointUrl, EncodedPayload payload, long timeoutMs) {
        return Mono.defer(() -> {
            WebClient.RequestBodySpec post = webClient.post().uri(URI.create(endpointUrl));
            WebClient.RequestHeadersSpec<?> request;
            if (payload instanceof EncodedPayload.Structured structured) {
                request = post.contentType(MediaType.MULTIPART_FORM_DATA)
                        .body(BodyInserters.fromMultipartData(structured.parts()));
            } else if (payload instanceof EncodedPayload.Envelope envelope) {
                // plain text body: no CORS preflight on the storage endpoint
                request = post.contentType(MediaType.TEXT_PLAIN)
                        .bodyValue(envelope.text());
            } else {
                return Mono.error(new IllegalArgumentException("Unsupported payload: " + payload));
            }
            log.debug("POST {} as {} [{}]", endpointUrl, payload.mode(), payload.uploadId());
            return request.exchangeToMono(WebClientUploadTransport::toResponse);
        }).transform(exchange -> withDeadline(exchange, timeoutMs));
    }

    @Override
    public Mono<TransportResponse> fetch(String url, long timeoutMs) {
        return Mono.defer(() -> {
            log.debug("GET {}", url);
            return webClient.get()
                    .uri(URI.create(url))
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(WebClientUploadTransport::toResponse);
        }).transform(exchange -> withDeadline(exchange, timeoutMs));
    }

    private static Mono<TransportResponse> toResponse(ClientResponse response) {
        final int status = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> new TransportResponse(status, body));
        }
        // error bodies are informational only
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .onErrorResume(e -> {
                    log.debug("Could not read error body for HTTP {}", status, e);
                    return Mono.just("");
                })
                .flatMap(body -> Mono.<TransportResponse>error(TransportException.httpStatus(status, body)));
    }

    private static Mono<TransportResponse> withDeadline(Mono<TransportResponse> exchange, long timeoutMs) {
        return exchange
                .timeout(Duration.ofMillis(timeoutMs))
                .onErrorMap(TimeoutException.class, e -> TransportException.timeout(timeoutMs, e))
                .onErrorMap(e -> !(e instanceof TransportException), TransportException::network);
    }
}
