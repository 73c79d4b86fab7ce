package ae.teletronics.mediaupload.ports;

import ae.teletronics.mediaupload.domain.model.EncodedPayload;
import reactor.core.publisher.Mono;

/**
 * Single request/response exchange against the remote storage endpoint.
 *
 * Both operations enforce a hard deadline: when it expires the in-flight request is cancelled and the
 * returned Mono fails with a TIMEOUT {@code TransportException}. Non-2xx answers fail with HTTP_STATUS,
 * connection-level problems with NETWORK. A successful Mono always carries a complete body.
 */
public interface UploadTransport {

    /** POST the payload, structured (multipart) or envelope (text/plain), depending on its mode. */
    Mono<TransportResponse> send(String endpointUrl, EncodedPayload payload, long timeoutMs);

    /** Plain GET used for read-only listings; no body encoding. */
    Mono<TransportResponse> fetch(String url, long timeoutMs);

    record TransportResponse(int status, String body) {
        public TransportResponse {
            body = body == null ? "" : body;
        }
    }
}
