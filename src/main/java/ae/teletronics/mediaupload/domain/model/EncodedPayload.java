package ae.teletronics.mediaupload.domain.model;

import org.springframework.http.HttpEntity;
import org.springframework.util.MultiValueMap;

/**
 * An asset ready for the wire. The variant decides the request shape the transport produces.
 */
public sealed interface EncodedPayload permits EncodedPayload.Structured, EncodedPayload.Envelope {

    TransportMode mode();

    String uploadId();

    record Structured(String uploadId, MultiValueMap<String, HttpEntity<?>> parts) implements EncodedPayload {
        @Override
        public TransportMode mode() { return TransportMode.STRUCTURED; }
    }

    record Envelope(String uploadId, String text) implements EncodedPayload {
        @Override
        public TransportMode mode() { return TransportMode.ENVELOPE; }
    }
}
