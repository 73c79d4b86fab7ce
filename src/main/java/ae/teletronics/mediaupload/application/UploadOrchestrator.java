package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.application.exceptions.TransportException;
import ae.teletronics.mediaupload.domain.model.Asset;
import ae.teletronics.mediaupload.domain.model.EncodedPayload;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.domain.model.UploadErrorKind;
import ae.teletronics.mediaupload.domain.model.UploadOutcome;
import ae.teletronics.mediaupload.domain.model.ValidationResult;
import ae.teletronics.mediaupload.ports.ClockProvider;
import ae.teletronics.mediaupload.ports.UploadTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Drives one asset through validation, encoding, transport and result classification.
 * The returned Mono always completes with an outcome and never errors. There is no retry here.
 */
@Service
public class UploadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);

    private final AssetValidator validator;
    private final PayloadEncoder encoder;
    private final UploadTransport transport;
    private final ClockProvider clock;
    private final ObjectMapper objectMapper;

    public UploadOrchestrator(AssetValidator validator,
                              PayloadEncoder encoder,
                              UploadTransport transport,
                              ClockProvider clock,
                              ObjectMapper objectMapper) {
        this.validator = validator;
        this.encoder = encoder;
        this.transport = transport;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public Mono<UploadOutcome> upload(Asset asset, UploadConfiguration config) {
        return Mono.defer(() -> {
            ValidationResult validation = validator.validate(asset, config);
            if (!validation.valid()) {
                log.warn("Rejected {} before upload: {}", asset.name(), validation.errorKind());
                return Mono.just(new UploadOutcome.Failure(asset.name(), validation.errorKind(), validation.message()));
            }

            final String uploadId = newUploadId();
            final byte[] content;
            try {
                content = readContent(asset);
            } catch (IOException e) {
                log.warn("Could not read content of {}", asset.name(), e);
                return Mono.just(failure(asset, UploadErrorKind.VALIDATION_ERROR,
                        "file could not be read (" + e.getMessage() + ")"));
            }

            final EncodedPayload payload;
            try {
                payload = encoder.encode(asset, content, uploadId);
            } catch (RuntimeException e) {
                log.warn("Could not encode {} for upload", asset.name(), e);
                return Mono.just(failure(asset, UploadErrorKind.VALIDATION_ERROR,
                        "file could not be encoded (" + e.getMessage() + ")"));
            }
            log.debug("Uploading {} ({} bytes) as {} [{}]", asset.name(), content.length, payload.mode(), uploadId);

            final long startedAt = clock.nowMillis();
            return transport.send(config.endpointUrl(), payload, config.uploadTimeoutMs())
                    .map(response -> classify(asset, payload, response.body(), clock.nowMillis() - startedAt))
                    .onErrorResume(TransportException.class, e -> Mono.just(fromTransportError(asset, e)))
                    .doOnNext(outcome -> logOutcome(outcome, uploadId));
        });
    }

    UploadOutcome classify(Asset asset, EncodedPayload payload, String body, long elapsedMs) {
        final JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Unparseable upload response for {}: {}", asset.name(), e.getMessage());
            return failure(asset, UploadErrorKind.SERVER_ERROR, "unreadable response body");
        }
        if (json == null || !json.isObject()) {
            return failure(asset, UploadErrorKind.SERVER_ERROR, "unreadable response body");
        }
        if (!json.path("success").asBoolean(false)) {
            return failure(asset, UploadErrorKind.SERVER_REJECTED, text(json, "error"));
        }
        String url = text(json, "url");
        if (url == null) {
            return failure(asset, UploadErrorKind.SERVER_ERROR, "response is missing the asset url");
        }
        String name = text(json, "name");
        return new UploadOutcome.Success(
                asset.name(),
                text(json, "id"),
                url,
                name != null ? name : asset.name(),
                payload.mode(),
                elapsedMs,
                payload.uploadId());
    }

    UploadOutcome.Failure fromTransportError(Asset asset, TransportException e) {
        return switch (e.getKind()) {
            case TIMEOUT -> failure(asset, UploadErrorKind.TIMEOUT, null);
            case NETWORK -> failure(asset, UploadErrorKind.NETWORK_ERROR, null);
            case HTTP_STATUS -> switch (e.getStatusCode()) {
                case 413 -> failure(asset, UploadErrorKind.PAYLOAD_TOO_LARGE, null);
                case 429 -> failure(asset, UploadErrorKind.RATE_LIMITED, null);
                default -> failure(asset, UploadErrorKind.SERVER_ERROR, "HTTP " + e.getStatusCode());
            };
        };
    }

    private static UploadOutcome.Failure failure(Asset asset, UploadErrorKind kind, String detail) {
        return new UploadOutcome.Failure(asset.name(), kind, UploadNotices.uploadFailure(kind, asset.name(), detail));
    }

    private static byte[] readContent(Asset asset) throws IOException {
        try (InputStream in = asset.content().openStream()) {
            return in.readAllBytes();
        }
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static void logOutcome(UploadOutcome outcome, String uploadId) {
        if (outcome instanceof UploadOutcome.Success s) {
            log.info("Uploaded {} ({}, {}ms) [{}]", s.assetName(), s.transportMode(), s.elapsedMs(), uploadId);
        } else if (outcome instanceof UploadOutcome.Failure f) {
            log.warn("Upload of {} failed: {} [{}]", f.assetName(), f.errorKind(), uploadId);
        }
    }

    // upload_<epochMillis>_<9 base-36 chars>
    private String newUploadId() {
        StringBuilder suffix = new StringBuilder(9);
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        for (int i = 0; i < 9; i++) {
            suffix.append(Character.forDigit(rnd.nextInt(36), 36));
        }
        return "upload_" + clock.nowMillis() + "_" + suffix;
    }
}
