package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.domain.model.Asset;
import ae.teletronics.mediaupload.domain.model.EncodedPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the wire form of an asset.
 *
 * Strategy: structured (multipart) whenever there are bytes to attach and the declared type can label a
 * file part. An empty byte stream or a type that is not a {@code type/subtype} media type goes out as a text
 * envelope instead. The choice is made up front, not by catching encoder failures.
 */
@Component
public class PayloadEncoder {

    static final String ENVELOPE_METHOD = "base64";

    private final ObjectMapper objectMapper;

    public PayloadEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EncodedPayload encode(Asset asset, byte[] content, String uploadId) {
        if (content.length == 0 || !isPartContentType(asset.mimeType())) {
            return envelope(asset, content, uploadId);
        }
        return structured(asset, content, uploadId);
    }

    static boolean isPartContentType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) return false;
        try {
            MediaType type = MediaType.parseMediaType(mimeType);
            return !type.isWildcardType() && !type.isWildcardSubtype();
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }

    public EncodedPayload.Structured structured(Asset asset, byte[] content, String uploadId) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new NamedByteArrayResource(content, asset.name()))
                .filename(asset.name())
                .contentType(MediaType.parseMediaType(asset.mimeType()));
        builder.part("filename", asset.name());
        builder.part("mimetype", asset.mimeType());
        builder.part("size", Long.toString(asset.sizeBytes()));
        builder.part("uploadId", uploadId);
        return new EncodedPayload.Structured(uploadId, builder.build());
    }

    public EncodedPayload.Envelope envelope(Asset asset, byte[] content, String uploadId) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("file", "data:" + asset.mimeType() + ";base64," + Base64.getEncoder().encodeToString(content));
        body.put("filename", asset.name());
        body.put("mimetype", asset.mimeType());
        body.put("size", Long.toString(asset.sizeBytes()));
        body.put("uploadId", uploadId);
        body.put("method", ENVELOPE_METHOD);
        try {
            return new EncodedPayload.Envelope(uploadId, objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize upload envelope for " + asset.name(), e);
        }
    }

    // multipart writer needs a filename on the resource to emit a file part
    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
