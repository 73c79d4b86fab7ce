package ae.teletronics.mediaupload.domain.model;

import ae.teletronics.mediaupload.ports.StreamSource;

import java.util.Objects;

/**
 * A binary file handed to the coordinator for upload.
 * Metadata is what the caller declared; nothing here is sniffed or corrected.
 */
public record Asset(
        String name,
        String mimeType,
        long sizeBytes,
        StreamSource content
) {
    public Asset {
        name = name == null ? "" : name;
        mimeType = mimeType == null ? "" : mimeType;
        content = Objects.requireNonNull(content, "content");
    }

    public static Asset of(String name, String mimeType, byte[] bytes) {
        return new Asset(name, mimeType, bytes.length, StreamSource.ofBytes(bytes));
    }
}
