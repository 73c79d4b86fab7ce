package ae.teletronics.mediaupload.ports;

import java.io.IOException;
import java.util.Optional;

/**
 * Determines the media type (e.g., "image/png") from bytes and/or filename hint.
 * Used only when a caller hands over content without a meaningful declared type.
 */
public interface FileTypeDetector {

    /**
     * @param source        re-openable source to inspect
     * @param filenameHint  optional filename to help detection (e.g., extension)
     * @return Optional content type (RFC 2046, e.g., "image/webp")
     */
    Optional<String> detect(StreamSource source, String filenameHint) throws IOException;
}
