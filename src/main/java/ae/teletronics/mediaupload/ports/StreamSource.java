package ae.teletronics.mediaupload.ports;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Supplier of (re-openable) InputStreams for an asset's content.
 * The coordinator only reads from it; the caller keeps ownership of the underlying bytes or file.
 */
@FunctionalInterface
public interface StreamSource {
    InputStream openStream() throws IOException;

    static StreamSource ofBytes(byte[] bytes) {
        return () -> new ByteArrayInputStream(bytes);
    }
}
