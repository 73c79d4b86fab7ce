package ae.teletronics.mediaupload.adapters.detection;

import ae.teletronics.mediaupload.ports.FileTypeDetector;
import ae.teletronics.mediaupload.ports.StreamSource;
import org.apache.tika.config.TikaConfig;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Apache Tika-based file type detector, used for uploads that arrive without a usable Content-Type.
 * Magic bytes win over the filename extension.
 */
public class TikaFileTypeDetector implements FileTypeDetector {

    private final DefaultDetector detector;

    public TikaFileTypeDetector() {
        this.detector = new DefaultDetector(TikaConfig.getDefaultConfig().getMimeRepository());
    }

    @Override
    public Optional<String> detect(StreamSource source, String filenameHint) throws IOException {
        Metadata md = new Metadata();
        if (filenameHint != null && !filenameHint.isBlank()) {
            md.set(TikaCoreProperties.RESOURCE_NAME_KEY, filenameHint);
        }

        // Tika needs mark/reset to peek at the header
        try (InputStream in = new BufferedInputStream(source.openStream())) {
            MediaType mediaType = detector.detect(in, md);
            if (mediaType == null || MediaType.OCTET_STREAM.equals(mediaType)) {
                return Optional.empty();
            }
            return Optional.of(mediaType.getBaseType().toString());
        }
    }
}
