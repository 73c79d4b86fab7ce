package ae.teletronics.mediaupload.adapters.detection;

import ae.teletronics.mediaupload.ports.StreamSource;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TikaFileTypeDetectorTest {

    private static final byte[] PNG_HEADER = {
            (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A,
            0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'
    };

    private final TikaFileTypeDetector detector = new TikaFileTypeDetector();

    @Test
    void detectsPngFromMagicBytes_evenWithMisleadingName() throws Exception {
        Optional<String> type = detector.detect(StreamSource.ofBytes(PNG_HEADER), "photo.jpg");

        assertThat(type).contains("image/png");
    }

    @Test
    void fallsBackToFilenameHint() throws Exception {
        Optional<String> type = detector.detect(StreamSource.ofBytes(new byte[]{0x00, 0x01, 0x02, (byte) 0xFE}), "photo.gif");

        assertThat(type).contains("image/gif");
    }
}
