package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.domain.model.Asset;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.domain.model.UploadErrorKind;
import ae.teletronics.mediaupload.domain.model.ValidationResult;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AssetValidatorUnitTest {

    private final AssetValidator validator = new AssetValidator();

    private final UploadConfiguration config = UploadConfiguration.builder("https://example.test/upload")
            .maxFileSizeBytes(1024 * 1024)
            .allowedMimeTypes(Set.of("image/png", "image/jpeg"))
            .build();

    private static Asset asset(String name, String type, long size) {
        return new Asset(name, type, size, () -> { throw new AssertionError("content must not be read"); });
    }

    @Test
    void acceptsWellFormedAsset() {
        ValidationResult r = validator.validate(asset("holiday.png", "image/png", 2048), config);
        assertThat(r.valid()).isTrue();
        assertThat(r.errorKind()).isNull();
    }

    @Test
    void emptyOrUnknownType_isUnsupported() {
        assertThat(validator.validate(asset("a.png", "", 10), config).errorKind())
                .isEqualTo(UploadErrorKind.UNSUPPORTED_TYPE);

        ValidationResult r = validator.validate(asset("a.gif", "image/gif", 10), config);
        assertThat(r.errorKind()).isEqualTo(UploadErrorKind.UNSUPPORTED_TYPE);
        assertThat(r.message()).contains("JPEG, PNG");
    }

    @Test
    void tooLarge_reportsBothSizesInMegabytes() {
        ValidationResult r = validator.validate(asset("big.png", "image/png", 3L * 1024 * 1024), config);

        assertThat(r.errorKind()).isEqualTo(UploadErrorKind.TOO_LARGE);
        assertThat(r.message()).contains("3.0MB").contains("1.0MB");
    }

    @Test
    void sizeExactlyAtLimit_isAccepted() {
        assertThat(validator.validate(asset("edge.png", "image/png", 1024 * 1024), config).valid()).isTrue();
    }

    @Test
    void nameLength_isCountedInCodePoints() {
        // 255 astral characters are 510 UTF-16 units but still within the limit
        String astral = "📷".repeat(251) + ".png";
        assertThat(validator.validate(asset(astral, "image/png", 1), config).valid()).isTrue();

        String tooLong = "a".repeat(252) + ".png";
        assertThat(validator.validate(asset(tooLong, "image/png", 1), config).errorKind())
                .isEqualTo(UploadErrorKind.NAME_TOO_LONG);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a<b.png", "a>b.png", "a:b.png", "a\"b.png", "a/b.png", "a\\b.png",
            "a|b.png", "a?b.png", "a*b.png", "tab\there.png", "nul\u0000.png", "bell\u0007.png"})
    void reservedOrControlCharacters_areInvalid(String name) {
        assertThat(validator.validate(asset(name, "image/png", 1), config).errorKind())
                .isEqualTo(UploadErrorKind.NAME_INVALID);
    }

    @Test
    void checksShortCircuitInOrder() {
        // wrong type, too large and a bad name at once: type wins
        ValidationResult r = validator.validate(asset("x*y.gif", "image/gif", 10L * 1024 * 1024), config);
        assertThat(r.errorKind()).isEqualTo(UploadErrorKind.UNSUPPORTED_TYPE);

        // too large and a bad name: size wins
        r = validator.validate(asset("x*y.png", "image/png", 10L * 1024 * 1024), config);
        assertThat(r.errorKind()).isEqualTo(UploadErrorKind.TOO_LARGE);
    }
}
