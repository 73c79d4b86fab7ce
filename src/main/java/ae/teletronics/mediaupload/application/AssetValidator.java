package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.domain.model.Asset;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.domain.model.UploadErrorKind;
import ae.teletronics.mediaupload.domain.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rejects an asset before any network use. Checks run in a fixed order and stop at the first failure:
 * type, size, name length, name characters.
 */
@Component
public class AssetValidator {

    public static final int MAX_NAME_CODE_POINTS = 255;
    private static final String RESERVED_NAME_CHARS = "<>:\"/\\|?*";

    public ValidationResult validate(Asset asset, UploadConfiguration config) {
        final String name = asset.name();

        if (asset.mimeType().isBlank()) {
            return ValidationResult.rejected(UploadErrorKind.UNSUPPORTED_TYPE,
                    "\"" + displayName(name) + "\": file type could not be determined");
        }
        if (!config.allows(asset.mimeType())) {
            return ValidationResult.rejected(UploadErrorKind.UNSUPPORTED_TYPE,
                    "\"" + name + "\": unsupported format (allowed: " + allowedFormats(config) + ")");
        }

        if (asset.sizeBytes() > config.maxFileSizeBytes()) {
            return ValidationResult.rejected(UploadErrorKind.TOO_LARGE,
                    "\"" + name + "\": file size exceeds the limit ("
                            + megabytes(asset.sizeBytes()) + "MB > " + megabytes(config.maxFileSizeBytes()) + "MB)");
        }

        if (name.codePointCount(0, name.length()) > MAX_NAME_CODE_POINTS) {
            return ValidationResult.rejected(UploadErrorKind.NAME_TOO_LONG,
                    "\"" + name + "\": file name is too long (" + MAX_NAME_CODE_POINTS + " characters max)");
        }

        if (hasIllegalNameChar(name)) {
            return ValidationResult.rejected(UploadErrorKind.NAME_INVALID,
                    "\"" + name + "\": file name contains characters that are not allowed");
        }

        return ValidationResult.ok();
    }

    static boolean hasIllegalNameChar(String name) {
        return name.codePoints().anyMatch(cp ->
                Character.getType(cp) == Character.CONTROL || RESERVED_NAME_CHARS.indexOf(cp) >= 0);
    }

    static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.1f", bytes / (1024.0 * 1024.0));
    }

    // "image/jpeg" -> "JPEG"
    private static String allowedFormats(UploadConfiguration config) {
        return config.allowedMimeTypes().stream()
                .map(t -> t.substring(t.indexOf('/') + 1).toUpperCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining(", "));
    }

    private static String displayName(String name) {
        return name.isBlank() ? "unknown file" : name;
    }
}
