package ae.teletronics.mediaupload.domain.model;

import org.springframework.lang.Nullable;

public record ValidationResult(boolean valid, @Nullable UploadErrorKind errorKind, @Nullable String message) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(UploadErrorKind kind, String message) {
        if (!kind.isValidation()) {
            throw new IllegalArgumentException("Not a validation error kind: " + kind);
        }
        return new ValidationResult(false, kind, message);
    }
}
