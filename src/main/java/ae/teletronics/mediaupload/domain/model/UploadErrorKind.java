package ae.teletronics.mediaupload.domain.model;

/**
 * Stable classification of a failed upload. The first four are raised before any network use.
 */
public enum UploadErrorKind {
    UNSUPPORTED_TYPE(true),
    TOO_LARGE(true),
    NAME_TOO_LONG(true),
    NAME_INVALID(true),

    TIMEOUT(false),
    SERVER_REJECTED(false),
    RATE_LIMITED(false),
    PAYLOAD_TOO_LARGE(false),
    SERVER_ERROR(false),
    NETWORK_ERROR(false),
    /** content could not be read or encoded at all */
    VALIDATION_ERROR(false);

    private final boolean validation;

    UploadErrorKind(boolean validation) {
        this.validation = validation;
    }

    public boolean isValidation() {
        return validation;
    }
}
