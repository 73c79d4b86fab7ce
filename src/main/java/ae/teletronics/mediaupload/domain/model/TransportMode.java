package ae.teletronics.mediaupload.domain.model;

/** How an asset travelled to the endpoint. */
public enum TransportMode {
    /** multipart/form-data with the raw bytes plus sidecar fields */
    STRUCTURED,
    /** text/plain JSON envelope with base64 content; avoids a CORS preflight */
    ENVELOPE
}
