package ae.teletronics.mediaupload.application.exceptions;

/**
 * Failure of a single request/response exchange with the remote endpoint.
 */
public class TransportException extends RuntimeException {
    public enum Kind { TIMEOUT, NETWORK, HTTP_STATUS }

    private final Kind kind;
    private final int statusCode;   // only for HTTP_STATUS, otherwise 0
    private final String body;      // best-effort response text, may be empty

    private TransportException(Kind kind, int statusCode, String body, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public static TransportException timeout(long timeoutMs, Throwable cause) {
        return new TransportException(Kind.TIMEOUT, 0, null, "Request timed out after " + timeoutMs + "ms", cause);
    }

    public static TransportException network(Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "connection failed";
        return new TransportException(Kind.NETWORK, 0, null, "Network error: " + detail, cause);
    }

    public static TransportException httpStatus(int statusCode, String body) {
        return new TransportException(Kind.HTTP_STATUS, statusCode, body, "HTTP " + statusCode, null);
    }

    public Kind getKind() { return kind; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
}
