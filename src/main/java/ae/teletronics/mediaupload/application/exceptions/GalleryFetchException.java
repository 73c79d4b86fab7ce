package ae.teletronics.mediaupload.application.exceptions;

/**
 * A gallery listing could not be refreshed: transport failure, {@code success:false} or an unreadable body.
 */
public class GalleryFetchException extends RuntimeException {

    public GalleryFetchException(String message) {
        super(message);
    }

    public GalleryFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
