package mailgate.core.model.oauth;

/**
 * The client store could not be written.
 */
public class ClientStoreException extends RuntimeException {

    public ClientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
