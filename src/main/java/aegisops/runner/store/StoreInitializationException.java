package aegisops.runner.store;

/**
 * Thrown when the run history store cannot be opened. No job could ever
 * record history, so startup must abort.
 */
public class StoreInitializationException extends RuntimeException {

    public StoreInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
