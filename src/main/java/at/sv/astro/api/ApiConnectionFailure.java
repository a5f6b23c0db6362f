package at.sv.astro.api;

/**
 * Exception to signal that a remote API could not be reached.
 */
public final class ApiConnectionFailure extends RuntimeException {

    public ApiConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
