package at.sv.astro.api;

/**
 * Exception to signal a backend error of a remote API (5xx, 429). Or when its response could not be parsed.
 */
public class ApiFailure extends RuntimeException {
    public ApiFailure(String message) {
        super(message);
    }

    public ApiFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
