package at.sv.astro.api;

public final class ResourceNotFoundException extends ApiFailure {
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
