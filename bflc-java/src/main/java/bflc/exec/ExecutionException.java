package bflc.exec;

/** The program could not be started or stopped abnormally. */
public final class ExecutionException extends RuntimeException {
    public ExecutionException(String message) {
        super(message);
    }
}
