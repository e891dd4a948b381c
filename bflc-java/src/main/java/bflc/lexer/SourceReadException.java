package bflc.lexer;

import java.io.IOException;

public class SourceReadException extends RuntimeException {
    public SourceReadException(String message, IOException cause) {
        super(message, cause);
    }
}
