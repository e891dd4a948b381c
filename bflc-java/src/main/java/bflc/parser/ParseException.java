package bflc.parser;

import bflc.lexer.Token;

public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(Token token, String message) {
        super(message + " at " + token.position());
        this.token = token;
    }

    public Token token() { return token; }
}
