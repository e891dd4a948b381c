package bflc.lexer;

public record Token(TokenType type, int line, int col) {
    public String position() {
        return line + ":" + col;
    }
}
