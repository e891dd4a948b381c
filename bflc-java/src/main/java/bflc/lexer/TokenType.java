package bflc.lexer;

public enum TokenType {

    // cell
    PLUS('+'),
    MINUS('-'),

    // pointer
    LT('<'),
    GT('>'),

    // i/o
    DOT('.'),
    COMMA(','),

    // scope
    LBRACKET('['),
    RBRACKET(']'),

    EOF('\0');

    private final char symbol;

    TokenType(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() { return symbol; }

    /** Returns the token type for a command character, or {@code null} for comment text. */
    public static TokenType of(char c) {
        return switch (c) {
            case '+' -> PLUS;
            case '-' -> MINUS;
            case '<' -> LT;
            case '>' -> GT;
            case '.' -> DOT;
            case ',' -> COMMA;
            case '[' -> LBRACKET;
            case ']' -> RBRACKET;
            default -> null;
        };
    }
}
