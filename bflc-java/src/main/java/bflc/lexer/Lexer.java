package bflc.lexer;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming tokenizer. Reads one character at a time and never looks ahead,
 * so the source can be an unbuffered, non-seekable stream.
 * Anything that is not one of the eight command characters is a comment.
 */
public class Lexer {

    private final Reader source;

    private int line = 1;
    private int col = 0;
    private boolean done = false;

    public Lexer(Reader source) {
        this.source = source;
    }

    public Lexer(String source) {
        this(new StringReader(source));
    }

    public Token next() {
        while (!done) {
            int c = read();
            if (c == -1) {
                done = true;
                break;
            }

            if (c == '\n') {
                line++;
                col = 0;
                continue;
            }
            col++;

            TokenType type = TokenType.of((char) c);
            if (type != null) return new Token(type, line, col);
        }
        return new Token(TokenType.EOF, line, col + 1);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (t.type() != TokenType.EOF);
        return tokens;
    }

    private int read() {
        try {
            return source.read();
        } catch (IOException e) {
            throw new SourceReadException("Failed to read program source at " + line + ":" + (col + 1), e);
        }
    }
}
