package bflc.parser;

import bflc.ast.Decrement;
import bflc.ast.Increment;
import bflc.ast.Input;
import bflc.ast.Instruction;
import bflc.ast.Loop;
import bflc.ast.MoveLeft;
import bflc.ast.MoveRight;
import bflc.ast.Output;
import bflc.ast.Program;
import bflc.lexer.Lexer;
import bflc.lexer.Token;

import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Single-pass parser over one-character tokens.
 * Each '[' opens a scope that collects a loop body until the matching ']'
 * or end of input. Open scopes live on an explicit stack, so nesting depth
 * is limited by heap only.
 */
public final class Parser {
    private final Lexer lexer;
    private final ParseMode mode;

    public Parser(Lexer lexer, ParseMode mode) {
        this.lexer = lexer;
        this.mode = mode;
    }

    public Parser(Lexer lexer) {
        this(lexer, ParseMode.PERMISSIVE);
    }

    public static Program parse(Reader source, ParseMode mode) {
        return new Parser(new Lexer(source), mode).parseProgram();
    }

    public static Program parse(String source) {
        return new Parser(new Lexer(source)).parseProgram();
    }

    // ---------- entry ----------
    public Program parseProgram() {
        Deque<Scope> open = new ArrayDeque<>();
        Scope top = new Scope(null);
        open.push(top);

        while (true) {
            Token t = lexer.next();
            Scope cur = open.peek();
            switch (t.type()) {
                case PLUS -> cur.items.add(new Increment());
                case MINUS -> cur.items.add(new Decrement());
                case LT -> cur.items.add(new MoveLeft());
                case GT -> cur.items.add(new MoveRight());
                case DOT -> cur.items.add(new Output());
                case COMMA -> cur.items.add(new Input());

                case LBRACKET -> open.push(new Scope(t));

                case RBRACKET -> {
                    if (cur == top) {
                        if (mode == ParseMode.STRICT) throw new ParseException(t, "Unmatched ']'");
                        // ']' на верхнем уровне завершает всю программу
                        return new Program(top.items);
                    }
                    open.pop();
                    open.peek().items.add(new Loop(cur.items));
                }

                case EOF -> {
                    if (cur != top && mode == ParseMode.STRICT) {
                        throw new ParseException(cur.opener, "Unclosed '['");
                    }
                    // конец потока закрывает все открытые циклы
                    while (open.size() > 1) {
                        Scope s = open.pop();
                        open.peek().items.add(new Loop(s.items));
                    }
                    return new Program(top.items);
                }
            }
        }
    }

    // ---------- scopes ----------

    /** A loop body being collected; {@code opener} is {@code null} at top level. */
    private static final class Scope {
        final Token opener;
        final List<Instruction> items = new ArrayList<>();

        Scope(Token opener) {
            this.opener = opener;
        }
    }
}
