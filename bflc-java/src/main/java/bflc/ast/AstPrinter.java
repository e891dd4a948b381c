package bflc.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/** Debug print: re-emits the command character of every node. */
public final class AstPrinter implements Instruction.Visitor<Void> {
    private final StringBuilder out = new StringBuilder();
    // незакрытые циклы: оставшиеся команды каждого тела
    private final Deque<Iterator<Instruction>> open = new ArrayDeque<>();

    private AstPrinter() {}

    public static String print(Program p) {
        AstPrinter printer = new AstPrinter();
        printer.emitAll(p.instructions());
        return printer.out.toString();
    }

    public static String print(Instruction i) {
        return print(new Program(List.of(i)));
    }

    private void emitAll(List<Instruction> xs) {
        Iterator<Instruction> top = xs.iterator();
        open.push(top);
        while (!open.isEmpty()) {
            Iterator<Instruction> rest = open.peek();
            if (rest.hasNext()) {
                rest.next().accept(this);
                continue;
            }
            open.pop();
            if (rest != top) out.append(']');
        }
    }

    @Override public Void visitIncrement(Increment n) { out.append('+'); return null; }
    @Override public Void visitDecrement(Decrement n) { out.append('-'); return null; }
    @Override public Void visitMoveLeft(MoveLeft n) { out.append('<'); return null; }
    @Override public Void visitMoveRight(MoveRight n) { out.append('>'); return null; }
    @Override public Void visitOutput(Output n) { out.append('.'); return null; }
    @Override public Void visitInput(Input n) { out.append(','); return null; }

    @Override
    public Void visitLoop(Loop n) {
        out.append('[');
        open.push(n.body().iterator());
        return null;
    }
}
