package bflc.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Top-level command sequence. Behaves like an unparented {@link Loop} body
 * that is never conditionally skipped.
 */
public record Program(List<Instruction> instructions) {
    public Program {
        instructions = List.copyOf(instructions);
    }

    /** Number of nodes in the tree, loops included. */
    public int instructionCount() {
        return count(instructions);
    }

    /** Deepest loop nesting; 0 for a program without loops. */
    public int maxDepth() {
        return depth(instructions);
    }

    private static int count(List<Instruction> xs) {
        int n = 0;
        Deque<List<Instruction>> pending = new ArrayDeque<>();
        pending.push(xs);
        while (!pending.isEmpty()) {
            for (Instruction i : pending.pop()) {
                n++;
                if (i instanceof Loop l) pending.push(l.body());
            }
        }
        return n;
    }

    private static int depth(List<Instruction> xs) {
        // тела циклов с их глубиной
        record Level(List<Instruction> body, int depth) {}
        int d = 0;
        Deque<Level> pending = new ArrayDeque<>();
        pending.push(new Level(xs, 0));
        while (!pending.isEmpty()) {
            Level level = pending.pop();
            for (Instruction i : level.body()) {
                if (i instanceof Loop l) {
                    d = Math.max(d, level.depth() + 1);
                    pending.push(new Level(l.body(), level.depth() + 1));
                }
            }
        }
        return d;
    }
}
