package bflc.ast;

import java.util.List;

// [ ... ]
public record Loop(List<Instruction> body) implements Instruction {
    public Loop {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> v) { return v.visitLoop(this); }
}
