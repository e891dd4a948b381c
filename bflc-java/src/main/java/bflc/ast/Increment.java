package bflc.ast;

// +
public record Increment() implements Instruction {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitIncrement(this); }
}
