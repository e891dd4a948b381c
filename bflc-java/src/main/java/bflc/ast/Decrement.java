package bflc.ast;

// -
public record Decrement() implements Instruction {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitDecrement(this); }
}
