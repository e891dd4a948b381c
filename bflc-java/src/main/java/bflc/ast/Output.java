package bflc.ast;

// .
public record Output() implements Instruction {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitOutput(this); }
}
