package bflc.ast;

// ,
public record Input() implements Instruction {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitInput(this); }
}
