package bflc.ast;

// >
public record MoveRight() implements Instruction {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitMoveRight(this); }
}
