package bflc.ast;

// <
public record MoveLeft() implements Instruction {
    @Override
    public <R> R accept(Visitor<R> v) { return v.visitMoveLeft(this); }
}
