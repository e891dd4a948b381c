package bflc.ast;

/**
 * One source command. {@link Loop} is the only node with children; every other
 * node is a payload-free leaf.
 */
public sealed interface Instruction
        permits Increment, Decrement, MoveLeft, MoveRight, Output, Input, Loop {

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitIncrement(Increment n);
        R visitDecrement(Decrement n);
        R visitMoveLeft(MoveLeft n);
        R visitMoveRight(MoveRight n);
        R visitOutput(Output n);
        R visitInput(Input n);
        R visitLoop(Loop n);
    }
}
