package bflc.codegen;

import bflc.ast.Decrement;
import bflc.ast.Increment;
import bflc.ast.Input;
import bflc.ast.Instruction;
import bflc.ast.Loop;
import bflc.ast.MoveLeft;
import bflc.ast.MoveRight;
import bflc.ast.Output;
import bflc.ast.Program;
import bflc.llvm.Llvm;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Lowers a parsed program into the body of {@code void @main()}.
 *
 * <p>The output is a direct translation: every command reloads {@code position}
 * and the current cell, nothing is cached between commands. Simplification is
 * left to the pass pipeline.
 *
 * <p>A loop becomes three regions:
 * <pre>
 *   current:    %c = cell != 0 ; br %c, loop.body, loop.merge
 *   loop.body:  ...children... ; %c2 = cell != 0 ; br %c2, loop.body, loop.merge
 *   loop.merge: (code after the loop)
 * </pre>
 * Open loops are kept on an explicit stack, so nesting depth is not bounded by the Java stack.
 */
public final class CodeGenerator implements Instruction.Visitor<Void> {
    public static final String ENTRY_NAME = "main";

    /** A loop whose body is still being emitted. */
    private record OpenLoop(Iterator<Instruction> rest, LLVMBasicBlockRef body, LLVMBasicBlockRef merge) {}

    private final GenerationContext ctx;
    private final LLVMBuilderRef b;
    private final Deque<OpenLoop> open = new ArrayDeque<>();

    private LLVMValueRef main;
    // общий блок аварийного выхода и phi с позицией, создаются при первой проверке
    private LLVMBasicBlockRef faultBlock;
    private LLVMValueRef faultPosition;

    public CodeGenerator(GenerationContext ctx) {
        this.ctx = ctx;
        this.b = ctx.builder();
    }

    public LLVMValueRef generate(Program program) {
        main = LLVMAddFunction(ctx.module(), ENTRY_NAME, LLVMFunctionType(ctx.voidType, (PointerPointer) null, 0, 0));
        LLVMPositionBuilderAtEnd(b, LLVMAppendBasicBlockInContext(ctx.context(), main, "entry"));

        LLVMValueRef position = LLVMBuildAlloca(b, ctx.i64, "position");
        LLVMBuildStore(b, i64(0), position);

        LLVMValueRef tape = LLVMBuildAlloca(b, ctx.tapeType, "tape");
        LLVMBuildStore(b, LLVMConstNull(ctx.tapeType), tape);

        ctx.bindSlots(position, tape);

        emitAll(program.instructions());

        LLVMBuildRetVoid(b);
        Llvm.verify(main);
        return main;
    }

    private void emitAll(List<Instruction> top) {
        open.push(new OpenLoop(top.iterator(), null, null));
        while (!open.isEmpty()) {
            OpenLoop scope = open.peek();
            if (scope.rest().hasNext()) {
                scope.rest().next().accept(this);
                continue;
            }
            open.pop();
            if (scope.body() != null) closeLoop(scope);
        }
    }

    // ---------- tape helpers ----------

    private LLVMValueRef currentPosition() {
        return LLVMBuildLoad2(b, ctx.i64, ctx.position(), "pos");
    }

    private LLVMValueRef currentCellPtr() {
        LLVMValueRef pos = currentPosition();
        if (ctx.boundsChecked()) guard(pos);
        PointerPointer<LLVMValueRef> indices = new PointerPointer<>(i64(0), pos);
        return LLVMBuildGEP2(b, ctx.tapeType, ctx.tape(), indices, 2, "cell.ptr");
    }

    private LLVMValueRef currentCell() {
        return LLVMBuildLoad2(b, ctx.i8, currentCellPtr(), "cell");
    }

    /** Leaves {@code main} through the fault block unless {@code 0 <= pos < tapeSize}. */
    private void guard(LLVMValueRef pos) {
        // беззнаковое сравнение ловит и отрицательные позиции
        LLVMValueRef outside = LLVMBuildICmp(b, LLVMIntUGE, pos, i64(ctx.tapeSize()), "pos.outside");
        LLVMBasicBlockRef here = LLVMGetInsertBlock(b);
        LLVMBasicBlockRef inside = LLVMAppendBasicBlockInContext(ctx.context(), main, "pos.inside");
        LLVMBasicBlockRef fault = faultBlock();
        LLVMBuildCondBr(b, outside, fault, inside);
        LLVMAddIncoming(faultPosition, new PointerPointer<>(pos), new PointerPointer<>(here), 1);
        LLVMPositionBuilderAtEnd(b, inside);
    }

    private LLVMBasicBlockRef faultBlock() {
        if (faultBlock != null) return faultBlock;

        LLVMBasicBlockRef resume = LLVMGetInsertBlock(b);
        faultBlock = LLVMAppendBasicBlockInContext(ctx.context(), main, "tape.fault");
        LLVMPositionBuilderAtEnd(b, faultBlock);
        faultPosition = LLVMBuildPhi(b, ctx.i64, "fault.pos");
        LLVMBuildCall2(b, ctx.faultType, ctx.tapeFault(), new PointerPointer<>(faultPosition), 1, "");
        LLVMBuildRetVoid(b);
        LLVMPositionBuilderAtEnd(b, resume);
        return faultBlock;
    }

    private LLVMValueRef i8(long v) {
        return LLVMConstInt(ctx.i8, v, 0);
    }

    private LLVMValueRef i64(long v) {
        return LLVMConstInt(ctx.i64, v, 0);
    }

    // ---------- cells ----------

    @Override
    public Void visitIncrement(Increment n) {
        LLVMValueRef ptr = currentCellPtr();
        LLVMValueRef cell = LLVMBuildLoad2(b, ctx.i8, ptr, "cell");
        LLVMBuildStore(b, LLVMBuildAdd(b, cell, i8(1), "cell.next"), ptr);
        return null;
    }

    @Override
    public Void visitDecrement(Decrement n) {
        LLVMValueRef ptr = currentCellPtr();
        LLVMValueRef cell = LLVMBuildLoad2(b, ctx.i8, ptr, "cell");
        LLVMBuildStore(b, LLVMBuildSub(b, cell, i8(1), "cell.next"), ptr);
        return null;
    }

    // ---------- pointer ----------

    @Override
    public Void visitMoveLeft(MoveLeft n) {
        LLVMValueRef pos = currentPosition();
        LLVMBuildStore(b, LLVMBuildSub(b, pos, i64(1), "pos.next"), ctx.position());
        return null;
    }

    @Override
    public Void visitMoveRight(MoveRight n) {
        LLVMValueRef pos = currentPosition();
        LLVMBuildStore(b, LLVMBuildAdd(b, pos, i64(1), "pos.next"), ctx.position());
        return null;
    }

    // ---------- i/o ----------

    @Override
    public Void visitOutput(Output n) {
        LLVMValueRef cell = currentCell();
        LLVMBuildCall2(b, ctx.putcharType, ctx.putchar(), new PointerPointer<>(cell), 1, "putchar");
        return null;
    }

    @Override
    public Void visitInput(Input n) {
        LLVMValueRef c = LLVMBuildCall2(b, ctx.getcharType, ctx.getchar(), (PointerPointer) null, 0, "getchar");
        LLVMValueRef truncated = LLVMBuildIntCast2(b, c, ctx.i8, 1, "input");
        LLVMBuildStore(b, truncated, currentCellPtr());
        return null;
    }

    // ---------- loops ----------

    @Override
    public Void visitLoop(Loop n) {
        // entry test: ноль на входе -> тело не выполняется ни разу
        LLVMValueRef enter = LLVMBuildICmp(b, LLVMIntNE, currentCell(), i8(0), "loop.enter");

        LLVMBasicBlockRef body = LLVMAppendBasicBlockInContext(ctx.context(), main, "loop.body");
        LLVMBasicBlockRef merge = LLVMAppendBasicBlockInContext(ctx.context(), main, "loop.merge");
        LLVMBuildCondBr(b, enter, body, merge);

        LLVMPositionBuilderAtEnd(b, body);
        open.push(new OpenLoop(n.body().iterator(), body, merge));
        return null;
    }

    private void closeLoop(OpenLoop loop) {
        // trailing test, курсор стоит там, где закончилось тело (возможно, в merge вложенного цикла)
        LLVMValueRef again = LLVMBuildICmp(b, LLVMIntNE, currentCell(), i8(0), "loop.again");
        LLVMBuildCondBr(b, again, loop.body(), loop.merge());

        LLVMPositionBuilderAtEnd(b, loop.merge());
    }
}
