package bflc.codegen;

import bflc.llvm.Llvm;
import bflc.parser.Parser;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;
import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private LLVMContextRef context;
    private LLVMModuleRef module;

    @BeforeEach
    void createModule() {
        context = LLVMContextCreate();
        module = LLVMModuleCreateWithNameInContext("brainfuck", context);
    }

    @AfterEach
    void disposeModule() {
        LLVMDisposeModule(module);
        LLVMContextDispose(context);
    }

    private LLVMValueRef gen(String src) {
        return gen(src, CompilerOptions.DEFAULT_TAPE_SIZE, false);
    }

    private LLVMValueRef gen(String src, int tapeSize, boolean checked) {
        try (var ctx = new GenerationContext(context, module, tapeSize, checked)) {
            return new CodeGenerator(ctx).generate(Parser.parse(src));
        }
    }

    private static List<Integer> opcodes(LLVMBasicBlockRef b) {
        return Llvm.instructions(b).stream().map(i -> LLVMGetInstructionOpcode(i)).toList();
    }

    private static List<String> blockNames(LLVMValueRef fn) {
        return Llvm.blocks(fn).stream().map(Llvm::name).toList();
    }

    private static LLVMBasicBlockRef block(LLVMValueRef fn, String name) {
        return Llvm.blocks(fn).stream().filter(b -> Llvm.name(b).equals(name)).findFirst().orElseThrow();
    }

    private static LLVMBasicBlockRef successor(LLVMBasicBlockRef b, int k) {
        return LLVMGetSuccessor(LLVMGetBasicBlockTerminator(b), k);
    }

    private static long constant(LLVMValueRef insn, int operand) {
        return LLVMConstIntGetZExtValue(LLVMGetOperand(insn, operand));
    }

    @Test
    void entry_allocates_position_and_zeroed_tape() {
        var fn = gen("");
        assertEquals("main", Llvm.name(fn));
        assertEquals(1, LLVMCountBasicBlocks(fn));

        var insns = Llvm.instructions(LLVMGetEntryBasicBlock(fn));
        assertEquals(List.of(LLVMAlloca, LLVMStore, LLVMAlloca, LLVMStore, LLVMRet), opcodes(LLVMGetEntryBasicBlock(fn)));

        var position = insns.get(0);
        assertEquals("position", Llvm.name(position));
        assertEquals(64, LLVMGetIntTypeWidth(LLVMGetAllocatedType(position)));
        assertEquals(0, constant(insns.get(1), 0));
        assertEquals(position, LLVMGetOperand(insns.get(1), 1));

        var tape = insns.get(2);
        assertEquals("tape", Llvm.name(tape));
        assertEquals(16384, LLVMGetArrayLength2(LLVMGetAllocatedType(tape)));
        assertEquals(1, LLVMIsNull(LLVMGetOperand(insns.get(3), 0)));
        assertEquals(tape, LLVMGetOperand(insns.get(3), 1));
    }

    @Test
    void tape_size_is_configurable() {
        var tape = Llvm.instructions(LLVMGetEntryBasicBlock(gen("", 64, false))).get(2);
        assertEquals(64, LLVMGetArrayLength2(LLVMGetAllocatedType(tape)));
    }

    @Test
    void cell_commands_load_modify_store() {
        var entry = LLVMGetEntryBasicBlock(gen("+-"));
        assertEquals(List.of(
                LLVMAlloca, LLVMStore, LLVMAlloca, LLVMStore,
                LLVMLoad, LLVMGetElementPtr, LLVMLoad, LLVMAdd, LLVMStore,
                LLVMLoad, LLVMGetElementPtr, LLVMLoad, LLVMSub, LLVMStore,
                LLVMRet
        ), opcodes(entry));

        var insns = Llvm.instructions(entry);
        var add = insns.get(7);
        assertEquals(8, LLVMGetIntTypeWidth(LLVMTypeOf(add)));
        assertEquals(1, constant(add, 1));
        assertEquals(1, constant(insns.get(12), 1));
    }

    @Test
    void pointer_commands_work_on_i64_position() {
        var entry = LLVMGetEntryBasicBlock(gen("<>"));
        assertEquals(List.of(
                LLVMAlloca, LLVMStore, LLVMAlloca, LLVMStore,
                LLVMLoad, LLVMSub, LLVMStore,
                LLVMLoad, LLVMAdd, LLVMStore,
                LLVMRet
        ), opcodes(entry));
        var sub = Llvm.instructions(entry).get(5);
        assertEquals(64, LLVMGetIntTypeWidth(LLVMTypeOf(sub)));
        assertEquals("pos.next", Llvm.name(sub));
    }

    @Test
    void io_commands_call_putchar_and_getchar() {
        var insns = Llvm.instructions(LLVMGetEntryBasicBlock(gen(",.")));
        var calls = insns.stream().filter(i -> LLVMGetInstructionOpcode(i) == LLVMCall).toList();
        assertEquals(2, calls.size());
        assertEquals("getchar", Llvm.name(LLVMGetCalledValue(calls.get(0))));
        assertEquals("putchar", Llvm.name(LLVMGetCalledValue(calls.get(1))));
        assertEquals(8, LLVMGetIntTypeWidth(LLVMTypeOf(LLVMGetOperand(calls.get(1), 0))));

        // результат getchar обрезается до i8 перед записью в ячейку
        var trunc = insns.stream().filter(i -> LLVMGetInstructionOpcode(i) == LLVMTrunc).findFirst().orElseThrow();
        assertEquals(calls.get(0), LLVMGetOperand(trunc, 0));
        assertEquals(8, LLVMGetIntTypeWidth(LLVMTypeOf(trunc)));
    }

    @Test
    void io_functions_declared_only_when_used() {
        gen("+-<>");
        assertNull(LLVMGetNamedFunction(module, GenerationContext.PUTCHAR));
        assertNull(LLVMGetNamedFunction(module, GenerationContext.GETCHAR));
        assertNull(LLVMGetNamedFunction(module, GenerationContext.TAPE_FAULT));
    }

    @Test
    void io_functions_declared_once() {
        gen(".,.,");
        var putchar = LLVMGetNamedFunction(module, GenerationContext.PUTCHAR);
        assertEquals(1, LLVMIsDeclaration(putchar));
        assertEquals(1, LLVMIsDeclaration(LLVMGetNamedFunction(module, GenerationContext.GETCHAR)));
        assertEquals("putchar", Llvm.name(putchar));
    }

    @Test
    void loop_lowers_to_entry_test_body_and_merge() {
        var fn = gen("[-]");
        assertEquals(List.of("entry", "loop.body", "loop.merge"), blockNames(fn));

        var entry = LLVMGetEntryBasicBlock(fn);
        var body = block(fn, "loop.body");
        var merge = block(fn, "loop.merge");

        assertEquals(body, successor(entry, 0));
        assertEquals(merge, successor(entry, 1));
        var test = LLVMGetCondition(LLVMGetBasicBlockTerminator(entry));
        assertEquals(LLVMIntNE, LLVMGetICmpPredicate(test));
        assertEquals(0, constant(test, 1));

        // trailing test прыгает обратно в тело, а не на entry test
        assertEquals(body, successor(body, 0));
        assertEquals(merge, successor(body, 1));
        assertEquals("loop.again", Llvm.name(LLVMGetCondition(LLVMGetBasicBlockTerminator(body))));

        assertEquals(List.of(LLVMRet), opcodes(merge));
    }

    @Test
    void nested_loop_retest_runs_from_inner_merge() {
        var fn = gen("[[-]-]");
        var blocks = Llvm.blocks(fn);
        assertEquals(5, blocks.size());

        var outerBody = blocks.get(1);
        var outerMerge = blocks.get(2);
        var innerBody = blocks.get(3);
        var innerMerge = blocks.get(4);
        assertTrue(Llvm.name(innerBody).startsWith("loop.body"));
        assertTrue(Llvm.name(innerMerge).startsWith("loop.merge"));

        assertEquals(innerBody, successor(outerBody, 0));
        assertEquals(innerMerge, successor(outerBody, 1));
        assertEquals(innerBody, successor(innerBody, 0));
        assertEquals(innerMerge, successor(innerBody, 1));

        // внешний '-' и внешний trailing test оказались в merge внутреннего цикла
        assertTrue(opcodes(innerMerge).contains(LLVMSub));
        assertEquals(outerBody, successor(innerMerge, 0));
        assertEquals(outerMerge, successor(innerMerge, 1));

        var entry = LLVMGetEntryBasicBlock(fn);
        for (var b : blocks) {
            var term = LLVMGetBasicBlockTerminator(b);
            for (int k = 0; k < LLVMGetNumSuccessors(term); k++) {
                assertNotEquals(entry, LLVMGetSuccessor(term, k), "nothing branches back to entry");
            }
        }
    }

    @Test
    void code_after_loop_continues_in_merge() {
        var merge = block(gen("[-]."), "loop.merge");
        assertTrue(opcodes(merge).contains(LLVMCall));
        assertEquals(LLVMRet, LLVMGetInstructionOpcode(LLVMGetBasicBlockTerminator(merge)));
    }

    @Test
    void checked_access_branches_to_shared_fault_block() {
        var fn = gen("+>+", 16, true);
        var entry = LLVMGetEntryBasicBlock(fn);
        var fault = block(fn, "tape.fault");
        var inside = block(fn, "pos.inside");

        var outside = LLVMGetCondition(LLVMGetBasicBlockTerminator(entry));
        assertEquals("pos.outside", Llvm.name(outside));
        assertEquals(LLVMIntUGE, LLVMGetICmpPredicate(outside));
        assertEquals(16, constant(outside, 1));
        assertEquals(fault, successor(entry, 0));
        assertEquals(inside, successor(entry, 1));

        // обе проверки ведут в один блок, позиция приходит через phi
        assertEquals(List.of(LLVMPHI, LLVMCall, LLVMRet), opcodes(fault));
        var phi = LLVMGetFirstInstruction(fault);
        assertEquals(2, LLVMCountIncoming(phi));
        var call = LLVMGetNextInstruction(phi);
        assertEquals(GenerationContext.TAPE_FAULT, Llvm.name(LLVMGetCalledValue(call)));
        assertEquals(phi, LLVMGetOperand(call, 0));
    }

    @Test
    void unchecked_access_has_no_guards() {
        var fn = gen("+>+<-.");
        assertEquals(1, LLVMCountBasicBlocks(fn));
        var ops = opcodes(LLVMGetEntryBasicBlock(fn));
        assertFalse(ops.contains(LLVMICmp));
    }

    @Test
    void very_deep_nesting_generates_every_loop() {
        int depth = 10_000;
        var fn = gen("[".repeat(depth) + "-" + "]".repeat(depth));
        assertEquals(2 * depth + 1, LLVMCountBasicBlocks(fn));
        // ret стоит в merge самого внешнего цикла
        var outerMerge = Llvm.blocks(fn).get(2);
        assertEquals(LLVMRet, LLVMGetInstructionOpcode(LLVMGetBasicBlockTerminator(outerMerge)));
    }

    @Test
    void rendered_ir_reads_like_llvm() {
        gen("[.]");
        var text = Llvm.print(module);
        assertTrue(text.startsWith("; ModuleID = 'brainfuck'\n"), text);
        assertTrue(text.contains("declare i32 @putchar(i8)"), text);
        assertTrue(text.contains("define void @main() {"), text);
        assertTrue(text.contains("  %tape = alloca [16384 x i8]"), text);
        assertTrue(text.contains("  store [16384 x i8] zeroinitializer, ptr %tape"), text);
        assertTrue(text.contains("  %cell.ptr = getelementptr [16384 x i8], ptr %tape, i64 0, i64 %pos"), text);
        assertTrue(text.contains("  br i1 %loop.enter, label %loop.body, label %loop.merge"), text);
        assertTrue(text.contains("  br i1 %loop.again, label %loop.body, label %loop.merge"), text);
    }
}
