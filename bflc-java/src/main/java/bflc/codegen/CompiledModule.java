package bflc.codegen;

import bflc.ast.Program;
import bflc.llvm.Llvm;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * A verified LLVM module together with the program it was generated from.
 * Owns the native module and its context until {@link #close()}.
 */
public final class CompiledModule implements AutoCloseable {
    private final Program program;
    private final LLVMContextRef context;
    private final LLVMModuleRef module;
    private final LLVMValueRef main;
    private final int generatedInsns;
    private final int finalInsns;
    private boolean closed = false;

    CompiledModule(Program program, LLVMContextRef context, LLVMModuleRef module, LLVMValueRef main,
                   int generatedInsns, int finalInsns) {
        this.program = program;
        this.context = context;
        this.module = module;
        this.main = main;
        this.generatedInsns = generatedInsns;
        this.finalInsns = finalInsns;
    }

    public Program program() { return program; }

    public LLVMModuleRef module() {
        ensureOpen();
        return module;
    }

    public LLVMValueRef main() {
        ensureOpen();
        return main;
    }

    /** Instructions in {@code main} right after generation. */
    public int generatedInsns() { return generatedInsns; }

    /** Instructions in {@code main} after the pass pipeline, if it ran. */
    public int finalInsns() { return finalInsns; }

    public int blockCount() {
        return LLVMCountBasicBlocks(main());
    }

    /** Textual {@code .ll} form of the module. */
    public String render() {
        return Llvm.print(module());
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Module already disposed");
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        LLVMDisposeModule(module);
        LLVMContextDispose(context);
    }
}
