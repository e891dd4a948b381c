package bflc.exec;

import bflc.codegen.CodeGenerator;
import bflc.codegen.CompiledModule;
import bflc.llvm.Llvm;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMExecutionEngineRef;
import org.bytedeco.llvm.LLVM.LLVMGenericValueRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Runs a compiled module in-process with MCJIT.
 *
 * <p>The module is cloned first, so the caller's module stays printable and reusable.
 * Input is handed over up front; output is collected in a buffer of at most
 * {@code outputLimit} bytes.
 */
public final class ProgramRunner {
    public static final int DEFAULT_OUTPUT_LIMIT = 1 << 20;

    private final int outputLimit;

    public ProgramRunner() {
        this(DEFAULT_OUTPUT_LIMIT);
    }

    public ProgramRunner(int outputLimit) {
        if (outputLimit <= 0) throw new IllegalArgumentException("Output limit must be positive: " + outputLimit);
        this.outputLimit = outputLimit;
    }

    public byte[] run(CompiledModule compiled, byte[] input) {
        Llvm.initializeNativeTarget();

        LLVMModuleRef copy = LLVMCloneModule(compiled.module());
        LLVMExecutionEngineRef engine = new LLVMExecutionEngineRef();
        BytePointer error = new BytePointer((Pointer) null);
        try {
            IoRuntime.link(copy, input, outputLimit);
            Llvm.verify(copy);
            if (LLVMCreateJITCompilerForModule(engine, copy, 0, error) != 0) {
                throw new ExecutionException("Cannot create JIT: " + error.getString());
            }
        } catch (RuntimeException e) {
            // до создания движка модулем владеем мы
            LLVMDisposeModule(copy);
            throw e;
        } finally {
            if (!error.isNull()) LLVMDisposeMessage(error);
        }

        try {
            LLVMValueRef main = LLVMGetNamedFunction(copy, CodeGenerator.ENTRY_NAME);
            if (main == null) throw new ExecutionException("No function @" + CodeGenerator.ENTRY_NAME);
            LLVMDisposeGenericValue(LLVMRunFunction(engine, main, 0, (PointerPointer) null));
            checkFault(engine, copy);
            return collectOutput(engine, copy);
        } finally {
            LLVMDisposeExecutionEngine(engine);
        }
    }

    /** Reads all of {@code in} before starting, then writes the output to {@code out}. */
    public void run(CompiledModule compiled, InputStream in, OutputStream out) throws IOException {
        byte[] output = run(compiled, in.readAllBytes());
        out.write(output);
        out.flush();
    }

    // ---------- results ----------

    private void checkFault(LLVMExecutionEngineRef engine, LLVMModuleRef module) {
        if (LLVMGetNamedFunction(module, IoRuntime.FAULTED) == null) return;
        if (call(engine, module, IoRuntime.FAULTED) == 0) return;
        long position = call(engine, module, IoRuntime.FAULT_POSITION);
        throw new ExecutionException("out-of-bounds tape access at cell " + position);
    }

    private byte[] collectOutput(LLVMExecutionEngineRef engine, LLVMModuleRef module) {
        long length = call(engine, module, IoRuntime.OUTPUT_LENGTH);
        if (length > outputLimit) {
            throw new ExecutionException("Program output exceeds " + outputLimit + " bytes");
        }
        LLVMValueRef getter = LLVMGetNamedFunction(module, IoRuntime.OUTPUT_BYTE);
        LLVMTypeRef i32 = LLVMInt32TypeInContext(LLVMGetModuleContext(module));
        byte[] out = new byte[(int) length];
        for (int k = 0; k < out.length; k++) {
            LLVMGenericValueRef index = LLVMCreateGenericValueOfInt(i32, k, 0);
            LLVMGenericValueRef result = LLVMRunFunction(engine, getter, 1, new PointerPointer<>(index));
            out[k] = (byte) LLVMGenericValueToInt(result, 0);
            LLVMDisposeGenericValue(result);
            LLVMDisposeGenericValue(index);
        }
        return out;
    }

    private static long call(LLVMExecutionEngineRef engine, LLVMModuleRef module, String name) {
        LLVMValueRef fn = LLVMGetNamedFunction(module, name);
        if (fn == null) throw new ExecutionException("No function @" + name);
        LLVMGenericValueRef result = LLVMRunFunction(engine, fn, 0, (PointerPointer) null);
        try {
            return LLVMGenericValueToInt(result, 1);
        } finally {
            LLVMDisposeGenericValue(result);
        }
    }
}
