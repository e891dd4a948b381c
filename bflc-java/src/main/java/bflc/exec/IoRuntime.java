package bflc.exec;

import bflc.codegen.GenerationContext;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Gives the I/O declarations of a generated module bodies written in IR.
 * {@code getchar} reads from a constant copy of the input, {@code putchar} appends to a
 * fixed-size global buffer, and {@code bflc.tape.fault} records the faulting position.
 * The buffer and fault state are read back through small exported accessor functions.
 */
final class IoRuntime {
    static final String OUTPUT_LENGTH = "bflc.out.length";   // i64 ()
    static final String OUTPUT_BYTE = "bflc.out.byte";       // i32 (i32 index)
    static final String FAULTED = "bflc.fault.flag";          // i8 ()
    static final String FAULT_POSITION = "bflc.fault.pos";   // i64 ()

    private final LLVMContextRef context;
    private final LLVMModuleRef module;
    private final LLVMBuilderRef b;
    private final LLVMTypeRef i8;
    private final LLVMTypeRef i32;
    private final LLVMTypeRef i64;

    private IoRuntime(LLVMModuleRef module) {
        this.module = module;
        this.context = LLVMGetModuleContext(module);
        this.b = LLVMCreateBuilderInContext(context);
        this.i8 = LLVMInt8TypeInContext(context);
        this.i32 = LLVMInt32TypeInContext(context);
        this.i64 = LLVMInt64TypeInContext(context);
    }

    /** Adds the runtime to {@code module}; the module must not be executing yet. */
    static void link(LLVMModuleRef module, byte[] input, int outputLimit) {
        IoRuntime rt = new IoRuntime(module);
        try {
            rt.defineGetchar(input);
            rt.defineOutput(outputLimit);
            rt.defineFault();
        } finally {
            LLVMDisposeBuilder(rt.b);
        }
    }

    // ---------- input ----------

    private void defineGetchar(byte[] input) {
        LLVMValueRef fn = LLVMGetNamedFunction(module, GenerationContext.GETCHAR);
        if (fn == null) return;

        LLVMTypeRef dataType = LLVMArrayType2(i8, input.length);
        LLVMValueRef init = input.length == 0
                ? LLVMConstNull(dataType)
                : LLVMConstStringInContext(context, new BytePointer(input), input.length, 1);
        LLVMValueRef data = global("bflc.in", dataType, init);
        LLVMSetGlobalConstant(data, 1);
        LLVMValueRef cursor = global("bflc.in.pos", i64, LLVMConstInt(i64, 0, 0));

        LLVMBasicBlockRef entry = body(fn);
        LLVMBasicBlockRef read = LLVMAppendBasicBlockInContext(context, fn, "read");
        LLVMBasicBlockRef eof = LLVMAppendBasicBlockInContext(context, fn, "eof");

        LLVMPositionBuilderAtEnd(b, entry);
        LLVMValueRef pos = LLVMBuildLoad2(b, i64, cursor, "pos");
        LLVMValueRef more = LLVMBuildICmp(b, LLVMIntULT, pos, LLVMConstInt(i64, input.length, 0), "more");
        LLVMBuildCondBr(b, more, read, eof);

        LLVMPositionBuilderAtEnd(b, read);
        LLVMValueRef ptr = LLVMBuildGEP2(b, dataType, data, indices(pos), 2, "ptr");
        LLVMValueRef c = LLVMBuildLoad2(b, i8, ptr, "c");
        LLVMBuildStore(b, LLVMBuildAdd(b, pos, LLVMConstInt(i64, 1, 0), "pos.next"), cursor);
        LLVMBuildRet(b, LLVMBuildZExt(b, c, i32, "r"));

        // конец ввода: -1, как у libc
        LLVMPositionBuilderAtEnd(b, eof);
        LLVMBuildRet(b, LLVMConstInt(i32, -1, 1));
    }

    // ---------- output ----------

    private void defineOutput(int limit) {
        LLVMTypeRef bufferType = LLVMArrayType2(i8, limit);
        LLVMValueRef buffer = global("bflc.out", bufferType, LLVMConstNull(bufferType));
        LLVMValueRef length = global("bflc.out.len", i64, LLVMConstInt(i64, 0, 0));

        LLVMValueRef fn = LLVMGetNamedFunction(module, GenerationContext.PUTCHAR);
        if (fn != null) {
            LLVMBasicBlockRef entry = body(fn);
            LLVMBasicBlockRef write = LLVMAppendBasicBlockInContext(context, fn, "write");
            LLVMBasicBlockRef done = LLVMAppendBasicBlockInContext(context, fn, "done");
            LLVMValueRef c = LLVMGetParam(fn, 0);

            LLVMPositionBuilderAtEnd(b, entry);
            LLVMValueRef len = LLVMBuildLoad2(b, i64, length, "len");
            LLVMValueRef fits = LLVMBuildICmp(b, LLVMIntULT, len, LLVMConstInt(i64, limit, 0), "fits");
            LLVMBuildCondBr(b, fits, write, done);

            LLVMPositionBuilderAtEnd(b, write);
            LLVMBuildStore(b, c, LLVMBuildGEP2(b, bufferType, buffer, indices(len), 2, "ptr"));
            LLVMBuildBr(b, done);

            // длина растёт и после переполнения: так видно, что вывод обрезан
            LLVMPositionBuilderAtEnd(b, done);
            LLVMBuildStore(b, LLVMBuildAdd(b, len, LLVMConstInt(i64, 1, 0), "len.next"), length);
            LLVMBuildRet(b, LLVMBuildZExt(b, c, i32, "r"));
        }

        accessor(OUTPUT_LENGTH, LLVMFunctionType(i64, (PointerPointer) null, 0, 0));
        LLVMBuildRet(b, LLVMBuildLoad2(b, i64, length, "len"));

        LLVMValueRef byteGetter = accessor(OUTPUT_BYTE, LLVMFunctionType(i32, new PointerPointer<>(i32), 1, 0));
        LLVMValueRef index = LLVMBuildZExt(b, LLVMGetParam(byteGetter, 0), i64, "index");
        LLVMValueRef ptr = LLVMBuildGEP2(b, bufferType, buffer, indices(index), 2, "ptr");
        LLVMBuildRet(b, LLVMBuildZExt(b, LLVMBuildLoad2(b, i8, ptr, "c"), i32, "r"));
    }

    // ---------- faults ----------

    private void defineFault() {
        LLVMValueRef fn = LLVMGetNamedFunction(module, GenerationContext.TAPE_FAULT);
        if (fn == null) return;

        LLVMValueRef flag = global("bflc.fault", i8, LLVMConstInt(i8, 0, 0));
        LLVMValueRef where = global("bflc.fault.at", i64, LLVMConstInt(i64, 0, 0));

        LLVMPositionBuilderAtEnd(b, body(fn));
        LLVMBuildStore(b, LLVMConstInt(i8, 1, 0), flag);
        LLVMBuildStore(b, LLVMGetParam(fn, 0), where);
        LLVMBuildRetVoid(b);

        accessor(FAULTED, LLVMFunctionType(i8, (PointerPointer) null, 0, 0));
        LLVMBuildRet(b, LLVMBuildLoad2(b, i8, flag, "flag"));

        accessor(FAULT_POSITION, LLVMFunctionType(i64, (PointerPointer) null, 0, 0));
        LLVMBuildRet(b, LLVMBuildLoad2(b, i64, where, "pos"));
    }

    // ---------- helpers ----------

    private LLVMValueRef global(String name, LLVMTypeRef type, LLVMValueRef init) {
        LLVMValueRef g = LLVMAddGlobal(module, type, name);
        LLVMSetInitializer(g, init);
        LLVMSetLinkage(g, LLVMInternalLinkage);
        return g;
    }

    /** Turns a declaration into an internal definition and returns its entry block. */
    private LLVMBasicBlockRef body(LLVMValueRef declared) {
        LLVMSetLinkage(declared, LLVMInternalLinkage);
        return LLVMAppendBasicBlockInContext(context, declared, "entry");
    }

    /** Adds an exported function and leaves the builder in its entry block. */
    private LLVMValueRef accessor(String name, LLVMTypeRef type) {
        LLVMValueRef fn = LLVMAddFunction(module, name, type);
        LLVMPositionBuilderAtEnd(b, LLVMAppendBasicBlockInContext(context, fn, "entry"));
        return fn;
    }

    private PointerPointer<LLVMValueRef> indices(LLVMValueRef index) {
        return new PointerPointer<>(LLVMConstInt(i64, 0, 0), index);
    }
}
