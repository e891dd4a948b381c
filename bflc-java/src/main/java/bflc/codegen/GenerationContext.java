package bflc.codegen;

import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Everything one code generation run mutates: the module under construction,
 * the builder cursor and the handles to the {@code position} and {@code tape} slots.
 * The module and its LLVM context belong to the caller; only the builder is released by {@link #close()}.
 */
public final class GenerationContext implements AutoCloseable {
    public static final String PUTCHAR = "putchar";
    public static final String GETCHAR = "getchar";
    /** {@code void(i64 position)}: called instead of touching a cell outside the tape. */
    public static final String TAPE_FAULT = "bflc.tape.fault";

    private final LLVMContextRef context;
    private final LLVMModuleRef module;
    private final LLVMBuilderRef builder;
    private final int tapeSize;
    private final boolean boundsChecked;

    final LLVMTypeRef i8;
    final LLVMTypeRef i32;
    final LLVMTypeRef i64;
    final LLVMTypeRef voidType;
    final LLVMTypeRef tapeType;
    final LLVMTypeRef putcharType;
    final LLVMTypeRef getcharType;
    final LLVMTypeRef faultType;

    private LLVMValueRef position;
    private LLVMValueRef tape;

    public GenerationContext(LLVMContextRef context, LLVMModuleRef module, int tapeSize, boolean boundsChecked) {
        this.context = context;
        this.module = module;
        this.builder = LLVMCreateBuilderInContext(context);
        this.tapeSize = tapeSize;
        this.boundsChecked = boundsChecked;

        i8 = LLVMInt8TypeInContext(context);
        i32 = LLVMInt32TypeInContext(context);
        i64 = LLVMInt64TypeInContext(context);
        voidType = LLVMVoidTypeInContext(context);
        tapeType = LLVMArrayType2(i8, tapeSize);
        putcharType = LLVMFunctionType(i32, new PointerPointer<>(i8), 1, 0);
        getcharType = LLVMFunctionType(i32, (PointerPointer) null, 0, 0);
        faultType = LLVMFunctionType(voidType, new PointerPointer<>(i64), 1, 0);
    }

    public LLVMContextRef context() { return context; }

    public LLVMModuleRef module() { return module; }

    public LLVMBuilderRef builder() { return builder; }

    public int tapeSize() { return tapeSize; }

    public boolean boundsChecked() { return boundsChecked; }

    public LLVMValueRef position() {
        if (position == null) throw new IllegalStateException("position slot not allocated yet");
        return position;
    }

    public LLVMValueRef tape() {
        if (tape == null) throw new IllegalStateException("tape slot not allocated yet");
        return tape;
    }

    void bindSlots(LLVMValueRef position, LLVMValueRef tape) {
        this.position = position;
        this.tape = tape;
    }

    // объявляются лениво, при первом '.' или ','
    LLVMValueRef putchar() {
        return declare(PUTCHAR, putcharType);
    }

    LLVMValueRef getchar() {
        return declare(GETCHAR, getcharType);
    }

    LLVMValueRef tapeFault() {
        return declare(TAPE_FAULT, faultType);
    }

    private LLVMValueRef declare(String name, LLVMTypeRef type) {
        LLVMValueRef fn = LLVMGetNamedFunction(module, name);
        return fn != null ? fn : LLVMAddFunction(module, name, type);
    }

    @Override
    public void close() {
        LLVMDisposeBuilder(builder);
    }
}
