package bflc.llvm;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.SizeTPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/** Helpers over the LLVM C API shared by code generation, output and execution. */
public final class Llvm {
    private static boolean nativeTargetReady = false;

    private Llvm() {}

    /** Registers the host target and MCJIT. Needed only for execution. */
    public static synchronized void initializeNativeTarget() {
        if (nativeTargetReady) return;
        LLVMLinkInMCJIT();
        if (LLVMInitializeNativeTarget() != 0) throw new LlvmException("No native target for this host");
        LLVMInitializeNativeAsmPrinter();
        LLVMInitializeNativeAsmParser();
        nativeTargetReady = true;
    }

    // ---------- verification ----------

    public static void verify(LLVMModuleRef module) {
        BytePointer error = new BytePointer((Pointer) null);
        try {
            if (LLVMVerifyModule(module, LLVMReturnStatusAction, error) != 0) {
                throw new VerifyException("Module failed verification:\n" + error.getString().strip());
            }
        } finally {
            if (!error.isNull()) LLVMDisposeMessage(error);
        }
    }

    public static void verify(LLVMValueRef function) {
        if (LLVMVerifyFunction(function, LLVMReturnStatusAction) == 0) return;
        // подробности даёт только проверка модуля
        verify(LLVMGetGlobalParent(function));
        throw new VerifyException("Function @" + name(function) + " failed verification");
    }

    // ---------- text ----------

    public static String print(LLVMModuleRef module) {
        BytePointer text = LLVMPrintModuleToString(module);
        try {
            return text.getString();
        } finally {
            LLVMDisposeMessage(text);
        }
    }

    public static void printToFile(LLVMModuleRef module, Path file) throws IOException {
        BytePointer error = new BytePointer((Pointer) null);
        try {
            if (LLVMPrintModuleToFile(module, file.toString(), error) != 0) {
                throw new IOException("Cannot write " + file + ": " + error.getString());
            }
        } finally {
            if (!error.isNull()) LLVMDisposeMessage(error);
        }
    }

    public static String name(LLVMValueRef value) {
        return LLVMGetValueName2(value, new SizeTPointer(1)).getString();
    }

    public static String name(LLVMBasicBlockRef block) {
        return LLVMGetBasicBlockName(block).getString();
    }

    // ---------- walking ----------

    public static List<LLVMBasicBlockRef> blocks(LLVMValueRef function) {
        List<LLVMBasicBlockRef> out = new ArrayList<>();
        for (LLVMBasicBlockRef b = LLVMGetFirstBasicBlock(function); b != null; b = LLVMGetNextBasicBlock(b)) {
            out.add(b);
        }
        return out;
    }

    public static List<LLVMValueRef> instructions(LLVMBasicBlockRef block) {
        List<LLVMValueRef> out = new ArrayList<>();
        for (LLVMValueRef i = LLVMGetFirstInstruction(block); i != null; i = LLVMGetNextInstruction(i)) {
            out.add(i);
        }
        return out;
    }

    public static int instructionCount(LLVMValueRef function) {
        int n = 0;
        for (LLVMBasicBlockRef b : blocks(function)) n += instructions(b).size();
        return n;
    }
}
