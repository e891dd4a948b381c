package bflc.llvm;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.llvm.LLVM.LLVMErrorRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMPassBuilderOptionsRef;
import org.bytedeco.llvm.LLVM.LLVMTargetMachineRef;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * A textual new-pass-manager pipeline applied to a whole module.
 * The standard one folds instructions, reassociates, numbers values globally
 * and cleans up the CFG, once per defined function.
 */
public final class PassPipeline {
    public static final String STANDARD = "function(instcombine,reassociate,gvn,simplifycfg)";

    private final String passes;
    private boolean verifyEach = false;

    public PassPipeline(String passes) {
        this.passes = passes;
    }

    public static PassPipeline standard() {
        return new PassPipeline(STANDARD);
    }

    /** Runs the LLVM verifier after every pass. */
    public PassPipeline verifyEach(boolean on) {
        this.verifyEach = on;
        return this;
    }

    public String passes() { return passes; }

    public void run(LLVMModuleRef module) {
        LLVMPassBuilderOptionsRef options = LLVMCreatePassBuilderOptions();
        try {
            LLVMPassBuilderOptionsSetVerifyEach(options, verifyEach ? 1 : 0);
            LLVMErrorRef error = LLVMRunPasses(module, passes, (LLVMTargetMachineRef) null, options);
            if (error != null && !error.isNull()) {
                BytePointer message = LLVMGetErrorMessage(error);
                String text = message.getString();
                LLVMDisposeErrorMessage(message);
                throw new LlvmException("Pass pipeline '" + passes + "' failed: " + text);
            }
        } finally {
            LLVMDisposePassBuilderOptions(options);
        }
    }
}
