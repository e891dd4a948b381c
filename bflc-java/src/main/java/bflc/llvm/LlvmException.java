package bflc.llvm;

/** The LLVM backend refused or failed an operation. */
public class LlvmException extends RuntimeException {
    public LlvmException(String message) {
        super(message);
    }
}
