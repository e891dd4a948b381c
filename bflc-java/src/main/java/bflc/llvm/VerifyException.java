package bflc.llvm;

/** Generated IR is not well-formed according to the LLVM verifier. */
public final class VerifyException extends LlvmException {
    public VerifyException(String message) {
        super(message);
    }
}
