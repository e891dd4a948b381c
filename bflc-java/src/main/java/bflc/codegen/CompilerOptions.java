package bflc.codegen;

import bflc.parser.ParseMode;

/**
 * @param optimize      run the standard LLVM pass pipeline after generation
 * @param parseMode     bracket matching policy
 * @param tapeSize      number of cells allocated for the tape
 * @param boundsChecked guard every cell access with a range test that stops the program
 */
public record CompilerOptions(boolean optimize, ParseMode parseMode, int tapeSize, boolean boundsChecked) {
    public static final int DEFAULT_TAPE_SIZE = 0x4000;

    public CompilerOptions {
        if (parseMode == null) throw new IllegalArgumentException("parseMode is required");
        if (tapeSize <= 0) throw new IllegalArgumentException("Tape size must be positive: " + tapeSize);
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(true, ParseMode.PERMISSIVE, DEFAULT_TAPE_SIZE, false);
    }

    public CompilerOptions withOptimize(boolean optimize) {
        return new CompilerOptions(optimize, parseMode, tapeSize, boundsChecked);
    }

    public CompilerOptions withParseMode(ParseMode parseMode) {
        return new CompilerOptions(optimize, parseMode, tapeSize, boundsChecked);
    }

    public CompilerOptions withTapeSize(int tapeSize) {
        return new CompilerOptions(optimize, parseMode, tapeSize, boundsChecked);
    }

    public CompilerOptions withBoundsChecked(boolean boundsChecked) {
        return new CompilerOptions(optimize, parseMode, tapeSize, boundsChecked);
    }
}
