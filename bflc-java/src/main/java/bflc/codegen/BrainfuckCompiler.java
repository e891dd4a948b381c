package bflc.codegen;

import bflc.ast.Program;
import bflc.llvm.Llvm;
import bflc.llvm.PassPipeline;
import bflc.parser.Parser;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Parse, generate, verify and optionally optimize in one call.
 * Either a verified module comes back or an exception aborts the whole run
 * and nothing native is left behind.
 */
public final class BrainfuckCompiler {
    public static final String MODULE_NAME = "brainfuck";

    private final CompilerOptions options;

    public BrainfuckCompiler(CompilerOptions options) {
        this.options = options;
    }

    public BrainfuckCompiler() {
        this(CompilerOptions.defaults());
    }

    public CompiledModule compile(String source) {
        return compile(new StringReader(source), "<string>");
    }

    public CompiledModule compile(Reader source, String sourceName) {
        Program program = Parser.parse(source, options.parseMode());
        return generate(program, sourceName);
    }

    public CompiledModule generate(Program program, String sourceName) {
        LLVMContextRef context = LLVMContextCreate();
        LLVMModuleRef module = LLVMModuleCreateWithNameInContext(MODULE_NAME, context);
        try {
            byte[] name = sourceName.getBytes(StandardCharsets.UTF_8);
            LLVMSetSourceFileName(module, new BytePointer(name), name.length);

            LLVMValueRef main;
            try (var ctx = new GenerationContext(context, module, options.tapeSize(), options.boundsChecked())) {
                main = new CodeGenerator(ctx).generate(program);
            }
            int generated = Llvm.instructionCount(main);

            if (options.optimize()) {
                PassPipeline.standard().run(module);
                Llvm.verify(module);
            }
            return new CompiledModule(program, context, module, main, generated, Llvm.instructionCount(main));
        } catch (RuntimeException e) {
            LLVMDisposeModule(module);
            LLVMContextDispose(context);
            throw e;
        }
    }
}
