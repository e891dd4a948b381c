package bflc.io;

import bflc.llvm.Llvm;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Writes a module as a textual {@code .ll} file. */
public final class IrWriter {
    private IrWriter() {}

    // ---- public API ----

    public static void write(Path out, LLVMModuleRef module) throws IOException {
        Path tmp = out.resolveSibling(out.getFileName() + ".tmp");
        try {
            Llvm.printToFile(module, tmp);
            // частичный .ll не должен оставаться на диске
            Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    public static void write(OutputStream out, LLVMModuleRef module) throws IOException {
        out.write(Llvm.print(module).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /** Default output path: {@code prog.bf -> prog.ll}. */
    public static Path defaultOutput(Path input) {
        String name = input.getFileName().toString().replaceFirst("\\.(bf|b)$", "");
        return input.resolveSibling(name + ".ll");
    }
}
