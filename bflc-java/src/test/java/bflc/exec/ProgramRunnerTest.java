package bflc.exec;

import bflc.codegen.BrainfuckCompiler;
import bflc.codegen.CompilerOptions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramRunnerTest {

    @Test
    void program_without_output_returns_nothing() {
        try (var compiled = new BrainfuckCompiler().compile("+++[-]>")) {
            assertArrayEquals(new byte[0], new ProgramRunner().run(compiled, new byte[0]));
        }
    }

    @Test
    void output_up_to_limit_is_kept() {
        try (var compiled = new BrainfuckCompiler().compile("+....")) {
            assertArrayEquals(new byte[]{1, 1, 1, 1}, new ProgramRunner(4).run(compiled, new byte[0]));
        }
    }

    @Test
    void output_over_limit_fails() {
        try (var compiled = new BrainfuckCompiler().compile("+......")) {
            var e = assertThrows(ExecutionException.class, () -> new ProgramRunner(4).run(compiled, new byte[0]));
            assertEquals("Program output exceeds 4 bytes", e.getMessage());
        }
    }

    @Test
    void limit_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new ProgramRunner(0));
    }

    @Test
    void each_run_starts_from_fresh_state() {
        try (var compiled = new BrainfuckCompiler().compile(",+.")) {
            String before = compiled.render();
            var runner = new ProgramRunner();
            assertArrayEquals(new byte[]{'b'}, runner.run(compiled, new byte[]{'a'}));
            assertArrayEquals(new byte[]{'c'}, runner.run(compiled, new byte[]{'b'}));
            // исходный модуль не меняется: рантайм добавляется в копию
            assertEquals(before, compiled.render());
        }
    }

    @Test
    void input_is_consumed_in_order() {
        try (var compiled = new BrainfuckCompiler(CompilerOptions.defaults().withOptimize(false)).compile(",.,.,.")) {
            assertArrayEquals(new byte[]{'x', 'y', (byte) 0xFF}, new ProgramRunner().run(compiled, new byte[]{'x', 'y'}));
        }
    }

    @Test
    void streams_are_read_fully_and_flushed() throws Exception {
        try (var compiled = new BrainfuckCompiler().compile(",[.,]")) {
            var in = new ByteArrayInputStream(new byte[]{'h', 'i', 0, 'z'});
            var out = new ByteArrayOutputStream();
            new ProgramRunner().run(compiled, in, out);
            assertEquals("hi", out.toString());
            assertEquals(0, in.available());
        }
    }

    @Test
    void closed_module_cannot_run() {
        var compiled = new BrainfuckCompiler().compile(".");
        compiled.close();
        assertThrows(IllegalStateException.class, () -> new ProgramRunner().run(compiled, new byte[0]));
    }

    @Test
    void runaway_pointer_faults_at_tape_end() {
        var options = CompilerOptions.defaults().withTapeSize(3).withBoundsChecked(true);
        try (var compiled = new BrainfuckCompiler(options).compile("+[>+]")) {
            var e = assertThrows(ExecutionException.class, () -> new ProgramRunner().run(compiled, new byte[0]));
            assertEquals("out-of-bounds tape access at cell 3", e.getMessage());
        }
    }
}
