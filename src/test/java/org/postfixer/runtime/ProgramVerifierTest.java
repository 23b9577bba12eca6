package org.postfixer.runtime;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.isa.Instruction.Apply;
import org.postfixer.runtime.isa.Instruction.Push;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProgramVerifierTest {

    private final ProgramVerifier verifier = new ProgramVerifier(3);

    @Test
    @Tag("unit")
    void returnsDeepestStack() throws BackendException {
        int depth = verifier.verify(List.of(new Push(1), new Push(2), new Push(3),
                new Apply("*", 2), new Apply("+", 2)));

        assertThat(depth).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void rejectsEmptyProgram() {
        assertThatThrownBy(() -> verifier.verify(List.of()))
                .isInstanceOf(BackendException.class)
                .hasMessage("Empty program");
    }

    @Test
    @Tag("unit")
    void rejectsUnderflow() {
        assertThatThrownBy(() -> verifier.verify(List.of(new Push(1), new Apply("+", 2))))
                .isInstanceOf(BackendException.class)
                .hasMessageStartingWith("Stack underflow at instruction 1");
    }

    @Test
    @Tag("unit")
    void rejectsOverflow() {
        assertThatThrownBy(() -> verifier.verify(List.of(new Push(1), new Push(2), new Push(3), new Push(4))))
                .isInstanceOf(BackendException.class)
                .hasMessage("Stack overflow at instruction 3 (capacity 3)");
    }

    @Test
    @Tag("unit")
    void rejectsLeftoverValues() {
        assertThatThrownBy(() -> verifier.verify(List.of(new Push(456), new Push(789))))
                .isInstanceOf(BackendException.class)
                .hasMessage("Program leaves 2 values on the stack, expected 1");
    }

    /**
     * Only binary arithmetic is executable; unary minus, factorial and the ternary are not.
     */
    @Test
    @Tag("unit")
    void rejectsNonArithmeticApply() {
        assertThatThrownBy(() -> verifier.verify(List.of(new Push(3), new Apply("-", 1))))
                .hasMessageContaining("Unrecognized instruction at 1: APPLY -/1");
        assertThatThrownBy(() -> verifier.verify(List.of(new Push(1), new Push(2), new Apply("=", 2))))
                .hasMessageContaining("APPLY =/2");
    }
}
