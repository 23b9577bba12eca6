package org.postfixer.compiler;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompiledProgram;
import org.postfixer.compiler.api.CompilerErrorCode;
import org.postfixer.compiler.backend.emit.PostfixPrinter;
import org.postfixer.compiler.frontend.parser.GroupingMode;
import org.postfixer.compiler.frontend.parser.Parser;
import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.postfixer.junit.extensions.logging.LogWatchExtension;
import org.postfixer.runtime.BackendFactory;
import org.postfixer.runtime.BackendType;
import org.postfixer.runtime.IBackendSession;
import org.postfixer.runtime.IExecutionBackend;
import org.postfixer.runtime.RuntimeOptions;
import org.postfixer.runtime.isa.Instruction;
import org.postfixer.runtime.isa.Instruction.Apply;
import org.postfixer.runtime.isa.Instruction.Push;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests the {@link Compiler} facade. The backend is mocked for the wiring tests and real for
 * the end-to-end ones.
 */
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class CompilerTest {

    @Mock
    private IExecutionBackend backend;
    @Mock
    private IBackendSession session;
    @Captor
    private ArgumentCaptor<List<Instruction>> programCaptor;

    @Test
    @Tag("unit")
    void compile_shouldProducePostfixAndInstructions() throws CompilationException {
        // Given
        Compiler compiler = new Compiler(CompilerOptions.defaults(), backend);

        // When
        CompiledProgram program = compiler.compile("3 + 4 * 5");

        // Then
        assertThat(program.source()).isEqualTo("3 + 4 * 5");
        assertThat(program.postfix()).isEqualTo("3 4 5 * +");
        assertThat(program.instructions()).containsExactly(
                new Push(3), new Push(4), new Push(5), new Apply("*", 2), new Apply("+", 2));
        assertThat(program.ast().symbol()).isEqualTo("+");
        verifyNoInteractions(backend);
    }

    @Test
    @Tag("unit")
    void evaluate_shouldCompileInScopedSessionAndInvokeCallable() throws CompilationException {
        // Given
        when(backend.openSession()).thenReturn(session);
        when(session.compile(anyList())).thenReturn(() -> 7);
        Compiler compiler = new Compiler(CompilerOptions.defaults(), backend);

        // When
        int result = compiler.evaluate("3 + 4");

        // Then
        assertThat(result).isEqualTo(7);
        InOrder order = inOrder(backend, session);
        order.verify(backend).openSession();
        order.verify(session).compile(programCaptor.capture());
        order.verify(session).close();
        assertThat(programCaptor.getValue()).containsExactly(new Push(3), new Push(4), new Apply("+", 2));
    }

    @Test
    @Tag("unit")
    void evaluate_whenBackendRejectsProgram_shouldCloseSessionAndPropagate() throws CompilationException {
        // Given
        when(backend.openSession()).thenReturn(session);
        when(session.compile(anyList())).thenThrow(new BackendException("Unrecognized instruction"));
        Compiler compiler = new Compiler(CompilerOptions.defaults(), backend);

        // When
        BackendException error = catchThrowableOfType(() -> compiler.evaluate("-3"), BackendException.class);

        // Then
        assertThat(error.getErrorCode()).isEqualTo(CompilerErrorCode.BACKEND_FAILURE);
        verify(session).close();
    }

    @Test
    @Tag("unit")
    void evaluate_whenParseFails_shouldNotTouchBackend() {
        Compiler compiler = new Compiler(CompilerOptions.defaults(), backend);

        CompilationException error = catchThrowableOfType(() -> compiler.evaluate("3 +"), CompilationException.class);

        assertThat(error.getErrorCode()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
        verifyNoInteractions(backend);
    }

    @Test
    @Tag("unit")
    void strictLexing_shouldRejectUnknownCharacters() {
        Compiler compiler = new Compiler(new CompilerOptions(true, GroupingMode.EXPLICIT, Parser.DEFAULT_MAX_DEPTH), backend);

        CompilationException error = catchThrowableOfType(() -> compiler.compile("3 $ 4"), CompilationException.class);

        assertThat(error.getErrorCode()).isEqualTo(CompilerErrorCode.ILLEGAL_CHARACTER);
    }

    @Test
    @Tag("unit")
    void strictLexing_shouldAcceptEveryTableSymbol() throws CompilationException {
        Compiler compiler = new Compiler(new CompilerOptions(true, GroupingMode.EXPLICIT, Parser.DEFAULT_MAX_DEPTH), backend);

        AstNode root = compiler.parse("x = (a ? b : c.d)!");

        assertThat(PostfixPrinter.print(root)).isEqualTo("x a b c d . ? ! =");
    }

    @Test
    @Tag("integration")
    void evaluate_endToEndWithDefaultBackend() throws CompilationException {
        Compiler compiler = new Compiler();

        assertThat(compiler.evaluate("3 + 4")).isEqualTo(7);
        assertThat(compiler.evaluate("42 * (35 + 12) / (7 - 3) + 8")).isEqualTo(501);
        assertThat(compiler.getBackend().getName()).isEqualTo("interpreter");
    }

    @Test
    @Tag("integration")
    void evaluate_unaryMinusIsRejectedByBackend() {
        Compiler compiler = new Compiler();

        CompilationException error = catchThrowableOfType(() -> compiler.evaluate("-3 + 4"), CompilationException.class);

        assertThat(error).isInstanceOf(BackendException.class);
        assertThat(error).hasMessageContaining("APPLY -/1");
    }

    @ParameterizedTest
    @Tag("integration")
    @EnumSource(BackendType.class)
    void evaluate_veryLongChainOnEveryBackend(BackendType type) throws CompilationException {
        Compiler compiler = new Compiler(CompilerOptions.defaults(),
                BackendFactory.create(new RuntimeOptions(type, RuntimeOptions.DEFAULT_MAX_STACK_DEPTH)));

        assertThat(compiler.evaluate("1" + " + 1".repeat(50_000))).isEqualTo(50_001);
    }

    @Test
    @Tag("unit")
    void parse_veryLongPostfixChainPrints() throws CompilationException {
        Compiler compiler = new Compiler(CompilerOptions.defaults(), backend);

        AstNode root = compiler.parse("3" + "!".repeat(50_000));

        assertThat(PostfixPrinter.print(root)).isEqualTo("3" + " !".repeat(50_000));
    }
}
