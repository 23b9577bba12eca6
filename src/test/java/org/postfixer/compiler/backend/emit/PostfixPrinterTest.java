package org.postfixer.compiler.backend.emit;

import org.postfixer.compiler.Compiler;
import org.postfixer.compiler.api.BackendException;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.frontend.lexer.Lexer;
import org.postfixer.compiler.frontend.parser.BindingPowers;
import org.postfixer.compiler.frontend.parser.GroupingMode;
import org.postfixer.compiler.frontend.parser.Parser;
import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link PostfixPrinter}, driven through the lexer and parser.
 * Each case pairs an infix line with its expected reverse-Polish rendering.
 */
public class PostfixPrinterTest {

    private static String postfix(String line) throws CompilationException {
        return PostfixPrinter.print(new Parser(new Lexer(line).scanTokens()).parse());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            // single values
            "3                                 | 3",
            "42                                | 42",
            // simple operations
            "3 + 4                             | 3 4 +",
            "10 - 5                            | 10 5 -",
            "6 * 7                             | 6 7 *",
            "8 / 2                             | 8 2 /",
            // precedence
            "3 + 4 * 5                         | 3 4 5 * +",
            "3 * 4 + 5                         | 3 4 * 5 +",
            "10 - 5 / 5                        | 10 5 5 / -",
            "1 + 2 * 3 - 4 / 5                 | 1 2 3 * + 4 5 / -",
            // parentheses
            "(3 + 4) * 5                       | 3 4 + 5 *",
            "(1 + 2) * (3 - 4)                 | 1 2 + 3 4 - *",
            "((3 + 4) * 5) / 2                 | 3 4 + 5 * 2 /",
            "(1 + (2 * 3)) - (4 / (5 + 6))     | 1 2 3 * + 4 5 6 + / -",
            "(((3)))                           | 3",
            "(3 + (4 * (5)))                   | 3 4 5 * +",
            // complex
            "3 + 4 * 2 / (1 - 5) + 6           | 3 4 2 * 1 5 - / + 6 +",
            "42 * (35 + 12) / (7 - 3) + 8      | 42 35 12 + * 7 3 - / 8 +",
            // unary
            "-3                                | 3 -",
            "+42                               | 42 +",
            "-3 + 4                            | 3 - 4 +",
            "-3 * (4 + 2)                      | 3 - 4 2 + *",
            "- -3                              | 3 - -",
            // associativity
            "1 - 2 - 3                         | 1 2 - 3 -",
            "3 + 4 - 5                         | 3 4 + 5 -",
            "6 * 7 / 2                         | 6 7 * 2 /",
            "a = b = c                         | a b c = =",
            "a.b.c                             | a b c . .",
            // large numbers
            "123 + 456                         | 123 456 +",
            "99999 * 88888                     | 99999 88888 *",
            "1234567890 - 987654321            | 1234567890 987654321 -",
            // postfix
            "3!                                | 3 !",
            "(4 + 5)!                          | 4 5 + !",
            "-3!                               | 3 ! -",
            "a[                                | a [",
            // ternary
            "a ? b : c                         | a b c ?",
            "a ? b : c ? d : e                 | a b c d e ? ?",
            "x = a ? 1 + 2 : 3                 | x a 1 2 + 3 ? =",
    })
    void testPrintsPostfix(String line, String expected) throws CompilationException {
        assertThat(postfix(line)).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void testWhitespaceIsIrrelevant() throws CompilationException {
        assertThat(postfix("  3   + 4   ")).isEqualTo("3 4 +");
        assertThat(postfix("3+4")).isEqualTo("3 4 +");
    }

    /**
     * In the legacy grouping mode the closing parenthesis is consumed through the postfix table,
     * so it binds inside the operand that precedes it.
     */
    @Test
    @Tag("unit")
    void testPostfixDelimiterGrouping() throws CompilationException {
        // Arrange
        AstNode root = new Parser(new Lexer("(3 + 4) * 5").scanTokens(),
                BindingPowers.standard(), GroupingMode.POSTFIX_DELIMITER, Parser.DEFAULT_MAX_DEPTH).parse();

        // Act
        String rendered = PostfixPrinter.print(root);

        // Assert
        assertThat(rendered).isEqualTo("3 4 ) 5 * +");
    }

    /**
     * Reading the printed text back with the assembler yields the instructions emitted from the tree,
     * so printing and emitting agree on order for arithmetic expressions.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "3 + 4 * 5",
            "(1 + 2) * (3 - 4)",
            "42 * (35 + 12) / (7 - 3) + 8",
            "1 - 2 - 3 - 4 - 5",
            "((((7))))"
    })
    void testPrintedTextReassemblesToEmittedProgram(String line) throws CompilationException {
        AstNode root = new Parser(new Lexer(line).scanTokens()).parse();

        String printed = PostfixPrinter.print(root);

        assertThat(PostfixAssembler.assemble(printed)).isEqualTo(new InstructionEmitter().emit(root));
        assertThat(PostfixPrinter.print(root)).isEqualTo(printed);
    }

    /**
     * Random fully parenthesized arithmetic: the printed text must match the tree it was generated
     * from, reassemble to the emitted program, and evaluate to the value of the tree.
     */
    @ParameterizedTest(name = "seed {0}")
    @Tag("unit")
    @ValueSource(longs = {7L, 42L, 20240611L})
    void testRandomArithmeticRoundTrips(long seed) throws CompilationException {
        Random random = new Random(seed);
        Compiler compiler = new Compiler();
        for (int i = 0; i < 300; i++) {
            RandomExpression expression = RandomExpression.generate(random, 5);
            AstNode root = compiler.parse(expression.infix());

            String printed = PostfixPrinter.print(root);

            assertThat(printed).as(expression.infix()).isEqualTo(expression.postfix());
            assertThat(PostfixAssembler.assemble(printed)).isEqualTo(new InstructionEmitter().emit(root));
            Integer expected = expression.valueOrNull();
            if (expected == null) {
                assertThatThrownBy(() -> compiler.evaluate(expression.infix())).isInstanceOf(BackendException.class);
            } else {
                assertThat(compiler.evaluate(expression.infix())).as(expression.infix()).isEqualTo(expected);
            }
        }
    }

    private record RandomExpression(String infix, String postfix, Integer valueOrNull) {

        private static final String OPERATORS = "+-*/";

        static RandomExpression generate(Random random, int depth) {
            if (depth == 0 || random.nextInt(3) == 0) {
                String literal = Integer.toString(random.nextInt(1000));
                return new RandomExpression(literal, literal, Integer.valueOf(literal));
            }
            RandomExpression left = generate(random, depth - 1);
            RandomExpression right = generate(random, depth - 1);
            char op = OPERATORS.charAt(random.nextInt(OPERATORS.length()));
            return new RandomExpression(
                    "(" + left.infix() + " " + op + " " + right.infix() + ")",
                    left.postfix() + " " + right.postfix() + " " + op,
                    apply(op, left.valueOrNull(), right.valueOrNull()));
        }

        private static Integer apply(char op, Integer left, Integer right) {
            if (left == null || right == null) {
                return null;
            }
            switch (op) {
                case '+':
                    return left + right;
                case '-':
                    return left - right;
                case '*':
                    return left * right;
                default:
                    return right == 0 ? null : left / right;
            }
        }
    }
}
