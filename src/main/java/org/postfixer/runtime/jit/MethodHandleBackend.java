package org.postfixer.runtime.jit;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.AbstractBackendSession;
import org.postfixer.runtime.CompiledExpression;
import org.postfixer.runtime.IBackendSession;
import org.postfixer.runtime.IExecutionBackend;
import org.postfixer.runtime.isa.Instruction;
import org.postfixer.runtime.isa.Operator;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a program once into {@link MethodHandle}s over an {@code int[]} frame.
 * <p>
 * Compilation runs the program symbolically: a push places a constant handle on a
 * compile-time stack, and an operator pops its right and left operand handles and pushes the
 * operator handle with both operands folded in. The JIT inlines these handles like ordinary code,
 * so evaluation does not interpret anything.
 * <p>
 * Invoking a handle recurses once per level of folding, so no handle is allowed to nest deeper
 * than {@link #SEGMENT_DEPTH}. A subtree reaching that depth becomes a segment of its own whose
 * result is stored in a frame slot, and the enclosing handle reads the slot instead. Segments run
 * in program order, so every slot is written before it is read.
 */
public class MethodHandleBackend implements IExecutionBackend {

    /** Deepest folding allowed inside one segment. */
    static final int SEGMENT_DEPTH = 64;

    private static final MethodType BINARY = MethodType.methodType(int.class, int.class, int.class);
    private static final MethodType SEGMENT = MethodType.methodType(int.class, int[].class);
    private static final MethodHandle SLOT_READER = MethodHandles.arrayElementGetter(int[].class);
    private static final Map<Operator, MethodHandle> OPERATORS = bindOperators();

    private final int maxStackDepth;

    /**
     * @param maxStackDepth The stack capacity programs are verified against.
     */
    public MethodHandleBackend(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
    }

    @Override
    public String getName() {
        return "method-handle";
    }

    @Override
    public IBackendSession openSession() {
        return new AbstractBackendSession(getName(), maxStackDepth) {
            @Override
            protected CompiledExpression doCompile(List<Instruction> program, int stackDepth) {
                List<MethodHandle> segments = link(program);
                return () -> invoke(segments);
            }
        };
    }

    /**
     * @return The segments in execution order; the last one yields the result.
     */
    static List<MethodHandle> link(List<Instruction> program) {
        List<MethodHandle> segments = new ArrayList<>();
        Deque<Folded> stack = new ArrayDeque<>();
        for (Instruction instruction : program) {
            if (instruction instanceof Instruction.Push push) {
                MethodHandle constant = MethodHandles.constant(int.class, push.value());
                stack.push(new Folded(MethodHandles.dropArguments(constant, 0, int[].class), 1));
            } else if (instruction instanceof Instruction.Apply apply) {
                Folded right = stack.pop();
                Folded left = stack.pop();
                MethodHandle op = OPERATORS.get(Operator.decode(apply).orElseThrow());
                // (int,int)int -> (int,int[])int -> (int[],int[])int -> (int[])int
                MethodHandle withRight = MethodHandles.collectArguments(op, 1, right.handle());
                MethodHandle withBoth = MethodHandles.collectArguments(withRight, 0, left.handle());
                MethodHandle folded = MethodHandles.permuteArguments(withBoth, SEGMENT, 0, 0);
                int depth = Math.max(left.depth(), right.depth()) + 1;
                if (depth >= SEGMENT_DEPTH) {
                    stack.push(spill(segments, folded));
                } else {
                    stack.push(new Folded(folded, depth));
                }
            }
        }
        segments.add(stack.pop().handle());
        return List.copyOf(segments);
    }

    private static Folded spill(List<MethodHandle> segments, MethodHandle handle) {
        segments.add(handle);
        MethodHandle reader = MethodHandles.insertArguments(SLOT_READER, 1, segments.size() - 1);
        return new Folded(reader, 1);
    }

    private static int invoke(List<MethodHandle> segments) throws BackendException {
        int[] frame = new int[segments.size()];
        for (int i = 0; i < segments.size(); i++) {
            frame[i] = invoke(segments.get(i), frame);
        }
        return frame[frame.length - 1];
    }

    private static int invoke(MethodHandle segment, int[] frame) throws BackendException {
        try {
            return (int) segment.invokeExact(frame);
        } catch (ArithmeticException e) {
            throw new BackendException("Arithmetic fault: " + e.getMessage(), e);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new BackendException("Compiled expression failed: " + t.getMessage(), t);
        }
    }

    private static Map<Operator, MethodHandle> bindOperators() {
        try {
            MethodHandle apply = MethodHandles.publicLookup().findVirtual(Operator.class, "apply", BINARY);
            Map<Operator, MethodHandle> handles = new EnumMap<>(Operator.class);
            for (Operator op : Operator.values()) {
                handles.put(op, apply.bindTo(op));
            }
            return handles;
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private record Folded(MethodHandle handle, int depth) {}
}
