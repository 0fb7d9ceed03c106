package com.mathdocx.parser;

import com.mathdocx.exception.MathParseException;
import com.mathdocx.expression.LargeOperator;
import com.mathdocx.expression.LargeOperator.LimitLocation;
import com.mathdocx.expression.LargeOperators;
import com.mathdocx.expression.MathNode;
import com.mathdocx.expression.Row;
import com.mathdocx.expression.Run;
import com.mathdocx.expression.SubSuperscript;
import com.mathdocx.expression.Subscript;
import com.mathdocx.expression.Superscript;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Second parsing pass: binds script tokens to the node before them.
 *
 * <p>The reducer keeps a single pending-base slot. A node token fills the
 * slot (after flushing whatever was there); a script token attaches to the
 * slot. Rules:
 * <ul>
 *   <li>A script with an empty slot binds to {@link Run#empty()}.</li>
 *   <li>A sub and a sup on one base fold into one {@link SubSuperscript}
 *       whatever their order, so {@code x^2_3} equals {@code x_3^2}.</li>
 *   <li>A second script of the same kind ({@code x^2^3}) closes the current
 *       base and starts a new one on an empty run.</li>
 *   <li>Scripts on a large operator become its limits. The operator then waits
 *       for the next reduced node, which becomes its operand; consecutive
 *       operators nest ({@code \sum_i \sum_j x}). Each open operator counts
 *       as one nesting level against the parser's depth limit.</li>
 * </ul>
 *
 * <p>Instances are single-use and not thread-safe; the parser creates one per
 * token sequence.
 */
final class ScriptReducer {

    private final List<MathNode> output = new ArrayList<>();
    private final Deque<OpenOperator> openOperators = new ArrayDeque<>();
    private final int depth;
    private final int maxDepth;
    private final String source;

    private LatexToken pendingBase;
    private MathNode pendingSub;
    private MathNode pendingSup;

    private ScriptReducer(int depth, int maxDepth, String source) {
        this.depth = depth;
        this.maxDepth = maxDepth;
        this.source = source;
    }

    /**
     * Reduces a token sequence to a list of nodes.
     *
     * @param tokens the tokens from the first pass
     * @param depth nesting depth of the sequence in the source
     * @param maxDepth the configured nesting limit
     * @param source the full source, for error messages
     * @return the reduced nodes in source order
     * @throws MathParseException if nested operators exceed {@code maxDepth}
     */
    static List<MathNode> reduce(List<LatexToken> tokens, int depth, int maxDepth, String source) {
        ScriptReducer reducer = new ScriptReducer(depth, maxDepth, source);
        for (LatexToken token : tokens) {
            reducer.accept(token);
        }
        return reducer.finish();
    }

    private void accept(LatexToken token) {
        if (!token.isScript()) {
            flush();
            pendingBase = token;
            return;
        }

        boolean isSup = token.type() == LatexToken.Type.SUPERSCRIPT;
        if (pendingBase == null) {
            pendingBase = LatexToken.node(Run.empty());
        } else if ((isSup && pendingSup != null) || (!isSup && pendingSub != null)) {
            flush();
            pendingBase = LatexToken.node(Run.empty());
        }

        if (isSup) {
            pendingSup = token.node();
        } else {
            pendingSub = token.node();
        }
    }

    private List<MathNode> finish() {
        flush();
        if (!openOperators.isEmpty()) {
            // Operators at the end of the sequence have nothing to apply to
            MathNode node = Row.empty();
            while (!openOperators.isEmpty()) {
                node = openOperators.pop().close(node);
            }
            output.add(node);
        }
        return output;
    }

    private void flush() {
        if (pendingBase == null) {
            return;
        }
        LatexToken base = pendingBase;
        MathNode sub = pendingSub;
        MathNode sup = pendingSup;
        pendingBase = null;
        pendingSub = null;
        pendingSup = null;

        if (base.type() == LatexToken.Type.OPERATOR) {
            if (depth + openOperators.size() + 1 > maxDepth) {
                throw new MathParseException(
                    "Maximum nesting depth of " + maxDepth + " exceeded", source, -1);
            }
            openOperators.push(new OpenOperator(base.operator(), base.limitLocation(), sub, sup));
            return;
        }
        emit(bind(base.node(), sub, sup));
    }

    private void emit(MathNode node) {
        MathNode result = node;
        while (!openOperators.isEmpty()) {
            result = openOperators.pop().close(result);
        }
        output.add(result);
    }

    private static MathNode bind(MathNode base, MathNode sub, MathNode sup) {
        if (sub != null && sup != null) {
            return new SubSuperscript(base, sub, sup);
        }
        if (sup != null) {
            return new Superscript(base, sup);
        }
        if (sub != null) {
            return new Subscript(base, sub);
        }
        return base;
    }

    /**
     * A large operator whose limits are known but whose operand is not.
     */
    private static final class OpenOperator {
        private final LargeOperators.Entry entry;
        private final LimitLocation limitLocation;
        private final MathNode sub;
        private final MathNode sup;

        OpenOperator(LargeOperators.Entry entry, LimitLocation limitLocation, MathNode sub, MathNode sup) {
            this.entry = entry;
            this.limitLocation = limitLocation;
            this.sub = sub;
            this.sup = sup;
        }

        LargeOperator close(MathNode operand) {
            return new LargeOperator(entry.glyph(), limitLocation, sub, sup, operand);
        }
    }
}
