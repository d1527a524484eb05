package com.phillippitts.mathwords.domain.tree;

import com.phillippitts.mathwords.service.registry.BigOperatorKind;
import com.phillippitts.mathwords.service.registry.Delimiter;
import com.phillippitts.mathwords.service.registry.EnvironmentKind;
import com.phillippitts.mathwords.service.registry.MathFont;
import com.phillippitts.mathwords.service.registry.Operator;
import com.phillippitts.mathwords.service.registry.UnaryOperator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree shared by the LaTeX parser, the MathML reader and the verbalizer.
 *
 * <p>Every node owns its children exclusively; lists are defensively copied so a tree cannot
 * be modified after construction. A fresh tree is built per conversion call.
 */
public sealed interface MathNode {

    /** Numeric literal kept as written ({@code "3.14"}). */
    record NumberLiteral(String literal) implements MathNode {
        public NumberLiteral {
            Objects.requireNonNull(literal, "literal");
        }
    }

    /**
     * Variable or symbol. {@code name} is a letter or a glyph such as {@code "α"}.
     */
    record Identifier(String name, MathFont font) implements MathNode {
        public Identifier {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(font, "font");
        }

        public static Identifier of(String name) {
            return new Identifier(name, MathFont.NORMAL);
        }
    }

    record BinaryOp(Operator op, MathNode left, MathNode right) implements MathNode {
        public BinaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /** Prefix sign, postfix mark or accent applied to one operand. */
    record UnaryOp(UnaryOperator op, MathNode operand) implements MathNode {
        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Fraction(MathNode numerator, MathNode denominator) implements MathNode {
        public Fraction {
            Objects.requireNonNull(numerator, "numerator");
            Objects.requireNonNull(denominator, "denominator");
        }
    }

    /** Root; a null {@code degree} means square root. */
    record Root(MathNode degree, MathNode radicand) implements MathNode {
        public Root {
            Objects.requireNonNull(radicand, "radicand");
        }
    }

    record Power(MathNode base, MathNode exponent) implements MathNode {
        public Power {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }
    }

    record Sub(MathNode base, MathNode subscript) implements MathNode {
        public Sub {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(subscript, "subscript");
        }
    }

    record SubSup(MathNode base, MathNode subscript, MathNode exponent) implements MathNode {
        public SubSup {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(subscript, "subscript");
            Objects.requireNonNull(exponent, "exponent");
        }
    }

    /** Sum, product, integral, limit and friends. Absent bounds are null; an absent body is {@link Empty}. */
    record BigOperator(BigOperatorKind kind, MathNode lower, MathNode upper, MathNode body) implements MathNode {
        public BigOperator {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(body, "body");
        }
    }

    /** How a {@link FunctionCall} name is spoken. */
    enum FunctionKind {
        /** Registered function read by its spoken name: "the sine of x". */
        NAMED,
        /** Literal text run read verbatim, with or without arguments. */
        TEXT,
        /** Letter applied to a parenthesised argument list: "f of x". */
        APPLIED,
        /** Binomial coefficient with exactly two arguments. */
        BINOMIAL
    }

    record FunctionCall(String name, FunctionKind kind, List<MathNode> args) implements MathNode {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            args = List.copyOf(args);
        }
    }

    /** Fenced group with its literal delimiters. */
    record Delimited(Delimiter open, Delimiter close, MathNode inner) implements MathNode {
        public Delimited {
            Objects.requireNonNull(open, "open");
            Objects.requireNonNull(close, "close");
            Objects.requireNonNull(inner, "inner");
        }
    }

    /** Tabular environment: matrix, piecewise cases or a block of aligned lines. */
    record Matrix(List<List<MathNode>> rows, EnvironmentKind kind) implements MathNode {
        public Matrix {
            Objects.requireNonNull(kind, "kind");
            rows = rows.stream().map(List::copyOf).toList();
        }

        public int columnCount() {
            return rows.stream().mapToInt(List::size).max().orElse(0);
        }
    }

    /** Separator of a {@link Sequence}. */
    enum Separator { COMMA, SEMICOLON }

    /** Flat list such as {@code a, b, c}; binds looser than every operator. */
    record Sequence(List<MathNode> items, Separator separator) implements MathNode {
        public Sequence {
            Objects.requireNonNull(separator, "separator");
            items = List.copyOf(items);
        }
    }

    /** Explicit brace group kept where it affects grouping. */
    record Group(MathNode inner) implements MathNode {
        public Group {
            Objects.requireNonNull(inner, "inner");
        }
    }

    /** Empty brace group {@code {}} or a missing big-operator body. */
    record Empty() implements MathNode {
    }

    /** Placeholder for a construct that could not be resolved. Never reaches the verbalizer. */
    record Unsupported(String rawText, String reason) implements MathNode {
    }

    /**
     * True when the node has nothing to speak: empty groups and text runs, and tables or lists
     * whose entries are all blank.
     */
    static boolean isBlank(MathNode node) {
        if (node instanceof Empty) {
            return true;
        }
        if (node instanceof Group group) {
            return isBlank(group.inner());
        }
        if (node instanceof Sequence sequence) {
            return sequence.items().stream().allMatch(MathNode::isBlank);
        }
        if (node instanceof Matrix matrix) {
            return matrix.rows().stream().flatMap(List::stream).allMatch(MathNode::isBlank);
        }
        if (node instanceof FunctionCall call) {
            return call.kind() == FunctionKind.TEXT && call.name().isBlank() && call.args().isEmpty();
        }
        return false;
    }

    /** Direct children in reading order; absent optional parts are skipped. */
    static List<MathNode> children(MathNode node) {
        List<MathNode> children = new ArrayList<>();
        if (node instanceof BinaryOp binary) {
            children.add(binary.left());
            children.add(binary.right());
        } else if (node instanceof UnaryOp unary) {
            children.add(unary.operand());
        } else if (node instanceof Fraction fraction) {
            children.add(fraction.numerator());
            children.add(fraction.denominator());
        } else if (node instanceof Root root) {
            if (root.degree() != null) {
                children.add(root.degree());
            }
            children.add(root.radicand());
        } else if (node instanceof Power power) {
            children.add(power.base());
            children.add(power.exponent());
        } else if (node instanceof Sub sub) {
            children.add(sub.base());
            children.add(sub.subscript());
        } else if (node instanceof SubSup subSup) {
            children.add(subSup.base());
            children.add(subSup.subscript());
            children.add(subSup.exponent());
        } else if (node instanceof BigOperator big) {
            if (big.lower() != null) {
                children.add(big.lower());
            }
            if (big.upper() != null) {
                children.add(big.upper());
            }
            children.add(big.body());
        } else if (node instanceof FunctionCall call) {
            children.addAll(call.args());
        } else if (node instanceof Delimited delimited) {
            children.add(delimited.inner());
        } else if (node instanceof Matrix matrix) {
            matrix.rows().forEach(children::addAll);
        } else if (node instanceof Sequence sequence) {
            children.addAll(sequence.items());
        } else if (node instanceof Group group) {
            children.add(group.inner());
        }
        return children;
    }

    /**
     * Height of the tree, counting a single leaf as 1. Computed without recursion so it is safe
     * on arbitrarily deep trees.
     */
    static int depth(MathNode root) {
        Deque<MathNode> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(root);
        levels.push(1);
        int max = 0;
        while (!nodes.isEmpty()) {
            MathNode node = nodes.pop();
            int level = levels.pop();
            max = Math.max(max, level);
            for (MathNode child : children(node)) {
                nodes.push(child);
                levels.push(level + 1);
            }
        }
        return max;
    }
}
