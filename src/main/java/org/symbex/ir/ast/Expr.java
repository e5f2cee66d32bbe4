package org.symbex.ir.ast;

import lombok.Getter;
import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 规范化 AST 中的表达式节点。由外部语言前端构造，构造后不可变。
 * 每个节点携带源代码行号（未知时为 0）。
 */
@Getter
public abstract class Expr {

    private final int line;

    protected Expr(int line) {
        this.line = line;
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * 常量。值的 Java 类型决定其种类：BigInteger、Rational、Boolean、String，或 null 表示 None。
     */
    @Getter
    public static final class Constant extends Expr {
        private final Object value;

        public Constant(Object value, int line) {
            super(line);
            if (value != null && !(value instanceof BigInteger) && !(value instanceof Rational)
                    && !(value instanceof Boolean) && !(value instanceof String)) {
                throw new IllegalArgumentException("不支持的常量类型: " + value.getClass().getName());
            }
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public String toString() {
            if (value == null) {
                return "None";
            }
            if (value instanceof String) {
                return "\"" + value + "\"";
            }
            return value.toString();
        }
    }

    @Getter
    public static final class Name extends Expr {
        private final String id;

        public Name(String id, int line) {
            super(line);
            this.id = Objects.requireNonNull(id, "Name cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitName(this);
        }

        @Override
        public String toString() {
            return id;
        }
    }

    @Getter
    public static final class BinOp extends Expr {
        private final BinaryOperator op;
        private final Expr left;
        private final Expr right;

        public BinOp(BinaryOperator op, Expr left, Expr right, int line) {
            super(line);
            this.op = Objects.requireNonNull(op, "Operator cannot be null.");
            this.left = Objects.requireNonNull(left, "Left operand cannot be null.");
            this.right = Objects.requireNonNull(right, "Right operand cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.getSymbol() + " " + right + ")";
        }
    }

    @Getter
    public static final class UnaryOp extends Expr {
        private final UnaryOperator op;
        private final Expr operand;

        public UnaryOp(UnaryOperator op, Expr operand, int line) {
            super(line);
            this.op = Objects.requireNonNull(op, "Operator cannot be null.");
            this.operand = Objects.requireNonNull(operand, "Operand cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        @Override
        public String toString() {
            return op == UnaryOperator.NOT ? "not " + operand : op.getSymbol() + operand;
        }
    }

    /**
     * 单个比较。链式比较 {@code a < b < c} 由前端展开为 {@code and}。
     */
    @Getter
    public static final class Compare extends Expr {
        private final CompareOperator op;
        private final Expr left;
        private final Expr right;

        public Compare(CompareOperator op, Expr left, Expr right, int line) {
            super(line);
            this.op = Objects.requireNonNull(op, "Operator cannot be null.");
            this.left = Objects.requireNonNull(left, "Left operand cannot be null.");
            this.right = Objects.requireNonNull(right, "Right operand cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompare(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.getSymbol() + " " + right + ")";
        }
    }

    /**
     * 短路 and / or，至少两个操作数。
     */
    @Getter
    public static final class BoolOp extends Expr {
        private final BoolOperator op;
        private final List<Expr> values;

        public BoolOp(BoolOperator op, List<Expr> values, int line) {
            super(line);
            this.op = Objects.requireNonNull(op, "Operator cannot be null.");
            this.values = List.copyOf(values);
            if (this.values.size() < 2) {
                throw new IllegalArgumentException(op + " 至少需要两个操作数");
            }
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }

        @Override
        public String toString() {
            return values.stream().map(Object::toString)
                    .collect(Collectors.joining(" " + op.getSymbol() + " ", "(", ")"));
        }
    }

    /**
     * 条件表达式 {@code body if test else orElse}。
     */
    @Getter
    public static final class IfExp extends Expr {
        private final Expr test;
        private final Expr body;
        private final Expr orElse;

        public IfExp(Expr test, Expr body, Expr orElse, int line) {
            super(line);
            this.test = Objects.requireNonNull(test, "Test cannot be null.");
            this.body = Objects.requireNonNull(body, "Body cannot be null.");
            this.orElse = Objects.requireNonNull(orElse, "Else branch cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIfExp(this);
        }

        @Override
        public String toString() {
            return "(" + body + " if " + test + " else " + orElse + ")";
        }
    }

    /**
     * 函数调用或方法调用。{@code receiver} 为 null 时是自由函数调用。
     */
    @Getter
    public static final class Call extends Expr {
        private final String function;
        private final Expr receiver;
        private final List<Expr> args;

        public Call(String function, Expr receiver, List<Expr> args, int line) {
            super(line);
            this.function = Objects.requireNonNull(function, "Function name cannot be null.");
            this.receiver = receiver;
            this.args = List.copyOf(args);
        }

        public boolean isMethodCall() {
            return receiver != null;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            String prefix = receiver == null ? function : receiver + "." + function;
            return prefix + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    @Getter
    public static final class Subscript extends Expr {
        private final Expr value;
        private final Expr index;

        public Subscript(Expr value, Expr index, int line) {
            super(line);
            this.value = Objects.requireNonNull(value, "Subscripted value cannot be null.");
            this.index = Objects.requireNonNull(index, "Index cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }

        @Override
        public String toString() {
            return value + "[" + index + "]";
        }
    }

    @Getter
    public static final class ListLiteral extends Expr {
        private final List<Expr> elements;

        public ListLiteral(List<Expr> elements, int line) {
            super(line);
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteral(this);
        }

        @Override
        public String toString() {
            return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * 前端无法规范化的表达式（lambda、推导式、反射等），下游按不透明值处理。
     */
    @Getter
    public static final class Unsupported extends Expr {
        private final String description;

        public Unsupported(String description, int line) {
            super(line);
            this.description = Objects.requireNonNull(description, "Description cannot be null.");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }

        @Override
        public String toString() {
            return "<" + description + ">";
        }
    }
}
