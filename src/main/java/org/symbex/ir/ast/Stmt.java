package org.symbex.ir.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 规范化 AST 中的语句节点。构造后不可变。
 */
@Getter
public abstract class Stmt {

    private final int line;

    protected Stmt(int line) {
        this.line = line;
    }

    public abstract <R> R accept(StmtVisitor<R> visitor);

    /**
     * 赋值。目标是 {@link Expr.Name} 或 {@link Expr.Subscript}。
     */
    @Getter
    public static final class Assign extends Stmt {
        private final Expr target;
        private final Expr value;

        public Assign(Expr target, Expr value, int line) {
            super(line);
            this.target = Objects.requireNonNull(target, "Assignment target cannot be null.");
            this.value = Objects.requireNonNull(value, "Assigned value cannot be null.");
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /**
     * 复合赋值 {@code target op= value}。
     */
    @Getter
    public static final class AugAssign extends Stmt {
        private final Expr target;
        private final BinaryOperator op;
        private final Expr value;

        public AugAssign(Expr target, BinaryOperator op, Expr value, int line) {
            super(line);
            this.target = Objects.requireNonNull(target, "Assignment target cannot be null.");
            this.op = Objects.requireNonNull(op, "Operator cannot be null.");
            this.value = Objects.requireNonNull(value, "Assigned value cannot be null.");
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }
    }

    /**
     * if / elif / else。elif 链表示为 orElse 中嵌套的 If。
     */
    @Getter
    public static final class If extends Stmt {
        private final Expr test;
        private final List<Stmt> body;
        private final List<Stmt> orElse;

        public If(Expr test, List<Stmt> body, List<Stmt> orElse, int line) {
            super(line);
            this.test = Objects.requireNonNull(test, "Test cannot be null.");
            this.body = List.copyOf(body);
            this.orElse = List.copyOf(orElse);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /**
     * while 循环。orElse 在循环正常结束（未 break）时执行。
     */
    @Getter
    public static final class While extends Stmt {
        private final Expr test;
        private final List<Stmt> body;
        private final List<Stmt> orElse;

        public While(Expr test, List<Stmt> body, List<Stmt> orElse, int line) {
            super(line);
            this.test = Objects.requireNonNull(test, "Test cannot be null.");
            this.body = List.copyOf(body);
            this.orElse = List.copyOf(orElse);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * {@code for target in iterable}。iterable 为 {@code range(...)} 时按计数循环降级，否则按下标遍历。
     */
    @Getter
    public static final class For extends Stmt {
        private final String target;
        private final Expr iterable;
        private final List<Stmt> body;

        public For(String target, Expr iterable, List<Stmt> body, int line) {
            super(line);
            this.target = Objects.requireNonNull(target, "Loop target cannot be null.");
            this.iterable = Objects.requireNonNull(iterable, "Iterable cannot be null.");
            this.body = List.copyOf(body);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    /**
     * return。{@code value} 为 null 表示返回 None。
     */
    @Getter
    public static final class Return extends Stmt {
        private final Expr value;

        public Return(Expr value, int line) {
            super(line);
            this.value = value;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    /**
     * 抛出异常 {@code raise ExceptionType(message)}。
     */
    @Getter
    public static final class Raise extends Stmt {
        private final String exceptionType;
        private final String message;

        public Raise(String exceptionType, String message, int line) {
            super(line);
            this.exceptionType = Objects.requireNonNull(exceptionType, "Exception type cannot be null.");
            this.message = message;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitRaise(this);
        }
    }

    @Getter
    public static final class Assert extends Stmt {
        private final Expr test;

        public Assert(Expr test, int line) {
            super(line);
            this.test = Objects.requireNonNull(test, "Test cannot be null.");
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    @Getter
    public static final class ExprStmt extends Stmt {
        private final Expr expr;

        public ExprStmt(Expr expr, int line) {
            super(line);
            this.expr = Objects.requireNonNull(expr, "Expression cannot be null.");
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }
    }

    /**
     * pass / break / continue 这类只有种类的语句。
     */
    @Getter
    public static final class Jump extends Stmt {

        public enum Kind { PASS, BREAK, CONTINUE }

        private final Kind kind;

        public Jump(Kind kind, int line) {
            super(line);
            this.kind = Objects.requireNonNull(kind, "Jump kind cannot be null.");
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitJump(this);
        }
    }

    /**
     * 前端无法规范化的语句。{@code kind} 为语句种类名（如 "try"、"with"、"global"），
     * {@code assignedNames} 为该语句可能写入的变量名。
     */
    @Getter
    public static final class Unsupported extends Stmt {
        private final String kind;
        private final List<String> assignedNames;

        public Unsupported(String kind, List<String> assignedNames, int line) {
            super(line);
            this.kind = Objects.requireNonNull(kind, "Statement kind cannot be null.");
            this.assignedNames = List.copyOf(assignedNames);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }
    }
}
