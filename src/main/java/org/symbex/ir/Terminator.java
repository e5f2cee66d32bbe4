package org.symbex.ir;

import lombok.Getter;
import org.symbex.core.ErrorKind;
import org.symbex.ir.ast.Expr;

import java.util.List;
import java.util.Objects;

/**
 * 基本块的终结指令及其出边。此类是不可变的。
 */
@Getter
public final class Terminator {

    public enum Kind {
        GOTO,
        /** 条件分支：边 0 为 TRUE，边 1 为 FALSE */
        BRANCH,
        /** 循环头测试：边 0 为 LOOP_CONTINUE，边 1 为 LOOP_EXIT */
        LOOP_TEST,
        RETURN,
        RAISE
    }

    private final Kind kind;
    /** BRANCH / LOOP_TEST 的条件，RETURN 的返回值 */
    private final Expr expr;
    private final ErrorKind error;
    private final String message;
    private final List<Edge> edges;
    private final int line;

    private Terminator(Kind kind, Expr expr, ErrorKind error, String message, List<Edge> edges, int line) {
        this.kind = kind;
        this.expr = expr;
        this.error = error;
        this.message = message;
        this.edges = List.copyOf(edges);
        this.line = line;
    }

    public static Terminator jump(int target, EdgeLabel label, int line) {
        return new Terminator(Kind.GOTO, null, null, null, List.of(new Edge(target, label)), line);
    }

    public static Terminator branch(Expr condition, int whenTrue, int whenFalse, int line) {
        return new Terminator(Kind.BRANCH, Objects.requireNonNull(condition, "Condition cannot be null."), null, null,
                List.of(new Edge(whenTrue, EdgeLabel.TRUE), new Edge(whenFalse, EdgeLabel.FALSE)), line);
    }

    public static Terminator loopTest(Expr condition, int body, int exit, int line) {
        return new Terminator(Kind.LOOP_TEST, Objects.requireNonNull(condition, "Condition cannot be null."), null, null,
                List.of(new Edge(body, EdgeLabel.LOOP_CONTINUE), new Edge(exit, EdgeLabel.LOOP_EXIT)), line);
    }

    public static Terminator ret(Expr value, int line) {
        return new Terminator(Kind.RETURN, Objects.requireNonNull(value, "Return value cannot be null."),
                null, null, List.of(), line);
    }

    public static Terminator raise(ErrorKind error, String message, int line) {
        return new Terminator(Kind.RAISE, null, Objects.requireNonNull(error, "Error kind cannot be null."),
                message, List.of(), line);
    }

    public Edge getEdge(int i) {
        return edges.get(i);
    }

    /**
     * 按新旧下标映射重写出边目标，用于剪除不可达块后的重新编号。
     */
    Terminator remap(int[] newIndex) {
        List<Edge> remapped = edges.stream()
                .map(e -> new Edge(newIndex[e.getTarget()], e.getLabel()))
                .toList();
        return new Terminator(kind, expr, error, message, remapped, line);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case GOTO -> "goto " + edges.get(0);
            case BRANCH -> "if " + expr + " " + edges;
            case LOOP_TEST -> "loop " + expr + " " + edges;
            case RETURN -> "return " + expr;
            case RAISE -> "raise " + error + (message == null ? "" : "(\"" + message + "\")");
        };
    }
}
