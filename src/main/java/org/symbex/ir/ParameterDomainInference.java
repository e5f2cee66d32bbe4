package org.symbex.ir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;
import org.symbex.ir.ast.Expr;
import org.symbex.ir.ast.ExprVisitor;
import org.symbex.ir.ast.FunctionAst;
import org.symbex.ir.ast.Stmt;
import org.symbex.ir.ast.StmtVisitor;
import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 为未声明类型的参数推断值域：按源代码顺序找到参数第一次与常量比较、运算或调用字符串方法的位置。
 * 找不到证据的参数不出现在结果中。
 */
final class ParameterDomainInference {

    private static final Logger logger = LoggerFactory.getLogger(ParameterDomainInference.class);

    private static final Set<String> STRING_METHODS = Set.of(
            "startswith", "endswith", "startsWith", "endsWith", "lower", "upper", "strip",
            "toLowerCase", "toUpperCase", "trim", "isdigit", "isalpha", "charAt", "substring", "isEmpty");

    private final Set<String> candidates;
    private final Map<String, Domain> inferred = new HashMap<>();

    private ParameterDomainInference(Set<String> candidates) {
        this.candidates = candidates;
    }

    static Map<String, Domain> infer(FunctionAst function, Set<String> untypedParameters) {
        ParameterDomainInference inference = new ParameterDomainInference(untypedParameters);
        if (!untypedParameters.isEmpty()) {
            inference.walk(function.getBody());
        }
        logger.debug("函数 {} 的参数值域推断结果: {}", function.getName(), inference.inferred);
        return inference.inferred;
    }

    private void walk(List<Stmt> statements) {
        StatementWalker walker = new StatementWalker();
        for (Stmt s : statements) {
            s.accept(walker);
        }
    }

    private void note(Expr maybeParameter, Domain domain) {
        if (domain == null || !(maybeParameter instanceof Expr.Name)) {
            return;
        }
        String id = ((Expr.Name) maybeParameter).getId();
        if (candidates.contains(id)) {
            inferred.putIfAbsent(id, domain);
        }
    }

    private static Domain constantDomain(Expr e) {
        if (e instanceof Expr.UnaryOp) {
            return constantDomain(((Expr.UnaryOp) e).getOperand());
        }
        if (!(e instanceof Expr.Constant)) {
            return null;
        }
        Object value = ((Expr.Constant) e).getValue();
        if (value instanceof BigInteger) {
            return Domain.INT;
        }
        if (value instanceof Rational) {
            return Domain.REAL;
        }
        if (value instanceof Boolean) {
            return Domain.BOOL;
        }
        if (value instanceof String) {
            return Domain.STRING;
        }
        return null;
    }

    private final class StatementWalker implements StmtVisitor<Void> {

        private final ExpressionWalker exprs = new ExpressionWalker();

        @Override
        public Void visitAssign(Stmt.Assign node) {
            node.getTarget().accept(exprs);
            node.getValue().accept(exprs);
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            note(node.getTarget(), constantDomain(node.getValue()));
            node.getValue().accept(exprs);
            return null;
        }

        @Override
        public Void visitIf(Stmt.If node) {
            node.getTest().accept(exprs);
            walk(node.getBody());
            walk(node.getOrElse());
            return null;
        }

        @Override
        public Void visitWhile(Stmt.While node) {
            node.getTest().accept(exprs);
            walk(node.getBody());
            walk(node.getOrElse());
            return null;
        }

        @Override
        public Void visitFor(Stmt.For node) {
            node.getIterable().accept(exprs);
            walk(node.getBody());
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return node) {
            if (node.getValue() != null) {
                node.getValue().accept(exprs);
            }
            return null;
        }

        @Override
        public Void visitRaise(Stmt.Raise node) {
            return null;
        }

        @Override
        public Void visitAssert(Stmt.Assert node) {
            node.getTest().accept(exprs);
            return null;
        }

        @Override
        public Void visitExprStmt(Stmt.ExprStmt node) {
            node.getExpr().accept(exprs);
            return null;
        }

        @Override
        public Void visitJump(Stmt.Jump node) {
            return null;
        }

        @Override
        public Void visitUnsupported(Stmt.Unsupported node) {
            return null;
        }
    }

    private final class ExpressionWalker implements ExprVisitor<Void> {

        @Override
        public Void visitConstant(Expr.Constant node) {
            return null;
        }

        @Override
        public Void visitName(Expr.Name node) {
            return null;
        }

        @Override
        public Void visitBinOp(Expr.BinOp node) {
            note(node.getLeft(), constantDomain(node.getRight()));
            note(node.getRight(), constantDomain(node.getLeft()));
            node.getLeft().accept(this);
            node.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitUnaryOp(Expr.UnaryOp node) {
            return node.getOperand().accept(this);
        }

        @Override
        public Void visitCompare(Expr.Compare node) {
            switch (node.getOp()) {
                case IN, NOT_IN -> {
                    // 只有字符串容器能确定两侧的值域
                    if (constantDomain(node.getRight()) == Domain.STRING) {
                        note(node.getLeft(), Domain.STRING);
                    }
                    if (constantDomain(node.getLeft()) == Domain.STRING) {
                        note(node.getRight(), Domain.STRING);
                    }
                }
                default -> {
                    note(node.getLeft(), constantDomain(node.getRight()));
                    note(node.getRight(), constantDomain(node.getLeft()));
                }
            }
            node.getLeft().accept(this);
            node.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitBoolOp(Expr.BoolOp node) {
            for (Expr v : node.getValues()) {
                v.accept(this);
            }
            return null;
        }

        @Override
        public Void visitIfExp(Expr.IfExp node) {
            node.getTest().accept(this);
            node.getBody().accept(this);
            node.getOrElse().accept(this);
            return null;
        }

        @Override
        public Void visitCall(Expr.Call node) {
            if (node.isMethodCall()) {
                if (STRING_METHODS.contains(node.getFunction())) {
                    note(node.getReceiver(), Domain.STRING);
                }
                node.getReceiver().accept(this);
            }
            for (Expr a : node.getArgs()) {
                a.accept(this);
            }
            return null;
        }

        @Override
        public Void visitSubscript(Expr.Subscript node) {
            node.getValue().accept(this);
            node.getIndex().accept(this);
            return null;
        }

        @Override
        public Void visitListLiteral(Expr.ListLiteral node) {
            for (Expr e : node.getElements()) {
                e.accept(this);
            }
            return null;
        }

        @Override
        public Void visitUnsupported(Expr.Unsupported node) {
            return null;
        }
    }
}
