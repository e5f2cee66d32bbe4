package org.symbex.ir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.core.ErrorKind;
import org.symbex.core.SymbolicVariable;
import org.symbex.core.TheoryFeatures;
import org.symbex.ir.ast.BinaryOperator;
import org.symbex.ir.ast.BoolOperator;
import org.symbex.ir.ast.CompareOperator;
import org.symbex.ir.ast.Expr;
import org.symbex.ir.ast.ExprVisitor;
import org.symbex.ir.ast.FunctionAst;
import org.symbex.ir.ast.ParameterAst;
import org.symbex.ir.ast.Stmt;
import org.symbex.ir.ast.StmtVisitor;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 将规范化的函数 AST 降级为 IR：基本块的平坦数组加带标签的下标边。
 * <p>
 * 每个控制结构（if/elif/else、while、for、提前返回、raise、assert）都变成块和边，语句顺序保持不变。
 * 不在短路操作数和条件表达式分支中的非内置自由函数调用被提升为独立的 CALL 语句。
 * 无法降级的控制结构抛出 {@link IrBuildException}；其余不支持的语句成为显式的 OPAQUE 语句。
 */
public class CfgBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CfgBuilder.class);

    /** 由翻译器直接建模的自由函数 */
    public static final Set<String> BUILTINS = Set.of(
            "len", "abs", "min", "max", "int", "float", "str", "bool", "range");

    /** 构建器为循环降级生成的内部函数，前缀 $ 保证不与源程序名称冲突 */
    public static final String LEN = "$len";
    public static final String ITEM = "$item";
    public static final String APPEND = "$append";

    /** 不修改接收者的方法，调用后不需要使接收者失效 */
    private static final Set<String> PURE_METHODS = Set.of(
            "startswith", "endswith", "startsWith", "endsWith", "contains", "equals", "isEmpty", "length",
            "charAt", "lower", "upper", "strip", "toLowerCase", "toUpperCase", "trim", "get", "count", "index",
            "find", "isdigit", "isalpha", "includes", "indexOf", "substring", "containsKey");

    /** 改变控制流、无法降级的语句种类 */
    private static final Set<String> CONTROL_KINDS = Set.of(
            "try", "with", "yield", "def", "class", "async", "await", "match", "goto", "switch", "lambda");

    private final Frontend frontend;
    private final TheoryFeatures features;

    public CfgBuilder(Frontend frontend, TheoryFeatures features) {
        this.frontend = Objects.requireNonNull(frontend, "Frontend cannot be null.");
        this.features = Objects.requireNonNull(features, "Theory features cannot be null.");
    }

    /**
     * 构建一次分析所需的全部函数。
     * @param functions 入口函数及其可内联的用户函数。
     * @param entry 入口函数名。
     * @throws IrBuildException 任一函数体无法降级，或入口函数不存在。
     */
    public IrProgram build(List<FunctionAst> functions, String entry) throws IrBuildException {
        Set<String> userFunctions = new HashSet<>();
        for (FunctionAst f : functions) {
            if (!userFunctions.add(f.getName())) {
                throw new IrBuildException("def", f.getLine(), "重复定义的函数: " + f.getName());
            }
        }
        if (!userFunctions.contains(entry)) {
            throw new IrBuildException("def", 0, "找不到入口函数: " + entry);
        }
        Map<String, IrFunction> built = new LinkedHashMap<>();
        for (FunctionAst f : functions) {
            built.put(f.getName(), buildFunction(f, userFunctions));
        }
        return new IrProgram(entry, built, frontend.getSemantics());
    }

    public IrProgram build(FunctionAst function) throws IrBuildException {
        return build(List.of(function), function.getName());
    }

    IrFunction buildFunction(FunctionAst function, Set<String> userFunctions) throws IrBuildException {
        List<SymbolicVariable> parameters = lowerParameters(function);
        FunctionLowering lowering = new FunctionLowering(function, userFunctions);
        try {
            lowering.lowerBody();
        } catch (LoweringFailure e) {
            logger.error("函数 {} 无法降级: {}", function.getName(), e.failure.getMessage());
            throw e.failure;
        }
        List<BasicBlock> blocks = lowering.finish();
        IrFunction ir = new IrFunction(function.getName(), parameters, blocks, function.getLine());
        logger.debug("函数 {} 降级完成，共 {} 个基本块\n{}", function.getName(), blocks.size(), ir);
        return ir;
    }

    /**
     * 参数成为第 0 代符号变量。值域依次取：声明类型、使用处推断、无类型默认值域。
     */
    private List<SymbolicVariable> lowerParameters(FunctionAst function) throws IrBuildException {
        Set<String> seen = new HashSet<>();
        Set<String> untyped = new HashSet<>();
        Map<String, Domain> declared = new LinkedHashMap<>();
        for (ParameterAst p : function.getParameters()) {
            if (!seen.add(p.getName())) {
                throw new IrBuildException("parameter", function.getLine(), "重复的参数名: " + p.getName());
            }
            Domain d = p.isTyped() ? frontend.parseDeclaredType(p.getDeclaredType()) : null;
            if (d == null) {
                untyped.add(p.getName());
            } else {
                declared.put(p.getName(), d);
            }
        }
        Map<String, Domain> inferred = ParameterDomainInference.infer(function, untyped);
        List<SymbolicVariable> result = new ArrayList<>();
        for (ParameterAst p : function.getParameters()) {
            Domain d = declared.get(p.getName());
            if (d == null) {
                d = inferred.getOrDefault(p.getName(), features.getUntypedParameterDomain());
            }
            if (d.is(DomainKind.INT) && frontend.getSemantics().isNumbersAreReal()) {
                d = Domain.REAL;
            }
            result.add(SymbolicVariable.parameter(p.getName(), d));
        }
        return result;
    }

    /**
     * 携带已检查异常穿过访问者接口。
     */
    private static final class LoweringFailure extends RuntimeException {
        private final IrBuildException failure;

        private LoweringFailure(IrBuildException failure) {
            super(failure.getMessage(), failure, false, false);
            this.failure = failure;
        }
    }

    private static final class BlockDraft {
        private final List<IrStatement> statements = new ArrayList<>();
        private Terminator terminator;
    }

    private static final class LoopContext {
        private final int continueTarget;
        private final EdgeLabel continueLabel;
        private final int breakTarget;

        private LoopContext(int continueTarget, EdgeLabel continueLabel, int breakTarget) {
            this.continueTarget = continueTarget;
            this.continueLabel = continueLabel;
            this.breakTarget = breakTarget;
        }
    }

    /**
     * 单个函数的降级过程。可变，只在一次构建内使用。
     */
    private final class FunctionLowering implements StmtVisitor<Void> {

        private final FunctionAst function;
        private final Set<String> userFunctions;
        private final List<BlockDraft> drafts = new ArrayList<>();
        private final Deque<LoopContext> loops = new ArrayDeque<>();
        private final Hoister hoister = new Hoister();
        private int current;
        private int currentLine;
        private int tempCounter;
        private int loopCounter;

        private FunctionLowering(FunctionAst function, Set<String> userFunctions) {
            this.function = function;
            this.userFunctions = userFunctions;
            this.current = newBlock();
            this.currentLine = function.getLine();
        }

        void lowerBody() {
            lowerAll(function.getBody());
            seal(Terminator.ret(new Expr.Constant(null, currentLine), currentLine));
        }

        private void lowerAll(List<Stmt> statements) {
            for (Stmt s : statements) {
                currentLine = s.getLine();
                s.accept(this);
            }
        }

        private int newBlock() {
            drafts.add(new BlockDraft());
            return drafts.size() - 1;
        }

        private void emit(IrStatement statement) {
            drafts.get(current).statements.add(statement);
        }

        private void seal(Terminator terminator) {
            BlockDraft draft = drafts.get(current);
            if (draft.terminator != null) {
                throw new IllegalStateException("块 B" + current + " 已经有终结指令");
            }
            draft.terminator = terminator;
        }

        /**
         * 结束当前块后，后续语句落入一个新的、没有前驱的块，最终被剪除。
         */
        private void sealAndContinueUnreachable(Terminator terminator) {
            seal(terminator);
            current = newBlock();
        }

        private Expr hoist(Expr e) {
            return e.accept(hoister);
        }

        private String temp(String prefix) {
            return "$" + prefix + (tempCounter++);
        }

        private LoweringFailure fail(String construct, String message) {
            return new LoweringFailure(new IrBuildException(construct, currentLine, message));
        }

        // ========== 语句 ==========

        @Override
        public Void visitAssign(Stmt.Assign node) {
            Expr target = node.getTarget();
            if (target instanceof Expr.Name) {
                emit(IrStatement.assign(((Expr.Name) target).getId(), hoist(node.getValue()), node.getLine()));
                return null;
            }
            String base = subscriptBase(target);
            Expr value = hoist(node.getValue());
            Expr index = hoist(((Expr.Subscript) target).getIndex());
            emit(IrStatement.store(base, index, value, node.getLine()));
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            Expr target = node.getTarget();
            Expr value = hoist(node.getValue());
            if (target instanceof Expr.Name) {
                String id = ((Expr.Name) target).getId();
                emit(IrStatement.assign(id, new Expr.BinOp(node.getOp(), target, value, node.getLine()),
                        node.getLine()));
                return null;
            }
            String base = subscriptBase(target);
            Expr index = hoist(((Expr.Subscript) target).getIndex());
            Expr existing = new Expr.Subscript(new Expr.Name(base, node.getLine()), index, node.getLine());
            emit(IrStatement.store(base, index, new Expr.BinOp(node.getOp(), existing, value, node.getLine()),
                    node.getLine()));
            return null;
        }

        private String subscriptBase(Expr target) {
            if (target instanceof Expr.Subscript && ((Expr.Subscript) target).getValue() instanceof Expr.Name) {
                return ((Expr.Name) ((Expr.Subscript) target).getValue()).getId();
            }
            throw fail("assignment target", "不支持的赋值目标: " + target);
        }

        @Override
        public Void visitIf(Stmt.If node) {
            Expr test = hoist(node.getTest());
            int thenBlock = newBlock();
            int elseBlock = node.getOrElse().isEmpty() ? -1 : newBlock();
            int join = newBlock();
            seal(Terminator.branch(test, thenBlock, elseBlock < 0 ? join : elseBlock, node.getLine()));

            current = thenBlock;
            lowerAll(node.getBody());
            seal(Terminator.jump(join, EdgeLabel.JUMP, currentLine));

            if (elseBlock >= 0) {
                current = elseBlock;
                lowerAll(node.getOrElse());
                seal(Terminator.jump(join, EdgeLabel.JUMP, currentLine));
            }
            current = join;
            return null;
        }

        @Override
        public Void visitWhile(Stmt.While node) {
            int header = newBlock();
            seal(Terminator.jump(header, EdgeLabel.LOOP_ENTRY, node.getLine()));

            current = header;
            currentLine = node.getLine();
            // 条件中提升出的调用留在循环头，每次迭代重新执行
            Expr test = hoist(node.getTest());
            int body = newBlock();
            int elseBlock = node.getOrElse().isEmpty() ? -1 : newBlock();
            int after = newBlock();
            seal(Terminator.loopTest(test, body, elseBlock < 0 ? after : elseBlock, node.getLine()));

            loops.push(new LoopContext(header, EdgeLabel.LOOP_BACK, after));
            current = body;
            lowerAll(node.getBody());
            seal(Terminator.jump(header, EdgeLabel.LOOP_BACK, currentLine));
            loops.pop();

            if (elseBlock >= 0) {
                current = elseBlock;
                lowerAll(node.getOrElse());
                seal(Terminator.jump(after, EdgeLabel.JUMP, currentLine));
            }
            current = after;
            return null;
        }

        @Override
        public Void visitFor(Stmt.For node) {
            int line = node.getLine();
            int loopId = loopCounter++;
            Expr iterable = node.getIterable();
            boolean isRange = iterable instanceof Expr.Call
                    && !((Expr.Call) iterable).isMethodCall()
                    && "range".equals(((Expr.Call) iterable).getFunction())
                    && !userFunctions.contains("range");

            String counter;
            Expr test;
            Expr element;
            Expr step;
            if (isRange) {
                List<Expr> args = ((Expr.Call) iterable).getArgs();
                if (args.isEmpty() || args.size() > 3) {
                    throw fail("for", "range() 需要 1 到 3 个参数");
                }
                Expr start = args.size() == 1 ? intConstant(0, line) : hoist(args.get(0));
                Expr stop = hoist(args.size() == 1 ? args.get(0) : args.get(1));
                step = args.size() == 3 ? hoist(args.get(2)) : intConstant(1, line);
                counter = "$i" + loopId;
                String stopVar = "$stop" + loopId;
                emit(IrStatement.assign(counter, start, line));
                emit(IrStatement.assign(stopVar, stop, line));
                BigInteger constantStep = constantInteger(step);
                if (constantStep == null) {
                    String stepVar = "$step" + loopId;
                    emit(IrStatement.assign(stepVar, step, line));
                    step = new Expr.Name(stepVar, line);
                    // 步长为 0 时 range() 抛出 ValueError
                    new Stmt.If(new Expr.Compare(CompareOperator.EQ, step, intConstant(0, line), line),
                            List.of(new Stmt.Raise("ValueError", "range() arg 3 must not be zero", line)),
                            List.of(), line).accept(this);
                    test = rangeTest(counter, stopVar, step, line);
                } else if (constantStep.signum() == 0) {
                    throw fail("for", "range() 的步长不能为 0");
                } else {
                    test = new Expr.Compare(constantStep.signum() > 0 ? CompareOperator.LT : CompareOperator.GT,
                            new Expr.Name(counter, line), new Expr.Name(stopVar, line), line);
                }
                element = new Expr.Name(counter, line);
            } else {
                String seq = "$seq" + loopId;
                counter = "$idx" + loopId;
                emit(IrStatement.assign(seq, hoist(iterable), line));
                emit(IrStatement.assign(counter, intConstant(0, line), line));
                test = new Expr.Compare(CompareOperator.LT, new Expr.Name(counter, line),
                        new Expr.Call(LEN, null, List.of(new Expr.Name(seq, line)), line), line);
                element = new Expr.Call(ITEM, null,
                        List.of(new Expr.Name(seq, line), new Expr.Name(counter, line)), line);
                step = intConstant(1, line);
            }

            int header = newBlock();
            seal(Terminator.jump(header, EdgeLabel.LOOP_ENTRY, line));
            int body = newBlock();
            int latch = newBlock();
            int after = newBlock();
            current = header;
            seal(Terminator.loopTest(test, body, after, line));

            loops.push(new LoopContext(latch, EdgeLabel.JUMP, after));
            current = body;
            emit(IrStatement.assign(node.getTarget(), element, line));
            lowerAll(node.getBody());
            seal(Terminator.jump(latch, EdgeLabel.JUMP, currentLine));
            loops.pop();

            current = latch;
            emit(IrStatement.assign(counter, new Expr.BinOp(BinaryOperator.ADD,
                    new Expr.Name(counter, line), step, line), line));
            seal(Terminator.jump(header, EdgeLabel.LOOP_BACK, line));
            current = after;
            return null;
        }

        private Expr rangeTest(String counter, String stopVar, Expr step, int line) {
            Expr zero = intConstant(0, line);
            Expr i = new Expr.Name(counter, line);
            Expr stop = new Expr.Name(stopVar, line);
            Expr ascending = new Expr.BoolOp(BoolOperator.AND, List.of(
                    new Expr.Compare(CompareOperator.GT, step, zero, line),
                    new Expr.Compare(CompareOperator.LT, i, stop, line)), line);
            Expr descending = new Expr.BoolOp(BoolOperator.AND, List.of(
                    new Expr.Compare(CompareOperator.LT, step, zero, line),
                    new Expr.Compare(CompareOperator.GT, i, stop, line)), line);
            return new Expr.BoolOp(BoolOperator.OR, List.of(ascending, descending), line);
        }

        private Expr intConstant(long value, int line) {
            return new Expr.Constant(BigInteger.valueOf(value), line);
        }

        private BigInteger constantInteger(Expr e) {
            if (e instanceof Expr.Constant && ((Expr.Constant) e).getValue() instanceof BigInteger) {
                return (BigInteger) ((Expr.Constant) e).getValue();
            }
            if (e instanceof Expr.UnaryOp) {
                Expr.UnaryOp u = (Expr.UnaryOp) e;
                BigInteger inner = constantInteger(u.getOperand());
                if (inner == null) {
                    return null;
                }
                return switch (u.getOp()) {
                    case NEG -> inner.negate();
                    case POS -> inner;
                    case NOT -> null;
                };
            }
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return node) {
            Expr value = node.getValue() == null ? new Expr.Constant(null, node.getLine()) : hoist(node.getValue());
            sealAndContinueUnreachable(Terminator.ret(value, node.getLine()));
            return null;
        }

        @Override
        public Void visitRaise(Stmt.Raise node) {
            sealAndContinueUnreachable(Terminator.raise(ErrorKind.raised(node.getExceptionType()),
                    node.getMessage(), node.getLine()));
            return null;
        }

        @Override
        public Void visitAssert(Stmt.Assert node) {
            emit(IrStatement.assertion(hoist(node.getTest()), node.getLine()));
            return null;
        }

        @Override
        public Void visitExprStmt(Stmt.ExprStmt node) {
            Expr e = node.getExpr();
            if (e instanceof Expr.Call && ((Expr.Call) e).isMethodCall()
                    && ((Expr.Call) e).getReceiver() instanceof Expr.Name) {
                Expr.Call call = (Expr.Call) e;
                Expr receiver = call.getReceiver();
                String id = ((Expr.Name) receiver).getId();
                if ("append".equals(call.getFunction()) && call.getArgs().size() == 1) {
                    Expr item = hoist(call.getArgs().get(0));
                    emit(IrStatement.assign(id, new Expr.Call(APPEND, null, List.of(receiver, item),
                            node.getLine()), node.getLine()));
                    return null;
                }
                if (!PURE_METHODS.contains(call.getFunction())) {
                    for (Expr a : call.getArgs()) {
                        Expr hoisted = hoist(a);
                        if (!(hoisted instanceof Expr.Name) && !(hoisted instanceof Expr.Constant)) {
                            emit(IrStatement.evaluate(hoisted, node.getLine()));
                        }
                    }
                    emit(IrStatement.opaque(List.of(id), "method " + call.getFunction(), node.getLine()));
                    return null;
                }
            }
            Expr hoisted = hoist(e);
            if (!(hoisted instanceof Expr.Name) && !(hoisted instanceof Expr.Constant)) {
                emit(IrStatement.evaluate(hoisted, node.getLine()));
            }
            return null;
        }

        @Override
        public Void visitJump(Stmt.Jump node) {
            switch (node.getKind()) {
                case PASS -> {
                }
                case BREAK -> {
                    if (loops.isEmpty()) {
                        throw fail("break", "循环之外的 break");
                    }
                    sealAndContinueUnreachable(Terminator.jump(loops.peek().breakTarget, EdgeLabel.JUMP,
                            node.getLine()));
                }
                case CONTINUE -> {
                    if (loops.isEmpty()) {
                        throw fail("continue", "循环之外的 continue");
                    }
                    LoopContext loop = loops.peek();
                    sealAndContinueUnreachable(Terminator.jump(loop.continueTarget, loop.continueLabel,
                            node.getLine()));
                }
            }
            return null;
        }

        @Override
        public Void visitUnsupported(Stmt.Unsupported node) {
            if (CONTROL_KINDS.contains(node.getKind())) {
                throw fail(node.getKind(), "无法降级的控制结构: " + node.getKind());
            }
            logger.debug("第 {} 行的 {} 语句按不透明语句处理，失效变量: {}",
                    node.getLine(), node.getKind(), node.getAssignedNames());
            emit(IrStatement.opaque(node.getAssignedNames(), node.getKind(), node.getLine()));
            return null;
        }

        /**
         * 剪除从入口不可达的块，按原有顺序重新编号。
         */
        List<BasicBlock> finish() {
            int n = drafts.size();
            boolean[] reachable = new boolean[n];
            Deque<Integer> work = new ArrayDeque<>();
            work.push(0);
            reachable[0] = true;
            while (!work.isEmpty()) {
                BlockDraft draft = drafts.get(work.pop());
                if (draft.terminator == null) {
                    throw new IllegalStateException("存在未封闭的基本块");
                }
                for (Edge e : draft.terminator.getEdges()) {
                    if (!reachable[e.getTarget()]) {
                        reachable[e.getTarget()] = true;
                        work.push(e.getTarget());
                    }
                }
            }
            int[] newIndex = new int[n];
            int next = 0;
            for (int i = 0; i < n; i++) {
                newIndex[i] = reachable[i] ? next++ : -1;
            }
            List<BasicBlock> blocks = new ArrayList<>(next);
            for (int i = 0; i < n; i++) {
                if (reachable[i]) {
                    BlockDraft draft = drafts.get(i);
                    blocks.add(new BasicBlock(newIndex[i], draft.statements, draft.terminator.remap(newIndex)));
                }
            }
            if (next < n) {
                logger.debug("函数 {} 剪除了 {} 个不可达块", function.getName(), n - next);
            }
            return blocks;
        }

        /**
         * 将需要内联或不可见的函数调用提升为 CALL 语句，返回改写后的表达式。
         * 短路操作数和条件表达式分支只在特定条件下求值，其中的调用不提升，由翻译器按不透明值处理。
         */
        private final class Hoister implements ExprVisitor<Expr> {

            @Override
            public Expr visitConstant(Expr.Constant node) {
                return node;
            }

            @Override
            public Expr visitName(Expr.Name node) {
                return node;
            }

            @Override
            public Expr visitBinOp(Expr.BinOp node) {
                Expr left = node.getLeft().accept(this);
                Expr right = node.getRight().accept(this);
                return new Expr.BinOp(node.getOp(), left, right, node.getLine());
            }

            @Override
            public Expr visitUnaryOp(Expr.UnaryOp node) {
                return new Expr.UnaryOp(node.getOp(), node.getOperand().accept(this), node.getLine());
            }

            @Override
            public Expr visitCompare(Expr.Compare node) {
                Expr left = node.getLeft().accept(this);
                Expr right = node.getRight().accept(this);
                return new Expr.Compare(node.getOp(), left, right, node.getLine());
            }

            @Override
            public Expr visitBoolOp(Expr.BoolOp node) {
                List<Expr> values = new ArrayList<>(node.getValues());
                values.set(0, values.get(0).accept(this));
                return new Expr.BoolOp(node.getOp(), values, node.getLine());
            }

            @Override
            public Expr visitIfExp(Expr.IfExp node) {
                return new Expr.IfExp(node.getTest().accept(this), node.getBody(), node.getOrElse(), node.getLine());
            }

            @Override
            public Expr visitCall(Expr.Call node) {
                Expr receiver = node.getReceiver() == null ? null : node.getReceiver().accept(this);
                List<Expr> args = new ArrayList<>();
                for (Expr a : node.getArgs()) {
                    args.add(a.accept(this));
                }
                String fn = node.getFunction();
                boolean hoisted = receiver == null
                        && (userFunctions.contains(fn) || (!BUILTINS.contains(fn) && !fn.startsWith("$")));
                if (!hoisted) {
                    return new Expr.Call(fn, receiver, args, node.getLine());
                }
                String target = temp("t");
                emit(IrStatement.call(target, fn, args, currentLine));
                return new Expr.Name(target, node.getLine());
            }

            @Override
            public Expr visitSubscript(Expr.Subscript node) {
                Expr value = node.getValue().accept(this);
                Expr index = node.getIndex().accept(this);
                return new Expr.Subscript(value, index, node.getLine());
            }

            @Override
            public Expr visitListLiteral(Expr.ListLiteral node) {
                List<Expr> elements = new ArrayList<>();
                for (Expr e : node.getElements()) {
                    elements.add(e.accept(this));
                }
                return new Expr.ListLiteral(elements, node.getLine());
            }

            @Override
            public Expr visitUnsupported(Expr.Unsupported node) {
                return node;
            }
        }
    }
}
