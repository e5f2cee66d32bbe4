package org.symbex.explorer;

import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.core.ErrorKind;
import org.symbex.core.ExplorationBudget;
import org.symbex.core.SymbolicVariable;
import org.symbex.core.TerminalKind;
import org.symbex.core.TheoryFeatures;
import org.symbex.core.TruncationReason;
import org.symbex.expressions.ConstantTerm;
import org.symbex.expressions.Hazard;
import org.symbex.expressions.Term;
import org.symbex.expressions.TermOperator;
import org.symbex.expressions.Terms;
import org.symbex.expressions.Translation;
import org.symbex.expressions.Translator;
import org.symbex.ir.BasicBlock;
import org.symbex.ir.Edge;
import org.symbex.ir.EdgeLabel;
import org.symbex.ir.IrFunction;
import org.symbex.ir.IrProgram;
import org.symbex.ir.IrStatement;
import org.symbex.ir.Terminator;
import org.symbex.ir.ast.Expr;
import org.symbex.result.AnalysisResult;
import org.symbex.result.BatchMetadata;
import org.symbex.result.ResultAssembler;
import org.symbex.state.Binding;
import org.symbex.state.BranchDecision;
import org.symbex.state.Frame;
import org.symbex.state.LoopKey;
import org.symbex.state.PersistentMap;
import org.symbex.state.SymbolicState;
import org.symbex.state.TerminalInfo;
import org.symbex.symbolic.CheckResult;
import org.symbex.symbolic.SolverAdapter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 在控制流图上做深度优先的符号执行。
 * <ul>
 *     <li>条件分支和循环测试分叉为两个状态，每个新状态在入队前检查可满足性，不可满足的直接剪枝。</li>
 *     <li>遍历顺序固定：真分支先于假分支，错误隐患先于正常继续，因此相同输入得到相同顺序的输出。</li>
 *     <li>循环计数达到展开上限后继续边被移除，沿继续边的路径以 loop-bound 截断。</li>
 *     <li>可见的用户函数被内联，超过调用深度上限的路径以 budget-exceeded 结束；不可见的函数返回不透明值。</li>
 *     <li>每个状态出队前检查会话截止时间和路径数量上限，超出时停止并标记批次被截断。</li>
 * </ul>
 * 一个实例只执行一次分析。
 */
public class PathExplorer {

    private static final Logger logger = LoggerFactory.getLogger(PathExplorer.class);

    private final IrProgram program;
    private final ExplorationBudget budget;
    private final SolverAdapter solver;
    private final List<Expr> preconditions;
    private final String language;
    @Getter(AccessLevel.PACKAGE)
    private final Translator translator;
    private final TheoryFeatures features;

    private final ResultAssembler assembler;
    private final Set<TruncationReason> reasons = EnumSet.noneOf(TruncationReason.class);
    @Getter
    private int pruned;
    @Getter
    private int unknown;
    @Getter
    private long solverCalls;
    private long deadline;
    private boolean done;

    public PathExplorer(IrProgram program, ExplorationBudget budget, SolverAdapter solver,
                        List<Expr> preconditions, String language) {
        this.program = Objects.requireNonNull(program, "IR program cannot be null.");
        this.budget = Objects.requireNonNull(budget, "Exploration budget cannot be null.");
        this.solver = Objects.requireNonNull(solver, "Solver adapter cannot be null.");
        this.preconditions = List.copyOf(Objects.requireNonNull(preconditions, "Preconditions cannot be null."));
        this.language = Objects.requireNonNull(language, "Language cannot be null.");
        this.features = budget.getFeatures();
        this.translator = new Translator(program.getSemantics(), features, budget.getMixedNumericPolicy());
        this.assembler = new ResultAssembler(program.getEntryFunction(), features, solver,
                budget.isDeduplicateModels());
    }

    /**
     * 执行分析并返回按发现顺序排列的路径和批次元数据。
     */
    public AnalysisResult explore() {
        if (done) {
            throw new IllegalStateException("PathExplorer 只能执行一次");
        }
        done = true;
        IrFunction entry = program.getEntryFunction();
        long start = System.nanoTime();
        deadline = start + budget.getSessionTimeout().toNanos();
        logger.info("开始符号执行 {}，预算: {}", entry.getName(), budget);

        Deque<SymbolicState> frontier = new ArrayDeque<>();
        frontier.push(initialState(entry));
        while (!frontier.isEmpty()) {
            // 1. 在准入下一个状态前检查会话截止时间与路径数量上限
            if (System.nanoTime() > deadline) {
                reasons.add(TruncationReason.TIMEOUT);
                logger.warn("会话超时，剩余 {} 个状态未探索", frontier.size());
                break;
            }
            if (assembler.size() >= budget.getMaxPaths()) {
                reasons.add(TruncationReason.PATH_COUNT);
                logger.warn("达到路径数量上限 {}，剩余 {} 个状态未探索", budget.getMaxPaths(), frontier.size());
                break;
            }
            SymbolicState state = frontier.pop();

            // 2. 终止状态做最终检查并交给结果组装
            if (state.isTerminal()) {
                finish(state);
                continue;
            }

            // 3. 非终止状态执行一步，后继按逆序入栈，使第一个后继最先被探索
            List<SymbolicState> successors = getSuccessors(state);
            for (int i = successors.size() - 1; i >= 0; i--) {
                frontier.push(successors.get(i));
            }
        }

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        BatchMetadata metadata = new BatchMetadata(assembler.size(), pruned, unknown,
                assembler.getDuplicatesDropped(), solverCalls, elapsedMs, new ArrayList<>(reasons));
        logger.info("符号执行 {} 完成: {}", entry.getName(), metadata);
        return new AnalysisResult(entry.getName(), language, assembler.getPaths(), metadata);
    }

    // ========== 初始状态 ==========

    /**
     * 入口状态：参数绑定到第 0 代变量，加上长度上限约束和调用方给出的前置条件。
     */
    SymbolicState initialState(IrFunction entry) {
        SymbolicState state = SymbolicState.initial(entry.getName(), entry.getParameters());
        for (SymbolicVariable p : entry.getParameters()) {
            state = state.extend(lengthBound(p));
        }
        for (Expr pre : preconditions) {
            Translation t = translator.translateCondition(pre, state);
            state = state.withFreshCounterAt(t.getNextFresh());
            // 前置条件本身被假定能正常求值
            for (Hazard h : t.getHazards()) {
                state = state.extend(Terms.not(h.getCondition()));
            }
            state = state.extend(t.getTerm());
        }
        logger.debug("初始状态: {}", state);
        return state;
    }

    private Term lengthBound(SymbolicVariable p) {
        Domain d = p.getDomain();
        if (!features.supports(d)) {
            return Terms.TRUE;
        }
        int max = d.is(DomainKind.STRING) ? features.getMaxStringLength()
                : d.is(DomainKind.LIST) ? features.getMaxSequenceLength() : 0;
        if (max <= 0) {
            return Terms.TRUE;
        }
        return Terms.compare(TermOperator.LE, Terms.length(Terms.variable(p)), Terms.integer(max));
    }

    // ========== 单步执行 ==========

    /**
     * 计算一个非终止状态的全部后继。
     */
    private List<SymbolicState> getSuccessors(SymbolicState state) {
        IrFunction function = program.resolve(state.getPc().getFunction());
        BasicBlock block = function.getBlock(state.getPc().getBlock());
        int index = state.getPc().getStatement();
        if (index < block.getStatements().size()) {
            IrStatement statement = block.getStatements().get(index);
            return execute(state.visitLine(statement.getLine()), statement);
        }
        Terminator terminator = block.getTerminator();
        return execute(state.visitLine(terminator.getLine()), function, block, terminator);
    }

    private List<SymbolicState> execute(SymbolicState state, IrStatement statement) {
        switch (statement.getKind()) {
            case ASSIGN: {
                Translation t = translator.translate(statement.getValue(), state);
                return withHazards(state, t, s -> s.assign(statement.getTarget(), t.getTerm()).advance());
            }
            case STORE: {
                Translation t = translator.translateStore(statement.getTarget(), statement.getIndex(),
                        statement.getValue(), state);
                return withHazards(state, t, s -> s.assign(statement.getTarget(), t.getTerm()).advance());
            }
            case EVALUATE: {
                Translation t = translator.translate(statement.getValue(), state);
                return withHazards(state, t, SymbolicState::advance);
            }
            case ASSERT: {
                Translation t = translator.translateCondition(statement.getValue(), state);
                List<Hazard> hazards = new ArrayList<>(t.getHazards());
                hazards.add(new Hazard(Terms.not(t.getTerm()), ErrorKind.ASSERTION_FAILED));
                return withHazards(state.withFreshCounterAt(t.getNextFresh()), hazards, SymbolicState::advance);
            }
            case OPAQUE: {
                SymbolicState s = state;
                for (String name : statement.getHavocNames()) {
                    Translation t = translator.havoc(name, s);
                    s = s.withFreshCounterAt(t.getNextFresh()).assign(name, t.getTerm());
                }
                logger.debug("不透明语句 {}，失效变量 {}", statement.getDescription(), statement.getHavocNames());
                return List.of(s.advance());
            }
            case CALL:
                return call(state, statement);
            default:
                throw new IllegalStateException("未知的语句种类: " + statement.getKind());
        }
    }

    private List<SymbolicState> call(SymbolicState state, IrStatement statement) {
        IrFunction callee = program.resolve(statement.getCallee());
        if (callee == null || callee.getParameters().size() != statement.getArgs().size()) {
            Expr.Call external = new Expr.Call(statement.getCallee(), null, statement.getArgs(), statement.getLine());
            Translation t = translator.translate(external, state);
            logger.debug("{} 不可内联，结果为不透明值", statement.getCallee());
            return withHazards(state, t, s -> s.assign(statement.getTarget(), t.getTerm()).advance());
        }

        // 1. 依次翻译实参，合并它们的错误隐患
        List<Term> values = new ArrayList<>();
        List<Hazard> hazards = new ArrayList<>();
        SymbolicState current = state;
        for (Expr arg : statement.getArgs()) {
            Translation t = translator.translate(arg, current);
            values.add(t.getTerm());
            hazards.addAll(t.getHazards());
            current = current.withFreshCounterAt(t.getNextFresh());
        }

        // 2. 超过调用深度上限时截断，否则进入被调用者
        return withHazards(current, hazards, s -> {
            if (s.getDepth() + 1 > budget.getMaxDepth()) {
                logger.debug("调用 {} 超过深度上限 {}", callee.getName(), budget.getMaxDepth());
                return s.terminate(TerminalInfo.truncated(TruncationReason.DEPTH));
            }
            PersistentMap<String, Binding> bindings = PersistentMap.empty();
            for (int i = 0; i < values.size(); i++) {
                bindings = bindings.put(callee.getParameters().get(i).getName(), new Binding(values.get(i), 0));
            }
            Frame frame = new Frame(s.getPc().next(), statement.getTarget(), s.getBindings());
            return s.enterCall(frame, callee.getName(), bindings);
        });
    }

    private List<SymbolicState> execute(SymbolicState state, IrFunction function, BasicBlock block,
                                        Terminator terminator) {
        switch (terminator.getKind()) {
            case GOTO: {
                Edge edge = terminator.getEdge(0);
                SymbolicState s = state;
                if (edge.getLabel() == EdgeLabel.LOOP_ENTRY) {
                    s = s.clearLoop(s.loopKey(edge.getTarget()));
                }
                return List.of(s.jump(edge.getTarget()));
            }
            case BRANCH: {
                Translation t = translator.translateCondition(terminator.getExpr(), state);
                List<SymbolicState> out = new ArrayList<>();
                for (SymbolicState s : withHazards(state, t, UnaryOperator.identity())) {
                    if (s.isTerminal()) {
                        out.add(s);
                    } else {
                        out.addAll(branch(s, function, block, t.getTerm(), terminator));
                    }
                }
                return out;
            }
            case LOOP_TEST: {
                Translation t = translator.translateCondition(terminator.getExpr(), state);
                List<SymbolicState> out = new ArrayList<>();
                for (SymbolicState s : withHazards(state, t, UnaryOperator.identity())) {
                    if (s.isTerminal()) {
                        out.add(s);
                    } else {
                        out.addAll(loopTest(s, function, block, t.getTerm(), terminator));
                    }
                }
                return out;
            }
            case RETURN: {
                Translation t = translator.translate(terminator.getExpr(), state);
                return withHazards(state, t, s -> s.inCall()
                        ? s.returnFromCall(t.getTerm())
                        : s.terminate(TerminalInfo.returned(t.getTerm())));
            }
            case RAISE:
                return List.of(state.terminate(TerminalInfo.error(terminator.getError(), terminator.getMessage())));
            default:
                throw new IllegalStateException("未知的终结指令: " + terminator.getKind());
        }
    }

    private List<SymbolicState> branch(SymbolicState state, IrFunction function, BasicBlock block, Term condition,
                                       Terminator terminator) {
        List<SymbolicState> out = new ArrayList<>();
        Pair<SymbolicState, SymbolicState> forks = state.fork();
        Edge whenTrue = terminator.getEdge(0);
        Edge whenFalse = terminator.getEdge(1);
        SymbolicState left = forks.getLeft().extend(condition)
                .record(new BranchDecision(function.getName(), block.getIndex(), EdgeLabel.TRUE));
        if (feasible(left, condition)) {
            out.add(left.jump(whenTrue.getTarget()));
        }
        Term negated = Terms.not(condition);
        SymbolicState right = forks.getRight().extend(negated)
                .record(new BranchDecision(function.getName(), block.getIndex(), EdgeLabel.FALSE));
        if (feasible(right, negated)) {
            out.add(right.jump(whenFalse.getTarget()));
        }
        return out;
    }

    /**
     * 循环测试。计数未达上限时像条件分支一样分叉，继续边计数加一，退出边清零；
     * 达到上限后继续边被移除，仍能继续的路径以 loop-bound 截断。
     */
    private List<SymbolicState> loopTest(SymbolicState state, IrFunction function, BasicBlock block, Term condition,
                                         Terminator terminator) {
        List<SymbolicState> out = new ArrayList<>();
        LoopKey key = state.loopKey(block.getIndex());
        boolean atLimit = state.loopCount(key) >= budget.getMaxLoopIterations();
        Pair<SymbolicState, SymbolicState> forks = state.fork();

        SymbolicState stay = forks.getLeft().extend(condition);
        if (feasible(stay, condition)) {
            if (atLimit) {
                logger.debug("{} 块 {} 达到循环展开上限 {}", function.getName(), block.getIndex(),
                        budget.getMaxLoopIterations());
                out.add(stay.record(BranchDecision.loopBound(function.getName(), block.getIndex()))
                        .terminate(TerminalInfo.truncated(TruncationReason.LOOP_BOUND)));
            } else {
                out.add(stay.record(new BranchDecision(function.getName(), block.getIndex(), EdgeLabel.LOOP_CONTINUE))
                        .incrementLoop(key)
                        .jump(terminator.getEdge(0).getTarget()));
            }
        }
        Term negated = Terms.not(condition);
        SymbolicState leave = forks.getRight().extend(negated);
        if (feasible(leave, negated)) {
            out.add(leave.record(new BranchDecision(function.getName(), block.getIndex(), EdgeLabel.LOOP_EXIT))
                    .clearLoop(key)
                    .jump(terminator.getEdge(1).getTarget()));
        }
        return out;
    }

    // ========== 错误隐患 ==========

    private List<SymbolicState> withHazards(SymbolicState state, Translation t, UnaryOperator<SymbolicState> effect) {
        return withHazards(state.withFreshCounterAt(t.getNextFresh()), t.getHazards(), effect);
    }

    /**
     * 按顺序处理错误隐患：每个隐患先分出以该错误终止的状态，再在隐患不成立的前提下继续；
     * 全部隐患之后对继续的状态应用 effect。
     */
    private List<SymbolicState> withHazards(SymbolicState state, List<Hazard> hazards,
                                            UnaryOperator<SymbolicState> effect) {
        List<SymbolicState> out = new ArrayList<>();
        SymbolicState current = state;
        for (Hazard h : hazards) {
            if (h.getCondition() instanceof ConstantTerm && ((ConstantTerm) h.getCondition()).isFalse()) {
                continue;
            }
            Pair<SymbolicState, SymbolicState> forks = current.fork();
            SymbolicState failing = forks.getLeft().extend(h.getCondition());
            if (feasible(failing, h.getCondition())) {
                out.add(failing.terminate(h.isError()
                        ? TerminalInfo.error(h.getKind(), null)
                        : TerminalInfo.truncated(h.getTruncation())));
            }
            Term safe = Terms.not(h.getCondition());
            current = forks.getRight().extend(safe);
            if (!feasible(current, safe)) {
                return out;
            }
        }
        out.add(effect.apply(current));
        return out;
    }

    // ========== 求解器交互 ==========

    /**
     * 刚加入 {@code added} 约束的状态是否可能可满足。常量约束不需要求解器；UNKNOWN 的状态保留。
     */
    private boolean feasible(SymbolicState state, Term added) {
        if (added instanceof ConstantTerm) {
            if (((ConstantTerm) added).isFalse()) {
                pruned++;
                return false;
            }
            return true;
        }
        CheckResult result = check(state);
        if (result.isUnsat()) {
            pruned++;
            logger.debug("剪枝不可满足的状态 {}", state.getPc());
            return false;
        }
        if (result.isUnknown()) {
            unknown++;
        }
        return true;
    }

    private CheckResult check(SymbolicState state) {
        if (state.isTriviallyInfeasible()) {
            return CheckResult.unsat();
        }
        solverCalls++;
        long remaining = Math.max(1L, Duration.ofNanos(deadline - System.nanoTime()).toMillis());
        Duration timeout = budget.getSolverTimeout().toMillis() < remaining
                ? budget.getSolverTimeout()
                : Duration.ofMillis(remaining);
        return solver.check(state.getPathCondition(), timeout);
    }

    /**
     * 终止状态的最终检查：SAT 交给结果组装，UNSAT 丢弃（或报告为不可达），UNKNOWN 报告为 unknown-timeout。
     */
    private void finish(SymbolicState state) {
        CheckResult result = check(state);
        TerminalInfo terminal = state.getTerminal();
        boolean depthExceeded = terminal.getKind() == TerminalKind.TRUNCATED
                && terminal.getTruncation() == TruncationReason.DEPTH;
        if (result.isUnsat()) {
            pruned++;
            if (budget.isIncludeUnreachable()) {
                assembler.unreachable(state);
            }
            return;
        }
        if (depthExceeded) {
            reasons.add(TruncationReason.DEPTH);
            assembler.budgetExceeded(state, result.getModel());
            return;
        }
        if (result.isUnknown()) {
            unknown++;
            logger.warn("路径 {} 的最终检查无法判定: {}", state.getBranchTrace(), result.getReasonUnknown());
            assembler.unknown(state);
            return;
        }
        if (terminal.getKind() == TerminalKind.TRUNCATED) {
            reasons.add(terminal.getTruncation());
        }
        assembler.satisfied(state, result.getModel());
    }
}
