package org.symbex.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.ExplorationBudget;
import org.symbex.expressions.Hazard;
import org.symbex.expressions.Terms;
import org.symbex.expressions.Translation;
import org.symbex.ir.CfgBuilder;
import org.symbex.ir.Frontend;
import org.symbex.ir.IrBuildException;
import org.symbex.ir.IrProgram;
import org.symbex.ir.ast.Expr;
import org.symbex.ir.ast.FunctionAst;
import org.symbex.result.ResultAssembler;
import org.symbex.state.SymbolicState;
import org.symbex.symbolic.CheckResult;
import org.symbex.symbolic.SolverAdapter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 直接针对函数参数的约束查询，不遍历函数体：
 * 寻找满足目标条件的输入，或证明断言在前置条件下恒成立。
 * 参数值域与路径探索使用相同的推断规则。
 */
public class ConstraintQueries {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintQueries.class);

    private final Frontend frontend;
    private final ExplorationBudget budget;
    private final Supplier<SolverAdapter> solverFactory;

    public ConstraintQueries(Frontend frontend, ExplorationBudget budget, Supplier<SolverAdapter> solverFactory) {
        this.frontend = Objects.requireNonNull(frontend, "Frontend cannot be null.");
        this.budget = Objects.requireNonNull(budget, "Exploration budget cannot be null.");
        this.solverFactory = Objects.requireNonNull(solverFactory, "Solver factory cannot be null.");
    }

    /**
     * 寻找一组参数取值，使前置条件和目标条件同时成立。
     * @return 按参数顺序排列的取值；不存在或无法判定时为空。
     */
    public Optional<Map<String, Object>> findInputs(FunctionAst function, List<Expr> preconditions, Expr target)
            throws IrBuildException {
        Objects.requireNonNull(target, "Target cannot be null.");
        IrProgram program = new CfgBuilder(frontend, budget.getFeatures()).build(function);
        try (SolverAdapter solver = solverFactory.get()) {
            PathExplorer explorer = new PathExplorer(program, budget, solver, preconditions, frontend.getLanguage());
            SymbolicState state = assume(explorer, explorer.initialState(program.getEntryFunction()), target);
            CheckResult result = solver.check(state.getPathCondition(), timeout());
            logger.debug("findInputs({}) : {}", target, result);
            if (!result.isSat()) {
                return Optional.empty();
            }
            ResultAssembler assembler = new ResultAssembler(program.getEntryFunction(), budget.getFeatures(), solver,
                    false);
            return Optional.of(assembler.modelOf(result.getModel()));
        }
    }

    /**
     * 证明断言在前置条件下对所有参数取值成立。断言的求值错误不视为反例。
     */
    public ProofResult prove(FunctionAst function, List<Expr> preconditions, Expr assertion)
            throws IrBuildException {
        Objects.requireNonNull(assertion, "Assertion cannot be null.");
        IrProgram program = new CfgBuilder(frontend, budget.getFeatures()).build(function);
        try (SolverAdapter solver = solverFactory.get()) {
            PathExplorer explorer = new PathExplorer(program, budget, solver, preconditions, frontend.getLanguage());
            SymbolicState state = explorer.initialState(program.getEntryFunction());
            Translation t = explorer.getTranslator().translateCondition(assertion, state);
            state = state.withFreshCounterAt(t.getNextFresh());
            for (Hazard h : t.getHazards()) {
                state = state.extend(Terms.not(h.getCondition()));
            }
            state = state.extend(Terms.not(t.getTerm()));
            CheckResult result = solver.check(state.getPathCondition(), timeout());
            logger.debug("prove({}) : {}", assertion, result);
            if (result.isUnsat()) {
                return new ProofResult(ProofStatus.VALID, null, null);
            }
            if (result.isUnknown()) {
                return new ProofResult(ProofStatus.UNKNOWN, null, result.getReasonUnknown());
            }
            ResultAssembler assembler = new ResultAssembler(program.getEntryFunction(), budget.getFeatures(), solver,
                    false);
            return new ProofResult(ProofStatus.INVALID, assembler.modelOf(result.getModel()), null);
        }
    }

    private SymbolicState assume(PathExplorer explorer, SymbolicState state, Expr condition) {
        Translation t = explorer.getTranslator().translateCondition(condition, state);
        SymbolicState s = state.withFreshCounterAt(t.getNextFresh());
        for (Hazard h : t.getHazards()) {
            s = s.extend(Terms.not(h.getCondition()));
        }
        return s.extend(t.getTerm());
    }

    private Duration timeout() {
        return budget.getSolverTimeout().compareTo(budget.getSessionTimeout()) < 0
                ? budget.getSolverTimeout()
                : budget.getSessionTimeout();
    }
}
