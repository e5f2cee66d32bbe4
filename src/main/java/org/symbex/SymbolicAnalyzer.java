package org.symbex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.ExplorationBudget;
import org.symbex.explorer.ConstraintQueries;
import org.symbex.explorer.PathExplorer;
import org.symbex.ir.CfgBuilder;
import org.symbex.ir.Frontend;
import org.symbex.ir.IrBuildException;
import org.symbex.ir.IrProgram;
import org.symbex.ir.ast.Expr;
import org.symbex.ir.ast.FunctionAst;
import org.symbex.result.AnalysisResult;
import org.symbex.symbolic.SolverAdapter;
import org.symbex.symbolic.Z3SolverAdapter;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 符号执行引擎的入口：{@code (函数, 预算) -> (路径, 元数据)}。
 * <p>
 * 分析之间不共享任何状态，每次调用使用新的求解器会话，因此相同输入总得到相同输出。
 * 唯一会逃出的异常是 {@link IrBuildException}。
 */
public class SymbolicAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicAnalyzer.class);

    private final Frontend frontend;
    private final ExplorationBudget budget;
    private final Supplier<SolverAdapter> solverFactory;

    public SymbolicAnalyzer(Frontend frontend, ExplorationBudget budget) {
        this(frontend, budget, Z3SolverAdapter::new);
    }

    public SymbolicAnalyzer(Frontend frontend, ExplorationBudget budget, Supplier<SolverAdapter> solverFactory) {
        this.frontend = Objects.requireNonNull(frontend, "Frontend cannot be null.");
        this.budget = Objects.requireNonNull(budget, "Exploration budget cannot be null.");
        this.solverFactory = Objects.requireNonNull(solverFactory, "Solver factory cannot be null.");
    }

    public AnalysisResult analyze(FunctionAst function) throws IrBuildException {
        return analyze(List.of(function), function.getName(), List.of());
    }

    /**
     * 分析入口函数，同一批中的其他函数可被内联。
     * @param preconditions 对参数的布尔前置条件，加入每条路径的初始路径条件。
     */
    public AnalysisResult analyze(List<FunctionAst> functions, String entry, List<Expr> preconditions)
            throws IrBuildException {
        IrProgram program = new CfgBuilder(frontend, budget.getFeatures()).build(functions, entry);
        return analyze(program, preconditions);
    }

    /**
     * 分析已构建的 IR。
     */
    public AnalysisResult analyze(IrProgram program, List<Expr> preconditions) {
        Objects.requireNonNull(program, "IR program cannot be null.");
        logger.debug("分析 {}（{}）", program.getEntry(), frontend.getLanguage());
        try (SolverAdapter solver = solverFactory.get()) {
            return new PathExplorer(program, budget, solver, preconditions, frontend.getLanguage()).explore();
        }
    }

    /**
     * 针对同一前端和预算的约束查询。
     */
    public ConstraintQueries queries() {
        return new ConstraintQueries(frontend, budget, solverFactory);
    }
}
