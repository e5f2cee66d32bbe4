package org.symbex.result;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.SymbolicVariable;
import org.symbex.core.TheoryFeatures;
import org.symbex.expressions.ConstantTerm;
import org.symbex.expressions.Term;
import org.symbex.expressions.Terms;
import org.symbex.ir.IrFunction;
import org.symbex.state.BranchDecision;
import org.symbex.state.SymbolicState;
import org.symbex.state.TerminalInfo;
import org.symbex.symbolic.SolverAdapter;
import org.symbex.symbolic.SolverModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 把终止状态转换为报告路径。编号按调用顺序（即发现顺序）从 0 开始分配。
 * 模型按入口函数的参数顺序映射回参数名；当前理论配置下无法建模的参数取 null。
 * <p>
 * 每次分析使用一个新的实例。
 */
public class ResultAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ResultAssembler.class);

    private final IrFunction entry;
    private final TheoryFeatures features;
    private final SolverAdapter adapter;
    private final boolean deduplicateModels;

    @Getter
    private final List<ExecutionPath> paths = new ArrayList<>();
    private final Set<Map<String, Object>> seenModels = new HashSet<>();
    @Getter
    private int duplicatesDropped;

    public ResultAssembler(IrFunction entry, TheoryFeatures features, SolverAdapter adapter,
                           boolean deduplicateModels) {
        this.entry = Objects.requireNonNull(entry, "Entry function cannot be null.");
        this.features = Objects.requireNonNull(features, "Theory features cannot be null.");
        this.adapter = Objects.requireNonNull(adapter, "Solver adapter cannot be null.");
        this.deduplicateModels = deduplicateModels;
    }

    /**
     * 报告一条可满足的路径。开启模型去重且模型与之前某条路径相同时丢弃并返回 null。
     */
    public ExecutionPath satisfied(SymbolicState state, SolverModel model) {
        Objects.requireNonNull(model, "Model cannot be null.");
        Map<String, Object> values = modelOf(model);
        if (deduplicateModels && !seenModels.add(values)) {
            duplicatesDropped++;
            logger.debug("丢弃模型重复的路径: {}", values);
            return null;
        }
        return add(state, PathStatus.SATISFIED, values, model);
    }

    /**
     * 报告最终检查证明不可达的路径（无模型）。
     */
    public ExecutionPath unreachable(SymbolicState state) {
        return add(state, PathStatus.PROVEN_UNREACHABLE, null, null);
    }

    /**
     * 报告最终检查无法判定的路径（无模型）。
     */
    public ExecutionPath unknown(SymbolicState state) {
        return add(state, PathStatus.UNKNOWN_TIMEOUT, null, null);
    }

    /**
     * 报告因调用深度被截断的路径；最终检查可满足时附带模型。
     */
    public ExecutionPath budgetExceeded(SymbolicState state, SolverModel model) {
        return add(state, PathStatus.BUDGET_EXCEEDED, model == null ? null : modelOf(model), model);
    }

    public int size() {
        return paths.size();
    }

    private ExecutionPath add(SymbolicState state, PathStatus status, Map<String, Object> values, SolverModel model) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("只有终止状态才能报告为路径: " + state);
        }
        List<String> constraints = state.getPathCondition().stream().map(Term::toString).toList();
        List<String> trace = state.getBranchTrace().stream().map(BranchDecision::toString).toList();
        ExecutionPath path = new ExecutionPath(paths.size(), status, constraints, values,
                terminalOf(state.getTerminal(), model), trace, state.getVisitedLines());
        paths.add(path);
        logger.debug("报告路径 {}", path);
        return path;
    }

    /**
     * 把模型映射回入口函数的参数名，按参数顺序排列。
     */
    public Map<String, Object> modelOf(SolverModel model) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (SymbolicVariable p : entry.getParameters()) {
            values.put(p.getName(), features.supports(p.getDomain())
                    ? adapter.toPortable(model.evaluate(Terms.variable(p)))
                    : null);
        }
        return values;
    }

    private Terminal terminalOf(TerminalInfo info, SolverModel model) {
        return switch (info.getKind()) {
            case RETURN -> {
                Term value = info.getValue();
                Object concrete = null;
                if (value.isConstant()) {
                    concrete = adapter.toPortable(((ConstantTerm) value).getValue());
                } else if (model != null && features.supports(value.getDomain())) {
                    concrete = adapter.toPortable(model.evaluate(value));
                }
                yield new Terminal(info.getKind(), concrete, value.toString(), null, null, null);
            }
            case ERROR -> new Terminal(info.getKind(), null, null, info.getError().getName(), info.getMessage(), null);
            case TRUNCATED -> new Terminal(info.getKind(), null, null, null, null, info.getTruncation());
        };
    }
}
