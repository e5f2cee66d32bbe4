package org.symbex.symbolic;

import org.symbex.expressions.Term;

import java.time.Duration;
import java.util.List;

/**
 * 与外部约束求解器的全部交互都经过此接口，其余组件只依赖与后端无关的 {@link Term}。
 * 一个适配器实例对应一次分析会话，使用完毕后必须关闭。
 */
public interface SolverAdapter extends AutoCloseable {

    /**
     * 检查约束合取的可满足性。每次调用都有独立的时间限制，之前的检查不会留下任何断言。
     * 求解器内部错误和无法降级的约束都报告为 {@link SolverStatus#UNKNOWN}，不抛出异常。
     * @param constraints 布尔项列表。
     * @param timeout 本次检查的时间上限。
     */
    CheckResult check(List<Term> constraints, Duration timeout);

    /**
     * 把求解器值或引擎内部值转换为可移植的标量。
     */
    Object toPortable(Object value);

    @Override
    void close();
}
