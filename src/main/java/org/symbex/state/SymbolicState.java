package org.symbex.state;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.With;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.SymbolicVariable;
import org.symbex.expressions.ConstantTerm;
import org.symbex.expressions.Term;
import org.symbex.expressions.Terms;

import java.util.List;
import java.util.Objects;

/**
 * 一条路径的符号状态：当前位置、变量绑定、路径条件、循环计数、调用栈和覆盖信息。
 * <p>
 * 这是一个纯值类型。所有操作都返回新状态而不修改自身；内部使用持久化结构，
 * 分叉得到的两个状态共享已有存储但互不影响。
 */
@Getter
@With(AccessLevel.PRIVATE)
public final class SymbolicState {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicState.class);

    private final ProgramPoint pc;
    private final PersistentMap<String, Binding> bindings;
    private final ConsList<Term> conditions;
    private final PersistentMap<LoopKey, Integer> loopCounters;
    private final int depth;
    private final ConsList<Frame> frames;
    private final ConsList<BranchDecision> decisions;
    private final PersistentMap<Integer, Boolean> lines;
    private final int freshCounter;
    private final TerminalInfo terminal;

    private SymbolicState(ProgramPoint pc, PersistentMap<String, Binding> bindings, ConsList<Term> conditions,
                          PersistentMap<LoopKey, Integer> loopCounters, int depth, ConsList<Frame> frames,
                          ConsList<BranchDecision> decisions, PersistentMap<Integer, Boolean> lines,
                          int freshCounter, TerminalInfo terminal) {
        this.pc = pc;
        this.bindings = bindings;
        this.conditions = conditions;
        this.loopCounters = loopCounters;
        this.depth = depth;
        this.frames = frames;
        this.decisions = decisions;
        this.lines = lines;
        this.freshCounter = freshCounter;
        this.terminal = terminal;
    }

    /**
     * 函数入口处的初始状态，每个参数绑定到自己的第 0 代符号变量。
     */
    public static SymbolicState initial(String function, List<SymbolicVariable> parameters) {
        PersistentMap<String, Binding> bindings = PersistentMap.empty();
        for (SymbolicVariable p : parameters) {
            bindings = bindings.put(p.getName(), new Binding(Terms.variable(p), p.getGeneration()));
        }
        return new SymbolicState(ProgramPoint.entryOf(function), bindings, ConsList.empty(), PersistentMap.empty(),
                0, ConsList.empty(), ConsList.empty(), PersistentMap.empty(), 0, null);
    }

    // ========== 分叉、赋值、约束 ==========

    /**
     * 分叉为两个独立的状态。两者共享现有的持久化存储，之后的任何操作都只影响各自的副本。
     */
    public Pair<SymbolicState, SymbolicState> fork() {
        SymbolicState left = copy();
        SymbolicState right = copy();
        logger.debug("在 {} 分叉，路径条件长度 {}", pc, conditions.size());
        return Pair.of(left, right);
    }

    private SymbolicState copy() {
        return new SymbolicState(pc, bindings, conditions, loopCounters, depth, frames, decisions, lines,
                freshCounter, terminal);
    }

    /**
     * 以新世代号绑定变量。参数的初始世代为 0，局部变量的第一次赋值为第 1 代。
     */
    public SymbolicState assign(String name, Term term) {
        Binding previous = bindings.get(name);
        int generation = previous == null ? 1 : previous.getGeneration() + 1;
        return withBindings(bindings.put(name, new Binding(term, generation)));
    }

    /**
     * 在路径条件末尾追加一个布尔约束。恒真约束被忽略。
     */
    public SymbolicState extend(Term constraint) {
        Objects.requireNonNull(constraint, "Constraint cannot be null.");
        if (constraint instanceof ConstantTerm && ((ConstantTerm) constraint).isTrue()) {
            return this;
        }
        return withConditions(conditions.append(constraint));
    }

    public Term lookup(String name) {
        Binding b = bindings.get(name);
        return b == null ? null : b.getTerm();
    }

    public int generationOf(String name) {
        Binding b = bindings.get(name);
        return b == null ? -1 : b.getGeneration();
    }

    public List<Term> getPathCondition() {
        return conditions.toList();
    }

    /**
     * 路径条件中是否已有恒假约束。
     */
    public boolean isTriviallyInfeasible() {
        return !conditions.isEmpty() && conditions.toList().stream()
                .anyMatch(t -> t instanceof ConstantTerm && ((ConstantTerm) t).isFalse());
    }

    // ========== 位置 ==========

    public SymbolicState moveTo(ProgramPoint target) {
        return withPc(Objects.requireNonNull(target, "Program point cannot be null."));
    }

    public SymbolicState advance() {
        return withPc(pc.next());
    }

    public SymbolicState jump(int block) {
        return withPc(pc.jumpTo(block));
    }

    public SymbolicState visitLine(int line) {
        if (line <= 0 || lines.containsKey(line)) {
            return this;
        }
        return withLines(lines.put(line, Boolean.TRUE));
    }

    public SymbolicState record(BranchDecision decision) {
        return withDecisions(decisions.append(decision));
    }

    public List<BranchDecision> getBranchTrace() {
        return decisions.toList();
    }

    public List<Integer> getVisitedLines() {
        return lines.keys();
    }

    // ========== 循环计数 ==========

    public LoopKey loopKey(int header) {
        return new LoopKey(depth, pc.getFunction(), header);
    }

    public int loopCount(LoopKey key) {
        return loopCounters.getOrDefault(key, 0);
    }

    public SymbolicState incrementLoop(LoopKey key) {
        return withLoopCounters(loopCounters.put(key, loopCount(key) + 1));
    }

    public SymbolicState clearLoop(LoopKey key) {
        return withLoopCounters(loopCounters.remove(key));
    }

    // ========== 调用栈 ==========

    /**
     * 进入被内联的函数：保存调用者帧，调用深度加一，绑定替换为被调用者的参数绑定。
     */
    public SymbolicState enterCall(Frame callerFrame, String callee, PersistentMap<String, Binding> calleeBindings) {
        return new SymbolicState(ProgramPoint.entryOf(callee), calleeBindings, conditions, loopCounters,
                depth + 1, frames.append(callerFrame), decisions, lines, freshCounter, terminal);
    }

    /**
     * 从被内联的函数返回：恢复调用者绑定，清除属于被调用者这一层的循环计数，并把返回值赋给接收变量。
     */
    public SymbolicState returnFromCall(Term result) {
        if (frames.isEmpty()) {
            throw new IllegalStateException("调用栈为空，无法返回");
        }
        Frame frame = frames.last();
        int calleeDepth = depth;
        SymbolicState restored = new SymbolicState(frame.getReturnPoint(), frame.getSavedBindings(), conditions,
                loopCounters.removeIf(k -> k.getDepth() >= calleeDepth), depth - 1, frames.dropLast(),
                decisions, lines, freshCounter, terminal);
        return restored.assign(frame.getResultTarget(), result);
    }

    public boolean inCall() {
        return !frames.isEmpty();
    }

    // ========== 不透明值与终止 ==========

    /**
     * 分配一个在本路径内唯一的编号，用于不透明变量的世代号。
     */
    public SymbolicState withFreshCounterAt(int next) {
        if (next < freshCounter) {
            throw new IllegalArgumentException("不透明编号不能回退: " + next + " < " + freshCounter);
        }
        return withFreshCounter(next);
    }

    public SymbolicState terminate(TerminalInfo info) {
        return withTerminal(Objects.requireNonNull(info, "Terminal info cannot be null."));
    }

    public boolean isTerminal() {
        return terminal != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicState that = (SymbolicState) o;
        return depth == that.depth
                && freshCounter == that.freshCounter
                && pc.equals(that.pc)
                && bindings.equals(that.bindings)
                && conditions.equals(that.conditions)
                && loopCounters.equals(that.loopCounters)
                && frames.equals(that.frames)
                && decisions.equals(that.decisions)
                && lines.equals(that.lines)
                && Objects.equals(terminal, that.terminal);
    }

    // 按字段计算，不缓存：@With 副本只经过全字段构造器
    @Override
    public int hashCode() {
        return Objects.hash(pc, bindings, conditions, loopCounters, depth, frames, decisions, lines,
                freshCounter, terminal);
    }

    @Override
    public String toString() {
        return "SymbolicState(" + pc + ", depth=" + depth + ", bindings=" + bindings
                + ", conditions=" + conditions + (terminal == null ? "" : ", " + terminal) + ")";
    }
}
