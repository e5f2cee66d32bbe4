package org.symbex.state;

import org.apache.commons.lang3.tuple.Pair;
import org.symbex.core.Domain;
import org.symbex.core.SymbolicVariable;
import org.symbex.core.TruncationReason;
import org.symbex.expressions.Term;
import org.symbex.expressions.TermOperator;
import org.symbex.expressions.Terms;
import org.symbex.ir.EdgeLabel;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolicStateTest {

    // --- Test Setup ---
    private final SymbolicVariable x = SymbolicVariable.parameter("x", Domain.INT);
    private final SymbolicState initial = SymbolicState.initial("f", List.of(x));

    private Term xGreaterThan(long bound) {
        return Terms.compare(TermOperator.GT, Terms.variable(x), Terms.integer(bound));
    }

    @Nested
    @DisplayName("分叉隔离测试 (Fork Isolation)")
    class ForkTests {

        @Test
        @DisplayName("分叉后的两个状态互不影响")
        void testFork_WhenBranchesDiverge_ShouldStayIsolated() {
            // 1. 准备
            SymbolicState base = initial.assign("y", Terms.integer(1)).extend(xGreaterThan(0));

            // 2. 执行
            Pair<SymbolicState, SymbolicState> forks = base.fork();
            SymbolicState left = forks.getLeft().assign("y", Terms.integer(2)).extend(xGreaterThan(5))
                    .record(new BranchDecision("f", 0, EdgeLabel.TRUE));
            SymbolicState right = forks.getRight().visitLine(7);

            // 3. 断言
            assertAll("分叉隔离",
                    () -> assertEquals(Terms.integer(2), left.lookup("y"), "左分支看到自己的赋值"),
                    () -> assertEquals(Terms.integer(1), right.lookup("y"), "右分支不受左分支影响"),
                    () -> assertEquals(Terms.integer(1), base.lookup("y"), "原状态不受影响"),
                    () -> assertEquals(2, left.getPathCondition().size()),
                    () -> assertEquals(1, right.getPathCondition().size()),
                    () -> assertTrue(right.getBranchTrace().isEmpty(), "分支轨迹不共享"),
                    () -> assertTrue(left.getVisitedLines().isEmpty(), "覆盖行不共享"));
        }

        @Test
        @DisplayName("赋值的世代号递增，参数为第 0 代")
        void testAssign_WhenRepeated_ShouldIncrementGeneration() {
            SymbolicState s = initial.assign("x", Terms.integer(3)).assign("y", Terms.ONE).assign("y", Terms.ZERO);
            assertAll("世代号",
                    () -> assertEquals(0, initial.generationOf("x")),
                    () -> assertEquals(1, s.generationOf("x")),
                    () -> assertEquals(2, s.generationOf("y")),
                    () -> assertEquals(-1, s.generationOf("z"), "未绑定的变量"),
                    () -> assertNull(s.lookup("z")));
        }

        @Test
        @DisplayName("恒真约束被忽略，恒假约束使状态平凡不可满足")
        void testExtend_WhenConstant_ShouldShortCircuit() {
            assertAll("常量约束",
                    () -> assertSame(initial, initial.extend(Terms.TRUE)),
                    () -> assertTrue(initial.extend(Terms.FALSE).isTriviallyInfeasible()),
                    () -> assertFalse(initial.extend(xGreaterThan(1)).isTriviallyInfeasible()));
        }

        @Test
        @DisplayName("按相同步骤得到的状态按值相等，散列值一致")
        void testEquality_WhenBuiltIdentically_ShouldBeEqualValues() {
            // 1. 准备
            SymbolicState a = initial.assign("y", Terms.ONE).extend(xGreaterThan(2)).visitLine(3);
            SymbolicState b = SymbolicState.initial("f", List.of(x))
                    .assign("y", Terms.ONE).extend(xGreaterThan(2)).visitLine(3);

            // 2. 执行
            SymbolicState diverged = b.extend(xGreaterThan(4));
            SymbolicState finished = a.terminate(TerminalInfo.returned(Terms.ONE));

            // 3. 断言
            assertAll("值相等",
                    () -> assertEquals(a, b),
                    () -> assertEquals(a.hashCode(), b.hashCode()),
                    () -> assertEquals(a, a.fork().getRight(), "分叉得到的副本与原状态相等"),
                    () -> assertNotEquals(a, diverged, "路径条件不同"),
                    () -> assertNotEquals(a, finished, "终止信息不同"),
                    () -> assertEquals(finished, b.terminate(TerminalInfo.returned(Terms.ONE))));
        }
    }

    @Nested
    @DisplayName("循环与调用测试 (Loops and Calls)")
    class FrameTests {

        @Test
        @DisplayName("循环计数按循环头独立累计，清零后重新开始")
        void testLoopCounters_WhenIncrementedAndCleared_ShouldTrackPerHeader() {
            LoopKey header = initial.loopKey(1);
            SymbolicState s = initial.incrementLoop(header).incrementLoop(header).incrementLoop(initial.loopKey(2));
            assertAll("循环计数",
                    () -> assertEquals(2, s.loopCount(header)),
                    () -> assertEquals(1, s.loopCount(initial.loopKey(2))),
                    () -> assertEquals(0, s.clearLoop(header).loopCount(header)));
        }

        @Test
        @DisplayName("进入和返回内联调用时保存并恢复调用者绑定")
        void testCall_WhenEnteredAndReturned_ShouldRestoreCallerBindings() {
            // 1. 准备
            SymbolicState caller = initial.assign("y", Terms.integer(5));
            Frame frame = new Frame(caller.getPc().next(), "r", caller.getBindings());
            PersistentMap<String, Binding> calleeBindings = PersistentMap.<String, Binding>empty()
                    .put("v", new Binding(Terms.integer(9), 0));

            // 2. 执行
            SymbolicState inside = caller.enterCall(frame, "g", calleeBindings)
                    .incrementLoop(new LoopKey(1, "g", 1));
            SymbolicState back = inside.returnFromCall(Terms.integer(10));

            // 3. 断言
            assertAll("调用栈",
                    () -> assertEquals(1, inside.getDepth()),
                    () -> assertTrue(inside.inCall()),
                    () -> assertEquals("g", inside.getPc().getFunction()),
                    () -> assertNull(inside.lookup("y"), "被调用者看不到调用者的局部变量"),
                    () -> assertEquals(0, back.getDepth()),
                    () -> assertFalse(back.inCall()),
                    () -> assertEquals(Terms.integer(5), back.lookup("y"), "恢复调用者绑定"),
                    () -> assertEquals(Terms.integer(10), back.lookup("r"), "返回值赋给接收变量"),
                    () -> assertEquals(0, back.loopCount(new LoopKey(1, "g", 1)), "被调用者的循环计数被清除"),
                    () -> assertEquals(caller.getPc().next(), back.getPc()));
        }

        @Test
        @DisplayName("终止状态携带终点信息，不透明编号不能回退")
        void testTerminate_WhenTruncated_ShouldCarryReason() {
            SymbolicState done = initial.terminate(TerminalInfo.truncated(TruncationReason.LOOP_BOUND));
            assertAll("终止",
                    () -> assertTrue(done.isTerminal()),
                    () -> assertFalse(initial.isTerminal()),
                    () -> assertEquals(TruncationReason.LOOP_BOUND, done.getTerminal().getTruncation()),
                    () -> assertThrows(IllegalStateException.class, () -> initial.returnFromCall(Terms.ONE)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> initial.withFreshCounterAt(3).withFreshCounterAt(2)));
        }
    }
}
