package org.symbex.explorer;

import org.symbex.SymbolicAnalyzer;
import org.symbex.core.ExplorationBudget;
import org.symbex.core.TerminalKind;
import org.symbex.core.TheoryFeatures;
import org.symbex.core.TruncationReason;
import org.symbex.expressions.Term;
import org.symbex.ir.IrBuildException;
import org.symbex.ir.SourceDialect;
import org.symbex.ir.ast.BinaryOperator;
import org.symbex.ir.ast.Expr;
import org.symbex.ir.ast.FunctionAst;
import org.symbex.ir.ast.ParameterAst;
import org.symbex.ir.ast.Stmt;
import org.symbex.result.AnalysisResult;
import org.symbex.result.ExecutionPath;
import org.symbex.result.PathStatus;
import org.symbex.symbolic.CheckResult;
import org.symbex.symbolic.SolverAdapter;
import org.symbex.symbolic.Z3SolverAdapter;
import org.symbex.utils.Rational;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.symbex.ir.ast.Ast.*;

class PathExplorerTest {

    // --- Test Setup ---
    private static final ExplorationBudget BUDGET = ExplorationBudget.defaults();

    private AnalysisResult analyze(SourceDialect dialect, ExplorationBudget budget, FunctionAst function)
            throws IrBuildException {
        return new SymbolicAnalyzer(dialect, budget).analyze(function);
    }

    private AnalysisResult analyzePython(FunctionAst function) throws IrBuildException {
        return analyze(SourceDialect.PYTHON, BUDGET, function);
    }

    /**
     * check_access(age, role)：未成年拒绝，管理员授权，其余普通授权。
     */
    private FunctionAst checkAccess() {
        return function("check_access", List.of(param("age"), param("role")),
                ifStmt(2, lt(name("age"), num(18)), List.of(ret(3, str("denied_minor")))),
                ifStmt(4, eq(name("role"), str("admin")), List.of(ret(5, str("granted_admin")))),
                ret(6, str("granted_user")));
    }

    /**
     * calculate_ratio(a, b)：a &gt; 10 时返回 b / (a - 20)，否则返回 0。
     */
    private FunctionAst calculateRatio() {
        return function("calculate_ratio", List.of(param("a"), param("b")),
                ifStmt(2, gt(name("a"), num(10)), List.of(ret(3, div(name("b"), sub(name("a"), num(20)))))),
                ret(4, num(0)));
    }

    /**
     * 十个顺序排列的独立条件，理论上共 1024 条路径。
     */
    private FunctionAst tenIndependentBranches() {
        List<Stmt> body = new ArrayList<>();
        List<ParameterAst> params = new ArrayList<>();
        body.add(assign(1, "c", num(0)));
        for (int i = 0; i < 10; i++) {
            params.add(param("x" + i, "int"));
            body.add(ifStmt(i + 2, gt(name("x" + i), num(0)),
                    List.of(augAssign(i + 2, "c", BinaryOperator.ADD, num(1)))));
        }
        body.add(ret(20, name("c")));
        return function("many_branches", params, body.toArray(new Stmt[0]));
    }

    private static String expectedAccess(Map<String, Object> model) {
        long age = (Long) model.get("age");
        if (age < 18) {
            return "denied_minor";
        }
        return "admin".equals(model.get("role")) ? "granted_admin" : "granted_user";
    }

    /**
     * 委托给 Z3 的求解器，但对满足 forceUnknown 的约束集合直接回答 UNKNOWN。
     */
    private static final class ScriptedSolver implements SolverAdapter {

        private final Z3SolverAdapter delegate = new Z3SolverAdapter();
        private final Predicate<List<Term>> forceUnknown;

        private ScriptedSolver(Predicate<List<Term>> forceUnknown) {
            this.forceUnknown = forceUnknown;
        }

        /**
         * 每组约束第一次出现时回答 UNKNOWN，之后交给 Z3。
         */
        static ScriptedSolver unknownOnFirstSight() {
            Set<List<Term>> seen = new HashSet<>();
            return new ScriptedSolver(constraints -> seen.add(List.copyOf(constraints)));
        }

        @Override
        public CheckResult check(List<Term> constraints, Duration timeout) {
            if (forceUnknown.test(constraints)) {
                return CheckResult.unknown("scripted");
            }
            return delegate.check(constraints, timeout);
        }

        @Override
        public Object toPortable(Object value) {
            return delegate.toPortable(value);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    @Nested
    @DisplayName("规格场景测试 (Reference Scenarios)")
    class ScenarioTests {

        @Test
        @DisplayName("check_access 应产生三条可满足路径，且模型重放得到相同返回值")
        void testCheckAccess_WhenExplored_ShouldReportThreeSatisfiedPaths() throws IrBuildException {
            // 1. 执行
            AnalysisResult result = analyzePython(checkAccess());

            // 2. 断言
            List<ExecutionPath> paths = result.getPaths();
            assertAll("check_access 路径",
                    () -> assertEquals(3, paths.size(), "应恰好有三条路径"),
                    () -> assertTrue(paths.stream().allMatch(ExecutionPath::isSatisfied), "所有路径都应可满足"),
                    () -> assertFalse(result.isTruncated(), "不应被截断"),
                    () -> assertEquals(Set.of("denied_minor", "granted_admin", "granted_user"),
                            paths.stream().map(p -> p.getTerminal().getValue()).collect(Collectors.toSet()),
                            "三种返回值都应出现"));

            // 3. 模型重放：每条路径的模型按具体语义执行应得到同样的返回值
            for (ExecutionPath p : paths) {
                assertEquals(expectedAccess(p.getModel()), p.getTerminal().getValue(),
                        "路径 " + p.getPathId() + " 的模型与终点不一致: " + p.getModel());
            }
        }

        @Test
        @DisplayName("calculate_ratio 应找到 a=20 的除零路径")
        void testCalculateRatio_WhenDivisorCanBeZero_ShouldReportDivisionByZero() throws IrBuildException {
            // 1. 执行
            AnalysisResult result = analyzePython(calculateRatio());

            // 2. 断言
            ExecutionPath error = result.getPaths().stream()
                    .filter(p -> p.getTerminal().isError())
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("应存在错误路径: " + result.getPaths()));
            assertAll("除零路径",
                    () -> assertEquals(PathStatus.SATISFIED, error.getStatus(), "错误路径应可满足"),
                    () -> assertEquals("division-by-zero", error.getTerminal().getErrorKind(), "错误种类应为除零"),
                    () -> assertEquals(20L, error.getModel().get("a"), "a 必须为 20"),
                    () -> assertEquals(3, result.getPaths().size(), "应有除零、正常相除、else 三条路径"));
        }

        @Test
        @DisplayName("十个独立条件在路径上限 50 下应恰好报告 50 条路径")
        void testManyBranches_WhenPathBudgetIs50_ShouldTruncateAtPathCount() throws IrBuildException {
            // 1. 准备
            ExplorationBudget budget = BUDGET.withMaxPaths(50);

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, tenIndependentBranches());

            // 3. 断言
            assertAll("路径数量截断",
                    () -> assertEquals(50, result.getPaths().size(), "应恰好 50 条路径"),
                    () -> assertTrue(result.getPaths().stream().allMatch(ExecutionPath::isSatisfied),
                            "报告的路径都应可满足"),
                    () -> assertTrue(result.isTruncated(), "批次应被标记为截断"),
                    () -> assertEquals(TruncationReason.PATH_COUNT, result.getMetadata().getReason(),
                            "截断原因应为 path-count"));
        }

        @Test
        @DisplayName("矛盾条件保护的代码应被剪枝，只剩 else 路径")
        void testDeadCode_WhenConditionIsContradictory_ShouldReturnOnlyElsePath() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("dead", List.of(param("x")),
                    ifStmt(2, and(gt(name("x"), num(5)), lt(name("x"), num(0))), List.of(ret(3, num(1)))),
                    ret(4, num(0)));

            // 2. 执行
            AnalysisResult result = analyzePython(f);

            // 3. 断言
            assertAll("死代码",
                    () -> assertEquals(1, result.getPaths().size(), "只应有一条路径"),
                    () -> assertEquals(0L, result.getPaths().get(0).getTerminal().getValue(), "应返回 0"),
                    () -> assertTrue(result.getMetadata().getPruned() >= 1, "then 分支应被计为剪枝"),
                    () -> assertFalse(result.getPaths().get(0).getVisitedLines().contains(3),
                            "第 3 行不应被覆盖"));
        }
    }

    @Nested
    @DisplayName("循环与调用深度测试 (Loops and Depth)")
    class BoundTests {

        @Test
        @DisplayName("while True 在展开上限处只产生一条截断路径")
        void testInfiniteLoop_WhenUnrolledToLimit_ShouldYieldSingleTruncatedPath() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("spin", List.of(),
                    whileLoop(2, bool(true), List.of(pass(3))),
                    ret(4, num(0)));
            ExplorationBudget budget = BUDGET.withMaxLoopIterations(3);

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, f);

            // 3. 断言
            assertAll("无限循环",
                    () -> assertEquals(1, result.getPaths().size(), "只应有一条路径"),
                    () -> assertEquals(TerminalKind.TRUNCATED, result.getPaths().get(0).getTerminal().getKind(),
                            "路径应以截断结束"),
                    () -> assertEquals(TruncationReason.LOOP_BOUND,
                            result.getPaths().get(0).getTerminal().getTruncation(), "截断原因应为 loop-bound"),
                    () -> assertEquals(TruncationReason.LOOP_BOUND, result.getMetadata().getReason(),
                            "批次截断原因应为 loop-bound"));
        }

        @Test
        @DisplayName("符号循环应在 0..L 次迭代处各有一条退出路径，外加一条截断路径")
        void testSymbolicLoop_WhenBoundIsSymbolic_ShouldExitAtEachIteration() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("count_up", List.of(param("n", "int")),
                    assign(2, "i", num(0)),
                    whileLoop(3, lt(name("i"), name("n")), List.of(assign(4, "i", add(name("i"), num(1))))),
                    ret(5, name("i")));
            ExplorationBudget budget = BUDGET.withMaxLoopIterations(3);

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, f);

            // 3. 断言
            List<ExecutionPath> returns = result.getPaths().stream()
                    .filter(p -> p.getTerminal().getKind() == TerminalKind.RETURN)
                    .toList();
            long truncated = result.getPaths().stream()
                    .filter(p -> p.getTerminal().getKind() == TerminalKind.TRUNCATED)
                    .count();
            assertAll("符号循环",
                    () -> assertEquals(5, result.getPaths().size(), "应有 4 条退出路径和 1 条截断路径"),
                    () -> assertEquals(Set.of(0L, 1L, 2L, 3L),
                            returns.stream().map(p -> p.getTerminal().getValue()).collect(Collectors.toSet()),
                            "退出时的迭代次数应覆盖 0 到 3"),
                    () -> assertEquals(1, truncated, "应有一条截断路径"));
            for (ExecutionPath p : returns) {
                long n = (Long) p.getModel().get("n");
                long expected = Math.max(0, n);
                assertEquals(expected, p.getTerminal().getValue(), "模型 n=" + n + " 应返回 " + expected);
            }
        }

        @Test
        @DisplayName("for range 循环在上限之内不应被截断")
        void testRangeLoop_WhenWithinLimit_ShouldNotTruncate() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("sum_range", List.of(),
                    assign(2, "s", num(0)),
                    forLoop(3, "k", call("range", num(3)), List.of(augAssign(4, "s", BinaryOperator.ADD, name("k")))),
                    ret(5, name("s")));
            ExplorationBudget budget = BUDGET.withMaxLoopIterations(3);

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, f);

            // 3. 断言
            assertAll("range 循环",
                    () -> assertEquals(1, result.getPaths().size(), "只应有一条路径"),
                    () -> assertEquals(3L, result.getPaths().get(0).getTerminal().getValue(), "0+1+2 = 3"),
                    () -> assertFalse(result.isTruncated(), "不应被截断"));
        }

        @Test
        @DisplayName("递归超过深度上限的路径应报告为 budget-exceeded")
        void testRecursion_WhenDepthExceeded_ShouldReportBudgetExceeded() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("down", List.of(param("n", "int")),
                    ifStmt(2, le(name("n"), num(0)), List.of(ret(3, num(0)))),
                    ret(4, call("down", sub(name("n"), num(1)))));
            ExplorationBudget budget = BUDGET.withMaxDepth(2);

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, f);

            // 3. 断言
            List<ExecutionPath> exceeded = result.getPaths().stream()
                    .filter(p -> p.getStatus() == PathStatus.BUDGET_EXCEEDED)
                    .toList();
            assertAll("调用深度",
                    () -> assertEquals(1, exceeded.size(), "应恰好一条超出深度的路径"),
                    () -> assertEquals(TruncationReason.DEPTH, exceeded.get(0).getTerminal().getTruncation(),
                            "截断原因应为 depth"),
                    () -> assertTrue((Long) exceeded.get(0).getModel().get("n") >= 3, "超深路径要求 n >= 3"),
                    () -> assertEquals(3, result.getPaths().size() - exceeded.size(), "n = 0, 1, 2 各一条返回路径"),
                    () -> assertTrue(result.getMetadata().getReasons().contains(TruncationReason.DEPTH),
                            "元数据应记录 depth"));
        }

        @Test
        @DisplayName("会话超时应停止探索并标记 timeout")
        void testSessionTimeout_WhenBudgetIsTiny_ShouldTruncateWithTimeout() throws IrBuildException {
            // 1. 准备
            ExplorationBudget budget = BUDGET.withSessionTimeout(Duration.ofMillis(1));

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, tenIndependentBranches());

            // 3. 断言
            assertAll("超时",
                    () -> assertTrue(result.isTruncated(), "批次应被截断"),
                    () -> assertEquals(TruncationReason.TIMEOUT, result.getMetadata().getReason(),
                            "超时是最严重的原因"),
                    () -> assertTrue(result.getPaths().size() < 1024, "不应探索完全部路径"));
        }
    }

    @Nested
    @DisplayName("错误隐患测试 (Error Hazards)")
    class HazardTests {

        @Test
        @DisplayName("assert 失败应作为独立的错误路径报告")
        void testAssert_WhenConditionCanFail_ShouldReportAssertionError() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("checked", List.of(param("x", "int")),
                    assertThat(2, gt(name("x"), num(0))),
                    ret(3, name("x")));

            // 2. 执行
            AnalysisResult result = analyzePython(f);

            // 3. 断言
            assertAll("断言",
                    () -> assertEquals(2, result.getPaths().size(), "应有失败和通过两条路径"),
                    () -> assertEquals("assertion-error", result.getPaths().get(0).getTerminal().getErrorKind(),
                            "错误路径应先于正常路径"),
                    () -> assertTrue((Long) result.getPaths().get(0).getModel().get("x") <= 0, "失败要求 x <= 0"),
                    () -> assertTrue((Long) result.getPaths().get(1).getModel().get("x") > 0, "通过要求 x > 0"));
        }

        @Test
        @DisplayName("raise 语句的错误种类取异常类型名")
        void testRaise_WhenReached_ShouldUseExceptionTypeAsErrorKind() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("guard", List.of(param("x", "int")),
                    ifStmt(2, eq(name("x"), num(42)), List.of(raise(3, "ValueError", "boom"))),
                    ret(4, num(1)));

            // 2. 执行
            AnalysisResult result = analyzePython(f);

            // 3. 断言
            ExecutionPath error = result.getPaths().get(0);
            assertAll("raise",
                    () -> assertEquals("ValueError", error.getTerminal().getErrorKind(), "错误种类"),
                    () -> assertEquals("boom", error.getTerminal().getMessage(), "错误消息"),
                    () -> assertEquals(42L, error.getModel().get("x"), "x 必须为 42"));
        }

        @Test
        @DisplayName("开启序列理论后，越界下标应产生 index-out-of-range 路径")
        void testIndex_WhenSequencesEnabled_ShouldReportIndexOutOfRange() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("pick", List.of(param("xs", "list[int]"), param("i", "int")),
                    ret(2, index(name("xs"), name("i"))));
            ExplorationBudget budget = BUDGET.withFeatures(TheoryFeatures.EXTENDED.withMaxSequenceLength(4));

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, f);

            // 3. 断言
            ExecutionPath error = result.getPaths().get(0);
            List<?> xs = (List<?>) error.getModel().get("xs");
            long i = (Long) error.getModel().get("i");
            assertAll("越界下标",
                    () -> assertEquals("index-out-of-range", error.getTerminal().getErrorKind(), "错误种类"),
                    () -> assertTrue(i >= xs.size() || i < -xs.size(), "模型中的下标应越界: " + error.getModel()),
                    () -> assertTrue(result.getPaths().stream()
                                    .anyMatch(p -> p.getTerminal().getKind() == TerminalKind.RETURN),
                            "应有正常返回路径"),
                    () -> assertTrue(xs.size() <= 4, "列表长度应受上限约束"));
        }

        @Test
        @DisplayName("字典下标应分出 key-error 路径，命中路径的模型包含该键")
        void testDictIndex_WhenSequencesEnabled_ShouldReportMissingKeyAndSolveValue() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("lookup", List.of(param("d", "dict[str, int]")),
                    ifStmt(2, gt(index(name("d"), str("k")), num(3)), List.of(ret(3, num(1)))),
                    ret(4, num(0)));
            ExplorationBudget budget = BUDGET.withFeatures(TheoryFeatures.EXTENDED);

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, budget, f);

            // 3. 断言
            List<ExecutionPath> paths = result.getPaths();
            Map<?, ?> hit = (Map<?, ?>) paths.get(1).getModel().get("d");
            assertAll("字典下标",
                    () -> assertEquals(3, paths.size(), "缺键、命中大于 3、命中不大于 3"),
                    () -> assertEquals("key-error", paths.get(0).getTerminal().getErrorKind(), "错误路径先报告"),
                    () -> assertFalse(((Map<?, ?>) paths.get(0).getModel().get("d")).containsKey("k"),
                            "缺键路径的模型中没有该键"),
                    () -> assertEquals(1L, paths.get(1).getTerminal().getValue()),
                    () -> assertTrue((Long) hit.get("k") > 3, "模型应满足 d['k'] > 3: " + hit),
                    () -> assertEquals(0L, paths.get(2).getTerminal().getValue()));
        }

        @Test
        @DisplayName("range() 的符号步长为 0 时应抛出 ValueError")
        void testRange_WhenSymbolicStepIsZero_ShouldRaiseValueError() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("stepper", List.of(param("s", "int")),
                    forLoop(2, "i", call("range", num(0), num(3), name("s")), List.of(pass(3))),
                    ret(4, num(1)));

            // 2. 执行
            AnalysisResult result = analyzePython(f);

            // 3. 断言
            ExecutionPath error = result.getPaths().get(0);
            List<ExecutionPath> returns = result.getPaths().stream()
                    .filter(p -> p.getTerminal().getKind() == TerminalKind.RETURN)
                    .collect(Collectors.toList());
            assertAll("零步长",
                    () -> assertEquals("ValueError", error.getTerminal().getErrorKind(), "错误种类"),
                    () -> assertEquals(0L, error.getModel().get("s"), "只有 s == 0 时抛出"),
                    () -> assertFalse(returns.isEmpty(), "非零步长应正常返回"),
                    () -> assertTrue(returns.stream().noneMatch(p -> (Long) p.getModel().get("s") == 0L),
                            "正常返回的路径步长都不为 0"));
        }
    }

    @Nested
    @DisplayName("语言语义测试 (Language Semantics)")
    class SemanticsTests {

        private FunctionAst halves() {
            return function("halves", List.of(param("a", "int")),
                    ifStmt(2, eq(div(name("a"), num(2)), num(1)), List.of(ret(3, num(1)))),
                    ret(4, num(0)));
        }

        @Test
        @DisplayName("Python 的 / 是真除法：a=3 时 a/2 != 1")
        void testDivision_WhenPython_ShouldUseTrueDivision() throws IrBuildException {
            // 1. 执行
            AnalysisResult result = new SymbolicAnalyzer(SourceDialect.PYTHON, BUDGET)
                    .analyze(List.of(halves()), "halves", List.of(eq(name("a"), num(3))));

            // 2. 断言
            assertAll("Python 除法",
                    () -> assertEquals(1, result.getPaths().size(), "只应有一条路径"),
                    () -> assertEquals(0L, result.getPaths().get(0).getTerminal().getValue(), "1.5 != 1"));
        }

        @Test
        @DisplayName("Java 的整数 / 向零截断：a=3 时 a/2 == 1")
        void testDivision_WhenJava_ShouldTruncate() throws IrBuildException {
            // 1. 执行
            AnalysisResult result = new SymbolicAnalyzer(SourceDialect.JAVA, BUDGET)
                    .analyze(List.of(halves()), "halves", List.of(eq(name("a"), num(3))));

            // 2. 断言
            assertAll("Java 除法",
                    () -> assertEquals(1, result.getPaths().size(), "只应有一条路径"),
                    () -> assertEquals(1L, result.getPaths().get(0).getTerminal().getValue(), "3 / 2 == 1"),
                    () -> assertEquals("java", result.getLanguage(), "语言名称"));
        }

        @Test
        @DisplayName("取模的符号随语言不同：Python 得 2，Java 得 -1")
        void testModulo_WhenDividendIsNegative_ShouldFollowLanguageSign() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("rem", List.of(param("a", "int")), ret(2, mod(name("a"), num(3))));
            List<Expr> pre = List.of(eq(name("a"), num(-7)));

            // 2. 执行
            AnalysisResult python = new SymbolicAnalyzer(SourceDialect.PYTHON, BUDGET).analyze(List.of(f), "rem", pre);
            AnalysisResult java = new SymbolicAnalyzer(SourceDialect.JAVA, BUDGET).analyze(List.of(f), "rem", pre);

            // 3. 断言
            assertAll("取模",
                    () -> assertEquals(2L, python.getPaths().get(0).getTerminal().getValue(), "Python: -7 % 3 == 2"),
                    () -> assertEquals(-1L, java.getPaths().get(0).getTerminal().getValue(), "Java: -7 % 3 == -1"));
        }

        @Test
        @DisplayName("Java 实数除以零不抛出异常，但结果无法建模，路径在此截断")
        void testRealDivision_WhenJavaDivisorZero_ShouldTruncateInsteadOfGuessing() throws IrBuildException {
            // 1. 准备
            FunctionAst f = function("ratio", List.of(param("a", "double"), param("b", "double")),
                    assign(2, "r", div(name("a"), name("b"))),
                    ifStmt(3, gt(name("r"), num(5)), List.of(ret(4, num(1)))),
                    ret(5, num(2)));

            // 2. 执行
            AnalysisResult result = analyze(SourceDialect.JAVA, BUDGET, f);

            // 3. 断言
            ExecutionPath cut = result.getPaths().get(0);
            assertAll("实数除零",
                    () -> assertEquals(3, result.getPaths().size(), "截断、r > 5、r <= 5"),
                    () -> assertEquals(TerminalKind.TRUNCATED, cut.getTerminal().getKind()),
                    () -> assertEquals(TruncationReason.UNMODELLED_VALUE, cut.getTerminal().getTruncation()),
                    () -> assertTrue(Rational.valueOf((String) cut.getModel().get("b")).isZero(), "截断要求 b == 0"),
                    () -> assertEquals(1L, result.getPaths().get(1).getTerminal().getValue()),
                    () -> assertEquals(2L, result.getPaths().get(2).getTerminal().getValue()),
                    () -> assertTrue(result.getMetadata().getReasons().contains(TruncationReason.UNMODELLED_VALUE)));
        }
    }

    @Nested
    @DisplayName("求解器结果测试 (Solver Outcomes)")
    class SolverOutcomeTests {

        private FunctionAst nested() {
            return function("nested", List.of(param("x", "int")),
                    ifStmt(2, gt(name("x"), num(5)), List.of(
                            ifStmt(3, lt(name("x"), num(3)), List.of(ret(4, num(1)))),
                            ret(5, num(2)))),
                    ret(6, num(0)));
        }

        @Test
        @DisplayName("分叉时无法判定、最终检查不可满足的路径，开启 includeUnreachable 后报告为 proven-unreachable")
        void testUnreachable_WhenIncluded_ShouldReportProvenUnreachablePath() throws IrBuildException {
            // 1. 准备
            ExplorationBudget budget = BUDGET.withIncludeUnreachable(true);

            // 2. 执行
            AnalysisResult included = new SymbolicAnalyzer(SourceDialect.PYTHON, budget,
                    ScriptedSolver::unknownOnFirstSight).analyze(nested());
            AnalysisResult omitted = new SymbolicAnalyzer(SourceDialect.PYTHON, BUDGET,
                    ScriptedSolver::unknownOnFirstSight).analyze(nested());

            // 3. 断言
            ExecutionPath unreachable = included.getPaths().get(0);
            assertAll("不可达路径",
                    () -> assertEquals(3, included.getPaths().size()),
                    () -> assertEquals(PathStatus.PROVEN_UNREACHABLE, unreachable.getStatus()),
                    () -> assertNull(unreachable.getModel(), "不可达路径没有模型"),
                    () -> assertEquals(2, included.satisfiedPaths().size()),
                    () -> assertEquals(2, omitted.getPaths().size(), "默认不报告不可达路径"),
                    () -> assertTrue(omitted.getPaths().stream().allMatch(ExecutionPath::isSatisfied)));
        }

        @Test
        @DisplayName("最终检查返回 UNKNOWN 的路径报告为 unknown-timeout，探索继续")
        void testUnknown_WhenSolverGivesUp_ShouldReportUnknownAndContinue() throws IrBuildException {
            // 1. 准备
            SymbolicAnalyzer analyzer = new SymbolicAnalyzer(SourceDialect.PYTHON, BUDGET,
                    () -> new ScriptedSolver(constraints -> constraints.size() >= 2));

            // 2. 执行
            AnalysisResult result = analyzer.analyze(nested());

            // 3. 断言
            List<ExecutionPath> paths = result.getPaths();
            assertAll("无法判定",
                    () -> assertEquals(3, paths.size(), "内层两条无法判定的路径和外层的返回路径"),
                    () -> assertEquals(PathStatus.UNKNOWN_TIMEOUT, paths.get(0).getStatus()),
                    () -> assertEquals(PathStatus.UNKNOWN_TIMEOUT, paths.get(1).getStatus()),
                    () -> assertNull(paths.get(0).getModel()),
                    () -> assertEquals(PathStatus.SATISFIED, paths.get(2).getStatus(), "探索在 UNKNOWN 之后继续"),
                    () -> assertEquals(0L, paths.get(2).getTerminal().getValue()),
                    () -> assertTrue(result.getMetadata().getUnknown() >= 2, "元数据记录无法判定的次数"));
        }
    }

    @Nested
    @DisplayName("整体性质测试 (Global Properties)")
    class PropertyTests {

        @Test
        @DisplayName("相同输入两次分析应得到相同的路径序列")
        void testDeterminism_WhenAnalyzedTwice_ShouldProduceSameOrder() throws IrBuildException {
            // 1. 执行
            AnalysisResult first = analyzePython(checkAccess());
            AnalysisResult second = analyzePython(checkAccess());

            // 2. 断言
            assertEquals(first.getPaths().size(), second.getPaths().size(), "路径数量应相同");
            for (int i = 0; i < first.getPaths().size(); i++) {
                ExecutionPath a = first.getPaths().get(i);
                ExecutionPath b = second.getPaths().get(i);
                assertAll("路径 " + i,
                        () -> assertEquals(a.getPathId(), b.getPathId(), "编号"),
                        () -> assertEquals(a.getConstraints(), b.getConstraints(), "路径条件"),
                        () -> assertEquals(a.getBranchTrace(), b.getBranchTrace(), "分支轨迹"),
                        () -> assertEquals(a.getTerminal().toString(), b.getTerminal().toString(), "终点"));
            }
        }

        @Test
        @DisplayName("可满足路径都带模型，编号从 0 开始连续")
        void testSatisfiedPaths_WhenReported_ShouldCarryModelsAndSequentialIds() throws IrBuildException {
            // 1. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, BUDGET.withMaxPaths(20), tenIndependentBranches());

            // 2. 断言
            for (int i = 0; i < result.getPaths().size(); i++) {
                ExecutionPath p = result.getPaths().get(i);
                assertEquals(i, p.getPathId(), "编号应按发现顺序从 0 开始");
                if (p.isSatisfied()) {
                    assertNotNull(p.getModel(), "可满足路径必须带模型");
                    assertEquals(10, p.getModel().size(), "模型应覆盖全部参数");
                }
            }
            assertEquals(result.getPaths().size(), result.getMetadata().getDiscovered(), "元数据中的路径数");
        }

        @Test
        @DisplayName("模型重放：many_branches 的返回值等于正参数的个数")
        void testReplay_WhenModelsExecutedConcretely_ShouldMatchReturnValues() throws IrBuildException {
            // 1. 执行
            AnalysisResult result = analyze(SourceDialect.PYTHON, BUDGET.withMaxPaths(30), tenIndependentBranches());

            // 2. 断言
            for (ExecutionPath p : result.satisfiedPaths()) {
                long positives = p.getModel().values().stream().filter(v -> (Long) v > 0).count();
                assertEquals(positives, p.getTerminal().getValue(), "模型 " + p.getModel());
            }
        }
    }
}
