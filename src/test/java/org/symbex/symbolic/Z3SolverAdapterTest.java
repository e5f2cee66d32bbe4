package org.symbex.symbolic;

import org.symbex.core.Domain;
import org.symbex.core.SymbolicVariable;
import org.symbex.expressions.Term;
import org.symbex.expressions.TermOperator;
import org.symbex.expressions.Terms;
import org.symbex.utils.Rational;
import org.junit.jupiter.api.*;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class Z3SolverAdapterTest {

    // --- Test Setup ---
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private Z3SolverAdapter solver;
    private Term x;
    private Term r;
    private Term s;

    @BeforeAll
    void setUp() {
        solver = new Z3SolverAdapter();
        x = Terms.variable(SymbolicVariable.parameter("x", Domain.INT));
        r = Terms.variable(SymbolicVariable.parameter("r", Domain.REAL));
        s = Terms.variable(SymbolicVariable.parameter("s", Domain.STRING));
    }

    @AfterAll
    void tearDown() {
        if (solver != null) {
            solver.close();
        }
    }

    private Term eq(Term a, Term b) {
        return Terms.compare(TermOperator.EQ, a, b);
    }

    /**
     * 在 x == value 的前提下求值给定的项，返回可移植值。
     */
    private Object evaluateAt(long value, Term term) {
        CheckResult result = solver.check(List.of(eq(x, Terms.integer(value))), TIMEOUT);
        assertTrue(result.isSat(), "前提应可满足");
        return solver.toPortable(result.getModel().evaluate(term));
    }

    @Nested
    @DisplayName("可满足性检查测试 (Satisfiability Checks)")
    class CheckTests {

        @Test
        @DisplayName("可满足的约束返回模型，模型值为可移植标量")
        void testCheck_WhenSatisfiable_ShouldReturnModel() {
            // 1. 准备
            List<Term> constraints = List.of(
                    Terms.compare(TermOperator.GT, x, Terms.integer(3)),
                    Terms.compare(TermOperator.LT, x, Terms.integer(5)));

            // 2. 执行
            CheckResult result = solver.check(constraints, TIMEOUT);

            // 3. 断言
            assertAll("SAT",
                    () -> assertTrue(result.isSat()),
                    () -> assertEquals(SolverStatus.SAT, result.getStatus()),
                    () -> assertEquals(4L, solver.toPortable(result.getModel().evaluate(x)), "唯一解 x = 4"));
        }

        @Test
        @DisplayName("矛盾的约束返回 UNSAT，且检查之间互不影响")
        void testCheck_WhenContradictory_ShouldReturnUnsatWithoutLeaking() {
            CheckResult contradiction = solver.check(List.of(
                    Terms.compare(TermOperator.GT, x, Terms.ZERO),
                    Terms.compare(TermOperator.LT, x, Terms.ZERO)), TIMEOUT);
            CheckResult afterwards = solver.check(List.of(Terms.compare(TermOperator.GT, x, Terms.ZERO)), TIMEOUT);
            assertAll("UNSAT",
                    () -> assertTrue(contradiction.isUnsat()),
                    () -> assertNull(contradiction.getModel()),
                    () -> assertTrue(afterwards.isSat(), "上一轮的约束不应残留"));
        }

        @Test
        @DisplayName("无法交给 Z3 的项得到 UNKNOWN 而不是异常")
        void testCheck_WhenTermUnsupported_ShouldReturnUnknown() {
            Term a = Terms.variable(SymbolicVariable.opaque("a", Domain.ANY, 0));
            Term b = Terms.variable(SymbolicVariable.opaque("b", Domain.ANY, 1));
            long before = solver.getChecks();
            CheckResult result = solver.check(List.of(eq(a, b)), TIMEOUT);
            assertAll("UNKNOWN",
                    () -> assertTrue(result.isUnknown()),
                    () -> assertNotNull(result.getReasonUnknown()),
                    () -> assertEquals(before + 1, solver.getChecks(), "检查次数计数"));
        }
    }

    @Nested
    @DisplayName("整数除法语义测试 (Integer Division Lowering)")
    class DivisionTests {

        @Test
        @DisplayName("-7 与 3：向下取整和向零截断的商与余数")
        void testDivision_WhenDividendNegative_ShouldDistinguishRoundingModes() {
            Term three = Terms.integer(3);
            assertAll("除法",
                    () -> assertEquals(-3L, evaluateAt(-7, Terms.apply(TermOperator.FLOOR_DIV, Domain.INT, x, three))),
                    () -> assertEquals(2L, evaluateAt(-7, Terms.apply(TermOperator.FLOOR_MOD, Domain.INT, x, three))),
                    () -> assertEquals(-2L, evaluateAt(-7, Terms.apply(TermOperator.TRUNC_DIV, Domain.INT, x, three))),
                    () -> assertEquals(-1L, evaluateAt(-7, Terms.apply(TermOperator.TRUNC_REM, Domain.INT, x, three))));
        }

        @Test
        @DisplayName("除数为负时 Python 取模与除数同号")
        void testFloorMod_WhenDivisorNegative_ShouldFollowDivisorSign() {
            Term minusThree = Terms.integer(-3);
            assertAll("负除数",
                    () -> assertEquals(-2L, evaluateAt(7, Terms.apply(TermOperator.FLOOR_MOD, Domain.INT, x, minusThree))),
                    () -> assertEquals(-3L, evaluateAt(7, Terms.apply(TermOperator.FLOOR_DIV, Domain.INT, x, minusThree))),
                    () -> assertEquals(1L, evaluateAt(7, Terms.apply(TermOperator.TRUNC_REM, Domain.INT, x, minusThree))));
        }
    }

    @Nested
    @DisplayName("模型提取测试 (Model Extraction)")
    class ModelTests {

        @Test
        @DisplayName("实数模型以十进制字符串给出")
        void testReal_WhenSolved_ShouldBeDecimalString() {
            CheckResult result = solver.check(List.of(eq(Terms.arithmetic(TermOperator.MUL, r,
                    Terms.real(Rational.valueOf(2))), Terms.real(Rational.ONE))), TIMEOUT);
            assertEquals("0.5", solver.toPortable(result.getModel().evaluate(r)));
        }

        @Test
        @DisplayName("字符串前缀与长度约束")
        void testString_WhenPrefixAndLength_ShouldSatisfyBoth() {
            CheckResult result = solver.check(List.of(
                    Terms.apply(TermOperator.STR_PREFIX, Domain.BOOL, s, Terms.string("ab")),
                    eq(Terms.length(s), Terms.integer(3))), TIMEOUT);
            String value = (String) solver.toPortable(result.getModel().evaluate(s));
            assertAll("字符串",
                    () -> assertTrue(value.startsWith("ab"), "模型: " + value),
                    () -> assertEquals(3, value.codePointCount(0, value.length())));
        }

        @Test
        @DisplayName("列表模型按长度逐个提取元素")
        void testList_WhenSolved_ShouldExtractElements() {
            Term xs = Terms.variable(SymbolicVariable.parameter("xs", Domain.listOf(Domain.INT)));
            CheckResult result = solver.check(List.of(
                    eq(Terms.length(xs), Terms.integer(2)),
                    eq(Terms.apply(TermOperator.SEQ_NTH, Domain.INT, xs, Terms.ZERO), Terms.integer(5)),
                    eq(Terms.apply(TermOperator.SEQ_NTH, Domain.INT, xs, Terms.ONE), Terms.integer(-1))), TIMEOUT);
            assertEquals(List.of(5L, -1L), solver.toPortable(result.getModel().evaluate(xs)));
        }

        @Test
        @DisplayName("字典模型只包含约束中出现过的键")
        void testDict_WhenSolved_ShouldExtractMentionedKeys() {
            Term d = Terms.variable(SymbolicVariable.parameter("d", Domain.dictOf(Domain.STRING, Domain.INT)));
            Term key = Terms.string("k");
            CheckResult result = solver.check(List.of(
                    Terms.apply(TermOperator.DICT_HAS, Domain.BOOL, d, key),
                    eq(Terms.apply(TermOperator.DICT_GET, Domain.INT, d, key), Terms.integer(7))), TIMEOUT);
            assertEquals(Map.of("k", 7L), solver.toPortable(result.getModel().evaluate(d)));
        }

        @Test
        @DisplayName("字典写入得到新字典，原字典中没有该键")
        void testDictPut_WhenKeyAbsentBefore_ShouldOnlyAppearInUpdatedDict() {
            // 1. 准备
            Domain domain = Domain.dictOf(Domain.STRING, Domain.INT);
            Term d = Terms.variable(SymbolicVariable.parameter("m", domain));
            Term key = Terms.string("n");
            Term updated = Terms.apply(TermOperator.DICT_PUT, domain, d, key, Terms.integer(9));

            // 2. 执行
            CheckResult result = solver.check(List.of(
                    Terms.not(Terms.apply(TermOperator.DICT_HAS, Domain.BOOL, d, key)),
                    Terms.apply(TermOperator.DICT_HAS, Domain.BOOL, updated, key),
                    eq(Terms.apply(TermOperator.DICT_GET, Domain.INT, updated, key), Terms.integer(9))), TIMEOUT);

            // 3. 断言
            assertAll("字典写入",
                    () -> assertEquals(SolverStatus.SAT, result.getStatus()),
                    () -> assertEquals(Map.of("n", 9L), solver.toPortable(result.getModel().evaluate(updated))),
                    () -> assertEquals(Map.of(), solver.toPortable(result.getModel().evaluate(d))));
        }
    }

    @Test
    @DisplayName("可移植值转换：小整数为 Long，大整数为 BigInteger，有理数为十进制字符串，Z3 转义被还原")
    void testToPortable_WhenGivenRawValues_ShouldNormalize() {
        BigInteger big = BigInteger.TEN.pow(30);
        assertAll("可移植值",
                () -> assertEquals(42L, solver.toPortable(BigInteger.valueOf(42))),
                () -> assertEquals(big, solver.toPortable(big)),
                () -> assertEquals("2.5", solver.toPortable(Rational.valueOf(5, 2))),
                () -> assertNull(solver.toPortable(null)),
                () -> assertEquals("aAb", Z3SolverAdapter.unescape("a\\u{41}b")));
    }
}
