package org.symbex.explorer;

import org.symbex.SymbolicAnalyzer;
import org.symbex.core.ExplorationBudget;
import org.symbex.ir.IrBuildException;
import org.symbex.ir.SourceDialect;
import org.symbex.ir.ast.FunctionAst;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.symbex.ir.ast.Ast.*;

class ConstraintQueriesTest {

    // --- Test Setup ---
    private final ConstraintQueries queries =
            new SymbolicAnalyzer(SourceDialect.PYTHON, ExplorationBudget.defaults()).queries();

    private final FunctionAst pair = function("pair", List.of(param("x", "int"), param("y", "int")), ret(2, num(0)));

    @Nested
    @DisplayName("输入查找测试 (Input Search)")
    class FindInputsTests {

        @Test
        @DisplayName("存在满足前置条件和目标的输入时返回按参数顺序排列的取值")
        void testFindInputs_WhenTargetReachable_ShouldReturnWitness() throws IrBuildException {
            // 1. 执行
            Optional<Map<String, Object>> inputs = queries.findInputs(pair,
                    List.of(gt(name("x"), num(0))),
                    and(eq(add(name("x"), name("y")), num(10)), gt(name("y"), name("x"))));

            // 2. 断言
            assertTrue(inputs.isPresent(), "应找到输入");
            long x = (Long) inputs.get().get("x");
            long y = (Long) inputs.get().get("y");
            assertAll("见证",
                    () -> assertEquals(List.of("x", "y"), List.copyOf(inputs.get().keySet()), "按参数顺序"),
                    () -> assertTrue(x > 0, "满足前置条件"),
                    () -> assertEquals(10, x + y, "满足目标"),
                    () -> assertTrue(y > x, "满足目标"));
        }

        @Test
        @DisplayName("目标与前置条件矛盾时返回空")
        void testFindInputs_WhenTargetContradictsPrecondition_ShouldReturnEmpty() throws IrBuildException {
            Optional<Map<String, Object>> inputs = queries.findInputs(pair,
                    List.of(gt(name("x"), num(0))), lt(name("x"), num(0)));
            assertTrue(inputs.isEmpty());
        }
    }

    @Nested
    @DisplayName("断言证明测试 (Proofs)")
    class ProveTests {

        @Test
        @DisplayName("对所有输入成立的断言应证明为 VALID")
        void testProve_WhenAssertionAlwaysHolds_ShouldBeValid() throws IrBuildException {
            ProofResult result = queries.prove(pair,
                    List.of(ge(name("x"), num(0)), gt(name("y"), num(0))),
                    ge(floorDiv(name("x"), name("y")), num(0)));
            assertAll("VALID",
                    () -> assertTrue(result.isValid(), "结果: " + result),
                    () -> assertNull(result.getCounterexample()));
        }

        @Test
        @DisplayName("存在反例时返回 INVALID 和反例")
        void testProve_WhenAssertionCanFail_ShouldReturnCounterexample() throws IrBuildException {
            ProofResult result = queries.prove(pair, List.of(gt(name("x"), num(0))), gt(name("x"), num(5)));
            assertAll("INVALID",
                    () -> assertEquals(ProofStatus.INVALID, result.getStatus()),
                    () -> assertNotNull(result.getCounterexample()),
                    () -> assertTrue((Long) result.getCounterexample().get("x") <= 5, "反例应违反断言"),
                    () -> assertTrue((Long) result.getCounterexample().get("x") > 0, "反例应满足前置条件"));
        }
    }
}
