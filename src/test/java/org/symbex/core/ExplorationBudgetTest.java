package org.symbex.core;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ExplorationBudgetTest {

    @Nested
    @DisplayName("配置加载测试 (Properties Loading)")
    class PropertiesTests {

        @Test
        @DisplayName("缺失的键取默认值")
        void testFromProperties_WhenEmpty_ShouldEqualDefaults() {
            ExplorationBudget budget = ExplorationBudget.fromProperties(new Properties());
            ExplorationBudget defaults = ExplorationBudget.defaults();
            assertAll("默认预算",
                    () -> assertEquals(defaults.getMaxDepth(), budget.getMaxDepth()),
                    () -> assertEquals(defaults.getMaxPaths(), budget.getMaxPaths()),
                    () -> assertEquals(defaults.getSolverTimeout(), budget.getSolverTimeout()),
                    () -> assertTrue(budget.getFeatures().isStrings(), "默认开启字符串理论"),
                    () -> assertFalse(budget.getFeatures().isSequences(), "默认关闭序列理论"),
                    () -> assertEquals(MixedNumericPolicy.PROMOTE_TO_REAL, budget.getMixedNumericPolicy()));
        }

        @Test
        @DisplayName("symbex.* 键覆盖对应的预算项")
        void testFromProperties_WhenKeysPresent_ShouldOverride() {
            // 1. 准备
            Properties p = new Properties();
            p.setProperty("symbex.maxPaths", "50");
            p.setProperty("symbex.sessionTimeoutMs", "1500");
            p.setProperty("symbex.sequences", "true");
            p.setProperty("symbex.maxStringLength", "16");
            p.setProperty("symbex.untypedDomain", "real");
            p.setProperty("symbex.mixedNumericPolicy", "opaque");
            p.setProperty("symbex.includeUnreachable", "true");

            // 2. 执行
            ExplorationBudget budget = ExplorationBudget.fromProperties(p);

            // 3. 断言
            assertAll("覆盖",
                    () -> assertEquals(50, budget.getMaxPaths()),
                    () -> assertEquals(Duration.ofMillis(1500), budget.getSessionTimeout()),
                    () -> assertTrue(budget.getFeatures().isSequences()),
                    () -> assertEquals(16, budget.getFeatures().getMaxStringLength()),
                    () -> assertEquals(Domain.REAL, budget.getFeatures().getUntypedParameterDomain()),
                    () -> assertEquals(MixedNumericPolicy.OPAQUE, budget.getMixedNumericPolicy()),
                    () -> assertTrue(budget.isIncludeUnreachable()));
        }

        @Test
        @DisplayName("非法值应抛出 IllegalArgumentException")
        void testFromProperties_WhenValuesInvalid_ShouldThrow() {
            Properties notNumber = new Properties();
            notNumber.setProperty("symbex.maxDepth", "deep");
            Properties badDomain = new Properties();
            badDomain.setProperty("symbex.untypedDomain", "list");
            Properties zeroPaths = new Properties();
            zeroPaths.setProperty("symbex.maxPaths", "0");
            assertAll("非法配置",
                    () -> assertThrows(IllegalArgumentException.class, () -> ExplorationBudget.fromProperties(notNumber)),
                    () -> assertThrows(IllegalArgumentException.class, () -> ExplorationBudget.fromProperties(badDomain)),
                    () -> assertThrows(IllegalArgumentException.class, () -> ExplorationBudget.fromProperties(zeroPaths)));
        }
    }

    @Test
    @DisplayName("理论开关决定值域能否建模")
    void testSupports_WhenFeaturesToggled_ShouldFollowSwitches() {
        Domain strings = Domain.listOf(Domain.STRING);
        assertAll("理论开关",
                () -> assertTrue(TheoryFeatures.DEFAULT.supports(Domain.STRING)),
                () -> assertFalse(TheoryFeatures.DEFAULT.supports(strings), "默认不支持序列"),
                () -> assertTrue(TheoryFeatures.EXTENDED.supports(strings)),
                () -> assertFalse(TheoryFeatures.EXTENDED.withStrings(false).supports(strings), "元素值域也需支持"),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> TheoryFeatures.DEFAULT.withUntypedParameterDomain(strings), "无类型参数只能是标量"));
    }
}
