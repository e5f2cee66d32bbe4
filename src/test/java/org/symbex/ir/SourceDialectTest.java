package org.symbex.ir;

import org.symbex.core.Domain;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class SourceDialectTest {

    @Nested
    @DisplayName("声明类型解析测试 (Declared Type Parsing)")
    class ParseTests {

        @Test
        @DisplayName("Python 标量与泛型容器类型")
        void testPython_WhenParsingTypes_ShouldMapToDomains() {
            assertAll("Python 类型",
                    () -> assertEquals(Domain.INT, SourceDialect.PYTHON.parseDeclaredType("int")),
                    () -> assertEquals(Domain.REAL, SourceDialect.PYTHON.parseDeclaredType("float")),
                    () -> assertEquals(Domain.STRING, SourceDialect.PYTHON.parseDeclaredType(" str ")),
                    () -> assertEquals(Domain.listOf(Domain.INT), SourceDialect.PYTHON.parseDeclaredType("List[int]")),
                    () -> assertEquals(Domain.dictOf(Domain.STRING, Domain.REAL),
                            SourceDialect.PYTHON.parseDeclaredType("dict[str, float]")),
                    () -> assertNull(SourceDialect.PYTHON.parseDeclaredType("dict[str, list[float]]"),
                            "容器只支持标量元素，嵌套容器无法识别"));
        }

        @Test
        @DisplayName("Java 的尖括号泛型与数组类型")
        void testJava_WhenParsingTypes_ShouldHandleGenericsAndArrays() {
            assertAll("Java 类型",
                    () -> assertEquals(Domain.INT, SourceDialect.JAVA.parseDeclaredType("long")),
                    () -> assertEquals(Domain.BOOL, SourceDialect.JAVA.parseDeclaredType("boolean")),
                    () -> assertEquals(Domain.listOf(Domain.INT), SourceDialect.JAVA.parseDeclaredType("int[]")),
                    () -> assertEquals(Domain.dictOf(Domain.STRING, Domain.INT),
                            SourceDialect.JAVA.parseDeclaredType("Map<String, Integer>")));
        }

        @Test
        @DisplayName("无法识别的类型返回 null，由调用方取默认值域")
        void testUnknownTypes_WhenParsed_ShouldReturnNull() {
            assertAll("未知类型",
                    () -> assertNull(SourceDialect.PYTHON.parseDeclaredType("Widget")),
                    () -> assertNull(SourceDialect.PYTHON.parseDeclaredType("List[Widget]")),
                    () -> assertNull(SourceDialect.JAVA.parseDeclaredType("Map<String")),
                    () -> assertNull(SourceDialect.JAVASCRIPT.parseDeclaredType("")),
                    () -> assertNull(SourceDialect.JAVASCRIPT.parseDeclaredType(null)));
        }
    }

    @Test
    @DisplayName("每个前端带有自己的算术语义")
    void testSemantics_WhenSelected_ShouldMatchLanguage() {
        assertAll("算术语义",
                () -> assertTrue(SourceDialect.PYTHON.getSemantics().isFlooredModulo(), "Python 取模向下取整"),
                () -> assertFalse(SourceDialect.JAVA.getSemantics().isTrueDivision(), "Java 整数除法截断"),
                () -> assertTrue(SourceDialect.JAVASCRIPT.getSemantics().isNumbersAreReal(), "JavaScript 只有实数"),
                () -> assertFalse(SourceDialect.JAVASCRIPT.getSemantics().integerDivisionByZeroRaises(),
                        "JavaScript 除零不抛出"),
                () -> assertEquals("python", SourceDialect.PYTHON.getLanguage()));
    }
}
