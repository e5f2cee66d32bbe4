package org.symbex.ir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 内置的语言前端变体。
 */
public enum SourceDialect implements Frontend {

    PYTHON("python", ArithmeticSemantics.PYTHON,
            Set.of("list", "List", "Sequence", "tuple", "Tuple"),
            Set.of("dict", "Dict", "Mapping")) {
        @Override
        protected Domain scalar(String name) {
            return switch (name) {
                case "int" -> Domain.INT;
                case "float", "Decimal" -> Domain.REAL;
                case "bool" -> Domain.BOOL;
                case "str" -> Domain.STRING;
                default -> null;
            };
        }
    },

    JAVA("java", ArithmeticSemantics.JAVA,
            Set.of("List", "ArrayList", "LinkedList", "Collection"),
            Set.of("Map", "HashMap", "TreeMap", "LinkedHashMap")) {
        @Override
        protected Domain scalar(String name) {
            return switch (name) {
                case "int", "long", "short", "byte", "Integer", "Long", "Short", "Byte", "BigInteger" -> Domain.INT;
                case "double", "float", "Double", "Float", "BigDecimal" -> Domain.REAL;
                case "boolean", "Boolean" -> Domain.BOOL;
                case "String", "CharSequence", "char", "Character" -> Domain.STRING;
                default -> null;
            };
        }
    },

    JAVASCRIPT("javascript", ArithmeticSemantics.JAVASCRIPT,
            Set.of("Array", "ReadonlyArray"),
            Set.of("Map", "Record")) {
        @Override
        protected Domain scalar(String name) {
            return switch (name) {
                case "number" -> Domain.REAL;
                case "bigint" -> Domain.INT;
                case "boolean" -> Domain.BOOL;
                case "string" -> Domain.STRING;
                default -> null;
            };
        }
    };

    private static final Logger logger = LoggerFactory.getLogger(SourceDialect.class);

    private final String language;
    private final ArithmeticSemantics semantics;
    private final Set<String> listTypes;
    private final Set<String> dictTypes;

    SourceDialect(String language, ArithmeticSemantics semantics, Set<String> listTypes, Set<String> dictTypes) {
        this.language = language;
        this.semantics = semantics;
        this.listTypes = listTypes;
        this.dictTypes = dictTypes;
    }

    /**
     * 标量类型名到值域的映射，未知名称返回 null。
     */
    protected abstract Domain scalar(String name);

    @Override
    public String getLanguage() {
        return language;
    }

    @Override
    public ArithmeticSemantics getSemantics() {
        return semantics;
    }

    @Override
    public Domain parseDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return null;
        }
        String text = declaredType.trim();
        try {
            return parse(text);
        } catch (IllegalArgumentException e) {
            logger.debug("无法识别的声明类型 '{}': {}", text, e.getMessage());
            return null;
        }
    }

    private Domain parse(String text) {
        if (text.endsWith("[]")) {
            Domain element = parse(text.substring(0, text.length() - 2).trim());
            return element == null ? null : Domain.listOf(element);
        }
        int open = firstBracket(text);
        if (open < 0) {
            return scalar(text);
        }
        String head = text.substring(0, open).trim();
        List<String> args = splitArguments(text.substring(open + 1, text.length() - 1));
        if (listTypes.contains(head) && args.size() == 1) {
            Domain element = parse(args.get(0));
            return element == null ? null : Domain.listOf(element);
        }
        if (dictTypes.contains(head) && args.size() == 2) {
            Domain key = parse(args.get(0));
            Domain value = parse(args.get(1));
            return key == null || value == null ? null : Domain.dictOf(key, value);
        }
        return null;
    }

    private static int firstBracket(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[' || c == '<') {
                char close = c == '[' ? ']' : '>';
                if (text.charAt(text.length() - 1) != close) {
                    throw new IllegalArgumentException("括号不匹配");
                }
                return i;
            }
        }
        return -1;
    }

    /**
     * 按顶层逗号切分类型参数，忽略嵌套括号内的逗号。
     */
    private static List<String> splitArguments(String inner) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '[' || c == '<') {
                depth++;
            } else if (c == ']' || c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(inner.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(inner.substring(start).trim());
        return parts;
    }
}
