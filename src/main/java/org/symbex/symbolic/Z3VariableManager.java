package org.symbex.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.TupleSort;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.core.SymbolicVariable;
import org.symbex.expressions.UnsupportedConstructException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理符号变量到 Z3 常量、值域到 Z3 Sort 的映射。
 * 确保每个符号变量在 Z3 Context 中有唯一的对应 Z3 常量。
 * <p>
 * 字典值域映射为一个二元组 Sort：{@code keys} 是键到布尔的数组（键是否存在），{@code vals} 是键到值的数组。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 一个适配器实例只在一个线程中使用，HashMap 足够
    private final Map<SymbolicVariable, Expr> variables;
    private final Map<Domain, Sort> sorts;
    // Z3 对 TupleSort 的 Expr 返回的是 DatatypeSort，字段访问器只能从构造时的 TupleSort 取
    private final Map<Domain, TupleSort> dictSorts;

    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.variables = new HashMap<>();
        this.sorts = new HashMap<>();
        this.dictSorts = new HashMap<>();
        logger.debug("Z3VariableManager 初始化完成");
    }

    /**
     * 获取符号变量对应的 Z3 常量，尚未创建时创建并缓存。
     * 不透明变量可能以不同值域出现，值域是常量名的一部分。
     */
    public Expr getZ3Var(SymbolicVariable variable) {
        return variables.computeIfAbsent(variable, v -> {
            String name = v.isOpaque() ? v.getSolverName() + "$" + v.getDomain() : v.getSolverName();
            logger.debug("创建 Z3 变量: {} : {}", name, v.getDomain());
            return ctx.mkConst(name, getSort(v.getDomain()));
        });
    }

    /**
     * 值域对应的 Z3 Sort。
     * @throws UnsupportedConstructException 值域无法在 Z3 中表示时（NONE、ANY）。
     */
    public Sort getSort(Domain domain) {
        Sort cached = sorts.get(domain);
        if (cached != null) {
            return cached;
        }
        Sort sort = switch (domain.getKind()) {
            case INT -> ctx.getIntSort();
            case REAL -> ctx.getRealSort();
            case BOOL -> ctx.getBoolSort();
            case STRING -> ctx.getStringSort();
            case LIST -> ctx.mkSeqSort(getSort(domain.getElement()));
            case DICT -> {
                Sort key = getSort(domain.getKey());
                Sort value = getSort(domain.getValue());
                TupleSort tuple = ctx.mkTupleSort(ctx.mkSymbol(domain.toString()),
                        new Symbol[]{ctx.mkSymbol("keys"), ctx.mkSymbol("vals")},
                        new Sort[]{ctx.mkArraySort(key, ctx.getBoolSort()), ctx.mkArraySort(key, value)});
                dictSorts.put(domain, tuple);
                yield tuple;
            }
            case NONE, ANY -> throw new UnsupportedConstructException("no solver sort for " + domain);
        };
        sorts.put(domain, sort);
        return sort;
    }

    /**
     * 字典二元组的键集合数组。
     */
    public Expr dictKeys(Expr dict, Domain domain) {
        return dictSort(domain).getFieldDecls()[0].apply(dict);
    }

    /**
     * 字典二元组的值数组。
     */
    public Expr dictValues(Expr dict, Domain domain) {
        return dictSort(domain).getFieldDecls()[1].apply(dict);
    }

    public Expr mkDict(Domain domain, Expr keys, Expr values) {
        return dictSort(domain).mkDecl().apply(keys, values);
    }

    private TupleSort dictSort(Domain domain) {
        if (!domain.is(DomainKind.DICT)) {
            throw new IllegalArgumentException("不是字典值域: " + domain);
        }
        getSort(domain);
        return dictSorts.get(domain);
    }
}
