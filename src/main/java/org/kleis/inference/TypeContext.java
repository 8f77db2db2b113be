package org.kleis.inference;

import org.kleis.types.Type;
import org.kleis.types.TypeVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 变量名到类型的作用域链，以及会话内的新类型变量计数器。
 * 子作用域与根共享同一个计数器，因此同一会话内 id 不重复；不同会话互不影响。
 */
public final class TypeContext {

    private static final Logger logger = LoggerFactory.getLogger(TypeContext.class);

    private final TypeContext parent;
    private final AtomicInteger counter;
    private final Map<String, Type> bindings = new LinkedHashMap<>();

    public TypeContext() {
        this(null, new AtomicInteger(0));
    }

    private TypeContext(TypeContext parent, AtomicInteger counter) {
        this.parent = parent;
        this.counter = counter;
    }

    public TypeVar fresh() {
        TypeVar var = TypeVar.of(counter.getAndIncrement());
        logger.trace("创建新的类型变量 {}", var);
        return var;
    }

    public void bind(String name, Type type) {
        bindings.put(Objects.requireNonNull(name), Objects.requireNonNull(type));
    }

    /**
     * 由内向外查找绑定；找不到时返回 null。
     */
    public Type lookup(String name) {
        for (TypeContext ctx = this; ctx != null; ctx = ctx.parent) {
            Type type = ctx.bindings.get(name);
            if (type != null) {
                return type;
            }
        }
        return null;
    }

    /**
     * 新的内层作用域，例如量词体。
     */
    public TypeContext child() {
        return new TypeContext(this, counter);
    }

    public TypeContext root() {
        TypeContext ctx = this;
        while (ctx.parent != null) {
            ctx = ctx.parent;
        }
        return ctx;
    }

    public Map<String, Type> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
