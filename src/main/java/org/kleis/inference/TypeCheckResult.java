package org.kleis.inference;

import lombok.Getter;
import org.kleis.expressions.Expression;
import org.kleis.types.Type;

import java.util.List;

/**
 * 前端看到的类型检查结果。
 * <ul>
 *     <li>{@code CONCRETE}：类型中不含类型变量</li>
 *     <li>{@code INCOMPLETE}：仍有类型变量，但没有遇到歧义</li>
 *     <li>{@code POLYMORPHIC}：某个运算有多个可行候选结构</li>
 *     <li>{@code ERROR}：类型错误</li>
 * </ul>
 */
@Getter
public final class TypeCheckResult {

    public enum Status {
        CONCRETE,
        INCOMPLETE,
        POLYMORPHIC,
        ERROR
    }

    private final Status status;
    private final Type type;
    private final String message;
    private final String suggestion;
    private final Expression location;
    private final List<String> candidateStructures;
    private final List<String> availableTypes;

    private TypeCheckResult(Status status, Type type, String message, String suggestion, Expression location,
                            List<String> candidateStructures, List<String> availableTypes) {
        this.status = status;
        this.type = type;
        this.message = message;
        this.suggestion = suggestion;
        this.location = location;
        this.candidateStructures = List.copyOf(candidateStructures);
        this.availableTypes = List.copyOf(availableTypes);
    }

    public static TypeCheckResult concrete(Type type) {
        return new TypeCheckResult(Status.CONCRETE, type, null, null, null, List.of(), List.of());
    }

    public static TypeCheckResult incomplete(Type type) {
        return new TypeCheckResult(Status.INCOMPLETE, type, null, null, null, List.of(), List.of());
    }

    public static TypeCheckResult polymorphic(Type type, List<String> candidateStructures, List<String> availableTypes) {
        return new TypeCheckResult(Status.POLYMORPHIC, type, null, null, null, candidateStructures, availableTypes);
    }

    public static TypeCheckResult error(String message, Expression location, String suggestion) {
        return new TypeCheckResult(Status.ERROR, null, message, suggestion, location, List.of(), List.of());
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    @Override
    public String toString() {
        return switch (status) {
            case CONCRETE, INCOMPLETE -> status + ": " + type;
            case POLYMORPHIC -> status + ": " + type + " " + candidateStructures;
            case ERROR -> status + ": " + message;
        };
    }
}
