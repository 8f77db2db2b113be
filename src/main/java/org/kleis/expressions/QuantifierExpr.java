package org.kleis.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 量词表达式 {@code ∀(vars) where C. body} 或 {@code ∃(vars) where C. body}。
 * where 子句可以为空。
 */
@Getter
public final class QuantifierExpr implements Expression {

    private final QuantifierKind kind;
    private final List<QuantifiedVar> variables;
    private final Expression whereClause;
    private final Expression body;
    private final int hashCode;

    private QuantifierExpr(QuantifierKind kind, List<QuantifiedVar> variables, Expression whereClause, Expression body) {
        this.kind = Objects.requireNonNull(kind, "量词种类不能为空");
        this.variables = List.copyOf(variables);
        this.whereClause = whereClause;
        this.body = Objects.requireNonNull(body, "量词体不能为空");
        this.hashCode = Objects.hash(kind, this.variables, whereClause, body);
    }

    public static QuantifierExpr forAll(List<QuantifiedVar> variables, Expression body) {
        return new QuantifierExpr(QuantifierKind.FOR_ALL, variables, null, body);
    }

    public static QuantifierExpr forAll(List<QuantifiedVar> variables, Expression whereClause, Expression body) {
        return new QuantifierExpr(QuantifierKind.FOR_ALL, variables, whereClause, body);
    }

    public static QuantifierExpr exists(List<QuantifiedVar> variables, Expression body) {
        return new QuantifierExpr(QuantifierKind.EXISTS, variables, null, body);
    }

    public static QuantifierExpr exists(List<QuantifiedVar> variables, Expression whereClause, Expression body) {
        return new QuantifierExpr(QuantifierKind.EXISTS, variables, whereClause, body);
    }

    public boolean hasWhereClause() {
        return whereClause != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuantifierExpr that = (QuantifierExpr) o;
        return kind == that.kind
                && variables.equals(that.variables)
                && Objects.equals(whereClause, that.whereClause)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String vars = variables.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
        String where = whereClause == null ? "" : " where " + whereClause;
        return kind.getSymbol() + vars + where + ". " + body;
    }
}
