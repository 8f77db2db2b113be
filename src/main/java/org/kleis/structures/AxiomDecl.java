package org.kleis.structures;

import lombok.Getter;
import org.kleis.expressions.Expression;

import java.util.Objects;

@Getter
public final class AxiomDecl {

    private final String name;
    private final Expression proposition;

    private AxiomDecl(String name, Expression proposition) {
        this.name = Objects.requireNonNull(name, "公理名不能为空");
        this.proposition = Objects.requireNonNull(proposition, "公理命题不能为空");
    }

    public static AxiomDecl of(String name, Expression proposition) {
        return new AxiomDecl(name, proposition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AxiomDecl that = (AxiomDecl) o;
        return name.equals(that.name) && proposition.equals(that.proposition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, proposition);
    }

    @Override
    public String toString() {
        return "axiom " + name + " : " + proposition;
    }
}
