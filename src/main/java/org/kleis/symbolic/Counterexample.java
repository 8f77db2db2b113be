package org.kleis.symbolic;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 求解器给出的模型：常量名到取值的文本。反驳公理时是反例，可满足性检查时是见证。
 */
@Getter
public final class Counterexample {

    private final Map<String, String> assignments;
    private final String model;

    private Counterexample(Map<String, String> assignments, String model) {
        this.assignments = Collections.unmodifiableMap(assignments);
        this.model = model;
    }

    public static Counterexample of(Map<String, String> assignments, String model) {
        return new Counterexample(new LinkedHashMap<>(assignments), model);
    }

    static Counterexample fromModel(Model model) {
        if (model == null) {
            return new Counterexample(new LinkedHashMap<>(), "");
        }
        Map<String, String> assignments = new LinkedHashMap<>();
        for (FuncDecl<?> decl : model.getConstDecls()) {
            Expr<?> value = model.getConstInterp(decl);
            if (value != null) {
                assignments.put(decl.getName().toString(), value.toString());
            }
        }
        return new Counterexample(assignments, model.toString());
    }

    public String get(String name) {
        return assignments.get(name);
    }

    @Override
    public String toString() {
        return assignments.toString();
    }
}
