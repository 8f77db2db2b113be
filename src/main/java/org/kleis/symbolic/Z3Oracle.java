package org.kleis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个 Z3 会话：一个 Context 和其上唯一的持久求解器。
 * 求解器在会话内增量使用，结构公理断言在底层，单次查询放在 {@link ProverScope} 里。
 * <p>
 * 不是线程安全的，调用方负责串行化。
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final Context ctx;
    private final Solver solver;
    private final int defaultTimeoutMs;

    public Z3Oracle(int defaultTimeoutMs, boolean produceModels) {
        Map<String, String> cfg = new HashMap<>();
        cfg.put("model", Boolean.toString(produceModels));
        this.ctx = new Context(cfg);
        this.solver = ctx.mkSolver();
        this.defaultTimeoutMs = defaultTimeoutMs;
        applyTimeout(defaultTimeoutMs);
        logger.debug("Z3 会话已创建，默认超时 {} ms", defaultTimeoutMs);
    }

    public void add(BoolExpr... assertions) {
        solver.add(assertions);
    }

    public void add(List<BoolExpr> assertions) {
        solver.add(assertions.toArray(new BoolExpr[0]));
    }

    public ProverScope openScope() {
        return new ProverScope(solver);
    }

    public Status check() {
        return solver.check();
    }

    /**
     * 以指定超时检查；超时为空时使用默认值。检查结束后恢复默认超时。
     */
    public Status check(Duration timeout) {
        if (timeout == null) {
            return solver.check();
        }
        applyTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        try {
            return solver.check();
        } finally {
            applyTimeout(defaultTimeoutMs);
        }
    }

    public Model getModel() {
        return solver.getModel();
    }

    public String getReasonUnknown() {
        return solver.getReasonUnknown();
    }

    public int getNumScopes() {
        return solver.getNumScopes();
    }

    private void applyTimeout(int timeoutMs) {
        Params params = ctx.mkParams();
        params.add("timeout", timeoutMs);
        solver.setParameters(params);
    }

    @Override
    public void close() {
        logger.debug("关闭 Z3 会话");
        ctx.close();
    }
}
