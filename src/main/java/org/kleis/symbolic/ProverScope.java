package org.kleis.symbolic;

import com.microsoft.z3.Solver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 求解器的一层 push/pop。配合 try-with-resources 使用，保证任何退出路径都会 pop。
 */
public final class ProverScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ProverScope.class);

    private final Solver solver;
    private boolean closed;

    ProverScope(Solver solver) {
        this.solver = solver;
        solver.push();
        logger.trace("push，当前层数 {}", solver.getNumScopes());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        solver.pop();
        logger.trace("pop，当前层数 {}", solver.getNumScopes());
    }
}
