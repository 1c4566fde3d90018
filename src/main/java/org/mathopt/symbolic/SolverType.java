package org.mathopt.symbolic;

/**
 * 可用的求解器。
 */
public enum SolverType {
    Z3 {
        @Override
        public Solver newSolver() {
            return new Z3Solver();
        }
    };

    public abstract Solver newSolver();
}
