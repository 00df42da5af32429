package com.cgekernel.runtime.solver;

import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.exceptions.SolverException;
import com.cgekernel.api.numeric.NumericExpr;
import com.cgekernel.api.solver.OptimizerConfig;
import com.cgekernel.infra.config.KernelConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NewtonOptimizerTest {

    private ExpressionModel model;

    @BeforeEach
    void setUp() {
        model = new ExpressionModel();
        model.setOptimizer(OptimizerConfig.of(NewtonOptimizer.NAME));
    }

    private static NumericExpr v(ModelVariable variable) {
        return NumericExpr.variable(variable);
    }

    @Test
    @DisplayName("Should solve a linear system")
    void shouldSolveLinearSystem() {
        ModelVariable x = model.addVariable("x");
        ModelVariable y = model.addVariable("y");
        model.addEquality(NumericExpr.sum(List.of(v(x), v(y))), NumericExpr.literal(10.0));
        model.addEquality(NumericExpr.difference(v(x), v(y)), NumericExpr.literal(2.0));

        model.optimize();

        assertThat(model.getStatus()).isEqualTo(SolveStatus.CONVERGED);
        assertThat(x.value()).isCloseTo(6.0, within(1e-8));
        assertThat(y.value()).isCloseTo(4.0, within(1e-8));
    }

    @Test
    @DisplayName("Should find the root selected by the start value")
    void shouldSolveNonlinearEquation() {
        ModelVariable x = model.addVariable("x");
        x.setStartValue(1.0);
        model.addEquality(NumericExpr.power(v(x), NumericExpr.literal(2.0)), NumericExpr.literal(4.0));

        model.optimize();

        assertThat(model.getStatus()).isEqualTo(SolveStatus.CONVERGED);
        assertThat(x.value()).isCloseTo(2.0, within(1e-8));
    }

    @Test
    @DisplayName("Fixed variables should stay at their value")
    void fixedVariablesShouldNotMove() {
        ModelVariable x = model.addVariable("x");
        ModelVariable y = model.addVariable("y");
        y.fix(3.0);
        model.addEquality(NumericExpr.product(List.of(v(x), v(y))), NumericExpr.literal(12.0));

        model.optimize();

        assertThat(y.value()).isEqualTo(3.0);
        assertThat(x.value()).isCloseTo(4.0, within(1e-8));
    }

    @Test
    @DisplayName("Complementarity pair should settle at an active bound")
    void complementarityShouldSettleAtBound() {
        // p - 3 ⟂ p >= 5: the function is positive at the bound, so p stays at 5
        ModelVariable p = model.addVariable("p");
        p.setLowerBound(5.0);
        ModelConstraint row = model.addComplementarity(
                NumericExpr.difference(v(p), NumericExpr.literal(3.0)), p);

        model.optimize();

        assertThat(model.getStatus()).isEqualTo(SolveStatus.CONVERGED);
        assertThat(p.value()).isEqualTo(5.0);
        assertThat(row.residual()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Complementarity pair with an interior root should zero the function")
    void complementarityShouldFindInteriorRoot() {
        ModelVariable p = model.addVariable("p");
        p.setLowerBound(0.0);
        p.setStartValue(1.0);
        ModelConstraint row = model.addComplementarity(
                NumericExpr.difference(v(p), NumericExpr.literal(3.0)), p);

        model.optimize();

        assertThat(p.value()).isCloseTo(3.0, within(1e-8));
        assertThat(row.residual()).isCloseTo(0.0, within(1e-8));
    }

    @Test
    @DisplayName("Should reject a non-square system")
    void shouldRejectNonSquareSystem() {
        ModelVariable x = model.addVariable("x");
        model.addVariable("y");
        model.addEquality(v(x), NumericExpr.literal(1.0));

        assertThatThrownBy(model::optimize)
                .isInstanceOf(SolverException.class)
                .hasMessageContaining("requires a square system");
    }

    @Test
    @DisplayName("Should report a singular Jacobian")
    void shouldReportSingularJacobian() {
        // neither row depends on y
        ModelVariable x = model.addVariable("x");
        model.addVariable("y");
        model.addEquality(v(x), NumericExpr.literal(1.0));
        model.addEquality(v(x), NumericExpr.literal(2.0));

        assertThatThrownBy(model::optimize)
                .isInstanceOf(SolverException.class)
                .hasMessageContaining("Singular Jacobian");
    }

    @Test
    @DisplayName("Should stop at the iteration limit without throwing")
    void shouldStopAtIterationLimit() {
        model.setOptimizer(new OptimizerConfig(NewtonOptimizer.NAME, Map.of(NewtonOptimizer.ATTR_MAX_ITERATIONS, 1)));
        ModelVariable x = model.addVariable("x");
        x.setStartValue(10.0);
        model.addEquality(NumericExpr.power(v(x), NumericExpr.literal(3.0)), NumericExpr.literal(2.0));

        model.optimize();

        assertThat(model.getStatus()).isEqualTo(SolveStatus.ITERATION_LIMIT);
    }

    @Test
    @DisplayName("Attributes should override configured defaults")
    void attributesShouldOverrideDefaults() {
        KernelConfig config = KernelConfig.builder().newtonMaxIterations(7).build();

        NewtonOptimizer defaults = NewtonOptimizer.fromConfig(OptimizerConfig.of(NewtonOptimizer.NAME), config);
        NewtonOptimizer tuned = NewtonOptimizer.fromConfig(new OptimizerConfig(NewtonOptimizer.NAME,
                Map.of(NewtonOptimizer.ATTR_TOLERANCE, 1e-6)), config);

        assertThat(defaults.getMaxIterations()).isEqualTo(7);
        assertThat(tuned.getTolerance()).isEqualTo(1e-6);
        assertThatThrownBy(() -> new NewtonOptimizer(0, 1e-8)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Linear solve should pivot on the largest entry")
    void linearSolveShouldPivot() {
        double[][] a = {{0.0, 1.0}, {2.0, 0.0}};
        double[] b = {3.0, 4.0};

        assertThat(NewtonOptimizer.solveLinear(a, b)).containsExactly(2.0, 3.0);
    }
}
