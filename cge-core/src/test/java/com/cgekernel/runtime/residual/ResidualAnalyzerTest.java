package com.cgekernel.runtime.residual;

import com.cgekernel.api.expr.Expr;
import com.cgekernel.api.model.EquationPayload;
import com.cgekernel.api.model.MapParameterSource;
import com.cgekernel.api.model.ResidualRecord;
import com.cgekernel.api.model.ResidualSummary;
import com.cgekernel.compiler.EquationCompiler;
import com.cgekernel.runtime.model.KernelContext;
import com.cgekernel.runtime.solver.ExpressionModel;
import com.cgekernel.runtime.solver.ModelVariable;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResidualAnalyzerTest {

    private static final double TOL = 1e-6;

    private static EquationPayload withResidual(String index, double residual) {
        return EquationPayload.builder().indices(List.of("i"), List.of(index)).residual(residual).build();
    }

    @Test
    @DisplayName("Empty context should summarize to zero")
    void emptyContextShouldSummarizeToZero() {
        ResidualSummary summary = ResidualAnalyzer.summarize(new KernelContext(), TOL);

        assertThat(summary).isEqualTo(ResidualSummary.EMPTY);
        assertThat(summary.hasWorst()).isFalse();
    }

    @Test
    @DisplayName("Should extract only records carrying a residual, in registration order")
    void shouldExtractResidualsInOrder() {
        KernelContext context = new KernelContext();
        context.registerEquation("supply", "market", withResidual("a", 0.5));
        context.registerEquation("pending", "market", EquationPayload.empty());
        context.registerEquation("demand", "household", withResidual("b", -1.5));

        List<ResidualRecord> residuals = ResidualAnalyzer.residuals(context);

        assertThat(residuals).containsExactly(
                new ResidualRecord("supply", "market", List.of("a"), 0.5),
                new ResidualRecord("demand", "household", List.of("b"), -1.5));
    }

    @Test
    @DisplayName("NaN residual registered last should be reported as the worst")
    void nanAfterFiniteShouldBeWorst() {
        KernelContext context = new KernelContext();
        context.registerEquation("finite", "blk", withResidual("a", 5.0));
        context.registerEquation("broken", "blk", withResidual("b", Double.NaN));

        assertNanIsWorst(context);
    }

    @Test
    @DisplayName("NaN residual registered first should be reported as the worst")
    void nanBeforeFiniteShouldBeWorst() {
        KernelContext context = new KernelContext();
        context.registerEquation("broken", "blk", withResidual("b", Double.NaN));
        context.registerEquation("finite", "blk", withResidual("a", 5.0));

        assertNanIsWorst(context);
    }

    private static void assertNanIsWorst(KernelContext context) {
        ResidualSummary summary = ResidualAnalyzer.summarize(context, TOL);

        assertThat(summary.maxAbs()).isNaN();
        assertThat(summary.worst().tag()).isEqualTo("broken");
        assertThat(ResidualAnalyzer.topResiduals(context, 1)).containsExactly(summary.worst());
    }

    @Test
    @DisplayName("Ties on the largest magnitude should resolve to the earliest record")
    void tiesShouldResolveToFirst() {
        KernelContext context = new KernelContext();
        context.registerEquation("first", "blk", withResidual("a", -2.0));
        context.registerEquation("second", "blk", withResidual("b", 2.0));
        context.registerEquation("third", "blk", withResidual("c", 1e-7));

        ResidualSummary summary = ResidualAnalyzer.summarize(context, TOL);

        assertThat(summary.count()).isEqualTo(3);
        assertThat(summary.maxAbs()).isEqualTo(2.0);
        assertThat(summary.worst().tag()).isEqualTo("first");
        assertThat(summary.aboveTol()).isEqualTo(2);
    }

    @Test
    @DisplayName("Residual exactly at tolerance should not count as above it")
    void toleranceShouldBeStrict() {
        KernelContext context = new KernelContext();
        context.registerEquation("edge", "blk", withResidual("a", TOL));

        assertThat(ResidualAnalyzer.summarize(context, TOL).aboveTol()).isZero();
    }

    @Test
    @DisplayName("Top residuals should rank by magnitude with stable ties")
    void topResidualsShouldRankByMagnitude() {
        KernelContext context = new KernelContext();
        context.registerEquation("small", "blk", withResidual("a", 0.1));
        context.registerEquation("big", "blk", withResidual("b", -3.0));
        context.registerEquation("tie1", "blk", withResidual("c", 1.0));
        context.registerEquation("tie2", "blk", withResidual("d", -1.0));

        assertThat(ResidualAnalyzer.topResiduals(context, 3))
                .extracting(ResidualRecord::tag)
                .containsExactly("big", "tie1", "tie2");
        assertThat(ResidualAnalyzer.topResiduals(context, 10)).hasSize(4);
    }

    @Test
    @DisplayName("Satisfied equality should leave a zero residual")
    void satisfiedEqualityShouldHaveZeroResidual() {
        ExpressionModel model = new ExpressionModel();
        KernelContext context = new KernelContext(model);
        ModelVariable x = model.addVariable("x");
        ModelVariable y = model.addVariable("y");
        x.fix(4.0);
        y.fix(6.0);
        context.registerVariable("x", x);
        context.registerVariable("y", y);
        context.registerEquation("total", "blk", EquationPayload.builder()
                .expr(Expr.eq(Expr.add(Expr.var("x"), Expr.var("y")), Expr.constant(10)))
                .build());

        new EquationCompiler(OpenTelemetry.noop().getTracer("test")).compileEquations(context);
        context.solve();
        ResidualSummary summary = ResidualAnalyzer.summarize(context, TOL);

        assertThat(summary.count()).isEqualTo(1);
        assertThat(summary.maxAbs()).isEqualTo(0.0);
        assertThat(summary.aboveTol()).isZero();
    }

    @Test
    @DisplayName("Weighted domain sum at fixed values should leave its expanded residual")
    void weightedSumShouldLeaveResidual() {
        ExpressionModel model = new ExpressionModel();
        KernelContext context = new KernelContext(model);
        for (String label : List.of("a", "b", "c")) {
            ModelVariable x = model.addVariable("x_" + label);
            x.fix(1.0);
            context.registerVariable("x_" + label, x);
        }
        context.registerEquation("weighted", "blk", EquationPayload.builder()
                .expr(Expr.eq(Expr.sum("i", List.of("a", "b", "c"),
                        Expr.mul(Expr.param("p", Expr.index("i")), Expr.var("x", Expr.index("i")))),
                        Expr.constant(0)))
                .params(MapParameterSource.builder().putAll("p", Map.of("a", 1.0, "b", 2.0, "c", 3.0)).build())
                .build());

        new EquationCompiler(OpenTelemetry.noop().getTracer("test")).compileEquations(context);
        context.solve();
        ResidualSummary summary = ResidualAnalyzer.summarize(context, TOL);

        assertThat(summary.maxAbs()).isEqualTo(6.0);
        assertThat(summary.aboveTol()).isEqualTo(1);
        assertThat(summary.worst().tag()).isEqualTo("weighted");
    }
}
