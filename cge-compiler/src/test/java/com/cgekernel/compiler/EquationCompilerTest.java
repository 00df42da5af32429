package com.cgekernel.compiler;

import com.cgekernel.api.exceptions.CompilationException;
import com.cgekernel.api.exceptions.ConfigurationException;
import com.cgekernel.api.expr.Expr;
import com.cgekernel.api.expr.RawExpr;
import com.cgekernel.api.model.EquationPayload;
import com.cgekernel.api.model.MapParameterSource;
import com.cgekernel.api.model.ObjectiveSense;
import com.cgekernel.api.numeric.NumericExpr;
import com.cgekernel.api.solver.ConstraintHandle;
import com.cgekernel.api.solver.SolverModel;
import com.cgekernel.api.solver.VariableHandle;
import com.cgekernel.runtime.model.KernelContext;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EquationCompilerTest {

    @Mock
    private SolverModel model;

    @Mock
    private VariableHandle xa;

    @Mock
    private VariableHandle pa;

    @Mock
    private ConstraintHandle constraint;

    private EquationCompiler compiler;
    private KernelContext context;

    @BeforeEach
    void setUp() {
        compiler = new EquationCompiler(OpenTelemetry.noop().getTracer("test"));
        context = new KernelContext(model);
        context.registerVariable("x_a", xa);
        context.registerVariable("p_a", pa);
    }

    private static EquationPayload.Builder instance(Expr expr) {
        return EquationPayload.builder().expr(expr).indices(List.of("i"), List.of("a"));
    }

    @Test
    @DisplayName("Should compile an equality and write the handle back")
    void shouldCompileEquality() {
        when(model.addEquality(any(), any())).thenReturn(constraint);
        context.registerEquation("supply", "market", instance(Expr.eq(Expr.var("x"), Expr.constant(5))).build());

        compiler.compileEquations(context);

        verify(model).addEquality(NumericExpr.variable(xa), NumericExpr.literal(5.0));
        assertThat(context.listEquations().get(0).payload().constraint()).isSameAs(constraint);
    }

    @Test
    @DisplayName("Should pair an equation with a complementarity variable given by name")
    void shouldCompileComplementarityByName() {
        when(model.addComplementarity(any(), any())).thenReturn(constraint);
        context.registerEquation("zero_profit", "firm",
                instance(Expr.eq(Expr.var("x"), Expr.constant(1))).mcpVar("p_a").build());

        compiler.compileEquations(context);

        NumericExpr expected = NumericExpr.difference(NumericExpr.variable(xa), NumericExpr.literal(1.0));
        verify(model).addComplementarity(expected, pa);
        verify(model, never()).addEquality(any(), any());
    }

    @Test
    @DisplayName("Complementarity variable reference should inherit the instance indices")
    void shouldResolveComplementarityReference() {
        when(model.addComplementarity(any(), any())).thenReturn(constraint);
        context.registerEquation("zero_profit", "firm",
                instance(Expr.eq(Expr.var("x"), Expr.constant(1))).mcpVar(Expr.var("p")).build());

        compiler.compileEquations(context);

        verify(model).addComplementarity(any(), same(pa));
    }

    @Test
    @DisplayName("Should reject a complementarity variable that is not a variable reference")
    void shouldRejectNonVariableMcp() {
        context.registerEquation("zero_profit", "firm",
                instance(Expr.eq(Expr.var("x"), Expr.constant(1))).mcpVar(Expr.constant(3)).build());

        assertThatThrownBy(() -> compiler.compileEquations(context))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Unsupported MCP variable expression: Constant");
    }

    @Test
    @DisplayName("Should reject an equation that is not an equality")
    void shouldRejectNonEquality() {
        assertThatThrownBy(() -> compiler.compileEquation(Expr.add(Expr.var("x"), Expr.constant(1)), context,
                null, List.of("a"), new IndexEnvironment(), null))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Unsupported equation expression: expected Equality, got Add");
    }

    @Test
    @DisplayName("Should reject a second objective")
    void shouldRejectMultipleObjectives() {
        context.registerEquation("objective", "welfare",
                EquationPayload.builder().objective(Expr.var("x", Expr.label("a"))).build());
        context.registerEquation("objective", "tax",
                EquationPayload.builder().objective(Expr.var("p", Expr.label("a"))).build());

        assertThatThrownBy(() -> compiler.compileEquations(context))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Multiple objectives registered")
                .hasMessageContaining("tax.objective");
        verify(model, never()).setObjective(any(), any());
    }

    @Test
    @DisplayName("Should install the objective with the default sense")
    void shouldInstallObjectiveWithDefaultSense() {
        context.registerEquation("objective", "welfare",
                EquationPayload.builder().objective(Expr.var("x", Expr.label("a"))).build());

        compiler.compileEquations(context);

        verify(model).setObjective(ObjectiveSense.MAXIMIZE, NumericExpr.variable(xa));
    }

    @Test
    @DisplayName("Should honor an explicit minimize sense")
    void shouldInstallMinimizeObjective() {
        context.registerEquation("objective", "cost",
                EquationPayload.builder().objective(Expr.var("x", Expr.label("a")), ObjectiveSense.MINIMIZE).build());

        compiler.compileEquations(context);

        verify(model).setObjective(ObjectiveSense.MINIMIZE, NumericExpr.variable(xa));
    }

    @Test
    @DisplayName("Should not install an objective when objective compilation is disabled")
    void shouldSkipObjectiveWhenDisabled() {
        context.registerEquation("objective", "welfare",
                EquationPayload.builder().objective(Expr.var("x", Expr.label("a"))).build());

        compiler.compileEquations(context, null, false);

        verify(model, never()).setObjective(any(), any());
    }

    @Test
    @DisplayName("Should reject an unknown objective sense name")
    void shouldRejectUnknownSense() {
        EquationCompiler.ObjectiveRecord objective = new EquationCompiler.ObjectiveRecord(
                Expr.var("x", Expr.label("a")), null, List.of(), null, null);

        assertThatThrownBy(() -> compiler.compileObjective(objective, context, null, "sideways"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sideways");
    }

    @Test
    @DisplayName("Should accept objective sense names")
    void shouldAcceptSenseNames() {
        EquationCompiler.ObjectiveRecord objective = new EquationCompiler.ObjectiveRecord(
                Expr.var("x", Expr.label("a")), null, List.of(), null, null);

        compiler.compileObjective(objective, context, null, "min");

        verify(model).setObjective(ObjectiveSense.MINIMIZE, NumericExpr.variable(xa));
    }

    @Test
    @DisplayName("Should leave already compiled records untouched")
    void shouldSkipCompiledRecords() {
        context.registerEquation("supply", "market",
                instance(Expr.eq(Expr.var("x"), Expr.constant(5))).constraint(constraint).build());

        compiler.compileEquations(context);

        verify(model, never()).addEquality(any(), any());
        assertThat(context.listEquations().get(0).payload().constraint()).isSameAs(constraint);
    }

    @Test
    @DisplayName("Should skip raw and expression-less records")
    void shouldSkipRawRecords() {
        context.registerEquation("note", "market", instance(new RawExpr("x = 5")).build());
        context.registerEquation("empty", "market", EquationPayload.empty());

        compiler.compileEquations(context);

        verify(model, never()).addEquality(any(), any());
        assertThat(context.listEquations()).allSatisfy(r -> assertThat(r.payload().isCompiled()).isFalse());
    }

    @Test
    @DisplayName("Call-site parameters should override payload parameters")
    void callSiteParamsShouldOverridePayload() {
        when(model.addEquality(any(), any())).thenReturn(constraint);
        context.registerEquation("price", "market",
                instance(Expr.eq(Expr.mul(Expr.param("k"), Expr.var("x")), Expr.constant(0)))
                        .params(MapParameterSource.builder().put("k", List.of("a"), 1.0).build())
                        .build());

        compiler.compileEquations(context, MapParameterSource.builder().put("k", List.of("a"), 2.0).build(), true);

        ArgumentCaptor<NumericExpr> lhs = ArgumentCaptor.forClass(NumericExpr.class);
        verify(model).addEquality(lhs.capture(), any());
        assertThat(lhs.getValue().evaluate(h -> 3.0)).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Payload parameters should apply when no call-site parameters are given")
    void payloadParamsShouldApplyByDefault() {
        when(model.addEquality(any(), any())).thenReturn(constraint);
        context.registerEquation("price", "market",
                instance(Expr.eq(Expr.mul(Expr.param("k"), Expr.var("x")), Expr.constant(0)))
                        .params(MapParameterSource.builder().put("k", List.of("a"), 1.0).build())
                        .build());

        compiler.compileEquations(context);

        ArgumentCaptor<NumericExpr> lhs = ArgumentCaptor.forClass(NumericExpr.class);
        verify(model).addEquality(lhs.capture(), any());
        assertThat(lhs.getValue().evaluate(h -> 3.0)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should require an attached solver model")
    void shouldRequireModel() {
        KernelContext detached = new KernelContext();
        detached.registerEquation("supply", "market", instance(Expr.eq(Expr.var("x"), Expr.constant(5))).build());

        assertThatThrownBy(() -> compiler.compileEquations(detached))
                .isInstanceOf(ConfigurationException.class);
    }
}
