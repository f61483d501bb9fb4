package com.symderiv.exception;

import com.symderiv.calculus.Differentiator;
import com.symderiv.exception.SymbolicExpressionException.ErrorKind;
import com.symderiv.expression.Expression;
import com.symderiv.expression.Expressions;
import com.symderiv.test.TestBase;
import com.symderiv.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the error taxonomy and the messages offered to host bindings.
 *
 * <p>Test ID prefix: TC-ERR-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error Handling Tests")
public class SymbolicExpressionExceptionTest extends TestBase {

    private static SymbolicExpressionException capture(Runnable call) {
        Throwable thrown = catchThrowable(call::run);
        assertThat(thrown).isInstanceOf(SymbolicExpressionException.class);
        return (SymbolicExpressionException) thrown;
    }

    @Test
    @DisplayName("TC-ERR-001: Each failure maps to its error kind")
    void testKinds() {
        assertThat(capture(() -> Expressions.constant(Double.NaN)).getKind())
            .isEqualTo(ErrorKind.INVALID_CONSTANT);
        assertThat(capture(() -> Expressions.variable("")).getKind())
            .isEqualTo(ErrorKind.INVALID_VARIABLE_NAME);
        assertThat(capture(() -> Expressions.add(1, new Object())).getKind())
            .isEqualTo(ErrorKind.UNSUPPORTED_OPERAND);
        assertThat(capture(() -> Differentiator.derivative(Expressions.variable("x"), Expressions.constant(1))).getKind())
            .isEqualTo(ErrorKind.NOT_A_VARIABLE);
        assertThat(capture(() -> Differentiator.derivative(
                Expressions.raise(2, Expressions.variable("x")), Expressions.variable("x"))).getKind())
            .isEqualTo(ErrorKind.UNSUPPORTED_DIFFERENTIATION);
    }

    @Test
    @DisplayName("TC-ERR-002: Error codes match the published taxonomy")
    void testCodes() {
        assertThat(ErrorKind.INVALID_CONSTANT.code()).isEqualTo("InvalidConstant");
        assertThat(ErrorKind.INVALID_VARIABLE_NAME.code()).isEqualTo("InvalidVariableName");
        assertThat(ErrorKind.UNSUPPORTED_OPERAND.code()).isEqualTo("UnsupportedOperand");
        assertThat(ErrorKind.NOT_A_VARIABLE.code()).isEqualTo("NotAVariable");
        assertThat(ErrorKind.UNSUPPORTED_DIFFERENTIATION.code()).isEqualTo("UnsupportedDifferentiation");
    }

    @Test
    @DisplayName("TC-ERR-003: User messages give guidance")
    void testUserMessages() {
        assertThat(new InvalidConstantException(Double.NaN).getUserMessage()).contains("NaN");
        assertThat(new InvalidConstantException(Double.POSITIVE_INFINITY).getUserMessage()).contains("infinite");
        assertThat(new UnsupportedOperandException("x + 1").getUserMessage()).contains("not parsed");
        assertThat(new UnsupportedOperandException(Boolean.FALSE).getUserMessage()).contains("Boolean");
        assertThat(new NotAVariableException(null).getUserMessage()).contains("variable");
    }

    @Test
    @DisplayName("TC-ERR-004: Technical message carries kind and context")
    void testTechnicalMessage() {
        SymbolicExpressionException e = capture(() -> Expressions.variable("   "));
        String technical = e.getTechnicalMessage();

        logData("Technical message", technical);
        assertThat(technical)
            .contains("Kind: InvalidVariableName")
            .contains("Context: name='   ' (length 3)");
    }

    @Test
    @DisplayName("TC-ERR-005: Errors are unchecked")
    void testUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(SymbolicExpressionException.class);
    }

    @Test
    @DisplayName("TC-ERR-006: Depth errors describe the tree by a summary, not its rendering")
    void testDepthExceededSummary() {
        Expression e = Expressions.variable("x");
        for (int i = 0; i < 20_000; i++) {
            e = Expressions.multiply(e, 2);
        }

        UnsupportedDifferentiationException error = UnsupportedDifferentiationException.depthExceeded(e, 20_001, 100);

        assertThat(error.getOffendingExpression()).isSameAs(e);
        assertThat(error.getOffendingDescription()).isEqualTo("Product of depth 20001 with 40001 nodes");
        assertThat(error.getUserMessage())
            .isEqualTo("Cannot differentiate Product of depth 20001 with 40001 nodes: "
                       + "expression depth 20001 exceeds the limit of 100.");
        assertThat(error.getTechnicalMessage())
            .contains("Kind: UnsupportedDifferentiation")
            .doesNotContain("(x * 2)");
    }
}
