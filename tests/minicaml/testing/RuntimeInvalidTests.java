// This file is part of the MiniCaml Interpreter (mci).
//
// The MiniCaml Interpreter is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The MiniCaml Interpreter is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the MiniCaml Interpreter. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2026, The MiniCaml Interpreter Authors.
package minicaml.testing;

import static minicaml.testing.Builders.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import minicaml.core.BigStepSemantics;
import minicaml.core.NameGenerator;
import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Operator;
import minicaml.core.Syntax.Type;
import minicaml.util.EvaluationLimitError;
import minicaml.util.StuckError;

/**
 * Runtime test cases which should get stuck (or, when evaluation is bounded,
 * exceed their bound).
 *
 */
public class RuntimeInvalidTests {

	@Test
	public void test_01() {
		StuckError e = checkStuck(Var("x"));
		assertTrue(e.getMessage().startsWith(BigStepSemantics.FREE_VARIABLE));
		assertEquals(Var("x"), e.term());
	}

	@Test
	public void test_02() {
		checkStuck(Plus(B(true), I(1)), BigStepSemantics.BAD_PRIMITIVE_ARGUMENTS);
	}

	@Test
	public void test_03() {
		checkStuck(new Expr.Operation(Operator.NEGATE, new Expr[] { I(1), I(2) }),
				BigStepSemantics.BAD_PRIMITIVE_ARGUMENTS);
	}

	@Test
	public void test_04() {
		checkStuck(If(I(1), I(2), I(3)), BigStepSemantics.NON_BOOLEAN_CONDITION);
	}

	@Test
	public void test_05() {
		checkStuck(Apply(I(3), I(4)), BigStepSemantics.NOT_A_FUNCTION);
	}

	@Test
	public void test_06() {
		checkStuck(Let(Decls(ValTuple(Tuple(I(3), I(4)), "a", "b", "c")), Var("a")),
				BigStepSemantics.ARITY_MISMATCH);
	}

	@Test
	public void test_07() {
		checkStuck(Let(Decls(ValTuple(I(3), "a")), Var("a")), BigStepSemantics.NOT_A_TUPLE);
	}

	@Test
	public void test_08() {
		// Declarations are evaluated even when unused
		checkStuck(Let(Decls(Val(Apply(I(3), I(4)), "x")), I(1)), BigStepSemantics.NOT_A_FUNCTION);
	}

	@Test
	public void test_09() {
		// Operands are evaluated before the operator is applied
		checkStuck(Negate(Plus(I(1), Var("y"))));
	}

	// ==============================================================
	// Divergence
	// ==============================================================

	@Test
	public void test_10() {
		checkDiverges(Rec("f", Type.Int, Var("f")), 1000);
	}

	@Test
	public void test_11() {
		Expr loop = Rec("f", Arrow(Type.Int, Type.Int), Fn("x", Type.Int, Apply(Var("f"), Var("x"))));
		checkDiverges(Apply(loop, I(0)), 500);
	}

	@Test
	public void test_12() {
		// Bound is large enough for a terminating program
		BigStepSemantics semantics = new BigStepSemantics(new NameGenerator(), 1000);
		assertEquals(I(720), semantics.execute(Apply(factorial(), I(6))));
	}

	public static StuckError checkStuck(Expr input) {
		BigStepSemantics semantics = new BigStepSemantics(new NameGenerator());
		return assertThrows(StuckError.class, () -> semantics.execute(input));
	}

	public static void checkStuck(Expr input, String message) {
		assertEquals(message, checkStuck(input).getMessage());
	}

	public static void checkDiverges(Expr input, int bound) {
		BigStepSemantics semantics = new BigStepSemantics(new NameGenerator(), bound);
		EvaluationLimitError e = assertThrows(EvaluationLimitError.class, () -> semantics.execute(input));
		assertEquals(bound, e.limit());
	}
}
