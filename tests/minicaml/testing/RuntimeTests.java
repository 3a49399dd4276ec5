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

import org.junit.jupiter.api.Test;

import minicaml.core.BigStepSemantics;
import minicaml.core.NameGenerator;
import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Type;

/**
 * Runtime test cases. Each test should evaluate to the given value without
 * getting stuck.
 *
 */
public class RuntimeTests {
	private static Expr.Integer One = I(1);
	private static Expr.Integer OneTwoThree = I(123);

	// ==============================================================
	// Values & Primitives
	// ==============================================================

	@Test
	public void test_01() {
		check(OneTwoThree, OneTwoThree);
	}

	@Test
	public void test_02() {
		Expr fn = Fn("x", Type.Int, Var("x"));
		check(fn, fn);
	}

	@Test
	public void test_03() {
		check(Plus(I(120), I(3)), OneTwoThree);
	}

	@Test
	public void test_04() {
		check(Minus(I(124), One), OneTwoThree);
	}

	@Test
	public void test_05() {
		check(Times(I(41), I(3)), OneTwoThree);
	}

	@Test
	public void test_06() {
		check(Negate(I(5)), I(-5));
	}

	@Test
	public void test_07() {
		check(Equals(I(3), Plus(One, I(2))), B(true));
	}

	@Test
	public void test_08() {
		check(LessThan(I(3), I(2)), B(false));
	}

	// ==============================================================
	// Conditionals & Tuples
	// ==============================================================

	@Test
	public void test_10() {
		check(If(LessThan(One, I(2)), I(10), I(20)), I(10));
	}

	@Test
	public void test_11() {
		check(If(B(false), I(10), I(20)), I(20));
	}

	@Test
	public void test_12() {
		// Branch not taken is never evaluated
		check(If(B(true), One, Var("stuck")), One);
	}

	@Test
	public void test_13() {
		Expr fn = Fn("x", Type.Int, Var("x"));
		check(Tuple(Plus(One, I(2)), fn, Tuple()), Tuple(I(3), fn, Tuple()));
	}

	// ==============================================================
	// Application & Recursion
	// ==============================================================

	@Test
	public void test_20() {
		check(Apply(Fn("x", Type.Int, Plus(Var("x"), One)), I(5)), I(6));
	}

	@Test
	public void test_21() {
		check(Apply(factorial(), I(5)), I(120));
	}

	@Test
	public void test_22() {
		// Argument is substituted unevaluated, so is never reached
		check(Apply(Fn("x", Type.Int, One), Apply(I(3), I(4))), One);
	}

	@Test
	public void test_23() {
		Expr curried = Fn("x", Type.Int, Fn("y", Type.Int, Minus(Var("x"), Var("y"))));
		check(Apply(Apply(curried, I(10)), I(3)), I(7));
	}

	@Test
	public void test_24() {
		// twice f x = f (f x)
		Expr twice = Fn("f", Arrow(Type.Int, Type.Int), Fn("x", Type.Int, Apply(Var("f"), Apply(Var("f"), Var("x")))));
		Expr inc = Fn("x", Type.Int, Plus(Var("x"), One));
		check(Apply(Apply(twice, inc), I(121)), OneTwoThree);
	}

	@Test
	public void test_25() {
		// sum (n) = if n < 1 then 0 else n + sum (n - 1)
		Expr sum = Rec("sum", Arrow(Type.Int, Type.Int),
				Fn("n", Type.Int, If(LessThan(Var("n"), One), I(0),
						Plus(Var("n"), Apply(Var("sum"), Minus(Var("n"), One))))));
		check(Apply(sum, I(10)), I(55));
	}

	@Test
	public void test_26() {
		// A recursive abstraction need not be a function
		check(Rec("r", Type.Int, I(3)), I(3));
	}

	// ==============================================================
	// Let
	// ==============================================================

	@Test
	public void test_30() {
		check(Let(Decls(), I(3)), I(3));
	}

	@Test
	public void test_31() {
		check(Let(Decls(Val(I(3), "y")), Plus(Var("y"), One)), I(4));
	}

	@Test
	public void test_32() {
		check(Let(Decls(ValTuple(Tuple(I(3), I(4)), "a", "b")), Plus(Var("a"), Var("b"))), I(7));
	}

	@Test
	public void test_33() {
		Expr e = Let(Decls(Val(One, "x"), Val(Plus(Var("x"), One), "x")), Times(Var("x"), I(10)));
		check(e, I(20));
	}

	@Test
	public void test_34() {
		Expr e = Let(Decls(ValTuple(Tuple(Tuple(One, I(2)), B(true)), "p", "q")),
				If(Var("q"), Var("p"), Tuple(I(0), I(0))));
		check(e, Tuple(One, I(2)));
	}

	@Test
	public void test_35() {
		Expr e = Let(Decls(Val(I(1), "y")),
				Apply(Apply(Fn("x", Type.Int, Fn("y", Type.Int, Plus(Var("x"), Var("y")))), Var("y")), I(10)));
		check(e, I(11));
	}

	@Test
	public void test_36() {
		Expr e = Let(Decls(Val(factorial(), "f"), ValTuple(Tuple(I(3), I(4)), "a", "b")),
				Minus(Apply(Var("f"), Var("b")), Apply(Var("f"), Var("a"))));
		check(e, I(18));
	}

	@Test
	public void test_37() {
		Expr e = Let(Decls(ValTuple(Tuple(), new String[0])), OneTwoThree);
		check(e, OneTwoThree);
	}

	public static void check(Expr input, Expr output) {
		BigStepSemantics semantics = new BigStepSemantics(new NameGenerator());
		assertEquals(output, semantics.execute(input));
	}
}
