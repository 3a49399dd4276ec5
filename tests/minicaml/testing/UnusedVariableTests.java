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

import java.util.Set;

import org.junit.jupiter.api.Test;

import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Type;
import minicaml.core.UnusedVariables;

/**
 * Test cases for identifying bound names which are never used.
 *
 */
public class UnusedVariableTests {

	@Test
	public void test_01() {
		check(Fn("x", Type.Int, Plus(Var("x"), I(5))));
	}

	@Test
	public void test_02() {
		check(Let(Decls(ValTuple(I(6), "a", "c")), Tuple(Var("a"), Var("b"))), "c");
	}

	@Test
	public void test_03() {
		Expr e = Let(Decls(Val(I(5), "x"), Val(I(4), "y")), Fn("a", Type.Int, Times(Var("a"), I(3))));
		check(e, "x", "y");
	}

	@Test
	public void test_04() {
		check(Let(Decls(), Tuple(Var("a"))));
	}

	@Test
	public void test_05() {
		Expr e = Let(Decls(ValTuple(I(2), "x", "y")),
				Fn("x", Type.Int, Let(Decls(Val(I(8), "p")), Fn("p", Type.Int, Times(Var("p"), I(4))))));
		check(e, "x", "y", "p");
	}

	@Test
	public void test_06() {
		check(Rec("f", Type.Int, I(1)), "f");
	}

	@Test
	public void test_07() {
		check(factorial());
	}

	@Test
	public void test_08() {
		// A later use of the name does not count once it is shadowed
		Expr e = Let(Decls(Val(I(1), "x"), Val(I(2), "x")), Var("x"));
		check(e, "x");
	}

	public static void check(Expr e, String... expected) {
		assertEquals(Set.of(expected), UnusedVariables.of(e));
	}
}
