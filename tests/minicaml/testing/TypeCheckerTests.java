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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Operator;
import minicaml.core.Syntax.Type;
import minicaml.core.TypeChecker;
import minicaml.core.TypeChecker.Context;
import minicaml.util.SyntacticElement.Attribute;
import minicaml.util.TypeError;

/**
 * Test cases for type inference. Valid tests check the inferred type, whilst
 * invalid tests check a type error is raised.
 *
 */
public class TypeCheckerTests {
	private static Type IntToInt = Arrow(Type.Int, Type.Int);

	// ==============================================================
	// Valid
	// ==============================================================

	@Test
	public void test_01() {
		check(I(1), Type.Int);
	}

	@Test
	public void test_02() {
		check(B(false), Type.Bool);
	}

	@Test
	public void test_03() {
		check(Fn("x", Type.Int, Plus(Var("x"), I(1))), IntToInt);
	}

	@Test
	public void test_04() {
		check(If(LessThan(I(1), I(2)), B(true), Equals(I(3), I(4))), Type.Bool);
	}

	@Test
	public void test_05() {
		check(Tuple(I(1), B(true), Tuple()), Product(Type.Int, Type.Bool, Product()));
	}

	@Test
	public void test_06() {
		check(factorial(), IntToInt);
	}

	@Test
	public void test_07() {
		check(Apply(factorial(), I(5)), Type.Int);
	}

	@Test
	public void test_08() {
		check(Fn("x", Type.Bool, Fn("x", Type.Int, Var("x"))), Arrow(Type.Bool, IntToInt));
	}

	@Test
	public void test_09() {
		Expr e = Let(Decls(Val(I(3), "x"), ValTuple(Tuple(Var("x"), B(true)), "a", "b")),
				If(Var("b"), Var("a"), Var("x")));
		check(e, Type.Int);
	}

	@Test
	public void test_10() {
		check(Let(Decls(), B(true)), Type.Bool);
	}

	@Test
	public void test_11() {
		check(Context.EMPTY.extend("x", Type.Bool), Var("x"), Type.Bool);
	}

	@Test
	public void test_12() {
		// Most recent binding wins
		Context ctx = Context.EMPTY.extend("x", Type.Int).extend("x", Type.Bool);
		check(ctx, Var("x"), Type.Bool);
	}

	@Test
	public void test_13() {
		Expr twice = Fn("f", IntToInt, Fn("x", Type.Int, Apply(Var("f"), Apply(Var("f"), Var("x")))));
		check(twice, Arrow(IntToInt, IntToInt));
	}

	@Test
	public void test_14() {
		check(Negate(I(4)), Type.Int);
	}

	@Test
	public void test_15() {
		check(Context.EMPTY.extend("f", IntToInt), Apply(Var("f"), I(1)), Type.Int);
	}

	// ==============================================================
	// Invalid
	// ==============================================================

	@Test
	public void test_30() {
		TypeError e = checkInvalid(If(B(true), I(1), B(false)));
		assertEquals(Type.Int, e.expected());
		assertEquals(Type.Bool, e.found());
	}

	@Test
	public void test_31() {
		TypeError e = checkInvalid(Let(Decls(ValTuple(Tuple(I(3), I(4)), "a", "b", "c")), Var("a")));
		assertEquals(TypeChecker.ARITY_MISMATCH, e.msg());
	}

	@Test
	public void test_32() {
		TypeError e = checkInvalid(Let(Decls(ValTuple(I(3), "a")), Var("a")));
		assertEquals(TypeChecker.EXPECTED_TUPLE, e.msg());
		assertEquals(Type.Int, e.found());
	}

	@Test
	public void test_33() {
		TypeError e = checkInvalid(Var("x"));
		assertTrue(e.msg().startsWith(TypeChecker.FREE_VARIABLE));
	}

	@Test
	public void test_34() {
		TypeError e = checkInvalid(Plus(I(1), B(true)));
		assertEquals(Type.Int, e.expected());
		assertEquals(Type.Bool, e.found());
		assertEquals("incompatible type\nExpected type int\nFound type bool", e.getMessage());
	}

	@Test
	public void test_35() {
		TypeError e = checkInvalid(If(I(1), I(1), I(2)));
		assertEquals(TypeChecker.EXPECTED_BOOL, e.msg());
		assertEquals(Type.Bool, e.expected());
		assertEquals(Type.Int, e.found());
	}

	@Test
	public void test_36() {
		TypeError e = checkInvalid(Rec("f", Type.Int, B(true)));
		assertEquals(Type.Int, e.expected());
		assertEquals(Type.Bool, e.found());
	}

	@Test
	public void test_37() {
		TypeError e = checkInvalid(Apply(I(1), I(2)));
		assertEquals(TypeChecker.EXPECTED_FUNCTION, e.msg());
	}

	@Test
	public void test_38() {
		TypeError e = checkInvalid(Apply(Fn("x", Type.Int, Var("x")), B(true)));
		assertEquals(Type.Int, e.expected());
		assertEquals(Type.Bool, e.found());
	}

	@Test
	public void test_39() {
		TypeError e = checkInvalid(new Expr.Operation(Operator.PLUS, new Expr[] { I(1) }));
		assertEquals(TypeChecker.ARITY_MISMATCH, e.msg());
	}

	@Test
	public void test_40() {
		// Binding is not visible outside the function
		checkInvalid(Tuple(Fn("x", Type.Int, Var("x")), Var("x")));
	}

	@Test
	public void test_41() {
		// A recursive function must be declared with its function type
		checkInvalid(Rec("f", Type.Int, Fn("x", Type.Int, Var("x"))));
	}

	@Test
	public void test_42() {
		// Type error is reported at the offending element
		Expr x = new Expr.Variable("x", new Attribute.Source(4, 6));
		TypeError e = checkInvalid(Plus(I(1), x));
		assertEquals(4, e.start());
		assertEquals(6, e.end());
	}

	@Test
	public void test_43() {
		TypeError e = checkInvalid(Plus(I(1), B(true)));
		assertEquals(-1, e.start());
	}

	// ==============================================================
	// Contexts
	// ==============================================================

	@Test
	public void test_50() {
		Context c1 = Context.EMPTY.extend("x", Type.Int);
		Context c2 = c1.extend("x", Type.Bool);
		assertEquals(Type.Int, c1.lookup("x"));
		assertEquals(Type.Bool, c2.lookup("x"));
	}

	@Test
	public void test_51() {
		Context c = Context.EMPTY.extend(new String[] { "x", "y" }, new Type[] { Type.Int, Type.Bool });
		assertEquals("{x:int, y:bool}", c.toString());
		assertTrue(Context.EMPTY.isEmpty());
	}

	@Test
	public void test_52() {
		TypeError e = checkInvalid(Var("y"));
		assertNull(e.expected());
	}

	public static void check(Expr input, Type output) {
		check(Context.EMPTY, input, output);
	}

	public static void check(Context ctx, Expr input, Type output) {
		assertEquals(output, new TypeChecker().infer(ctx, input));
	}

	public static TypeError checkInvalid(Expr input) {
		return assertThrows(TypeError.class, () -> new TypeChecker().infer(Context.EMPTY, input));
	}
}
