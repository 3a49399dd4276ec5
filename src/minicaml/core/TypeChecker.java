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
package minicaml.core;

import java.util.NoSuchElementException;

import minicaml.core.Syntax.Decl;
import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Operator;
import minicaml.core.Syntax.Type;
import minicaml.util.AbstractTransformer;
import minicaml.util.SyntacticElement;
import minicaml.util.TypeError;

/**
 * Responsible for inferring the type of an expression in a given typing
 * context. Inference is deterministic and does not backtrack: the first rule
 * violated raises a <code>TypeError</code>.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class TypeChecker extends AbstractTransformer<TypeChecker.Context, Type> {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;
	// Error messages
	public final static String FREE_VARIABLE = "found free variable";
	public final static String EXPECTED_BOOL = "expected bool";
	public final static String INCOMPATIBLE_TYPE = "incompatible type";
	public final static String BRANCH_MISMATCH = "branches of if have different types";
	public final static String EXPECTED_FUNCTION = "expected function type";
	public final static String EXPECTED_TUPLE = "expected tuple type";
	public final static String ARITY_MISMATCH = "incorrect number of operands or names";

	/**
	 * Infer the type of a given expression in a given context.
	 *
	 * @param ctx
	 * @param expr
	 * @return
	 */
	public Type infer(Context ctx, Expr expr) {
		return apply(ctx, expr);
	}

	@Override
	public Type apply(Context ctx, Expr expr) {
		Type t = super.apply(ctx, expr);
		if (DEBUG) {
			System.err.println(ctx + " |- " + expr + " : " + t);
		}
		return t;
	}

	/**
	 * T-Int
	 */
	@Override
	protected Type apply(Context ctx, Expr.Integer expr) {
		return Type.Int;
	}

	/**
	 * T-Bool
	 */
	@Override
	protected Type apply(Context ctx, Expr.Boolean expr) {
		return Type.Bool;
	}

	/**
	 * T-If
	 */
	@Override
	protected Type apply(Context ctx, Expr.If expr) {
		Type c = apply(ctx, expr.condition());
		checkEquals(Type.Bool, c, EXPECTED_BOOL, expr.condition());
		Type t1 = apply(ctx, expr.trueBranch());
		Type t2 = apply(ctx, expr.falseBranch());
		checkEquals(t1, t2, BRANCH_MISMATCH, expr.falseBranch());
		return t1;
	}

	/**
	 * T-Op
	 */
	@Override
	protected Type apply(Context ctx, Expr.Operation expr) {
		Operator op = expr.operator();
		check(expr.size() == op.arity(), ARITY_MISMATCH, expr);
		for (int i = 0; i != expr.size(); ++i) {
			Type t = apply(ctx, expr.get(i));
			checkEquals(op.domain(i), t, INCOMPATIBLE_TYPE, expr.get(i));
		}
		return op.range();
	}

	/**
	 * T-Tuple
	 */
	@Override
	protected Type apply(Context ctx, Expr.Tuple expr) {
		Type[] types = new Type[expr.size()];
		for (int i = 0; i != types.length; ++i) {
			types[i] = apply(ctx, expr.get(i));
		}
		return new Type.Product(types);
	}

	/**
	 * T-Fn
	 */
	@Override
	protected Type apply(Context ctx, Expr.Fn expr) {
		Type T = apply(ctx.extend(expr.name(), expr.type()), expr.body());
		return new Type.Arrow(expr.type(), T);
	}

	/**
	 * T-Rec. The body must have exactly the declared type.
	 */
	@Override
	protected Type apply(Context ctx, Expr.Rec expr) {
		Type T = apply(ctx.extend(expr.name(), expr.type()), expr.body());
		checkEquals(expr.type(), T, INCOMPATIBLE_TYPE, expr.body());
		return expr.type();
	}

	/**
	 * T-Let and T-LetTuple
	 */
	@Override
	protected Type apply(Context ctx, Expr.Let expr) {
		if (expr.size() == 0) {
			return apply(ctx, expr.body());
		}
		Decl head = expr.get(0);
		Type T = apply(ctx, head.initialiser());
		if (head instanceof Decl.Val) {
			ctx = ctx.extend(((Decl.Val) head).name(), T);
		} else {
			String[] names = head.names();
			if (!(T instanceof Type.Product)) {
				throw new TypeError(EXPECTED_TUPLE, null, T, head.initialiser());
			}
			Type.Product P = (Type.Product) T;
			check(P.size() == names.length, ARITY_MISMATCH, head);
			Type[] types = new Type[P.size()];
			for (int i = 0; i != types.length; ++i) {
				types[i] = P.get(i);
			}
			ctx = ctx.extend(names, types);
		}
		return apply(ctx, expr.tail());
	}

	/**
	 * T-App
	 */
	@Override
	protected Type apply(Context ctx, Expr.Apply expr) {
		Type F = apply(ctx, expr.function());
		if (!(F instanceof Type.Arrow)) {
			throw new TypeError(EXPECTED_FUNCTION, null, F, expr.function());
		}
		Type.Arrow A = (Type.Arrow) F;
		Type T = apply(ctx, expr.argument());
		checkEquals(A.domain(), T, INCOMPATIBLE_TYPE, expr.argument());
		return A.range();
	}

	/**
	 * T-Var
	 */
	@Override
	protected Type apply(Context ctx, Expr.Variable expr) {
		try {
			return ctx.lookup(expr.name());
		} catch (NoSuchElementException e) {
			throw new TypeError(FREE_VARIABLE + " (" + expr.name() + ")", expr);
		}
	}

	public void check(boolean result, String msg, SyntacticElement e) {
		if (!result) {
			throw new TypeError(msg, e);
		}
	}

	public void checkEquals(Type expected, Type found, String msg, SyntacticElement e) {
		if (!expected.equals(found)) {
			throw new TypeError(msg, expected, found, e);
		}
	}

	/**
	 * A typing context is an ordered sequence of bindings from names to types.
	 * Later bindings shadow earlier ones. Contexts are persistent: extending a
	 * context produces a new one which shares the original.
	 *
	 */
	public static class Context {
		/**
		 * The context with no bindings.
		 */
		public static final Context EMPTY = new Context(null, null, null);

		private final String name;
		private final Type type;
		private final Context parent;

		private Context(String name, Type type, Context parent) {
			this.name = name;
			this.type = type;
			this.parent = parent;
		}

		/**
		 * Get the type of the most recent binding for a given name.
		 *
		 * @param name
		 * @return
		 * @throws NoSuchElementException if there is no binding for the name.
		 */
		public Type lookup(String name) {
			for (Context c = this; c != EMPTY; c = c.parent) {
				if (c.name.equals(name)) {
					return c.type;
				}
			}
			throw new NoSuchElementException("no binding for " + name);
		}

		/**
		 * Add a binding to this context.
		 *
		 * @param name
		 * @param type
		 * @return
		 */
		public Context extend(String name, Type type) {
			return new Context(name, type, this);
		}

		/**
		 * Add bindings pairwise to this context, from left to right.
		 *
		 * @param names
		 * @param types
		 * @return
		 */
		public Context extend(String[] names, Type[] types) {
			if (names.length != types.length) {
				throw new IllegalArgumentException("mismatched names and types");
			}
			Context c = this;
			for (int i = 0; i != names.length; ++i) {
				c = c.extend(names[i], types[i]);
			}
			return c;
		}

		public boolean isEmpty() {
			return this == EMPTY;
		}

		@Override
		public String toString() {
			String r = "";
			for (Context c = this; c != EMPTY; c = c.parent) {
				r = c.name + ":" + c.type + (r.isEmpty() ? "" : ", ") + r;
			}
			return "{" + r + "}";
		}
	}
}
