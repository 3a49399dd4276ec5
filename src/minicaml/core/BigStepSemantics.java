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

import java.util.ArrayList;
import java.util.List;

import minicaml.core.Syntax.Decl;
import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Operator;
import minicaml.util.AbstractTransformer;
import minicaml.util.EvaluationLimitError;
import minicaml.util.Pair;
import minicaml.util.StuckError;

/**
 * Encodes the operational semantics of MiniCaml as a recursive big-step
 * evaluator. There is no environment: binders are eliminated by substituting
 * for the bound name before evaluation continues. Evaluation is only defined
 * for closed expressions, and produces a value (i.e. an integer, boolean,
 * function abstraction or tuple of values).
 *
 * The state threaded through evaluation is the current recursion depth, which
 * is checked against the (optional) depth bound.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class BigStepSemantics extends AbstractTransformer<Integer, Expr> {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;
	/**
	 * Depth bound indicating evaluation is unbounded.
	 */
	public static final int UNBOUNDED = 0;
	// Error messages
	public final static String FREE_VARIABLE = "free variable during evaluation";
	public final static String BAD_PRIMITIVE_ARGUMENTS = "bad arguments to primitive operation";
	public final static String NON_BOOLEAN_CONDITION = "condition of if is not true or false";
	public final static String NOT_A_FUNCTION = "left term of application is not a function";
	public final static String NOT_A_TUPLE = "tuple declaration bound to non-tuple value";
	public final static String ARITY_MISMATCH = "tuple declaration bound to tuple of different arity";

	private final Substituter substituter;
	private final int maxDepth;

	public BigStepSemantics(NameGenerator names) {
		this(names, UNBOUNDED);
	}

	/**
	 * Construct an evaluator with a bound on its recursion depth.
	 *
	 * @param names    Generator used for renaming binders during substitution.
	 * @param maxDepth Maximum recursion depth, or <code>UNBOUNDED</code>.
	 */
	public BigStepSemantics(NameGenerator names, int maxDepth) {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("invalid depth bound: " + maxDepth);
		}
		this.substituter = new Substituter(names);
		this.maxDepth = maxDepth;
	}

	/**
	 * Evaluate a closed expression to a value.
	 *
	 * @param expr
	 * @return
	 */
	public Expr execute(Expr expr) {
		return apply(0, expr);
	}

	@Override
	public Expr apply(Integer depth, Expr expr) {
		if (maxDepth != UNBOUNDED && depth > maxDepth) {
			throw new EvaluationLimitError(maxDepth, expr);
		}
		Expr v = super.apply(depth, expr);
		if (DEBUG) {
			System.err.println(expr + " ==> " + v);
		}
		return v;
	}

	/**
	 * Rule R-Const.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Integer expr) {
		return expr;
	}

	/**
	 * Rule R-Const.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Boolean expr) {
		return expr;
	}

	/**
	 * Rule R-IfTrue and R-IfFalse.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.If expr) {
		Expr c = apply(depth + 1, expr.condition());
		if (!(c instanceof Expr.Boolean)) {
			throw new StuckError(NON_BOOLEAN_CONDITION, expr);
		} else if (((Expr.Boolean) c).value()) {
			return apply(depth + 1, expr.trueBranch());
		} else {
			return apply(depth + 1, expr.falseBranch());
		}
	}

	/**
	 * Rule R-Op.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Operation expr) {
		// Evaluate operands left to right
		Expr[] values = new Expr[expr.size()];
		for (int i = 0; i != values.length; ++i) {
			values[i] = apply(depth + 1, expr.get(i));
		}
		Expr v = evaluate(expr.operator(), values);
		if (v == null) {
			throw new StuckError(BAD_PRIMITIVE_ARGUMENTS, expr);
		}
		return v;
	}

	/**
	 * Rule R-Tuple.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Tuple expr) {
		Expr[] values = new Expr[expr.size()];
		for (int i = 0; i != values.length; ++i) {
			values[i] = apply(depth + 1, expr.get(i));
		}
		return new Expr.Tuple(values);
	}

	/**
	 * Rule R-Fn.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Fn expr) {
		return expr;
	}

	/**
	 * Rule R-Rec. The recursive abstraction is unfolded by substituting itself
	 * for its own name.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Rec expr) {
		return apply(depth + 1, substituter.subst(expr, expr.name(), expr.body()));
	}

	/**
	 * Rule R-Let and R-LetTuple.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Let expr) {
		if (expr.size() == 0) {
			return apply(depth + 1, expr.body());
		}
		Decl head = expr.get(0);
		Expr.Let rest = expr.tail();
		// Declarations are strict
		Expr v = apply(depth + 1, head.initialiser());
		if (head instanceof Decl.Val) {
			String x = ((Decl.Val) head).name();
			return apply(depth + 1, substituter.subst(v, x, rest));
		} else {
			String[] xs = head.names();
			if (!(v instanceof Expr.Tuple)) {
				throw new StuckError(NOT_A_TUPLE, expr);
			}
			Expr.Tuple t = (Expr.Tuple) v;
			if (t.size() != xs.length) {
				throw new StuckError(ARITY_MISMATCH, expr);
			}
			List<Pair<Expr, String>> substitutions = new ArrayList<>();
			for (int i = 0; i != xs.length; ++i) {
				substitutions.add(new Pair<>(t.get(i), xs[i]));
			}
			return apply(depth + 1, substituter.substAll(substitutions, rest));
		}
	}

	/**
	 * Rule R-App. Note the argument is substituted unevaluated.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Apply expr) {
		Expr f = apply(depth + 1, expr.function());
		if (!(f instanceof Expr.Fn)) {
			throw new StuckError(NOT_A_FUNCTION, expr);
		}
		Expr.Fn fn = (Expr.Fn) f;
		return apply(depth + 1, substituter.subst(expr.argument(), fn.name(), fn.body()));
	}

	/**
	 * Variables are substituted away before they can be reached, so any
	 * variable encountered here is free.
	 */
	@Override
	protected Expr apply(Integer depth, Expr.Variable expr) {
		throw new StuckError(FREE_VARIABLE + " (" + expr.name() + ")", expr);
	}

	/**
	 * Apply a primitive operator to a given sequence of values, producing
	 * <code>null</code> if the values are not of the right shape.
	 *
	 * @param op
	 * @param values
	 * @return
	 */
	private static Expr evaluate(Operator op, Expr[] values) {
		if (values.length != op.arity()) {
			return null;
		}
		int[] is = new int[values.length];
		for (int i = 0; i != values.length; ++i) {
			if (!(values[i] instanceof Expr.Integer)) {
				return null;
			}
			is[i] = ((Expr.Integer) values[i]).value();
		}
		switch (op) {
		case EQUALS:
			return new Expr.Boolean(is[0] == is[1]);
		case LESSTHAN:
			return new Expr.Boolean(is[0] < is[1]);
		case PLUS:
			return new Expr.Integer(is[0] + is[1]);
		case MINUS:
			return new Expr.Integer(is[0] - is[1]);
		case TIMES:
			return new Expr.Integer(is[0] * is[1]);
		case NEGATE:
			return new Expr.Integer(-is[0]);
		default:
			return null;
		}
	}
}
