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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import minicaml.core.Syntax.Decl;
import minicaml.core.Syntax.Expr;
import minicaml.util.AbstractTransformer;

/**
 * Computes the set of names occurring free in an expression. The set has a
 * stable (insertion) order, though this carries no meaning.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class FreeVariables extends AbstractTransformer<Void, Set<String>> {
	private static final FreeVariables INSTANCE = new FreeVariables();

	/**
	 * Determine the free variables of a given expression.
	 *
	 * @param expr
	 * @return
	 */
	public static Set<String> of(Expr expr) {
		return Collections.unmodifiableSet(INSTANCE.apply(null, expr));
	}

	/**
	 * Determine whether a given name occurs free in an expression.
	 *
	 * @param name
	 * @param expr
	 * @return
	 */
	public static boolean isFree(String name, Expr expr) {
		return INSTANCE.apply(null, expr).contains(name);
	}

	@Override
	protected Set<String> apply(Void state, Expr.Integer expr) {
		return new LinkedHashSet<>();
	}

	@Override
	protected Set<String> apply(Void state, Expr.Boolean expr) {
		return new LinkedHashSet<>();
	}

	@Override
	protected Set<String> apply(Void state, Expr.If expr) {
		Set<String> r = apply(state, expr.condition());
		r.addAll(apply(state, expr.trueBranch()));
		r.addAll(apply(state, expr.falseBranch()));
		return r;
	}

	@Override
	protected Set<String> apply(Void state, Expr.Operation expr) {
		return union(state, expr.toArray());
	}

	@Override
	protected Set<String> apply(Void state, Expr.Tuple expr) {
		return union(state, expr.toArray());
	}

	@Override
	protected Set<String> apply(Void state, Expr.Fn expr) {
		Set<String> r = apply(state, expr.body());
		r.remove(expr.name());
		return r;
	}

	@Override
	protected Set<String> apply(Void state, Expr.Rec expr) {
		Set<String> r = apply(state, expr.body());
		r.remove(expr.name());
		return r;
	}

	@Override
	protected Set<String> apply(Void state, Expr.Let expr) {
		if (expr.size() == 0) {
			return apply(state, expr.body());
		}
		Decl head = expr.get(0);
		// Names bound by the first declaration scope over the remainder only
		Set<String> rest = apply(state, expr.tail());
		for (String name : head.names()) {
			rest.remove(name);
		}
		Set<String> r = apply(state, head.initialiser());
		r.addAll(rest);
		return r;
	}

	@Override
	protected Set<String> apply(Void state, Expr.Apply expr) {
		Set<String> r = apply(state, expr.function());
		r.addAll(apply(state, expr.argument()));
		return r;
	}

	@Override
	protected Set<String> apply(Void state, Expr.Variable expr) {
		Set<String> r = new LinkedHashSet<>();
		r.add(expr.name());
		return r;
	}

	private Set<String> union(Void state, Expr[] exprs) {
		Set<String> r = new LinkedHashSet<>();
		for (Expr e : exprs) {
			r.addAll(apply(state, e));
		}
		return r;
	}
}
