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

import java.util.List;

import minicaml.core.Syntax.Decl;
import minicaml.core.Syntax.Expr;
import minicaml.util.AbstractTransformer;
import minicaml.util.Pair;

/**
 * Capture-avoiding substitution. Applying <code>[e/x]</code> to an expression
 * replaces the free occurrences of <code>x</code> by <code>e</code>, renaming
 * any binder which would otherwise capture a free variable of <code>e</code>.
 * For example, <code>[y/x](fn (y:int) => x)</code> gives
 * <code>fn (1y:int) => y</code> rather than <code>fn (y:int) => y</code>.
 *
 * Input trees are never modified. Literals, variables and binders under which
 * the target does not occur free are returned as is, whilst other compound
 * nodes are rebuilt. Hence, substituting for an absent name never renames.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class Substituter extends AbstractTransformer<Substitution, Expr> {
	private final NameGenerator names;

	public Substituter(NameGenerator names) {
		this.names = names;
	}

	/**
	 * Compute <code>[replacement/target]expr</code>.
	 *
	 * @param replacement
	 * @param target
	 * @param expr
	 * @return
	 */
	public Expr subst(Expr replacement, String target, Expr expr) {
		return apply(new Substitution(replacement, target), expr);
	}

	/**
	 * Apply a sequence of substitutions to an expression, where the last is
	 * applied innermost. That is,
	 * <code>[e1/x1]([e2/x2](...([en/xn]expr)))</code>.
	 *
	 * @param substitutions
	 * @param expr
	 * @return
	 */
	public Expr substAll(List<Pair<Expr, String>> substitutions, Expr expr) {
		for (int i = substitutions.size() - 1; i >= 0; --i) {
			Pair<Expr, String> s = substitutions.get(i);
			expr = subst(s.first(), s.second(), expr);
		}
		return expr;
	}

	/**
	 * Replace free occurrences of a given name in an expression with a fresh
	 * version of that name.
	 *
	 * @param name
	 * @param expr
	 * @return The fresh name, and the renamed expression.
	 */
	public Pair<String, Expr> rename(String name, Expr expr) {
		String fresh = names.next(name);
		return new Pair<>(fresh, subst(new Expr.Variable(fresh), name, expr));
	}

	/**
	 * Rename each of a sequence of names in turn within an expression.
	 *
	 * @param names
	 * @param expr
	 * @return The fresh names (in order), and the renamed expression.
	 */
	public Pair<String[], Expr> renameAll(String[] names, Expr expr) {
		String[] fresh = new String[names.length];
		for (int i = 0; i != names.length; ++i) {
			Pair<String, Expr> p = rename(names[i], expr);
			fresh[i] = p.first();
			expr = p.second();
		}
		return new Pair<>(fresh, expr);
	}

	@Override
	protected Expr apply(Substitution s, Expr.Integer expr) {
		return expr;
	}

	@Override
	protected Expr apply(Substitution s, Expr.Boolean expr) {
		return expr;
	}

	@Override
	protected Expr apply(Substitution s, Expr.If expr) {
		return new Expr.If(apply(s, expr.condition()), apply(s, expr.trueBranch()), apply(s, expr.falseBranch()),
				expr.attributes());
	}

	@Override
	protected Expr apply(Substitution s, Expr.Operation expr) {
		return new Expr.Operation(expr.operator(), apply(s, expr.toArray()), expr.attributes());
	}

	@Override
	protected Expr apply(Substitution s, Expr.Tuple expr) {
		return new Expr.Tuple(apply(s, expr.toArray()), expr.attributes());
	}

	@Override
	protected Expr apply(Substitution s, Expr.Fn expr) {
		String y = expr.name();
		if (y.equals(s.target())) {
			// Binder shadows the target
			return expr;
		}
		Expr body = expr.body();
		if (!FreeVariables.isFree(s.target(), body)) {
			// Nothing to substitute
			return expr;
		} else if (s.captures(y)) {
			Pair<String, Expr> p = rename(y, body);
			y = p.first();
			body = p.second();
		}
		return new Expr.Fn(y, expr.type(), apply(s, body), expr.attributes());
	}

	@Override
	protected Expr apply(Substitution s, Expr.Rec expr) {
		String f = expr.name();
		if (f.equals(s.target())) {
			// Binder shadows the target
			return expr;
		}
		Expr body = expr.body();
		if (!FreeVariables.isFree(s.target(), body)) {
			// Nothing to substitute
			return expr;
		} else if (s.captures(f)) {
			Pair<String, Expr> p = rename(f, body);
			f = p.first();
			body = p.second();
		}
		return new Expr.Rec(f, expr.type(), apply(s, body), expr.attributes());
	}

	@Override
	protected Expr.Let apply(Substitution s, Expr.Let expr) {
		if (expr.size() == 0) {
			return new Expr.Let(new Decl[0], apply(s, expr.body()), expr.attributes());
		}
		Decl head = expr.get(0);
		// The initialiser is outside the scope of its own binder
		Expr initialiser = apply(s, head.initialiser());
		String[] bound = head.names();
		Expr rest = expr.tail();
		if (contains(bound, s.target()) || !FreeVariables.isFree(s.target(), rest)) {
			// Binder shadows the target in the remainder, or it does not occur there
			Decl[] decls = expr.toArray();
			decls[0] = head.rebuild(initialiser, bound);
			return new Expr.Let(decls, expr.body(), expr.attributes());
		}
		// Rename only those bound names which would capture
		for (int i = 0; i != bound.length; ++i) {
			if (s.captures(bound[i])) {
				Pair<String, Expr> p = rename(bound[i], rest);
				bound[i] = p.first();
				rest = p.second();
			}
		}
		// Substitution maps a let onto a let
		Expr.Let r = (Expr.Let) apply(s, rest);
		return r.prepend(head.rebuild(initialiser, bound), expr.attributes());
	}

	@Override
	protected Expr apply(Substitution s, Expr.Apply expr) {
		return new Expr.Apply(apply(s, expr.function()), apply(s, expr.argument()), expr.attributes());
	}

	@Override
	protected Expr apply(Substitution s, Expr.Variable expr) {
		if (expr.name().equals(s.target())) {
			return s.replacement();
		} else {
			return expr;
		}
	}

	private Expr[] apply(Substitution s, Expr[] exprs) {
		Expr[] nexprs = new Expr[exprs.length];
		for (int i = 0; i != exprs.length; ++i) {
			nexprs[i] = apply(s, exprs[i]);
		}
		return nexprs;
	}

	private static boolean contains(String[] names, String name) {
		for (String n : names) {
			if (n.equals(name)) {
				return true;
			}
		}
		return false;
	}
}
