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
package minicaml.util;

import minicaml.core.Syntax;
import minicaml.core.Syntax.Expr;

/**
 * Provides a common dispatch over the syntactic forms of an expression. Every
 * form has its own abstract <code>apply</code> method, so any transformer
 * (e.g. evaluation, type inference, substitution) is obliged to give a rule for
 * every form.
 *
 * @param <T> The state threaded through the transformer (e.g. a typing
 *            context or a substitution)
 * @param <S> The result of transforming an expression
 */
public abstract class AbstractTransformer<T, S> {

	public S apply(T state, Expr expr) {
		switch (expr.getOpcode()) {
		case Syntax.EXPR_integer:
			return apply(state, (Expr.Integer) expr);
		case Syntax.EXPR_boolean:
			return apply(state, (Expr.Boolean) expr);
		case Syntax.EXPR_if:
			return apply(state, (Expr.If) expr);
		case Syntax.EXPR_operation:
			return apply(state, (Expr.Operation) expr);
		case Syntax.EXPR_tuple:
			return apply(state, (Expr.Tuple) expr);
		case Syntax.EXPR_fn:
			return apply(state, (Expr.Fn) expr);
		case Syntax.EXPR_rec:
			return apply(state, (Expr.Rec) expr);
		case Syntax.EXPR_let:
			return apply(state, (Expr.Let) expr);
		case Syntax.EXPR_apply:
			return apply(state, (Expr.Apply) expr);
		case Syntax.EXPR_variable:
			return apply(state, (Expr.Variable) expr);
		}
		// Give up
		throw new IllegalArgumentException("Invalid expression encountered: " + expr);
	}

	/**
	 * Apply this transformer to a given integer literal.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Integer expr);

	/**
	 * Apply this transformer to a given boolean literal.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Boolean expr);

	/**
	 * Apply this transformer to a given conditional.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.If expr);

	/**
	 * Apply this transformer to a given primitive operation.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Operation expr);

	/**
	 * Apply this transformer to a given tuple construction.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Tuple expr);

	/**
	 * Apply this transformer to a given function abstraction.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Fn expr);

	/**
	 * Apply this transformer to a given recursive abstraction.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Rec expr);

	/**
	 * Apply this transformer to a given let expression.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Let expr);

	/**
	 * Apply this transformer to a given function application.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Apply expr);

	/**
	 * Apply this transformer to a given variable reference.
	 *
	 * @param state The current state (e.g. typing context or substitution)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	protected abstract S apply(T state, Expr.Variable expr);
}
