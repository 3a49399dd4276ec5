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
package minicaml;

import java.util.Set;

import minicaml.core.BigStepSemantics;
import minicaml.core.FreeVariables;
import minicaml.core.NameGenerator;
import minicaml.core.Substituter;
import minicaml.core.Syntax.Expr;
import minicaml.core.Syntax.Type;
import minicaml.core.TypeChecker;
import minicaml.core.UnusedVariables;
import minicaml.util.EvaluationLimitError;
import minicaml.util.Outcome;
import minicaml.util.StuckError;
import minicaml.util.TypeError;

/**
 * Entry point for clients of the MiniCaml core (e.g. a parser or driver).
 * Provides type checking, evaluation and substitution over expression trees,
 * reporting failures as an <code>Outcome</code> rather than an exception.
 *
 * Each instance owns (or is given) a <code>NameGenerator</code>, so separate
 * instances rename binders independently. The generator is only reset when a
 * client explicitly asks for it.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class MiniCaml {
	private final NameGenerator names;
	private final Substituter substituter;
	private final TypeChecker checker;
	private final BigStepSemantics semantics;

	public MiniCaml() {
		this(new NameGenerator(), BigStepSemantics.UNBOUNDED);
	}

	/**
	 * Construct an instance using a given name generator and evaluation depth
	 * bound.
	 *
	 * @param names
	 * @param maxDepth Maximum evaluation depth, or
	 *                 <code>BigStepSemantics.UNBOUNDED</code>.
	 */
	public MiniCaml(NameGenerator names, int maxDepth) {
		this.names = names;
		this.substituter = new Substituter(names);
		this.checker = new TypeChecker();
		this.semantics = new BigStepSemantics(names, maxDepth);
	}

	/**
	 * The generator used to mint fresh names.
	 *
	 * @return
	 */
	public NameGenerator names() {
		return names;
	}

	public Outcome<Type> typecheck(TypeChecker.Context ctx, Expr expr) {
		try {
			return Outcome.success(checker.infer(ctx, expr));
		} catch (TypeError e) {
			return Outcome.failure(e);
		}
	}

	/**
	 * Evaluate a closed expression to a value.
	 *
	 * @param expr
	 * @return
	 */
	public Outcome<Expr> evaluate(Expr expr) {
		try {
			return Outcome.success(semantics.execute(expr));
		} catch (StuckError | EvaluationLimitError e) {
			return Outcome.failure(e);
		}
	}

	/**
	 * Type check a closed expression and, only if it is well typed, evaluate it.
	 *
	 * @param expr
	 * @return
	 */
	public Outcome<Expr> run(Expr expr) {
		Outcome<Type> type = typecheck(TypeChecker.Context.EMPTY, expr);
		if (!type.isSuccess()) {
			return Outcome.failure(type.error());
		}
		return evaluate(expr);
	}

	public Expr substitute(Expr replacement, String target, Expr expr) {
		return substituter.subst(replacement, target, expr);
	}

	public Set<String> freeVariables(Expr expr) {
		return FreeVariables.of(expr);
	}

	public Set<String> unusedVariables(Expr expr) {
		return UnusedVariables.of(expr);
	}
}
