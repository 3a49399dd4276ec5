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

import minicaml.core.Syntax.Expr;

/**
 * This exception is thrown when evaluation exceeds its configured depth bound,
 * which is how a divergent program is reported when evaluation is bounded.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class EvaluationLimitError extends RuntimeException {
	private final int limit;
	private final Expr term;

	public EvaluationLimitError(int limit, Expr term) {
		super("evaluation depth limit (" + limit + ") exceeded");
		this.limit = limit;
		this.term = term;
	}

	public int limit() {
		return limit;
	}

	/**
	 * The term being evaluated when the limit was reached.
	 *
	 * @return
	 */
	public Expr term() {
		return term;
	}

	public static final long serialVersionUID = 1l;
}
