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
 * This exception is thrown when evaluation reaches a term which is not a value
 * and for which no reduction rule applies. A closed, well-typed expression
 * should never get stuck.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class StuckError extends RuntimeException {
	private final Expr term;

	public StuckError(String msg, Expr term) {
		super(msg);
		this.term = term;
	}

	/**
	 * The term on which evaluation got stuck.
	 *
	 * @return
	 */
	public Expr term() {
		return term;
	}

	public static final long serialVersionUID = 1l;
}
