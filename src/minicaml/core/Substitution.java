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

import java.util.Set;

import minicaml.core.Syntax.Expr;

/**
 * A substitution <code>[e/x]</code>, read as "<code>e</code> for
 * <code>x</code>". That is, replace free occurrences of the target name
 * <code>x</code> by the replacement <code>e</code>.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public final class Substitution {
	private final Expr replacement;
	private final String target;
	/**
	 * Free variables of the replacement, which no binder may capture.
	 */
	private final Set<String> captured;

	public Substitution(Expr replacement, String target) {
		this.replacement = replacement;
		this.target = target;
		this.captured = FreeVariables.of(replacement);
	}

	public Expr replacement() {
		return replacement;
	}

	public String target() {
		return target;
	}

	/**
	 * Determine whether a binder of the given name would capture a free variable
	 * of the replacement.
	 *
	 * @param name
	 * @return
	 */
	public boolean captures(String name) {
		return captured.contains(name);
	}

	@Override
	public String toString() {
		return "[" + replacement + "/" + target + "]";
	}
}
