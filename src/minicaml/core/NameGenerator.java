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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mints fresh names for renaming bound variables. A minted name has the form
 * <code>nx</code>, where <code>n</code> is a counter value and <code>x</code>
 * is the given base name with any leading digits removed. Since user-level
 * identifiers cannot begin with a digit, and each counter value is used only
 * once between resets, minted names never collide with each other or with user
 * identifiers.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class NameGenerator {
	private final AtomicInteger counter = new AtomicInteger();

	/**
	 * Generate a fresh name based on a given one.
	 *
	 * @param base
	 * @return
	 */
	public String next(String base) {
		int i = 0;
		while (i < base.length() && Character.isDigit(base.charAt(i))) {
			i = i + 1;
		}
		return counter.incrementAndGet() + base.substring(i);
	}

	/**
	 * Reset the counter, so the next name minted is numbered from one again.
	 * Names minted before a reset may then be minted again.
	 */
	public void reset() {
		counter.set(0);
	}
}
