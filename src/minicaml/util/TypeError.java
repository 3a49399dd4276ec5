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

import minicaml.core.Syntax.Type;
import minicaml.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when an expression cannot be given a type. Where the
 * problem is a mismatch between two types, both the expected and the found
 * type are retained.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public class TypeError extends RuntimeException {
	private final String msg;
	private final Type expected;
	private final Type found;
	private final SyntacticElement element;

	/**
	 * Identify a type error at a given syntactic element.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param element
	 *            The offending element (which may be <code>null</code>).
	 */
	public TypeError(String msg, SyntacticElement element) {
		this(msg, null, null, element);
	}

	/**
	 * Identify a type mismatch at a given syntactic element.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param expected
	 *            The type which was required.
	 * @param found
	 *            The type which was actually inferred.
	 * @param element
	 *            The offending element (which may be <code>null</code>).
	 */
	public TypeError(String msg, Type expected, Type found, SyntacticElement element) {
		this.msg = msg;
		this.expected = expected;
		this.found = found;
		this.element = element;
	}

	@Override
	public String getMessage() {
		if (expected == null && found == null) {
			return msg;
		}
		String r = msg;
		if (expected != null) {
			r += "\nExpected type " + expected;
		}
		if (found != null) {
			r += "\nFound type " + found;
		}
		return r;
	}

	/**
	 * Error message, without the expected and found types.
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	public Type expected() {
		return expected;
	}

	public Type found() {
		return found;
	}

	public SyntacticElement element() {
		return element;
	}

	/**
	 * Get index of first character of offending element, or <code>-1</code> if
	 * this is unknown.
	 *
	 * @return
	 */
	public int start() {
		Attribute.Source src = source();
		return src == null ? -1 : src.start;
	}

	/**
	 * Get index of last character of offending element, or <code>-1</code> if
	 * this is unknown.
	 *
	 * @return
	 */
	public int end() {
		Attribute.Source src = source();
		return src == null ? -1 : src.end;
	}

	private Attribute.Source source() {
		return element == null ? null : element.attribute(Attribute.Source.class);
	}

	public static final long serialVersionUID = 1l;
}
