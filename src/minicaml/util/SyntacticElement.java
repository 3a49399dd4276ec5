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

/**
 * A Syntactic Element represents any node of an expression tree to which we may
 * wish to attach additional information (e.g. source positions). Attributes
 * never take part in structural equality.
 *
 * @author The MiniCaml Interpreter Authors
 *
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type, or <code>null</code> if
	 * there is none.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	public class Impl implements SyntacticElement {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes.length == 0 ? NONE : attributes.clone();
		}

		@Override
		public Attribute[] attributes() {
			return attributes.length == 0 ? NONE : attributes.clone();
		}

		@Override
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return c.cast(a);
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the span of source text (inclusive) an element was built
		 * from.
		 */
		public static class Source implements Attribute {

			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}
