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

import java.util.Arrays;
import java.util.List;

import minicaml.util.SyntacticElement;

/**
 * The abstract syntax of MiniCaml: types, expressions, declarations and
 * primitive operators. All syntactic forms are immutable, and equality is
 * structural (attributes are ignored).
 */
public class Syntax {
	public final static int EXPR_integer = 0;
	public final static int EXPR_boolean = 1;
	public final static int EXPR_if = 2;
	public final static int EXPR_operation = 3;
	public final static int EXPR_tuple = 4;
	public final static int EXPR_fn = 5;
	public final static int EXPR_rec = 6;
	public final static int EXPR_let = 7;
	public final static int EXPR_apply = 8;
	public final static int EXPR_variable = 9;

	public interface Expr extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this expression.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract expression to be implemented by all other expressions.
		 *
		 */
		public static abstract class AbstractExpr extends SyntacticElement.Impl implements Expr {
			private final int opcode;

			public AbstractExpr(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * An integer literal, such as <code>123</code>.
		 *
		 */
		public class Integer extends AbstractExpr {
			private final int value;

			public Integer(int value, Attribute... attributes) {
				super(EXPR_integer, attributes);
				this.value = value;
			}

			public int value() {
				return value;
			}

			@Override
			public int hashCode() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Integer && ((Integer) o).value == value;
			}

			@Override
			public String toString() {
				return java.lang.Integer.toString(value);
			}
		}

		public class Boolean extends AbstractExpr {
			private final boolean value;

			public Boolean(boolean value, Attribute... attributes) {
				super(EXPR_boolean, attributes);
				this.value = value;
			}

			public boolean value() {
				return value;
			}

			@Override
			public int hashCode() {
				return value ? 1 : 0;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Boolean && ((Boolean) o).value == value;
			}

			@Override
			public String toString() {
				return value ? "true" : "false";
			}
		}

		/**
		 * Represents a conditional of the form:
		 *
		 * <pre>
		 * if e then e1 else e2
		 * </pre>
		 *
		 */
		public class If extends AbstractExpr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			public If(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
				super(EXPR_if, attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr condition() {
				return condition;
			}

			public Expr trueBranch() {
				return trueBranch;
			}

			public Expr falseBranch() {
				return falseBranch;
			}

			@Override
			public int hashCode() {
				return condition.hashCode() ^ trueBranch.hashCode() ^ falseBranch.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof If) {
					If e = (If) o;
					return condition.equals(e.condition) && trueBranch.equals(e.trueBranch)
							&& falseBranch.equals(e.falseBranch);
				}
				return false;
			}

			@Override
			public String toString() {
				return "if " + condition + " then " + trueBranch + " else " + falseBranch;
			}
		}

		/**
		 * Represents the application of a primitive operator to its operands, such
		 * as <code>x + 1</code> or <code>-x</code>.
		 *
		 */
		public class Operation extends AbstractExpr {
			private final Operator operator;
			private final Expr[] operands;

			public Operation(Operator operator, Expr[] operands, Attribute... attributes) {
				super(EXPR_operation, attributes);
				this.operator = operator;
				this.operands = operands.clone();
			}

			public Operator operator() {
				return operator;
			}

			public int size() {
				return operands.length;
			}

			public Expr get(int i) {
				return operands[i];
			}

			public Expr[] toArray() {
				return operands.clone();
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ Arrays.hashCode(operands);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Operation) {
					Operation e = (Operation) o;
					return operator == e.operator && Arrays.equals(operands, e.operands);
				}
				return false;
			}

			@Override
			public String toString() {
				if (operands.length == 1) {
					return operator.symbol() + operands[0];
				} else {
					String r = "";
					for (int i = 0; i != operands.length; ++i) {
						if (i != 0) {
							r += " " + operator.symbol() + " ";
						}
						r += operands[i];
					}
					return "(" + r + ")";
				}
			}

			public static Operation construct(Operator operator, Expr... operands) {
				return new Operation(operator, operands);
			}
		}

		public class Tuple extends AbstractExpr {
			private final Expr[] items;

			public Tuple(Expr[] items, Attribute... attributes) {
				super(EXPR_tuple, attributes);
				this.items = items.clone();
			}

			public int size() {
				return items.length;
			}

			public Expr get(int i) {
				return items[i];
			}

			public Expr[] toArray() {
				return items.clone();
			}

			@Override
			public int hashCode() {
				return Arrays.hashCode(items);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Tuple && Arrays.equals(items, ((Tuple) o).items);
			}

			@Override
			public String toString() {
				return "(" + join(items) + ")";
			}

			public static Tuple construct(Expr... items) {
				return new Tuple(items);
			}
		}

		/**
		 * Common super class of the two binding abstractions, both of which bind a
		 * single name with a declared type over a body.
		 *
		 */
		public static abstract class Abstraction extends AbstractExpr {
			private final String name;
			private final Type type;
			private final Expr body;

			public Abstraction(int opcode, String name, Type type, Expr body, Attribute... attributes) {
				super(opcode, attributes);
				this.name = name;
				this.type = type;
				this.body = body;
			}

			/**
			 * Return the name bound by this abstraction.
			 *
			 * @return
			 */
			public String name() {
				return name;
			}

			/**
			 * Return the declared type of the bound name.
			 *
			 * @return
			 */
			public Type type() {
				return type;
			}

			public Expr body() {
				return body;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ type.hashCode() ^ body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					Abstraction e = (Abstraction) o;
					return name.equals(e.name) && type.equals(e.type) && body.equals(e.body);
				}
				return false;
			}
		}

		/**
		 * Represents a function abstraction of the form:
		 *
		 * <pre>
		 * fn (x:t) => e
		 * </pre>
		 *
		 */
		public class Fn extends Abstraction {
			public Fn(String parameter, Type type, Expr body, Attribute... attributes) {
				super(EXPR_fn, parameter, type, body, attributes);
			}

			@Override
			public String toString() {
				return "fn (" + name() + ":" + type() + ") => " + body();
			}
		}

		/**
		 * Represents a recursive abstraction of the form below, where
		 * <code>f</code> refers to the whole expression within <code>e</code>.
		 *
		 * <pre>
		 * rec (f:t) => e
		 * </pre>
		 *
		 */
		public class Rec extends Abstraction {
			public Rec(String self, Type type, Expr body, Attribute... attributes) {
				super(EXPR_rec, self, type, body, attributes);
			}

			@Override
			public String toString() {
				return "rec (" + name() + ":" + type() + ") => " + body();
			}
		}

		/**
		 * Represents a sequence of declarations scoping over a body, such as:
		 *
		 * <pre>
		 * let val x = 1; val (y, z) = (x, 2) in x + y + z end
		 * </pre>
		 *
		 * Each declaration is in scope for all those following it, and for the
		 * body.
		 *
		 */
		public class Let extends AbstractExpr {
			private final Decl[] declarations;
			private final Expr body;

			public Let(Decl[] declarations, Expr body, Attribute... attributes) {
				super(EXPR_let, attributes);
				this.declarations = declarations.clone();
				this.body = body;
			}

			public int size() {
				return declarations.length;
			}

			public Decl get(int i) {
				return declarations[i];
			}

			public Decl[] toArray() {
				return declarations.clone();
			}

			public Expr body() {
				return body;
			}

			/**
			 * Return the let expression formed by dropping the first declaration from
			 * this one. That is, the scope of the first declaration.
			 *
			 * @return
			 */
			public Let tail() {
				return new Let(Arrays.copyOfRange(declarations, 1, declarations.length), body);
			}

			/**
			 * Return the let expression formed by prepending a given declaration to
			 * this one.
			 *
			 * @param decl
			 * @return
			 */
			public Let prepend(Decl decl, Attribute... attributes) {
				Decl[] ndecls = new Decl[declarations.length + 1];
				ndecls[0] = decl;
				System.arraycopy(declarations, 0, ndecls, 1, declarations.length);
				return new Let(ndecls, body, attributes);
			}

			@Override
			public int hashCode() {
				return Arrays.hashCode(declarations) ^ body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Let) {
					Let e = (Let) o;
					return Arrays.equals(declarations, e.declarations) && body.equals(e.body);
				}
				return false;
			}

			@Override
			public String toString() {
				String r = "let";
				for (int i = 0; i != declarations.length; ++i) {
					r += (i == 0 ? " " : "; ") + declarations[i];
				}
				return r + " in " + body + " end";
			}

			public static Let construct(List<Decl> declarations, Expr body) {
				return new Let(declarations.toArray(new Decl[declarations.size()]), body);
			}
		}

		public class Apply extends AbstractExpr {
			private final Expr function;
			private final Expr argument;

			public Apply(Expr function, Expr argument, Attribute... attributes) {
				super(EXPR_apply, attributes);
				this.function = function;
				this.argument = argument;
			}

			public Expr function() {
				return function;
			}

			public Expr argument() {
				return argument;
			}

			@Override
			public int hashCode() {
				return function.hashCode() ^ argument.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Apply) {
					Apply e = (Apply) o;
					return function.equals(e.function) && argument.equals(e.argument);
				}
				return false;
			}

			@Override
			public String toString() {
				return "(" + function + " " + argument + ")";
			}
		}

		public class Variable extends AbstractExpr {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(EXPR_variable, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public String toString() {
				return name;
			}
		}
	}

	/**
	 * A declaration binds one or more names to the value of an initialiser
	 * expression.
	 *
	 */
	public interface Decl extends SyntacticElement {

		/**
		 * Return the expression whose value is being bound.
		 *
		 * @return
		 */
		public Expr initialiser();

		/**
		 * Return the names bound by this declaration, in order.
		 *
		 * @return
		 */
		public String[] names();

		/**
		 * Construct a declaration of the same form as this, but with a different
		 * initialiser and bound names.
		 *
		 * @param initialiser
		 * @param names
		 * @return
		 */
		public Decl rebuild(Expr initialiser, String[] names);

		/**
		 * Represents a single binding of the form:
		 *
		 * <pre>
		 * val x = e
		 * </pre>
		 */
		public class Val extends SyntacticElement.Impl implements Decl {
			private final Expr initialiser;
			private final String name;

			public Val(Expr initialiser, String name, Attribute... attributes) {
				super(attributes);
				this.initialiser = initialiser;
				this.name = name;
			}

			@Override
			public Expr initialiser() {
				return initialiser;
			}

			public String name() {
				return name;
			}

			@Override
			public String[] names() {
				return new String[] { name };
			}

			@Override
			public Val rebuild(Expr initialiser, String[] names) {
				return new Val(initialiser, names[0], attributes());
			}

			@Override
			public int hashCode() {
				return initialiser.hashCode() ^ name.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Val) {
					Val d = (Val) o;
					return initialiser.equals(d.initialiser) && name.equals(d.name);
				}
				return false;
			}

			@Override
			public String toString() {
				return "val " + name + " = " + initialiser;
			}
		}

		/**
		 * Represents a tuple destructuring binding of the form:
		 *
		 * <pre>
		 * val (x1, ..., xn) = e
		 * </pre>
		 */
		public class ValTuple extends SyntacticElement.Impl implements Decl {
			private final Expr initialiser;
			private final String[] names;

			public ValTuple(Expr initialiser, String[] names, Attribute... attributes) {
				super(attributes);
				this.initialiser = initialiser;
				this.names = names.clone();
			}

			@Override
			public Expr initialiser() {
				return initialiser;
			}

			public int size() {
				return names.length;
			}

			@Override
			public String[] names() {
				return names.clone();
			}

			@Override
			public ValTuple rebuild(Expr initialiser, String[] names) {
				return new ValTuple(initialiser, names, attributes());
			}

			@Override
			public int hashCode() {
				return initialiser.hashCode() ^ Arrays.hashCode(names);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof ValTuple) {
					ValTuple d = (ValTuple) o;
					return initialiser.equals(d.initialiser) && Arrays.equals(names, d.names);
				}
				return false;
			}

			@Override
			public String toString() {
				return "val (" + String.join(", ", names) + ") = " + initialiser;
			}
		}
	}

	/**
	 * The primitive operators, each with a fixed signature.
	 *
	 */
	public enum Operator {
		EQUALS("=", Type.Bool, Type.Int, Type.Int),
		LESSTHAN("<", Type.Bool, Type.Int, Type.Int),
		PLUS("+", Type.Int, Type.Int, Type.Int),
		MINUS("-", Type.Int, Type.Int, Type.Int),
		TIMES("*", Type.Int, Type.Int, Type.Int),
		NEGATE("-", Type.Int, Type.Int);

		private final String symbol;
		private final Type range;
		private final Type[] domain;

		private Operator(String symbol, Type range, Type... domain) {
			this.symbol = symbol;
			this.range = range;
			this.domain = domain;
		}

		public String symbol() {
			return symbol;
		}

		/**
		 * Number of operands this operator accepts.
		 *
		 * @return
		 */
		public int arity() {
			return domain.length;
		}

		/**
		 * Get the type required of the ith operand.
		 *
		 * @param i
		 * @return
		 */
		public Type domain(int i) {
			return domain[i];
		}

		public Type range() {
			return range;
		}
	}

	public interface Type {
		/**
		 * Constant representing the type int
		 */
		public static Type Int = new Int();
		/**
		 * Constant representing the type bool
		 */
		public static Type Bool = new Bool();

		public static class Int implements Type {
			private Int() {
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Type.Int;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "int";
			}
		}

		public static class Bool implements Type {
			private Bool() {
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Type.Bool;
			}

			@Override
			public int hashCode() {
				return 2;
			}

			@Override
			public String toString() {
				return "bool";
			}
		}

		/**
		 * Represents a function type <code>S -> T</code>.
		 *
		 */
		public static class Arrow implements Type {
			private final Type domain;
			private final Type range;

			public Arrow(Type domain, Type range) {
				this.domain = domain;
				this.range = range;
			}

			public Type domain() {
				return domain;
			}

			public Type range() {
				return range;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Arrow) {
					Arrow t = (Arrow) o;
					return domain.equals(t.domain) && range.equals(t.range);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 31 * domain.hashCode() + range.hashCode();
			}

			@Override
			public String toString() {
				return bracket(domain) + " -> " + range;
			}
		}

		/**
		 * Represents a tuple type <code>T1 * ... * Tn</code>, where n may be zero.
		 *
		 */
		public static class Product implements Type {
			private final Type[] types;

			public Product(Type... types) {
				this.types = types.clone();
			}

			public int size() {
				return types.length;
			}

			public Type get(int i) {
				return types[i];
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Product && Arrays.equals(types, ((Product) o).types);
			}

			@Override
			public int hashCode() {
				return 3 + Arrays.hashCode(types);
			}

			@Override
			public String toString() {
				if (types.length == 0) {
					return "()";
				}
				String r = "";
				for (int i = 0; i != types.length; ++i) {
					if (i != 0) {
						r += " * ";
					}
					r += bracket(types[i]);
				}
				return r;
			}
		}
	}

	private static String bracket(Type t) {
		if (t instanceof Type.Arrow || (t instanceof Type.Product && ((Type.Product) t).size() > 0)) {
			return "(" + t + ")";
		} else {
			return t.toString();
		}
	}

	private static String join(Expr[] items) {
		String r = "";
		for (int i = 0; i != items.length; ++i) {
			if (i != 0) {
				r += ", ";
			}
			r += items[i];
		}
		return r;
	}
}
