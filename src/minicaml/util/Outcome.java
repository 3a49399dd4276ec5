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

import java.util.NoSuchElementException;

/**
 * The outcome of an operation which either produced a value, or failed with a
 * specific error.
 *
 * @param <T> Type of value produced on success
 */
public final class Outcome<T> {
	private final T value;
	private final RuntimeException error;

	private Outcome(T value, RuntimeException error) {
		this.value = value;
		this.error = error;
	}

	public static <T> Outcome<T> success(T value) {
		return new Outcome<>(value, null);
	}

	public static <T> Outcome<T> failure(RuntimeException error) {
		if (error == null) {
			throw new IllegalArgumentException("failure requires an error");
		}
		return new Outcome<>(null, error);
	}

	public boolean isSuccess() {
		return error == null;
	}

	/**
	 * Get the value produced by a successful operation.
	 *
	 * @return
	 * @throws NoSuchElementException if the operation failed.
	 */
	public T get() {
		if (error != null) {
			throw new NoSuchElementException("no value, operation failed: " + error.getMessage());
		}
		return value;
	}

	/**
	 * Get the error which caused the operation to fail, or <code>null</code> if
	 * it succeeded.
	 *
	 * @return
	 */
	public RuntimeException error() {
		return error;
	}

	/**
	 * Determine whether this operation failed with an error of the given kind.
	 *
	 * @param kind
	 * @return
	 */
	public boolean failedWith(Class<? extends RuntimeException> kind) {
		return kind.isInstance(error);
	}

	@Override
	public String toString() {
		return error == null ? "success(" + value + ")" : "failure(" + error.getMessage() + ")";
	}
}
