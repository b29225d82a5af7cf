/*
 * Copyright (c) 2013-2014 Massachusetts Institute of Technology
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package edu.mit.cfront.types;

import static com.google.common.base.Preconditions.checkNotNull;
import edu.mit.cfront.basic.LangOptions;

/**
 * Spelling choices for printing types that depend on the source language.
 */
public final class PrintingPolicy {
	private final boolean bool;
	private final boolean half;
	private final boolean msWChar;

	public PrintingPolicy(boolean bool, boolean half, boolean msWChar) {
		this.bool = bool;
		this.half = half;
		this.msWChar = msWChar;
	}

	/**
	 * Returns the policy matching the given language: {@code bool} in C++,
	 * {@code half} in OpenCL, and {@code __wchar_t} for Microsoft extensions
	 * in C.
	 * @param langOpts the language options
	 * @return the policy
	 */
	public static PrintingPolicy of(LangOptions langOpts) {
		checkNotNull(langOpts);
		return new PrintingPolicy(langOpts.isCPlusPlus(), langOpts.isOpenCL(),
				langOpts.isMicrosoftExt() && !langOpts.isCPlusPlus());
	}

	/**
	 * Whether the boolean type is spelled {@code bool} (else {@code _Bool}).
	 * @return true to print bool
	 */
	public boolean printsBool() {
		return bool;
	}

	/**
	 * Whether the half type is spelled {@code half} (else {@code __fp16}).
	 * @return true to print half
	 */
	public boolean printsHalf() {
		return half;
	}

	/**
	 * Whether wchar_t is spelled {@code __wchar_t}.
	 * @return true to print __wchar_t
	 */
	public boolean printsMSWChar() {
		return msWChar;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final PrintingPolicy other = (PrintingPolicy)obj;
		return bool == other.bool && half == other.half && msWChar == other.msWChar;
	}

	@Override
	public int hashCode() {
		int hash = 7;
		hash = 59 * hash + (bool ? 1 : 0);
		hash = 59 * hash + (half ? 1 : 0);
		hash = 59 * hash + (msWChar ? 1 : 0);
		return hash;
	}

	@Override
	public String toString() {
		return String.format("PrintingPolicy[bool=%s, half=%s, msWChar=%s]", bool, half, msWChar);
	}
}
