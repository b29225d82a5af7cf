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
package edu.mit.cfront.basic;

/**
 * Address space codes.  Codes below {@link #FIRST_TARGET_ADDRESS_SPACE} are
 * language address spaces; codes at or above it encode a target-specific
 * address space number.
 */
public final class LangAS {
	private LangAS() {}

	public static final int DEFAULT = 0;
	public static final int OPENCL_GLOBAL = 1;
	public static final int OPENCL_LOCAL = 2;
	public static final int OPENCL_CONSTANT = 3;
	public static final int OPENCL_PRIVATE = 4;
	public static final int OPENCL_GENERIC = 5;
	public static final int CUDA_DEVICE = 6;
	public static final int CUDA_CONSTANT = 7;
	public static final int CUDA_SHARED = 8;
	public static final int FIRST_TARGET_ADDRESS_SPACE = 9;

	public static boolean isTargetAddressSpace(int as) {
		return as >= FIRST_TARGET_ADDRESS_SPACE;
	}

	public static int toTargetAddressSpace(int as) {
		if (!isTargetAddressSpace(as))
			throw new IllegalArgumentException("not a target address space: "+as);
		return as - FIRST_TARGET_ADDRESS_SPACE;
	}

	public static int getLangASFromTargetAS(int targetAS) {
		if (targetAS < 0)
			throw new IllegalArgumentException("negative address space: "+targetAS);
		return targetAS + FIRST_TARGET_ADDRESS_SPACE;
	}

	public static String toString(int as) {
		switch (as) {
			case DEFAULT: return "default";
			case OPENCL_GLOBAL: return "__global";
			case OPENCL_LOCAL: return "__local";
			case OPENCL_CONSTANT: return "__constant";
			case OPENCL_PRIVATE: return "__private";
			case OPENCL_GENERIC: return "__generic";
			case CUDA_DEVICE: return "__device__";
			case CUDA_CONSTANT: return "__constant__";
			case CUDA_SHARED: return "__shared__";
			default: return "__attribute__((address_space("+toTargetAddressSpace(as)+")))";
		}
	}
}
