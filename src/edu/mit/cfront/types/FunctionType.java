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

/**
 * The base of function types, with or without a prototype.
 */
public abstract class FunctionType extends Type {
	/**
	 * The non-prototype parts of a function type that affect calls: the
	 * noreturn attribute, ARC's ns_returns_retained, regparm and the
	 * calling convention.
	 */
	public static final class ExtInfo {
		public static final ExtInfo DEFAULT = new ExtInfo(false, false, false, 0, CallingConv.C);
		private final boolean noReturn;
		private final boolean producesResult;
		private final boolean hasRegParm;
		private final int regParm;
		private final CallingConv cc;

		public ExtInfo(boolean noReturn, boolean producesResult, boolean hasRegParm, int regParm, CallingConv cc) {
			this.noReturn = noReturn;
			this.producesResult = producesResult;
			this.hasRegParm = hasRegParm;
			this.regParm = regParm;
			this.cc = checkNotNull(cc);
		}

		public boolean getNoReturn() {
			return noReturn;
		}
		public boolean getProducesResult() {
			return producesResult;
		}
		public boolean getHasRegParm() {
			return hasRegParm;
		}
		public int getRegParm() {
			return regParm;
		}
		public CallingConv getCC() {
			return cc;
		}

		public ExtInfo withNoReturn(boolean noReturn) {
			return new ExtInfo(noReturn, producesResult, hasRegParm, regParm, cc);
		}
		public ExtInfo withProducesResult(boolean producesResult) {
			return new ExtInfo(noReturn, producesResult, hasRegParm, regParm, cc);
		}
		public ExtInfo withRegParm(int regParm) {
			return new ExtInfo(noReturn, producesResult, true, regParm, cc);
		}
		public ExtInfo withCallingConv(CallingConv cc) {
			return new ExtInfo(noReturn, producesResult, hasRegParm, regParm, cc);
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			final ExtInfo other = (ExtInfo)obj;
			if (noReturn != other.noReturn)
				return false;
			if (producesResult != other.producesResult)
				return false;
			if (hasRegParm != other.hasRegParm)
				return false;
			if (regParm != other.regParm)
				return false;
			return cc == other.cc;
		}

		@Override
		public int hashCode() {
			int hash = 3;
			hash = 97 * hash + (noReturn ? 1 : 0);
			hash = 97 * hash + (producesResult ? 1 : 0);
			hash = 97 * hash + (hasRegParm ? 1 : 0);
			hash = 97 * hash + regParm;
			hash = 97 * hash + cc.hashCode();
			return hash;
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			if (noReturn)
				sb.append(" __attribute__((noreturn))");
			if (producesResult)
				sb.append(" __attribute__((ns_returns_retained))");
			if (hasRegParm)
				sb.append(" __attribute__((regparm(").append(regParm).append(")))");
			if (cc != CallingConv.C)
				sb.append(" __attribute__((").append(getNameForCallConv(cc)).append("))");
			return sb.toString();
		}
	}

	private final QualType returnType;
	private final ExtInfo extInfo;

	FunctionType(TypeFactory factory, TypeClass typeClass, QualType returnType, QualType canon, ExtInfo extInfo) {
		super(factory, typeClass, canon, false, false, false, false);
		this.returnType = returnType;
		this.extInfo = checkNotNull(extInfo);
		inheritFlags(returnType);
	}

	public QualType getReturnType() {
		return returnType;
	}

	public ExtInfo getExtInfo() {
		return extInfo;
	}

	public boolean getNoReturnAttr() {
		return extInfo.getNoReturn();
	}

	public boolean getHasRegParm() {
		return extInfo.getHasRegParm();
	}

	public int getRegParmType() {
		return extInfo.getRegParm();
	}

	public CallingConv getCallConv() {
		return extInfo.getCC();
	}

	/**
	 * Returns the type of a call expression to a function of this type.
	 * @return the call result type
	 */
	public QualType getCallResultType() {
		return returnType.getNonLValueExprType();
	}

	/**
	 * Returns the attribute spelling of a calling convention.
	 * @param cc the calling convention
	 * @return the convention's name
	 */
	public static String getNameForCallConv(CallingConv cc) {
		switch (cc) {
			case C: return "cdecl";
			case X86_STDCALL: return "stdcall";
			case X86_FASTCALL: return "fastcall";
			case X86_THISCALL: return "thiscall";
			case X86_PASCAL: return "pascal";
			case X86_VECTORCALL: return "vectorcall";
			case WIN64: return "ms_abi";
			case X86_64_SYSV: return "sysv_abi";
			case X86_REGCALL: return "regcall";
			case AAPCS: return "aapcs";
			case AAPCS_VFP: return "aapcs-vfp";
			case INTEL_OCL_BICC: return "intel_ocl_bicc";
			case SPIR_FUNCTION: return "spir_function";
			case OPENCL_KERNEL: return "opencl_kernel";
			case SWIFT: return "swiftcall";
			case PRESERVE_MOST: return "preserve_most";
			case PRESERVE_ALL: return "preserve_all";
			default:
				throw new AssertionError(cc);
		}
	}

	@Override
	public final boolean isSugared() {
		return false;
	}

	@Override
	public final QualType desugar() {
		return asQualType();
	}
}
