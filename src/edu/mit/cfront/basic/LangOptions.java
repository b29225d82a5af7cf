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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import java.util.Properties;

/**
 * The language dialect options the type engine consults.  Instances are
 * immutable; use {@link #builder()} or {@link #fromProperties(Properties)}.
 */
public final class LangOptions {
	/**
	 * The language standard being compiled.  Later standards imply the
	 * features of earlier ones.
	 */
	public enum Standard {
		C, CXX98, CXX11, CXX14, CXX17;
	}

	private final Standard standard;
	private final boolean objC;
	private final boolean objCAutoRefCount;
	private final boolean objCWeak;
	private final boolean openCL;
	private final int openCLVersion;
	private final boolean microsoftExt;
	private final boolean checkedC;

	private LangOptions(Builder b) {
		this.standard = b.standard;
		this.objC = b.objC;
		this.objCAutoRefCount = b.objCAutoRefCount;
		this.objCWeak = b.objCWeak;
		this.openCL = b.openCL;
		this.openCLVersion = b.openCLVersion;
		this.microsoftExt = b.microsoftExt;
		this.checkedC = b.checkedC;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads options from the given properties, using defaults for any
	 * missing keys.  Recognized keys are {@code standard}, {@code objc},
	 * {@code objcArc}, {@code objcWeak}, {@code opencl},
	 * {@code openclVersion}, {@code microsoftExt} and {@code checkedc}.
	 * @param prop the properties to read
	 * @return the options
	 * @throws IllegalArgumentException if a value can't be parsed
	 */
	public static LangOptions fromProperties(Properties prop) {
		Builder b = builder();
		b.standard(Standard.valueOf(prop.getProperty("standard", "C").trim().toUpperCase()));
		b.objC(Boolean.parseBoolean(prop.getProperty("objc", "false")));
		b.objCAutoRefCount(Boolean.parseBoolean(prop.getProperty("objcArc", "false")));
		b.objCWeak(Boolean.parseBoolean(prop.getProperty("objcWeak", "false")));
		b.openCL(Boolean.parseBoolean(prop.getProperty("opencl", "false")));
		b.openCLVersion(Integer.parseInt(prop.getProperty("openclVersion", "0").trim()));
		b.microsoftExt(Boolean.parseBoolean(prop.getProperty("microsoftExt", "false")));
		b.checkedC(Boolean.parseBoolean(prop.getProperty("checkedc", "false")));
		return b.build();
	}

	public Properties toProperties() {
		Properties prop = new Properties();
		prop.setProperty("standard", standard.name());
		prop.setProperty("objc", Boolean.toString(objC));
		prop.setProperty("objcArc", Boolean.toString(objCAutoRefCount));
		prop.setProperty("objcWeak", Boolean.toString(objCWeak));
		prop.setProperty("opencl", Boolean.toString(openCL));
		prop.setProperty("openclVersion", Integer.toString(openCLVersion));
		prop.setProperty("microsoftExt", Boolean.toString(microsoftExt));
		prop.setProperty("checkedc", Boolean.toString(checkedC));
		return prop;
	}

	public Standard getStandard() {
		return standard;
	}
	public boolean isCPlusPlus() {
		return standard != Standard.C;
	}
	public boolean isCPlusPlus11() {
		return standard.compareTo(Standard.CXX11) >= 0;
	}
	public boolean isCPlusPlus14() {
		return standard.compareTo(Standard.CXX14) >= 0;
	}
	public boolean isCPlusPlus17() {
		return standard.compareTo(Standard.CXX17) >= 0;
	}
	public boolean isObjC() {
		return objC;
	}
	public boolean isObjCAutoRefCount() {
		return objCAutoRefCount;
	}
	public boolean isObjCWeak() {
		return objCWeak;
	}
	public boolean isOpenCL() {
		return openCL;
	}
	public int getOpenCLVersion() {
		return openCLVersion;
	}
	public boolean isMicrosoftExt() {
		return microsoftExt;
	}
	public boolean isCheckedC() {
		return checkedC;
	}

	@Override
	public String toString() {
		return toProperties().toString();
	}

	public static final class Builder {
		private Standard standard = Standard.C;
		private boolean objC, objCAutoRefCount, objCWeak, openCL, microsoftExt, checkedC;
		private int openCLVersion;
		private Builder() {}
		public Builder standard(Standard standard) {
			this.standard = checkNotNull(standard);
			return this;
		}
		public Builder objC(boolean objC) {
			this.objC = objC;
			return this;
		}
		public Builder objCAutoRefCount(boolean arc) {
			this.objCAutoRefCount = arc;
			return this;
		}
		public Builder objCWeak(boolean weak) {
			this.objCWeak = weak;
			return this;
		}
		public Builder openCL(boolean openCL) {
			this.openCL = openCL;
			return this;
		}
		public Builder openCLVersion(int version) {
			checkArgument(version >= 0, "bad OpenCL version %s", version);
			this.openCLVersion = version;
			return this;
		}
		public Builder microsoftExt(boolean microsoftExt) {
			this.microsoftExt = microsoftExt;
			return this;
		}
		public Builder checkedC(boolean checkedC) {
			this.checkedC = checkedC;
			return this;
		}
		public LangOptions build() {
			checkArgument(!objCAutoRefCount || objC, "ARC requires Objective-C");
			return new LangOptions(this);
		}
	}
}
