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

import static org.junit.jupiter.api.Assertions.*;
import edu.mit.cfront.basic.LangOptions.Standard;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class OptionsTest {
	@Test
	public void defaultsComeFromBundledProperties() {
		assertEquals(Standard.CXX14, Options.langOptions.getStandard());
		assertFalse(Options.langOptions.isObjC());
		assertFalse(Options.traceInterning);
		assertEquals("CXX14", Options.getProperties().getProperty("standard"));
		assertEquals("false", Options.getProperties().getProperty("traceInterning"));
	}

	@Test
	public void propertiesRoundTrip() {
		LangOptions opts = LangOptions.builder()
				.standard(Standard.CXX17)
				.objC(true)
				.objCAutoRefCount(true)
				.openCL(true)
				.openCLVersion(200)
				.checkedC(true)
				.build();
		Properties prop = opts.toProperties();
		LangOptions copy = LangOptions.fromProperties(prop);
		assertEquals(prop, copy.toProperties());
		assertTrue(copy.isObjCAutoRefCount());
		assertEquals(200, copy.getOpenCLVersion());
	}

	@Test
	public void missingKeysTakeDefaults() {
		Properties prop = new Properties();
		prop.setProperty("standard", " cxx11 ");
		LangOptions opts = LangOptions.fromProperties(prop);
		assertEquals(Standard.CXX11, opts.getStandard());
		assertTrue(opts.isCPlusPlus11());
		assertFalse(opts.isCPlusPlus14());
		assertFalse(opts.isObjC());
		assertEquals(0, opts.getOpenCLVersion());
	}

	@Test
	public void badValuesAreRejected() {
		Properties prop = new Properties();
		prop.setProperty("standard", "CXX23");
		assertThrows(IllegalArgumentException.class, () -> LangOptions.fromProperties(prop));
		Properties version = new Properties();
		version.setProperty("openclVersion", "-1");
		assertThrows(IllegalArgumentException.class, () -> LangOptions.fromProperties(version));
		assertThrows(IllegalArgumentException.class, () -> LangOptions.builder().objCAutoRefCount(true).build());
		assertThrows(NullPointerException.class, () -> LangOptions.builder().standard(null));
	}

	@Test
	public void standardsImplyEarlierOnes() {
		LangOptions c = LangOptions.builder().build();
		assertFalse(c.isCPlusPlus());
		LangOptions cxx98 = LangOptions.builder().standard(Standard.CXX98).build();
		assertTrue(cxx98.isCPlusPlus());
		assertFalse(cxx98.isCPlusPlus11());
		LangOptions cxx17 = LangOptions.builder().standard(Standard.CXX17).build();
		assertTrue(cxx17.isCPlusPlus11());
		assertTrue(cxx17.isCPlusPlus14());
		assertTrue(cxx17.isCPlusPlus17());
	}

	@Test
	public void visibilityAndLinkageOrdering() {
		assertEquals(Visibility.HIDDEN, Visibility.minVisibility(Visibility.DEFAULT, Visibility.HIDDEN));
		assertEquals(Visibility.PROTECTED, Visibility.minVisibility(Visibility.PROTECTED, Visibility.DEFAULT));
		assertTrue(Linkage.UNIQUE_EXTERNAL_LINKAGE.isExternallyVisible());
		assertFalse(Linkage.VISIBLE_NO_LINKAGE.isExternallyVisible());
		assertFalse(Linkage.MODULE_INTERNAL_LINKAGE.isExternallyVisible());
		assertTrue(Linkage.MODULE_LINKAGE.isExternallyVisible());
		assertEquals(Linkage.INTERNAL_LINKAGE, Linkage.MODULE_INTERNAL_LINKAGE.getFormalLinkage());
	}
}
