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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine-wide options.  Loads the values from "cfront.properties" on the
 * classpath; missing keys fall back to defaults.
 */
public final class Options {
	private static final Logger LOG = LoggerFactory.getLogger(Options.class);
	private static final String RESOURCE = "cfront.properties";

	/**
	 * The language options used when a factory is created without explicit
	 * options.
	 */
	public static final LangOptions langOptions;

	/**
	 * Whether new types are logged at trace level as they're interned.
	 */
	public static final boolean traceInterning;

	static {
		Properties prop = loadProperties();
		langOptions = LangOptions.fromProperties(prop);
		traceInterning = Boolean.parseBoolean(prop.getProperty("traceInterning", "false"));
	}

	private Options() {}

	public static Properties getProperties() {
		Properties prop = langOptions.toProperties();
		prop.setProperty("traceInterning", Boolean.toString(traceInterning));
		return prop;
	}

	private static Properties loadProperties() {
		Properties prop = new Properties();
		try (InputStream input = Options.class.getResourceAsStream(RESOURCE)) {
			if (input == null)
				LOG.warn("{} not found on classpath; using defaults", RESOURCE);
			else
				prop.load(input);
		} catch (IOException ex) {
			LOG.warn("Failed to load {}; using defaults", RESOURCE, ex);
		}
		return prop;
	}
}
