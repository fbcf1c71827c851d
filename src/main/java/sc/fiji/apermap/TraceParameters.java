/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.apermap;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * The tunable parameters of aperture-map making, with their defaults.
 * <p>
 * Most defaults are empirical values that instrument operators rely on; they
 * are exposed so they can be adjusted, not because they are expected to be.
 * </p>
 * <pre>
 *   TraceParameters params = new TraceParameters()
 *       .traceStep(20)          // columns between profile groups
 *       .nLines(11)             // columns stacked per profile
 *       .matchTolerance(3)      // max. drift (px) of a fiber between profiles
 *       .distanceFactor(2.0);   // simplified variant of the peak distance cut
 * </pre>
 */
public class TraceParameters {

	/** Classpath resource holding the bundled defaults */
	public static final String DEFAULTS_RESOURCE = "/apermap.properties";
	/** Key prefix of the bundled defaults */
	public static final String DEFAULT_PREFIX = "apermap.";

	private int traceStep = 20;
	private int nLines = 11;
	private double matchTolerance = 3.0;
	private double maxGapFraction = 0.2;
	private double prominenceCut = 20.0;
	private double distanceFactor = 1.8;
	private int widthOffset = 1;
	private double relHeight = 0.5;
	private double gapFactor = 1.5;
	private int localWindow = 5;
	private double matchWidthFactor = 2.0;
	private int templateDegree = 4;
	private int traceDegree = 4;
	private int templateBinning = 1;
	private int ifuGuessTolerance = 20;

	/** Spacing (columns) between the starts of consecutive column groups. Default: 20 */
	public TraceParameters traceStep(final int traceStep) {
		this.traceStep = traceStep;
		return this;
	}

	/** Number of adjacent columns stacked into one profile. Default: 11 */
	public TraceParameters nLines(final int nLines) {
		this.nLines = nLines;
		return this;
	}

	/** Maximum distance (px) between a track and a peak of the next profile for them to be joined. Default: 3 */
	public TraceParameters matchTolerance(final double matchTolerance) {
		this.matchTolerance = matchTolerance;
		return this;
	}

	/** Tracks with a larger fraction of undetected profiles are discarded. Default: 0.2 */
	public TraceParameters maxGapFraction(final double maxGapFraction) {
		this.maxGapFraction = maxGapFraction;
		return this;
	}

	/** Minimum prominence of a fiber peak in the refined pass. Default: 20 */
	public TraceParameters prominenceCut(final double prominenceCut) {
		this.prominenceCut = prominenceCut;
		return this;
	}

	/** Minimum peak distance, in units of the aperture half width. Default: 1.8 */
	public TraceParameters distanceFactor(final double distanceFactor) {
		this.distanceFactor = distanceFactor;
		return this;
	}

	/** Minimum peak width is the aperture half width minus this offset. Default: 1 */
	public TraceParameters widthOffset(final int widthOffset) {
		this.widthOffset = widthOffset;
		return this;
	}

	/** Relative height (fraction of prominence) at which peak widths are measured. Default: 0.5 */
	public TraceParameters relHeight(final double relHeight) {
		this.relHeight = relHeight;
		return this;
	}

	/** A spacing larger than this multiple of the local spacing marks a gap. Default: 1.5 */
	public TraceParameters gapFactor(final double gapFactor) {
		this.gapFactor = gapFactor;
		return this;
	}

	/** Half size (in spacings) of the window used for local median spacings. Default: 5 */
	public TraceParameters localWindow(final int localWindow) {
		this.localWindow = localWindow;
		return this;
	}

	/** A detection matches a predicted fiber within this multiple of the aperture half width. Default: 2 */
	public TraceParameters matchWidthFactor(final double matchWidthFactor) {
		this.matchWidthFactor = matchWidthFactor;
		return this;
	}

	/** Degree of the template-to-detector mappings. Default: 4 */
	public TraceParameters templateDegree(final int templateDegree) {
		this.templateDegree = templateDegree;
		return this;
	}

	/** Degree of the per-fiber trace polynomials. Default: 4 */
	public TraceParameters traceDegree(final int traceDegree) {
		this.traceDegree = traceDegree;
		return this;
	}

	/** Pixel binning at which templates were measured. Default: 1 */
	public TraceParameters templateBinning(final int templateBinning) {
		this.templateBinning = templateBinning;
		return this;
	}

	/** Tolerance used when inferring the IFU type from a fiber count. Default: 20 */
	public TraceParameters ifuGuessTolerance(final int ifuGuessTolerance) {
		this.ifuGuessTolerance = ifuGuessTolerance;
		return this;
	}

	public int getTraceStep() {
		return traceStep;
	}

	public int getNLines() {
		return nLines;
	}

	public double getMatchTolerance() {
		return matchTolerance;
	}

	public double getMaxGapFraction() {
		return maxGapFraction;
	}

	public double getProminenceCut() {
		return prominenceCut;
	}

	public double getDistanceFactor() {
		return distanceFactor;
	}

	public int getWidthOffset() {
		return widthOffset;
	}

	public double getRelHeight() {
		return relHeight;
	}

	public double getGapFactor() {
		return gapFactor;
	}

	public int getLocalWindow() {
		return localWindow;
	}

	public double getMatchWidthFactor() {
		return matchWidthFactor;
	}

	public int getTemplateDegree() {
		return templateDegree;
	}

	public int getTraceDegree() {
		return traceDegree;
	}

	public int getTemplateBinning() {
		return templateBinning;
	}

	public int getIfuGuessTolerance() {
		return ifuGuessTolerance;
	}

	/**
	 * Checks that every parameter is within its valid range.
	 *
	 * @throws ConfigurationException if a parameter is out of range
	 */
	public void validate() throws ConfigurationException {
		if (traceStep <= 0) throw new ConfigurationException("Trace step must be positive: " + traceStep);
		if (nLines <= 0) throw new ConfigurationException("Number of stacked columns must be positive: " + nLines);
		if (matchTolerance <= 0) throw new ConfigurationException("Match tolerance must be positive: " + matchTolerance);
		if (maxGapFraction < 0 || maxGapFraction > 1)
			throw new ConfigurationException("Gap fraction must be within [0, 1]: " + maxGapFraction);
		if (prominenceCut < 0) throw new ConfigurationException("Prominence cut cannot be negative: " + prominenceCut);
		if (distanceFactor <= 0) throw new ConfigurationException("Distance factor must be positive: " + distanceFactor);
		if (relHeight <= 0 || relHeight > 1)
			throw new ConfigurationException("Relative height must be within (0, 1]: " + relHeight);
		if (gapFactor <= 1) throw new ConfigurationException("Gap factor must be larger than 1: " + gapFactor);
		if (localWindow < 1) throw new ConfigurationException("Local window must be at least 1: " + localWindow);
		if (matchWidthFactor <= 0)
			throw new ConfigurationException("Match width factor must be positive: " + matchWidthFactor);
		if (templateDegree < 1 || traceDegree < 1)
			throw new ConfigurationException("Polynomial degrees must be at least 1");
		if (templateBinning < 1) throw new ConfigurationException("Template binning must be at least 1: " + templateBinning);
	}

	public void setProperties(final String prefix, final Properties properties) {
		properties.setProperty(prefix + "traceStep", traceStep + "");
		properties.setProperty(prefix + "nLines", nLines + "");
		properties.setProperty(prefix + "matchTolerance", matchTolerance + "");
		properties.setProperty(prefix + "maxGapFraction", maxGapFraction + "");
		properties.setProperty(prefix + "prominenceCut", prominenceCut + "");
		properties.setProperty(prefix + "distanceFactor", distanceFactor + "");
		properties.setProperty(prefix + "widthOffset", widthOffset + "");
		properties.setProperty(prefix + "relHeight", relHeight + "");
		properties.setProperty(prefix + "gapFactor", gapFactor + "");
		properties.setProperty(prefix + "localWindow", localWindow + "");
		properties.setProperty(prefix + "matchWidthFactor", matchWidthFactor + "");
		properties.setProperty(prefix + "templateDegree", templateDegree + "");
		properties.setProperty(prefix + "traceDegree", traceDegree + "");
		properties.setProperty(prefix + "templateBinning", templateBinning + "");
		properties.setProperty(prefix + "ifuGuessTolerance", ifuGuessTolerance + "");
	}

	/**
	 * Reads parameters from properties. Keys that are absent leave the current
	 * value untouched.
	 *
	 * @throws ConfigurationException if a value cannot be parsed
	 */
	public void getProperties(final String prefix, final Properties properties) throws ConfigurationException {
		traceStep = getInt(properties, prefix + "traceStep", traceStep);
		nLines = getInt(properties, prefix + "nLines", nLines);
		matchTolerance = getDouble(properties, prefix + "matchTolerance", matchTolerance);
		maxGapFraction = getDouble(properties, prefix + "maxGapFraction", maxGapFraction);
		prominenceCut = getDouble(properties, prefix + "prominenceCut", prominenceCut);
		distanceFactor = getDouble(properties, prefix + "distanceFactor", distanceFactor);
		widthOffset = getInt(properties, prefix + "widthOffset", widthOffset);
		relHeight = getDouble(properties, prefix + "relHeight", relHeight);
		gapFactor = getDouble(properties, prefix + "gapFactor", gapFactor);
		localWindow = getInt(properties, prefix + "localWindow", localWindow);
		matchWidthFactor = getDouble(properties, prefix + "matchWidthFactor", matchWidthFactor);
		templateDegree = getInt(properties, prefix + "templateDegree", templateDegree);
		traceDegree = getInt(properties, prefix + "traceDegree", traceDegree);
		templateBinning = getInt(properties, prefix + "templateBinning", templateBinning);
		ifuGuessTolerance = getInt(properties, prefix + "ifuGuessTolerance", ifuGuessTolerance);
	}

	/**
	 * Creates a parameter set from the defaults bundled in
	 * {@value #DEFAULTS_RESOURCE}.
	 *
	 * @return the parameters
	 * @throws ConfigurationException if the resource is missing or invalid
	 */
	public static TraceParameters loadDefaults() throws ConfigurationException {
		final Properties properties = new Properties();
		try (InputStream is = TraceParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) throw new ConfigurationException("Missing resource " + DEFAULTS_RESOURCE);
			properties.load(is);
		} catch (final IOException e) {
			throw new ConfigurationException("Could not read " + DEFAULTS_RESOURCE, e);
		}
		final TraceParameters params = new TraceParameters();
		params.getProperties(DEFAULT_PREFIX, properties);
		params.validate();
		return params;
	}

	private static int getInt(final Properties properties, final String key, final int fallback) {
		final String value = properties.getProperty(key);
		if (value == null) return fallback;
		try {
			return Integer.parseInt(value.trim());
		} catch (final NumberFormatException e) {
			throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
		}
	}

	private static double getDouble(final Properties properties, final String key, final double fallback) {
		final String value = properties.getProperty(key);
		if (value == null) return fallback;
		try {
			return Double.parseDouble(value.trim());
		} catch (final NumberFormatException e) {
			throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
		}
	}

}
