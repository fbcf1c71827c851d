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

import java.util.Arrays;
import java.util.List;

import ij.ImagePlus;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.apermap.event.TraceEventListener;
import sc.fiji.apermap.io.FiberTemplate;
import sc.fiji.apermap.io.TemplateLoader;
import sc.fiji.apermap.tracing.ApertureMapBuilder;
import sc.fiji.apermap.tracing.ColumnProfile;
import sc.fiji.apermap.tracing.ColumnProfileExtractor;
import sc.fiji.apermap.tracing.FiberLayout;
import sc.fiji.apermap.tracing.FrameRectifier;
import sc.fiji.apermap.tracing.MissingFiberResolver;
import sc.fiji.apermap.tracing.PeakAligner;
import sc.fiji.apermap.tracing.PeakDetector;
import sc.fiji.apermap.tracing.PeakThresholds;
import sc.fiji.apermap.tracing.TraceCoefficients;
import sc.fiji.apermap.tracing.TraceFitter;
import sc.fiji.apermap.tracing.TrackCleaner;
import sc.fiji.apermap.tracing.TrackTable;
import sc.fiji.apermap.util.ImpUtils;
import sc.fiji.apermap.util.Logger;

/**
 * Makes the aperture map of one spectrograph side from a flat-field (trace)
 * frame.
 * <p>
 * A run chains the stages of {@link sc.fiji.apermap.tracing}: the frame is
 * rectified, collapsed into column profiles, fiber peaks are detected and
 * aligned into tracks, fibers that were never detected are located with the
 * IFU template and interpolated, one trace polynomial is fitted per fiber and
 * the traces are rasterized. Runs are deterministic and single-threaded.
 * </p>
 * <pre>{@code
 * ApertureMapMaker maker = new ApertureMapMaker(frame, curvature, IFUType.HR, Side.BLUE, 1);
 * maker.addListener(event -> System.out.println(event));
 * ApertureMapResult result = maker.make(new TemplateLoader(templateDir, 1));
 * ImagePlus map = result.getApertureMap().toImagePlus("aperMap");
 * }</pre>
 */
public class ApertureMapMaker {

	private final RandomAccessibleInterval<? extends RealType<?>> frame;
	private RandomAccessibleInterval<? extends RealType<?>> variance;
	private final CurvatureModel curvature;
	private final IFUType ifuType;
	private final Side side;
	private final int binning;
	private TraceParameters params = new TraceParameters();
	private final Logger logger;

	/**
	 * @param frame     the 2D trace frame (dimension 0: column, dimension 1: row)
	 * @param curvature the curvature model of the frame
	 * @param ifuType   the IFU configuration
	 * @param side      the spectrograph side
	 * @param binning   the pixel binning of the frame along the slit
	 */
	public ApertureMapMaker(final RandomAccessibleInterval<? extends RealType<?>> frame,
			final CurvatureModel curvature, final IFUType ifuType, final Side side, final int binning) {
		if (frame == null || curvature == null || ifuType == null || side == null)
			throw new IllegalArgumentException("Frame, curvature, IFU type and side are required");
		if (frame.numDimensions() != 2)
			throw new IllegalArgumentException("Frame must be 2D but has " + frame.numDimensions() + " dimensions");
		if (binning < 1) throw new IllegalArgumentException("Invalid binning: " + binning);
		this.frame = Views.zeroMin(frame);
		this.curvature = curvature;
		this.ifuType = ifuType;
		this.side = side;
		this.binning = binning;
		logger = new Logger(ApertureMapMaker.class);
	}

	/**
	 * @param imp the trace frame (its current plane is used)
	 * @see #ApertureMapMaker(RandomAccessibleInterval, CurvatureModel, IFUType,
	 *      Side, int)
	 */
	public ApertureMapMaker(final ImagePlus imp, final CurvatureModel curvature, final IFUType ifuType,
			final Side side, final int binning) {
		this(ImpUtils.toFrame(imp), curvature, ifuType, side, binning);
	}

	/**
	 * Sets the per-pixel variance of the frame, used to weight columns when
	 * profiles are averaged. Unit variance is assumed if unset.
	 */
	public void setVariance(final RandomAccessibleInterval<? extends RealType<?>> variance) {
		if (variance != null && (variance.dimension(0) != frame.dimension(0)
				|| variance.dimension(1) != frame.dimension(1)))
			throw new IllegalArgumentException("Variance and frame dimensions differ");
		this.variance = (variance == null) ? null : Views.zeroMin(variance);
	}

	public void setParameters(final TraceParameters params) {
		if (params == null) throw new IllegalArgumentException("Parameters cannot be null");
		this.params = params;
	}

	public TraceParameters getParameters() {
		return params;
	}

	public void addListener(final TraceEventListener listener) {
		logger.addListener(listener);
	}

	public void removeListener(final TraceEventListener listener) {
		logger.removeListener(listener);
	}

	public void setVerbose(final boolean verbose) {
		logger.setDebug(verbose);
	}

	/**
	 * Loads the template of this IFU and side, then makes the map.
	 *
	 * @see #make(FiberTemplate)
	 */
	public ApertureMapResult make(final TemplateLoader loader) throws ApertureMapException {
		return make(loader.load(ifuType, side));
	}

	/**
	 * Makes the aperture map.
	 *
	 * @param template the fiber template, at its native binning
	 * @return the result
	 * @throws ConfigurationException  if parameters are invalid for this frame
	 * @throws SignalNotFoundException if no usable fiber signal is found
	 * @throws FitException            if a fiber trace cannot be fitted
	 */
	public ApertureMapResult make(final FiberTemplate template) throws ApertureMapException {
		final long start = System.currentTimeMillis();
		params.validate();
		if (template.getIFUType() != ifuType || template.getSide() != side)
			logger.warn("Template " + template + " used for " + ifuType + "/" + side);
		final double[] templatePositions = template.scaledTo(binning).getPositions();
		final int nColumns = (int) frame.dimension(0);
		final int nRows = (int) frame.dimension(1);
		logger.info("Tracing " + ifuType + "/" + side + " on " + nColumns + "x" + nRows + " frame, " + curvature);

		final FrameRectifier rectifier = new FrameRectifier(curvature);
		final Interval covered = rectifier.coveredInterval(nColumns, nRows);
		if (covered == null)
			throw new ConfigurationException(
					"Curvature offsets and span leave no column inside the frame and the valid span on every row");
		final Img<DoubleType> rectified = rectifier.rectify(frame);
		final List<ColumnProfile> profiles = new ColumnProfileExtractor(params.getTraceStep(), params.getNLines(),
				logger.child(ColumnProfileExtractor.class)).extract(Views.interval(rectified, covered),
						(variance == null) ? null : Views.interval(rectifier.rectifyVariance(variance), covered));

		final PeakDetector detector = new PeakDetector(params, logger.child(PeakDetector.class));
		final PeakThresholds thresholds = detector.calibrate(profiles);
		final List<double[]> peakLists = detector.detect(profiles, thresholds);

		final TrackTable aligned = new PeakAligner(params.getMatchTolerance(), logger.child(PeakAligner.class))
				.align(peakLists);
		final TrackCleaner.Result cleaned = new TrackCleaner(params.getMaxGapFraction(),
				logger.child(TrackCleaner.class)).clean(aligned);

		final FiberLayout resolved = new MissingFiberResolver(params, logger.child(MissingFiberResolver.class))
				.resolve(cleaned.referencePositions(), templatePositions, ifuType, thresholds.getApertureHalfWidth());
		final FiberLayout layout = resolved.retainSyntheticWithin(0, nRows);
		if (layout.size() < resolved.size())
			logger.warn((resolved.size() - layout.size()) + " missing fiber(s) predicted beyond the frame edges");
		final List<TraceCoefficients> traces = new TraceFitter(params.getTemplateDegree(), params.getTraceDegree(),
				logger.child(TraceFitter.class)).fit(cleaned.tracks(), layout, profiles, curvature);
		final ApertureMapBuilder.Rasterization raster = new ApertureMapBuilder(curvature,
				thresholds.getApertureHalfWidth(), logger.child(ApertureMapBuilder.class))
						.buildComplete(nColumns, nRows, traces);
		if (raster.traces().isEmpty())
			throw new SignalNotFoundException("No fiber trace crosses the valid span of the frame");

		final int expected = (ifuType.getExpectedFibers() > 0) ? ifuType.getExpectedFibers() : template.size();
		final ApertureMapResult result = new ApertureMapResult(raster.map(), raster.traces(),
				raster.syntheticLabels(), thresholds, expected, cleaned.referenceProfile(),
				profiles.get(cleaned.referenceProfile()).getRepresentativeColumn());
		if (result.isCountMismatch()) {
			logger.warn(result.getNFibers() + " fibers found but " + ifuType + " expects " + expected
					+ ". Check the missing fibers " + Arrays.toString(result.getMissingIndices()));
			final IFUType guess = IFUType.guess(result.getNFibers(), params.getIfuGuessTolerance());
			if (guess != ifuType && guess != IFUType.UNKNOWN)
				logger.warn("Fiber count is closer to the " + guess + " configuration");
		}
		logger.info(result + " in " + ApertureUtils.getElapsedTime(start));
		return result;
	}

}
