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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import ij.ImagePlus;
import ij.process.FloatProcessor;
import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.FloatType;

import org.junit.Test;

import sc.fiji.apermap.event.TraceEvent;
import sc.fiji.apermap.io.FiberTemplate;
import sc.fiji.apermap.tracing.ApertureMap;

/**
 * End-to-end tests for {@link ApertureMapMaker} on synthetic trace frames.
 */
public class ApertureMapMakerTest {

	private static final int WIDTH = 600;
	private static final double SIGMA = 1.5;
	private static final double AMPLITUDE = 1000;

	/* 10 fibers, 8 rows apart */
	private static final double[] EVEN_ROWS = SyntheticFrames.evenlySpaced(60, 8, 10);
	private static final FiberTemplate EVEN_TEMPLATE = new FiberTemplate(IFUType.UNKNOWN, Side.BLUE,
			SyntheticFrames.evenlySpaced(10, 8, 10), 1);

	private static ApertureMapResult makeEven(final double[] rows, final CurvatureModel curvature) {
		final Img<FloatType> frame = SyntheticFrames.fibers(WIDTH, 200, rows, SIGMA, AMPLITUDE);
		return new ApertureMapMaker(frame, curvature, IFUType.UNKNOWN, Side.BLUE, 1).make(EVEN_TEMPLATE);
	}

	@Test
	public void testEvenlySpacedFibers() {
		final ApertureMapResult result = makeEven(EVEN_ROWS, CurvatureModel.flat(WIDTH));
		assertEquals(10, result.getNFibers());
		assertEquals(10, result.getExpectedFibers());
		assertFalse(result.isCountMismatch());
		assertEquals(0, result.getMissingIndices().length);
		assertEquals(4, result.getApertureHalfWidth());
		assertEquals(3, result.getThresholds().getWidthCut(), 0);
		final int reference = result.getReferenceProfile();
		assertTrue(reference >= 0 && reference < 29);
		assertTrue(result.getReferenceColumn() >= 0 && result.getReferenceColumn() < WIDTH);
		final int[] midpoints = result.getMidpointRows();
		for (int i = 0; i < EVEN_ROWS.length; i++) {
			assertEquals(EVEN_ROWS[i], midpoints[i], 1);
			assertEquals(EVEN_ROWS[i], result.getReferencePositions()[i], 0.5);
			assertEquals(i + 1, result.getTraces().get(i).getLabel());
			assertFalse(result.getTraces().get(i).isSynthetic());
		}

		final ApertureMap map = result.getApertureMap();
		assertTrue(map.isComplete());
		assertEquals(WIDTH, map.getWidth());
		assertEquals(1, map.getLabel(300, 60));
		assertEquals(10, map.getLabel(0, 132));
		assertEquals(0, map.getLabel(300, 20));
		assertEquals(0, map.getLabel(300, 180));
		// adjacent bands tile the rows between fibers
		for (int label = 1; label <= 10; label++)
			assertEquals(8 * WIDTH, map.getPixelCounts()[label]);
	}

	@Test
	public void testFullDetectorFrame() {
		final double[] rows = SyntheticFrames.evenlySpaced(1000, 8, 10);
		final Img<FloatType> frame = SyntheticFrames.fibers(2048, 2048, rows, SIGMA, AMPLITUDE);
		final ApertureMapResult result = new ApertureMapMaker(frame, CurvatureModel.flat(2048), IFUType.UNKNOWN,
				Side.RED, 1).make(new FiberTemplate(IFUType.UNKNOWN, Side.RED, rows, 1));
		assertEquals(0, result.getMissingIndices().length);
		assertArrayEquals(new int[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 }, result.getApertureMap().getPresentLabels());
		for (int i = 0; i < rows.length; i++)
			assertEquals(rows[i], result.getMidpointRows()[i], 1);
	}

	@Test
	public void testMissingFiberIsInterpolated() {
		final ApertureMapResult result = makeEven(SyntheticFrames.without(EVEN_ROWS, 5), CurvatureModel.flat(WIDTH));
		assertEquals(10, result.getNFibers());
		assertArrayEquals(new int[] { 5 }, result.getMissingIndices());
		assertTrue(result.getTraces().get(4).isSynthetic());
		assertEquals(92, result.getTraces().get(4).rowAt(WIDTH / 2), 0.5);
		assertEquals(92, result.getMidpointRows()[4]);
		assertEquals(5, result.getApertureMap().getLabel(300, 92));
	}

	@Test
	public void testGroupedFibers() {
		final double[] rows = SyntheticFrames.without(SyntheticFrames.bundled(40, 4, 5, 8, 20), 7);
		final FiberTemplate template = new FiberTemplate(IFUType.M2FS, Side.RED,
				SyntheticFrames.bundled(10, 4, 5, 8, 20), 1);
		final List<TraceEvent> warnings = new ArrayList<>();
		final ApertureMapMaker maker = new ApertureMapMaker(SyntheticFrames.fibers(WIDTH, 280, rows, SIGMA,
				AMPLITUDE), CurvatureModel.flat(WIDTH), IFUType.M2FS, Side.RED, 1);
		maker.addListener(event -> {
			if (event.isWarning()) warnings.add(event);
		});
		final ApertureMapResult result = maker.make(template);
		assertEquals(20, result.getNFibers());
		assertArrayEquals(new int[] { 7 }, result.getMissingIndices());
		assertEquals(100, result.getMidpointRows()[6]);
		assertEquals(128, result.getExpectedFibers());
		assertTrue(result.isCountMismatch());
		assertFalse(warnings.isEmpty());
	}

	@Test
	public void testFibersBeyondFrameEdge() {
		// the first two template fibers fall above row 0
		final double[] template = SyntheticFrames.bundled(10, 4, 5, 8, 20);
		final double[] rows = new double[template.length - 2];
		for (int i = 0; i < rows.length; i++)
			rows[i] = template[i + 2] - 20;
		final List<TraceEvent> warnings = new ArrayList<>();
		final ApertureMapMaker maker = new ApertureMapMaker(SyntheticFrames.fibers(WIDTH, 280, rows, SIGMA,
				AMPLITUDE), CurvatureModel.flat(WIDTH), IFUType.M2FS, Side.RED, 1);
		maker.addListener(event -> {
			if (event.isWarning()) warnings.add(event);
		});
		final ApertureMapResult result = maker.make(new FiberTemplate(IFUType.M2FS, Side.RED, template, 1));
		assertEquals(18, result.getNFibers());
		assertEquals(0, result.getMissingIndices().length);
		final int[] labels = new int[18];
		for (int i = 0; i < labels.length; i++)
			labels[i] = i + 1;
		assertArrayEquals(labels, result.getApertureMap().getPresentLabels());
		assertEquals(6, result.getMidpointRows()[0]);
		assertTrue(result.isCountMismatch());
		assertFalse(warnings.isEmpty());
	}

	@Test
	public void testSignalOnlyWithinValidSpan() {
		final CurvatureModel curvature = new CurvatureModel(0, 0, 0, 100, 400);
		final Img<FloatType> frame = curvature.maskOutsideSpan(SyntheticFrames.fibers(WIDTH, 200, EVEN_ROWS, SIGMA,
				AMPLITUDE));
		final ApertureMapResult result = new ApertureMapMaker(frame, curvature, IFUType.UNKNOWN, Side.BLUE, 1)
				.make(EVEN_TEMPLATE);
		assertEquals(10, result.getNFibers());
		assertEquals(0, result.getMissingIndices().length);
		final ApertureMap map = result.getApertureMap();
		assertEquals(0, map.getLabel(99, 60));
		assertEquals(1, map.getLabel(100, 60));
		assertEquals(1, map.getLabel(300, 60));
		assertEquals(1, map.getLabel(499, 60));
		assertEquals(0, map.getLabel(500, 60));
		for (int i = 0; i < EVEN_ROWS.length; i++)
			assertEquals(EVEN_ROWS[i], result.getMidpointRows()[i], 1);
	}

	@Test
	public void testCurvedFrame() {
		final CurvatureModel curvature = new CurvatureModel(1e-4, 100, 5, 10, 500);
		final ApertureMapResult result = makeEven(EVEN_ROWS, curvature);
		assertEquals(10, result.getNFibers());
		final ApertureMap map = result.getApertureMap();
		// row 60: offset 5.16, valid span [15.16, 515.16)
		assertEquals(0, map.getLabel(15, 60));
		assertEquals(1, map.getLabel(16, 60));
		assertEquals(1, map.getLabel(515, 60));
		assertEquals(0, map.getLabel(516, 60));
		assertEquals(60, result.getMidpointRows()[0]);
	}

	@Test
	public void testDeterministic() {
		final ApertureMap first = makeEven(EVEN_ROWS, CurvatureModel.flat(WIDTH)).getApertureMap();
		final ApertureMap second = makeEven(EVEN_ROWS, CurvatureModel.flat(WIDTH)).getApertureMap();
		final Cursor<IntType> c1 = first.getLabels().cursor();
		final Cursor<IntType> c2 = second.getLabels().cursor();
		while (c1.hasNext())
			assertEquals(c1.next().get(), c2.next().get());
	}

	@Test
	public void testImagePlusFrame() {
		final float[] pixels = new float[WIDTH * 200];
		final double[] profile = SyntheticFrames.profile(200, EVEN_ROWS, SIGMA, AMPLITUDE);
		for (int y = 0; y < 200; y++) {
			for (int x = 0; x < WIDTH; x++)
				pixels[y * WIDTH + x] = (float) profile[y];
		}
		final ImagePlus imp = new ImagePlus("trace", new FloatProcessor(WIDTH, 200, pixels));
		final ApertureMapMaker maker = new ApertureMapMaker(imp, CurvatureModel.flat(WIDTH), IFUType.UNKNOWN,
				Side.BLUE, 1);
		final List<TraceEvent> events = new ArrayList<>();
		maker.addListener(events::add);
		final ApertureMapResult result = maker.make(EVEN_TEMPLATE);
		assertEquals(10, result.getNFibers());
		assertFalse(events.isEmpty());
		final ImagePlus map = result.getApertureMap().toImagePlus("aperMap");
		assertEquals(1, map.getProcessor().get(300, 60));
	}

	@Test
	public void testBinnedTemplate() {
		// template measured at binning 1, frame binned by 2 along the slit
		final FiberTemplate unbinned = new FiberTemplate(IFUType.UNKNOWN, Side.BLUE,
				SyntheticFrames.evenlySpaced(20, 16, 10), 1);
		final Img<FloatType> frame = SyntheticFrames.fibers(WIDTH, 200, EVEN_ROWS, SIGMA, AMPLITUDE);
		final ApertureMapResult result = new ApertureMapMaker(frame, CurvatureModel.flat(WIDTH), IFUType.UNKNOWN,
				Side.BLUE, 2).make(unbinned);
		assertEquals(10, result.getNFibers());
		assertEquals(0, result.getMissingIndices().length);
	}

	@Test(expected = SignalNotFoundException.class)
	public void testBlankFrame() {
		new ApertureMapMaker(ArrayImgs.floats(WIDTH, 200), CurvatureModel.flat(WIDTH), IFUType.HR, Side.BLUE, 1)
				.make(EVEN_TEMPLATE);
	}

	@Test(expected = ConfigurationException.class)
	public void testInvalidParameters() {
		final ApertureMapMaker maker = new ApertureMapMaker(ArrayImgs.floats(WIDTH, 200),
				CurvatureModel.flat(WIDTH), IFUType.HR, Side.BLUE, 1);
		maker.setParameters(new TraceParameters().traceStep(0));
		maker.make(EVEN_TEMPLATE);
	}

	@Test(expected = ConfigurationException.class)
	public void testOffsetsOutsideFrame() {
		new ApertureMapMaker(ArrayImgs.floats(WIDTH, 200), new CurvatureModel(0, 0, 2 * WIDTH, 0, WIDTH),
				IFUType.HR, Side.BLUE, 1).make(EVEN_TEMPLATE);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testVarianceShape() {
		new ApertureMapMaker(ArrayImgs.floats(WIDTH, 200), CurvatureModel.flat(WIDTH), IFUType.HR, Side.BLUE, 1)
				.setVariance(ArrayImgs.floats(WIDTH, 100));
	}

}
