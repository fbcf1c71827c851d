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

package sc.fiji.apermap.io;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.apermap.IFUType;
import sc.fiji.apermap.Side;
import sc.fiji.apermap.TemplateLoadException;
import sc.fiji.apermap.TraceParameters;

/**
 * Tests for {@link TemplateLoader} and {@link FiberTemplate}.
 */
public class TemplateLoaderTest {

	private Path dir;

	@Before
	public void setUp() throws URISyntaxException {
		dir = Paths.get(TemplateLoaderTest.class.getResource("/templates").toURI());
	}

	@Test
	public void testFileName() {
		assertEquals("HR_b.txt", TemplateLoader.fileName(IFUType.HR, Side.BLUE));
		assertEquals("M2FS_r.txt", TemplateLoader.fileName(IFUType.M2FS, Side.RED));
	}

	@Test
	public void testLoad() {
		final FiberTemplate template = new TemplateLoader(dir, 1).load(IFUType.HR, Side.BLUE);
		assertEquals(5, template.size());
		assertEquals(IFUType.HR, template.getIFUType());
		assertEquals(Side.BLUE, template.getSide());
		assertArrayEquals(new double[] { 100, 110, 120, 130, 140 }, template.getPositions(), 0);
	}

	@Test
	public void testBinning() {
		final TemplateLoader loader = new TemplateLoader(dir, 2);
		final FiberTemplate unbinned = loader.load(IFUType.HR, Side.BLUE, 1);
		assertEquals(1, unbinned.getBinning());
		assertArrayEquals(new double[] { 200, 220, 240, 260, 280 }, unbinned.getPositions(), 0);
		assertSame(loader.load(IFUType.HR, Side.BLUE), loader.load(IFUType.HR, Side.BLUE, 2));
		final FiberTemplate binned = new TemplateLoader(dir, 1).load(IFUType.HR, Side.BLUE, 2);
		assertEquals(55, binned.getPositions()[1], 0);
	}

	@Test
	public void testBinningFromParameters() {
		final TemplateLoader loader = new TemplateLoader(dir, new TraceParameters().templateBinning(2));
		assertEquals(2, loader.getNativeBinning());
		assertEquals(200, loader.load(IFUType.HR, Side.BLUE, 1).getPositions()[0], 0);
	}

	@Test
	public void testCache() {
		final TemplateLoader loader = new TemplateLoader(dir, 1);
		final FiberTemplate first = loader.load(IFUType.HR, Side.BLUE);
		assertSame(first, loader.load(IFUType.HR, Side.BLUE));
		final FiberTemplate other = new TemplateLoader(dir, 1).load(IFUType.HR, Side.BLUE);
		assertNotSame(first, other);
		assertEquals(first, other);
		assertEquals(first.hashCode(), other.hashCode());
	}

	@Test
	public void testPositionsAreCopied() {
		final FiberTemplate template = new TemplateLoader(dir, 1).load(IFUType.HR, Side.BLUE);
		template.getPositions()[0] = -1;
		assertEquals(100, template.getPositions()[0], 0);
	}

	@Test
	public void testMalformed() {
		try {
			new TemplateLoader(dir, 1).load(IFUType.M2FS, Side.RED);
			fail("Malformed template accepted");
		}
		catch (final TemplateLoadException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("line 5"));
		}
	}

	@Test(expected = TemplateLoadException.class)
	public void testEmpty() {
		new TemplateLoader(dir, 1).load(IFUType.STD, Side.BLUE);
	}

	@Test(expected = TemplateLoadException.class)
	public void testMissing() {
		new TemplateLoader(dir, 1).load(IFUType.LSB, Side.RED);
	}

	@Test
	public void testFailedLoadIsRetried() {
		final TemplateLoader loader = new TemplateLoader(dir, 1);
		for (int i = 0; i < 2; i++) {
			try {
				loader.load(IFUType.LSB, Side.RED);
				fail("Missing template loaded");
			}
			catch (final TemplateLoadException e) {
				assertTrue(loader.toString().contains("0 cached"));
			}
		}
	}

}
