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


/**
 * The stages of aperture-map making, from a frame to a labeled map.
 * <p>
 * Each stage is a small class that can be run, and tested, on its own. They
 * are chained by {@link sc.fiji.apermap.ApertureMapMaker} in this order:
 * </p>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link sc.fiji.apermap.tracing.FrameRectifier} - Straightens the
 *       spectral curvature</li>
 *   <li>{@link sc.fiji.apermap.tracing.ColumnProfileExtractor} - Collapses
 *       groups of adjacent columns into 1D profiles</li>
 *   <li>{@link sc.fiji.apermap.tracing.PeakDetector} - Finds sub-pixel fiber
 *       centers, with thresholds calibrated on the fiber spacing</li>
 *   <li>{@link sc.fiji.apermap.tracing.PeakAligner} - Stitches peaks of
 *       consecutive profiles into fiber tracks</li>
 *   <li>{@link sc.fiji.apermap.tracing.TrackCleaner} - Drops incomplete tracks
 *       and picks the reference profile</li>
 *   <li>{@link sc.fiji.apermap.tracing.MissingFiberResolver} - Registers the
 *       detected fibers on the IFU template</li>
 *   <li>{@link sc.fiji.apermap.tracing.TraceFitter} - Interpolates missing
 *       fibers and fits one polynomial per fiber</li>
 *   <li>{@link sc.fiji.apermap.tracing.ApertureMapBuilder} - Rasterizes the
 *       traces</li>
 * </ul>
 *
 * <h2>Coordinates</h2>
 * Images are indexed (column, row): dimension 0 runs along the dispersion
 * axis, dimension 1 along the slit. Peak and track positions are rows.
 * Profiles are taken on the rectified frame; traces are expressed in absolute
 * detector columns.
 */
package sc.fiji.apermap.tracing;
