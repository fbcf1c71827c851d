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

package sc.fiji.apermap.tracing;

import java.util.ArrayList;
import java.util.List;

import sc.fiji.apermap.CurvatureModel;
import sc.fiji.apermap.FitException;
import sc.fiji.apermap.util.Logger;
import sc.fiji.apermap.util.PolynomialFitter;

/**
 * Turns resolved fiber tracks into one trace polynomial per fiber.
 * <p>
 * Fibers that were never detected are first interpolated profile by profile:
 * in each profile a polynomial mapping template coordinate onto detected
 * position is fitted over the fibers detected there, and evaluated at the
 * template coordinate of every missing fiber. Entries are then converted to
 * absolute detector coordinates ({@code column = representative column +
 * offset(row)}) and a polynomial row(column) is fitted to every fiber.
 * </p>
 */
public class TraceFitter {

	private final int templateDegree;
	private final int traceDegree;
	private final Logger logger;

	public TraceFitter(final int templateDegree, final int traceDegree) {
		this(templateDegree, traceDegree, new Logger(TraceFitter.class));
	}

	public TraceFitter(final int templateDegree, final int traceDegree, final Logger logger) {
		this.templateDegree = templateDegree;
		this.traceDegree = traceDegree;
		this.logger = logger;
	}

	/**
	 * Builds the complete track table: the cleaned tracks in layout order, with
	 * a synthetic track, filled by interpolation, for every missing fiber.
	 *
	 * @param cleaned the cleaned tracks, sorted by reference position
	 * @param layout  the resolved layout referring to the cleaned tracks
	 * @return the complete table, one track per layout slot
	 */
	public TrackTable synthesize(final TrackTable cleaned, final FiberLayout layout) {
		final int nProfiles = cleaned.getNProfiles();
		final TrackTable complete = new TrackTable(nProfiles);
		for (final FiberLayout.Slot slot : layout.getSlots()) {
			complete.add(slot.isSynthetic() ? FiberTrack.synthetic(nProfiles) : cleaned.get(slot.getTrackIndex()));
		}
		if (layout.countMissing() == 0) return complete;

		int unresolved = 0;
		for (int p = 0; p < nProfiles; p++) {
			final List<Double> x = new ArrayList<>();
			final List<Double> y = new ArrayList<>();
			for (int i = 0; i < layout.size(); i++) {
				final FiberTrack track = complete.get(i);
				if (track.isSynthetic() || !track.isDetected(p)) continue;
				x.add(layout.get(i).getTemplateCoordinate());
				y.add(track.get(p).getPosition());
			}
			final int degree = Math.min(templateDegree, distinct(x) - 1);
			if (degree < 1) {
				unresolved++;
				continue;
			}
			final double[] coeffs = PolynomialFitter.fit(toArray(x), toArray(y), degree);
			for (int i = 0; i < layout.size(); i++) {
				if (!complete.get(i).isSynthetic()) continue;
				final double position = PolynomialFitter.evaluate(coeffs, layout.get(i).getTemplateCoordinate());
				complete.get(i).set(p, TrackEntry.detected(position));
			}
		}
		if (unresolved > 0) logger.debug(unresolved + " profile(s) too sparse to interpolate missing fibers");
		return complete;
	}

	/**
	 * Fits one trace per fiber.
	 *
	 * @param cleaned   the cleaned tracks, sorted by reference position
	 * @param layout    the resolved layout
	 * @param profiles  the column profiles the tracks refer to
	 * @param curvature the curvature model used to rectify the frame
	 * @return the traces, labeled 1..N in layout order
	 * @throws FitException if a fiber has too few points for the trace degree,
	 *                      or a fit is singular
	 */
	public List<TraceCoefficients> fit(final TrackTable cleaned, final FiberLayout layout,
			final List<ColumnProfile> profiles, final CurvatureModel curvature) throws FitException {
		if (profiles.size() != cleaned.getNProfiles()) throw new IllegalArgumentException(
				profiles.size() + " profiles given for a table of " + cleaned.getNProfiles());
		final TrackTable complete = synthesize(cleaned, layout);
		final List<TraceCoefficients> traces = new ArrayList<>(complete.size());
		for (int i = 0; i < complete.size(); i++) {
			final FiberTrack track = complete.get(i);
			final List<Double> columns = new ArrayList<>();
			final List<Double> rows = new ArrayList<>();
			for (int p = 0; p < profiles.size(); p++) {
				if (!track.isDetected(p)) continue;
				final double row = track.get(p).getPosition();
				columns.add(profiles.get(p).getRepresentativeColumn() + curvature.offset(row));
				rows.add(row);
			}
			final double[] coeffs;
			try {
				coeffs = PolynomialFitter.fit(toArray(columns), toArray(rows), traceDegree);
			} catch (final FitException e) {
				throw new FitException("Fiber " + (i + 1) + ": " + e.getMessage(), e);
			}
			traces.add(new TraceCoefficients(i + 1, coeffs, layout.get(i).getReferencePosition(), track.isSynthetic()));
		}
		logger.debug("Fitted " + traces.size() + " traces of degree " + traceDegree);
		return traces;
	}

	private static int distinct(final List<Double> values) {
		return (int) values.stream().distinct().count();
	}

	private static double[] toArray(final List<Double> values) {
		return values.stream().mapToDouble(Double::doubleValue).toArray();
	}

}
