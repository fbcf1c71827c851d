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
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

/**
 * The final ordering of fibers on the detector, with the fibers that were
 * never detected inserted where the template expects them.
 */
public class FiberLayout {

	/**
	 * One fiber of the layout.
	 */
	public static final class Slot {

		private final double referencePosition;
		private final double templateCoordinate;
		private final int trackIndex;

		/**
		 * @param referencePosition  the row of the fiber in the reference profile
		 *                           (predicted, for synthetic slots)
		 * @param templateCoordinate the template position matched to this fiber
		 * @param trackIndex         the index of the detected track, or -1 for a
		 *                           synthetic slot
		 */
		public Slot(final double referencePosition, final double templateCoordinate, final int trackIndex) {
			this.referencePosition = referencePosition;
			this.templateCoordinate = templateCoordinate;
			this.trackIndex = trackIndex;
		}

		public double getReferencePosition() {
			return referencePosition;
		}

		public double getTemplateCoordinate() {
			return templateCoordinate;
		}

		public int getTrackIndex() {
			return trackIndex;
		}

		public boolean isSynthetic() {
			return trackIndex < 0;
		}

		@Override
		public String toString() {
			return String.format("%s[%.2f <- %.2f]", isSynthetic() ? "Synthetic" : "Track " + trackIndex,
					referencePosition, templateCoordinate);
		}
	}

	private final List<Slot> slots;

	/**
	 * @param slots the slots; they are kept sorted by reference position
	 */
	public FiberLayout(final List<Slot> slots) {
		final List<Slot> sorted = new ArrayList<>(slots);
		sorted.sort((s1, s2) -> Double.compare(s1.referencePosition, s2.referencePosition));
		this.slots = Collections.unmodifiableList(sorted);
	}

	public List<Slot> getSlots() {
		return slots;
	}

	public Slot get(final int index) {
		return slots.get(index);
	}

	public int size() {
		return slots.size();
	}

	/**
	 * @return the 1-based positions, in final fiber order, of the synthetic
	 *         slots
	 */
	public int[] getMissingIndices() {
		return IntStream.range(0, slots.size()).filter(i -> slots.get(i).isSynthetic())
				.map(i -> i + 1).toArray();
	}

	/**
	 * Drops the synthetic slots predicted outside a range of rows, e.g., template
	 * fibers falling beyond the detector edges. Detected slots are always kept.
	 *
	 * @param from the first valid row
	 * @param to   the end (exclusive) of the valid rows
	 * @return the layout (this layout if nothing is dropped)
	 */
	public FiberLayout retainSyntheticWithin(final double from, final double to) {
		final List<Slot> kept = new ArrayList<>(slots.size());
		for (final Slot slot : slots) {
			if (!slot.isSynthetic() || (slot.referencePosition >= from && slot.referencePosition < to))
				kept.add(slot);
		}
		return (kept.size() == slots.size()) ? this : new FiberLayout(kept);
	}

	public int countMissing() {
		return getMissingIndices().length;
	}

	@Override
	public String toString() {
		return "FiberLayout[" + slots.size() + " fibers, " + countMissing() + " missing]";
	}

}
