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

/**
 * A 1D intensity profile along the row axis, obtained by averaging a group of
 * adjacent (rectified) columns.
 */
public class ColumnProfile {

	private final int index;
	private final int[] columns;
	private final double representativeColumn;
	private final double[] values;

	/**
	 * @param index   the position of this profile in its sequence
	 * @param columns the member column indices, ascending
	 * @param values  the averaged intensities, one per row
	 */
	public ColumnProfile(final int index, final int[] columns, final double[] values) {
		if (columns == null || columns.length == 0)
			throw new IllegalArgumentException("A profile needs at least one column");
		this.index = index;
		this.columns = columns;
		this.values = values;
		final int mid = columns.length / 2;
		representativeColumn = (columns.length % 2 == 1) ? columns[mid] : (columns[mid - 1] + columns[mid]) / 2.0;
	}

	public int getIndex() {
		return index;
	}

	public int[] getColumns() {
		return columns;
	}

	/** @return the median of the member columns */
	public double getRepresentativeColumn() {
		return representativeColumn;
	}

	public double[] getValues() {
		return values;
	}

	public int length() {
		return values.length;
	}

	@Override
	public String toString() {
		return "ColumnProfile[" + index + ", columns " + columns[0] + "-" + columns[columns.length - 1] + "]";
	}

}
