/*-
 * #%L
 * Software for the reconstruction of bright and dark field STEM images
 * from streamed detector data.
 * %%
 * Copyright (C) 2012 - 2025 STEM Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.stemrecon.process.mask;

/**
 * Builds the membership mask of one detector region.
 */
public interface MaskFactory
{
	/**
	 * @param rows - detector rows
	 * @param columns - detector columns
	 * @param innerRadius - inner boundary of the region (inclusive)
	 * @param outerRadius - outer boundary of the region (exclusive)
	 * @return the mask
	 */
	public Mask createMask( final long rows, final long columns, final double innerRadius, final double outerRadius );
}
