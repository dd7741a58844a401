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
package net.preibisch.stemrecon.process.stem;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;
import net.preibisch.stemrecon.process.mask.Mask;

/**
 * Sums the intensities under each mask, walking image and masks in the same flat iteration order.
 */
public class MaskedSumCalculator implements STEMValuesCalculator
{
	@Override
	public STEMValues calculate(
			final RandomAccessibleInterval< UnsignedShortType > image,
			final long imageNumber,
			final Mask bright,
			final Mask dark )
	{
		if ( !bright.sameDimensions( image ) || !dark.sameDimensions( image ) )
			throw new IllegalArgumentException( "Image " + imageNumber + " has dimensions " + Util.printInterval( image ) +
					", masks are " + bright + " and " + dark );

		final Cursor< UnsignedShortType > cursor = Views.flatIterable( image ).cursor();
		final Cursor< BitType > brightCursor = bright.flatIterable().cursor();
		final Cursor< BitType > darkCursor = dark.flatIterable().cursor();

		long brightSum = 0;
		long darkSum = 0;

		while ( cursor.hasNext() )
		{
			final int value = cursor.next().get();

			if ( brightCursor.next().get() )
				brightSum += value;

			if ( darkCursor.next().get() )
				darkSum += value;
		}

		return new STEMValues( imageNumber, brightSum, darkSum );
	}
}
