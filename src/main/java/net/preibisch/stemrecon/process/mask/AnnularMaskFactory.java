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

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;

/**
 * Annulus centered on the detector: a pixel (x, y) is part of the mask if
 * innerRadius &lt;= |(x, y) - (columns / 2, rows / 2)| &lt; outerRadius.
 * An inner radius of 0 gives a disk.
 */
public class AnnularMaskFactory implements MaskFactory
{
	@Override
	public Mask createMask( final long rows, final long columns, final double innerRadius, final double outerRadius )
	{
		if ( rows <= 0 || columns <= 0 )
			throw new IllegalArgumentException( "Cannot create a mask for a " + columns + "x" + rows + " detector." );

		if ( innerRadius < 0 || outerRadius < innerRadius )
			throw new IllegalArgumentException( "Invalid radii: inner=" + innerRadius + ", outer=" + outerRadius );

		final Img< BitType > img = ArrayImgs.bits( columns, rows );

		final long cx = columns / 2;
		final long cy = rows / 2;
		final double inner2 = innerRadius * innerRadius;
		final double outer2 = outerRadius * outerRadius;

		final Cursor< BitType > c = img.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();

			final long dx = c.getLongPosition( 0 ) - cx;
			final long dy = c.getLongPosition( 1 ) - cy;
			final double d2 = dx * dx + dy * dy;

			c.get().set( d2 >= inner2 && d2 < outer2 );
		}

		return new Mask( img );
	}
}
