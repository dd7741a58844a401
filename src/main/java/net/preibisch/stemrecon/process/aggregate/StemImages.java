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
package net.preibisch.stemrecon.process.aggregate;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.preibisch.stemrecon.process.StemProcessingException;

/**
 * The two reconstructed width x height images, pixel i holding the value of image number i + 1.
 * Allocated zero-filled, values are set (not accumulated).
 */
public class StemImages
{
	final int width, height;
	final long[] brightData, darkData;
	final ArrayImg< UnsignedLongType, LongArray > bright, dark;

	public StemImages( final int width, final int height )
	{
		if ( width <= 0 || height <= 0 || (long)width * height > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Invalid output size " + width + "x" + height );

		this.width = width;
		this.height = height;
		this.brightData = new long[ width * height ];
		this.darkData = new long[ width * height ];
		this.bright = ArrayImgs.unsignedLongs( brightData, width, height );
		this.dark = ArrayImgs.unsignedLongs( darkData, width, height );
	}

	/**
	 * @param imageNumber - 1-based image number, must be within [1, width*height]
	 * @param brightValue - bright field sum
	 * @param darkValue - dark field sum
	 */
	public void set( final long imageNumber, final long brightValue, final long darkValue )
	{
		if ( !contains( imageNumber ) )
			throw new StemProcessingException( "Image number " + imageNumber + " is outside of the " + width + "x" + height +
					" output image (valid: 1.." + numPixels() + ")" );

		final int index = (int)( imageNumber - 1 );
		brightData[ index ] = brightValue;
		darkData[ index ] = darkValue;
	}

	public boolean contains( final long imageNumber )
	{
		return imageNumber >= 1 && imageNumber <= numPixels();
	}

	public int width() { return width; }
	public int height() { return height; }
	public int numPixels() { return width * height; }

	public long bright( final long imageNumber ) { return brightData[ (int)( imageNumber - 1 ) ]; }
	public long dark( final long imageNumber ) { return darkData[ (int)( imageNumber - 1 ) ]; }

	public ArrayImg< UnsignedLongType, LongArray > brightImg() { return bright; }
	public ArrayImg< UnsignedLongType, LongArray > darkImg() { return dark; }

	/**
	 * @return the row-major bright field values, not a copy
	 */
	public long[] brightData() { return brightData; }

	/**
	 * @return the row-major dark field values, not a copy
	 */
	public long[] darkData() { return darkData; }
}
