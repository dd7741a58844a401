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
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.read.ConvertedRandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.view.Views;

/**
 * Pixel membership over a columns x rows detector grid. The backing image is never handed out, all
 * accessors return copies of the values, so a Mask can be read by any number of threads once built.
 */
public class Mask
{
	final Img< BitType > img;
	final RandomAccessibleInterval< BitType > readOnly;
	final long count;

	/**
	 * @param img - columns x rows membership image, taken over by this mask (do not modify it afterwards)
	 */
	public Mask( final Img< BitType > img )
	{
		if ( img.numDimensions() != 2 )
			throw new IllegalArgumentException( "A mask must be two-dimensional, got " + img.numDimensions() + " dimensions." );

		this.img = img;
		this.readOnly = new ConvertedRandomAccessibleInterval< BitType, BitType >( img, ( in, out ) -> out.set( in.get() ), new BitType() );

		long c = 0;
		for ( final BitType t : img )
			if ( t.get() )
				++c;

		this.count = c;
	}

	public long columns() { return img.dimension( 0 ); }
	public long rows() { return img.dimension( 1 ); }

	public long numPixels() { return img.size(); }

	/**
	 * @return number of pixels in the mask
	 */
	public long count() { return count; }

	public boolean contains( final long x, final long y )
	{
		final RandomAccess< BitType > ra = readOnly.randomAccess();
		ra.setPosition( x, 0 );
		ra.setPosition( y, 1 );
		return ra.get().get();
	}

	/**
	 * @return read-only view in flat (row-major) iteration order
	 */
	public IterableInterval< BitType > flatIterable()
	{
		return Views.flatIterable( readOnly );
	}

	public boolean[] toArray()
	{
		final boolean[] array = new boolean[ (int)numPixels() ];
		final Cursor< BitType > c = flatIterable().cursor();

		for ( int i = 0; c.hasNext(); ++i )
			array[ i ] = c.next().get();

		return array;
	}

	public boolean sameDimensions( final RandomAccessibleInterval< ? > image )
	{
		return image.numDimensions() == 2 && image.dimension( 0 ) == columns() && image.dimension( 1 ) == rows();
	}

	@Override
	public String toString()
	{
		return "Mask[" + columns() + "x" + rows() + ", " + count + " pixels]";
	}
}
