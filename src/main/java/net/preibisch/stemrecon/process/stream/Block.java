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
package net.preibisch.stemrecon.process.stream;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ShortArray;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.view.Views;

/**
 * One decoded detector block: the header and the raw samples of all images in it, stored as a
 * columns x rows x imagesInBlock {@link ArrayImg}. A block is handed to exactly one compute task,
 * which only reads it.
 */
public class Block
{
	final Header header;
	final short[] samples;
	final ArrayImg< UnsignedShortType, ShortArray > img;

	final long index, offset;

	/**
	 * @param header - the decoded header
	 * @param samples - imagesInBlock * rows * columns samples, images concatenated in row-major order
	 * @param index - running number of this block in the stream (0-based)
	 * @param offset - byte offset of the header in the stream
	 */
	public Block( final Header header, final short[] samples, final long index, final long offset )
	{
		if ( samples.length != header.numSamples() )
			throw new IllegalArgumentException( "Block holds " + samples.length + " samples, header declares " + header.numSamples() );

		this.header = header;
		this.samples = samples;
		this.index = index;
		this.offset = offset;

		if ( samples.length > 0 )
			this.img = ArrayImgs.unsignedShorts( samples, header.columns(), header.rows(), header.imagesInBlock() );
		else
			this.img = null;
	}

	public Header header() { return header; }
	public long index() { return index; }
	public long offset() { return offset; }

	public int numImages() { return (int)header.imagesInBlock(); }

	/**
	 * @param i - image in this block (0-based)
	 * @return a columns x rows view of image i
	 */
	public RandomAccessibleInterval< UnsignedShortType > image( final int i )
	{
		if ( i < 0 || i >= numImages() )
			throw new IndexOutOfBoundsException( "Image " + i + " is not part of block " + index + " (" + numImages() + " images)" );

		if ( img == null )
			throw new IllegalStateException( "Block " + index + " has no pixels (" + header + ")" );

		return Views.hyperSlice( img, 2, i );
	}

	/**
	 * @return the raw samples, not a copy
	 */
	public short[] samples() { return samples; }

	public String describe()
	{
		return "block " + index + " (byte offset " + offset + ")";
	}

	@Override
	public String toString()
	{
		return "Block[" + index + ", " + header + "]";
	}
}
