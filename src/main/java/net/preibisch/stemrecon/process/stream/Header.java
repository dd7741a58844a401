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

import java.util.Arrays;

/**
 * Decoded header of one detector block. All wire fields are unsigned 32 bit words, stored as long.
 */
public class Header
{
	private static final long[] NO_IMAGES = new long[ 0 ];

	final long imagesInBlock, rows, columns, version, timestamp;
	final long[] imageNumbers;

	public Header(
			final long imagesInBlock,
			final long rows,
			final long columns,
			final long version,
			final long timestamp,
			final long[] imageNumbers )
	{
		if ( imageNumbers.length != imagesInBlock )
			throw new IllegalArgumentException( "Header declares " + imagesInBlock + " images, but lists " + imageNumbers.length + " image numbers." );

		this.imagesInBlock = imagesInBlock;
		this.rows = rows;
		this.columns = columns;
		this.version = version;
		this.timestamp = timestamp;
		this.imageNumbers = imageNumbers.clone();
	}

	/**
	 * @return the zero-valued header that marks the end of a stream
	 */
	public static Header terminator()
	{
		return new Header( 0, 0, 0, StreamFormat.TERMINATOR_VERSION, 0, NO_IMAGES );
	}

	public long imagesInBlock() { return imagesInBlock; }
	public long rows() { return rows; }
	public long columns() { return columns; }
	public long version() { return version; }
	public long timestamp() { return timestamp; }

	public long imageNumber( final int i ) { return imageNumbers[ i ]; }
	public long[] imageNumbers() { return imageNumbers.clone(); }

	public boolean isTerminator() { return version == StreamFormat.TERMINATOR_VERSION; }

	public long pixelsPerImage() { return saturatedProduct( rows, columns ); }

	/**
	 * @return number of uint16 samples in the payload, Long.MAX_VALUE if that does not fit into a long
	 */
	public long numSamples() { return saturatedProduct( pixelsPerImage(), imagesInBlock ); }

	static long saturatedProduct( final long a, final long b )
	{
		try
		{
			return Math.multiplyExact( a, b );
		}
		catch ( final ArithmeticException e )
		{
			return Long.MAX_VALUE;
		}
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;

		if ( !( o instanceof Header ) )
			return false;

		final Header h = (Header)o;

		return imagesInBlock == h.imagesInBlock && rows == h.rows && columns == h.columns &&
				version == h.version && timestamp == h.timestamp && Arrays.equals( imageNumbers, h.imageNumbers );
	}

	@Override
	public int hashCode()
	{
		int result = Long.hashCode( imagesInBlock );
		result = 31 * result + Long.hashCode( rows );
		result = 31 * result + Long.hashCode( columns );
		result = 31 * result + Long.hashCode( version );
		result = 31 * result + Long.hashCode( timestamp );
		return 31 * result + Arrays.hashCode( imageNumbers );
	}

	@Override
	public String toString()
	{
		return "Header[images=" + imagesInBlock + ", rows=" + rows + ", columns=" + columns +
				", version=" + version + ", timestamp=" + timestamp + "]";
	}
}
