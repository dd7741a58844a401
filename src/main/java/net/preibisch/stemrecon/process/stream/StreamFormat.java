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

import java.nio.ByteOrder;

/**
 * Constants and byte order of the detector block record.
 *
 * <pre>
 * word 0      imagesInBlock
 * word 1      rows
 * word 2      columns
 * word 3      version (0 = stream terminator)
 * word 4      timestamp
 * word 5-9    reserved
 * word 10-    imageNumbers[ imagesInBlock ]
 * (header is always 1024 words, followed by imagesInBlock * rows * columns uint16 samples)
 * </pre>
 */
public class StreamFormat
{
	public static final int HEADER_WORDS = 1024;
	public static final int HEADER_BYTES = HEADER_WORDS * Integer.BYTES;

	public static final int RESERVED_WORDS = 5;
	public static final int IMAGE_NUMBERS_OFFSET = 5 + RESERVED_WORDS;
	public static final int MAX_IMAGES_IN_BLOCK = HEADER_WORDS - IMAGE_NUMBERS_OFFSET;

	public static final int BYTES_PER_SAMPLE = Short.BYTES;

	public static final long TERMINATOR_VERSION = 0;

	// largest array length the JVM reliably allocates
	public static final long MAX_SAMPLES_PER_BLOCK = Integer.MAX_VALUE - 8;

	public static final StreamFormat LITTLE_ENDIAN = new StreamFormat( ByteOrder.LITTLE_ENDIAN );
	public static final StreamFormat BIG_ENDIAN = new StreamFormat( ByteOrder.BIG_ENDIAN );

	final ByteOrder byteOrder;

	public StreamFormat( final ByteOrder byteOrder )
	{
		this.byteOrder = byteOrder;
	}

	public ByteOrder byteOrder() { return byteOrder; }

	public static StreamFormat forByteOrder( final String name )
	{
		if ( name == null || name.equalsIgnoreCase( "little" ) || name.equalsIgnoreCase( "little_endian" ) )
			return LITTLE_ENDIAN;
		else if ( name.equalsIgnoreCase( "big" ) || name.equalsIgnoreCase( "big_endian" ) )
			return BIG_ENDIAN;
		else if ( name.equalsIgnoreCase( "native" ) )
			return new StreamFormat( ByteOrder.nativeOrder() );
		else
			throw new IllegalArgumentException( "Unknown byte order '" + name + "', use little, big or native." );
	}

	/**
	 * @param header - the decoded header
	 * @return number of payload bytes following this header on the wire
	 */
	public static long payloadBytes( final Header header )
	{
		return Header.saturatedProduct( header.numSamples(), BYTES_PER_SAMPLE );
	}

	@Override
	public String toString()
	{
		return "StreamFormat[" + byteOrder + "]";
	}
}
