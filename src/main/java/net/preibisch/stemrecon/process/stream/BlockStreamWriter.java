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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Writes detector blocks in the wire layout read by {@link BlockStreamReader}. Reserved words and the
 * unused tail of the header are written as zeros.
 */
public class BlockStreamWriter implements Closeable
{
	final OutputStream out;
	final StreamFormat format;

	long offset = 0;

	public BlockStreamWriter( final OutputStream out, final StreamFormat format )
	{
		this.out = out;
		this.format = format;
	}

	public void writeHeader( final Header header ) throws IOException
	{
		if ( header.imagesInBlock() > StreamFormat.MAX_IMAGES_IN_BLOCK )
			throw new IllegalArgumentException( "At most " + StreamFormat.MAX_IMAGES_IN_BLOCK + " images fit into one header, got " + header.imagesInBlock() );

		final ByteBuffer buffer = ByteBuffer.allocate( StreamFormat.HEADER_BYTES ).order( format.byteOrder() );

		putWord( buffer, header.imagesInBlock() );
		putWord( buffer, header.rows() );
		putWord( buffer, header.columns() );
		putWord( buffer, header.version() );
		putWord( buffer, header.timestamp() );

		buffer.position( StreamFormat.IMAGE_NUMBERS_OFFSET * Integer.BYTES );

		for ( int i = 0; i < header.imagesInBlock(); ++i )
			putWord( buffer, header.imageNumber( i ) );

		write( buffer.array(), buffer.capacity() );
	}

	/**
	 * @param header - header of the block
	 * @param samples - imagesInBlock * rows * columns samples
	 * @throws IOException - if writing fails
	 */
	public void writeBlock( final Header header, final short[] samples ) throws IOException
	{
		if ( samples.length != header.numSamples() )
			throw new IllegalArgumentException( "Header declares " + header.numSamples() + " samples, got " + samples.length );

		writeHeader( header );
		writeSamples( samples, samples.length );
	}

	public void writeBlock( final Block block ) throws IOException
	{
		writeBlock( block.header(), block.samples() );
	}

	/**
	 * Writes only the first numSamples samples, e.g. to produce a truncated record.
	 */
	public void writeSamples( final short[] samples, final int numSamples ) throws IOException
	{
		final ByteBuffer buffer = ByteBuffer.allocate( numSamples * StreamFormat.BYTES_PER_SAMPLE ).order( format.byteOrder() );
		buffer.asShortBuffer().put( samples, 0, numSamples );

		write( buffer.array(), buffer.capacity() );
	}

	/**
	 * Writes a version == 0 record without payload.
	 */
	public void writeTerminator() throws IOException
	{
		writeHeader( Header.terminator() );
	}

	public long offset() { return offset; }

	public void flush() throws IOException
	{
		out.flush();
	}

	@Override
	public void close() throws IOException
	{
		out.close();
	}

	protected void write( final byte[] bytes, final int length ) throws IOException
	{
		out.write( bytes, 0, length );
		offset += length;
	}

	private static void putWord( final ByteBuffer buffer, final long value )
	{
		if ( value < 0 || value > 0xffffffffL )
			throw new IllegalArgumentException( "Value " + value + " does not fit into an unsigned 32 bit word." );

		buffer.putInt( (int)value );
	}
}
