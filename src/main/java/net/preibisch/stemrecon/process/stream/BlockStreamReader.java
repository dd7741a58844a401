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

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.ByteBuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads detector blocks from a byte stream. The only clean way for a stream to end is on a record
 * boundary (or with a terminator record); running out of bytes anywhere inside a record is a truncation.
 */
public class BlockStreamReader implements Closeable
{
	private static final Logger LOG = LoggerFactory.getLogger( BlockStreamReader.class );

	// payload is decoded in chunks of this many bytes (must be even)
	static final int CHUNK_BYTES = 1 << 20;

	final PushbackInputStream in;
	final StreamFormat format;
	final String source;

	long offset = 0;
	long numBlocks = 0;

	public BlockStreamReader( final InputStream in, final StreamFormat format, final String source )
	{
		this.in = new PushbackInputStream( in, 1 );
		this.format = format;
		this.source = source;
	}

	public BlockStreamReader( final InputStream in, final StreamFormat format )
	{
		this( in, format, "stream" );
	}

	/**
	 * @param file - the stream file
	 * @param format - byte order of the stream
	 * @return a reader for the file
	 * @throws SourceUnavailableException if the file does not exist or cannot be opened
	 */
	public static BlockStreamReader open( final File file, final StreamFormat format ) throws SourceUnavailableException
	{
		if ( !file.isFile() )
			throw new SourceUnavailableException( file.getAbsolutePath() );

		try
		{
			return new BlockStreamReader( new BufferedInputStream( new FileInputStream( file ), CHUNK_BYTES ), format, file.getAbsolutePath() );
		}
		catch ( final IOException e )
		{
			throw new SourceUnavailableException( file.getAbsolutePath(), e );
		}
	}

	/**
	 * Non-consuming check whether at least one more byte is available.
	 *
	 * @return false if the stream is exhausted
	 * @throws IOException - if reading fails
	 */
	public boolean hasMoreData() throws IOException
	{
		final int b = in.read();

		if ( b == -1 )
			return false;

		in.unread( b );
		return true;
	}

	/**
	 * Reads and decodes exactly one fixed-size header record.
	 *
	 * @return the header
	 * @throws TruncatedStreamException - if fewer than {@link StreamFormat#HEADER_BYTES} bytes remain
	 * @throws IOException - if reading fails or the header is malformed
	 */
	public Header readHeader() throws IOException
	{
		final long headerOffset = offset;
		final byte[] bytes = new byte[ StreamFormat.HEADER_BYTES ];
		final int read = readFully( bytes, 0, bytes.length );

		if ( read < bytes.length )
			throw new TruncatedStreamException( "header", headerOffset, bytes.length, read );

		final ByteBuffer buffer = ByteBuffer.wrap( bytes ).order( format.byteOrder() );

		final long imagesInBlock = nextWord( buffer );
		final long rows = nextWord( buffer );
		final long columns = nextWord( buffer );
		final long version = nextWord( buffer );
		final long timestamp = nextWord( buffer );

		// reserved
		buffer.position( StreamFormat.IMAGE_NUMBERS_OFFSET * Integer.BYTES );

		if ( version != StreamFormat.TERMINATOR_VERSION && imagesInBlock > StreamFormat.MAX_IMAGES_IN_BLOCK )
			throw new IOException( "Malformed header at byte offset " + headerOffset + " of " + source + ": " + imagesInBlock +
					" images declared, at most " + StreamFormat.MAX_IMAGES_IN_BLOCK + " fit into the header." );

		final long[] imageNumbers = new long[ (int)Math.min( imagesInBlock, StreamFormat.MAX_IMAGES_IN_BLOCK ) ];

		for ( int i = 0; i < imageNumbers.length; ++i )
			imageNumbers[ i ] = nextWord( buffer );

		return new Header( imageNumbers.length, rows, columns, version, timestamp, imageNumbers );
	}

	/**
	 * Reads the next block. A stream that is exhausted before the header is a clean end of stream, as is
	 * a terminator header (version == 0, no payload). A stream that ends anywhere after the first header
	 * byte is truncated.
	 *
	 * @return the block, END_OF_STREAM or TRUNCATED
	 * @throws IOException - if reading fails for any other reason
	 */
	public ReadResult readBlock() throws IOException
	{
		if ( !hasMoreData() )
		{
			LOG.debug( "End of stream {} after {} blocks ({} bytes)", source, numBlocks, offset );
			return ReadResult.endOfStream();
		}

		final long headerOffset = offset;
		final Header header;

		try
		{
			header = readHeader();
		}
		catch ( final TruncatedStreamException e )
		{
			return ReadResult.truncated( e );
		}

		if ( header.isTerminator() )
		{
			LOG.debug( "Terminator record in {} at byte offset {} after {} blocks", source, headerOffset, numBlocks );
			return ReadResult.terminated( header );
		}

		final long payloadOffset = offset;
		final long payloadBytes = StreamFormat.payloadBytes( header );

		if ( header.numSamples() > StreamFormat.MAX_SAMPLES_PER_BLOCK )
		{
			final long skipped = discard( payloadBytes );

			if ( skipped < payloadBytes )
				return ReadResult.truncated( new TruncatedStreamException( "payload of block " + numBlocks, payloadOffset, payloadBytes, skipped ) );

			throw new IOException( "Block " + numBlocks + " at byte offset " + headerOffset + " of " + source +
					" is too large (" + header + ")" );
		}

		final short[] samples = new short[ (int)header.numSamples() ];
		final long read = readSamples( samples );

		if ( read < payloadBytes )
			return ReadResult.truncated( new TruncatedStreamException( "payload of block " + numBlocks, payloadOffset, payloadBytes, read ) );

		final Block block = new Block( header, samples, numBlocks++, headerOffset );

		LOG.debug( "Read {}: {}", block.describe(), header );

		return ReadResult.block( block );
	}

	/**
	 * @return number of bytes consumed so far
	 */
	public long offset() { return offset; }

	/**
	 * @return number of data-bearing blocks read so far
	 */
	public long numBlocks() { return numBlocks; }

	public String source() { return source; }
	public StreamFormat format() { return format; }

	@Override
	public void close() throws IOException
	{
		in.close();
	}

	protected long readSamples( final short[] samples ) throws IOException
	{
		final long totalBytes = (long)samples.length * StreamFormat.BYTES_PER_SAMPLE;
		final byte[] chunk = new byte[ (int)Math.min( totalBytes, CHUNK_BYTES ) ];

		long done = 0;
		int sample = 0;

		while ( done < totalBytes )
		{
			final int toRead = (int)Math.min( totalBytes - done, chunk.length );
			final int read = readFully( chunk, 0, toRead );

			final int numShorts = read / StreamFormat.BYTES_PER_SAMPLE;
			ByteBuffer.wrap( chunk, 0, numShorts * StreamFormat.BYTES_PER_SAMPLE ).order( format.byteOrder() ).asShortBuffer().get( samples, sample, numShorts );

			sample += numShorts;
			done += read;

			if ( read < toRead )
				break;
		}

		return done;
	}

	protected long discard( final long numBytes ) throws IOException
	{
		final byte[] chunk = new byte[ CHUNK_BYTES ];
		long done = 0;

		while ( done < numBytes )
		{
			final int toRead = (int)Math.min( numBytes - done, chunk.length );
			final int read = readFully( chunk, 0, toRead );
			done += read;

			if ( read < toRead )
				break;
		}

		return done;
	}

	/**
	 * @return the number of bytes read, less than len only if the stream ended
	 */
	protected int readFully( final byte[] b, final int off, final int len ) throws IOException
	{
		int n = 0;

		while ( n < len )
		{
			final int count = in.read( b, off + n, len - n );

			if ( count < 0 )
				break;

			n += count;
		}

		offset += n;
		return n;
	}

	private static long nextWord( final ByteBuffer buffer )
	{
		return Integer.toUnsignedLong( buffer.getInt() );
	}
}
