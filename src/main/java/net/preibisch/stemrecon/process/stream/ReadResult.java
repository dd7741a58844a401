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

/**
 * Outcome of {@link BlockStreamReader#readBlock()}: a block, the end of the stream, or a truncated record.
 */
public class ReadResult
{
	public enum Kind { BLOCK, END_OF_STREAM, TRUNCATED }

	final Kind kind;
	final Block block;
	final Header terminator;
	final TruncatedStreamException truncation;

	private ReadResult( final Kind kind, final Block block, final Header terminator, final TruncatedStreamException truncation )
	{
		this.kind = kind;
		this.block = block;
		this.terminator = terminator;
		this.truncation = truncation;
	}

	public static ReadResult block( final Block block ) { return new ReadResult( Kind.BLOCK, block, null, null ); }

	/**
	 * @return the stream ended exactly on a record boundary
	 */
	public static ReadResult endOfStream() { return new ReadResult( Kind.END_OF_STREAM, null, null, null ); }

	/**
	 * @param terminator - the version == 0 header that was read
	 * @return the writer marked the end of the stream explicitly
	 */
	public static ReadResult terminated( final Header terminator ) { return new ReadResult( Kind.END_OF_STREAM, null, terminator, null ); }

	public static ReadResult truncated( final TruncatedStreamException e ) { return new ReadResult( Kind.TRUNCATED, null, null, e ); }

	public Kind kind() { return kind; }

	public boolean isBlock() { return kind == Kind.BLOCK; }
	public boolean isEndOfStream() { return kind == Kind.END_OF_STREAM; }
	public boolean isTruncated() { return kind == Kind.TRUNCATED; }

	/**
	 * @return true if the end of stream was signaled by a terminator record rather than by running out of bytes
	 */
	public boolean hasTerminator() { return terminator != null; }

	public Block block()
	{
		if ( kind != Kind.BLOCK )
			throw new IllegalStateException( "No block available, result is " + kind );

		return block;
	}

	/**
	 * @return the header of this result, a zero-valued terminator header for END_OF_STREAM
	 */
	public Header header()
	{
		if ( kind == Kind.BLOCK )
			return block.header();
		else if ( terminator != null )
			return terminator;
		else
			return Header.terminator();
	}

	public TruncatedStreamException truncation()
	{
		if ( kind != Kind.TRUNCATED )
			throw new IllegalStateException( "Stream is not truncated, result is " + kind );

		return truncation;
	}

	@Override
	public String toString()
	{
		switch ( kind )
		{
		case BLOCK:
			return "ReadResult[" + block + "]";
		case TRUNCATED:
			return "ReadResult[TRUNCATED: " + truncation.getMessage() + "]";
		default:
			return "ReadResult[END_OF_STREAM" + ( terminator != null ? ", terminator" : "" ) + "]";
		}
	}
}
