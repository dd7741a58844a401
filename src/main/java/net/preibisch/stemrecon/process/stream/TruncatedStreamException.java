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

import java.io.IOException;

/**
 * The stream ended inside a record, i.e. after the producer committed to a record boundary.
 */
public class TruncatedStreamException extends IOException
{
	private static final long serialVersionUID = 4271843012559863519L;

	final long offset, expectedBytes, actualBytes;
	final String part;

	public TruncatedStreamException( final String part, final long offset, final long expectedBytes, final long actualBytes )
	{
		super( "Unexpected end of stream while reading " + part + " at byte offset " + offset +
				": expected " + expectedBytes + " bytes, got " + actualBytes + "." );

		this.part = part;
		this.offset = offset;
		this.expectedBytes = expectedBytes;
		this.actualBytes = actualBytes;
	}

	/**
	 * @return byte offset in the stream where the incomplete part started
	 */
	public long offset() { return offset; }
	public long expectedBytes() { return expectedBytes; }
	public long actualBytes() { return actualBytes; }
	public String part() { return part; }
}
