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
package net.preibisch.stemrecon.process.export;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.process.aggregate.StemImages;

/**
 * Writes each image as a flat file of width*height uint64 values in row-major order,
 * named bright-SSS.III.bin and dark-SSS.III.bin (stream id, image id).
 */
public class RawFileSink implements StemImageSink
{
	private static final Logger LOG = LoggerFactory.getLogger( RawFileSink.class );

	final File directory;
	final ByteOrder byteOrder;

	public RawFileSink( final File directory, final ByteOrder byteOrder )
	{
		this.directory = directory;
		this.byteOrder = byteOrder;
	}

	public RawFileSink( final File directory )
	{
		this( directory, ByteOrder.LITTLE_ENDIAN );
	}

	public static String fileName( final String prefix, final int streamId, final int imageId )
	{
		return String.format( "%s-%03d.%03d.bin", prefix, streamId, imageId );
	}

	public File brightFile( final int streamId, final int imageId ) { return new File( directory, fileName( "bright", streamId, imageId ) ); }
	public File darkFile( final int streamId, final int imageId ) { return new File( directory, fileName( "dark", streamId, imageId ) ); }

	@Override
	public void export( final StemImages images, final int streamId, final int imageId ) throws IOException
	{
		if ( !directory.isDirectory() && !directory.mkdirs() )
			throw new IOException( "Cannot create output directory " + directory.getAbsolutePath() );

		final File brightFile = brightFile( streamId, imageId );
		final File darkFile = darkFile( streamId, imageId );

		write( images.brightData(), brightFile );
		write( images.darkData(), darkFile );

		LOG.info( "Saved {}x{} images to {} and {}", images.width(), images.height(), brightFile.getAbsolutePath(), darkFile.getAbsolutePath() );
	}

	protected void write( final long[] data, final File file ) throws IOException
	{
		final ByteBuffer buffer = ByteBuffer.allocate( data.length * Long.BYTES ).order( byteOrder );
		buffer.asLongBuffer().put( data );

		try ( FileChannel channel = FileChannel.open( file.toPath(), StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING ) )
		{
			while ( buffer.hasRemaining() )
				channel.write( buffer );
		}
	}

	@Override
	public String getDescription()
	{
		return "Raw uint64 files in " + directory.getAbsolutePath() + " (" + byteOrder + ")";
	}
}
