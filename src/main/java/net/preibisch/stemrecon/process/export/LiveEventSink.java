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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.process.aggregate.StemImages;

/**
 * Pushes both images as {@link StemEvent}s ("stem.bright", then "stem.dark") to an emitter.
 */
public class LiveEventSink implements StemImageSink
{
	private static final Logger LOG = LoggerFactory.getLogger( LiveEventSink.class );

	final StemEventEmitter emitter;
	final ByteOrder byteOrder;

	public LiveEventSink( final StemEventEmitter emitter, final ByteOrder byteOrder )
	{
		this.emitter = emitter;
		this.byteOrder = byteOrder;
	}

	public LiveEventSink( final StemEventEmitter emitter )
	{
		this( emitter, ByteOrder.LITTLE_ENDIAN );
	}

	@Override
	public void export( final StemImages images, final int streamId, final int imageId ) throws IOException
	{
		final String stream = Integer.toString( streamId );
		final String image = Integer.toString( imageId );

		emitter.emit( new StemEvent( StemEvent.BRIGHT, stream, image, toBytes( images.brightData(), byteOrder ) ) );
		emitter.emit( new StemEvent( StemEvent.DARK, stream, image, toBytes( images.darkData(), byteOrder ) ) );

		LOG.info( "Emitted {} and {} for stream {}, image {}", StemEvent.BRIGHT, StemEvent.DARK, streamId, imageId );
	}

	public static byte[] toBytes( final long[] data, final ByteOrder byteOrder )
	{
		final ByteBuffer buffer = ByteBuffer.allocate( data.length * Long.BYTES ).order( byteOrder );
		buffer.asLongBuffer().put( data );
		return buffer.array();
	}

	@Override
	public String getDescription()
	{
		return "Live events via " + emitter;
	}
}
