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
package net.preibisch.stemrecon.headless.stem;

import java.io.File;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.process.StemProcessingException;
import net.preibisch.stemrecon.process.export.JsonLinesEventEmitter;
import net.preibisch.stemrecon.process.export.LiveEventSink;
import net.preibisch.stemrecon.process.export.N5Sink;
import net.preibisch.stemrecon.process.export.RawFileSink;
import net.preibisch.stemrecon.process.export.StemImageSink;
import net.preibisch.stemrecon.process.mask.AnnularMaskFactory;
import net.preibisch.stemrecon.process.pipeline.StemPipeline;
import net.preibisch.stemrecon.process.stem.MaskedSumCalculator;
import net.preibisch.stemrecon.process.stream.BlockStreamReader;
import net.preibisch.stemrecon.process.stream.StreamFormat;

/**
 * Headless reconstruction of one stream file.
 * <pre>
 * StemReconstruction &lt;stream file&gt; [parameters.json]
 * </pre>
 */
public class StemReconstruction
{
	private static final Logger LOG = LoggerFactory.getLogger( StemReconstruction.class );

	public static StemPipeline createPipeline( final StemParameters params )
	{
		params.validate();

		return new StemPipeline(
				params.concurrency,
				params.width,
				params.height,
				params.maxBlocksInFlight,
				params.innerRadius,
				params.outerRadius,
				new AnnularMaskFactory(),
				new MaskedSumCalculator() );
	}

	/**
	 * Reconstructs one stream and writes the result to the sink configured in the parameters.
	 *
	 * @param streamFile - the detector stream
	 * @param params - the parameters
	 * @throws IOException - if the stream cannot be opened, is truncated, or the output cannot be written
	 */
	public static void reconstruct( final File streamFile, final StemParameters params ) throws IOException
	{
		LOG.info( "Reconstructing {} with parameters {}", streamFile, params );

		final StemPipeline pipeline = createPipeline( params );

		try ( BlockStreamReader reader = BlockStreamReader.open( streamFile, StreamFormat.forByteOrder( params.byteOrder ) ) )
		{
			switch ( params.sink )
			{
			case N5:
				pipeline.process( reader, N5Sink.open( new File( params.output ), params.n5Group ), params.streamId, params.imageId );
				break;
			case EVENTS:
				try ( JsonLinesEventEmitter emitter = new JsonLinesEventEmitter( eventStream( params.output ) ) )
				{
					pipeline.process( reader, new LiveEventSink( emitter, StreamFormat.forByteOrder( params.byteOrder ).byteOrder() ), params.streamId, params.imageId );
				}
				break;
			default:
				final StemImageSink sink = new RawFileSink( new File( params.output ), StreamFormat.forByteOrder( params.byteOrder ).byteOrder() );
				pipeline.process( reader, sink, params.streamId, params.imageId );
			}
		}
	}

	private static OutputStream eventStream( final String output ) throws IOException
	{
		if ( output.equals( "-" ) )
		{
			// do not close stdout together with the emitter
			return new FileOutputStream( FileDescriptor.out )
			{
				@Override
				public void close() throws IOException
				{
					flush();
				}
			};
		}

		return new FileOutputStream( output );
	}

	public static void main( final String[] args )
	{
		if ( args.length < 1 || args.length > 2 )
		{
			System.err.println( "usage: StemReconstruction <stream file> [parameters.json]" );
			System.exit( 2 );
		}

		try
		{
			final StemParameters params = args.length == 2 ? StemParameters.load( new File( args[ 1 ] ) ) : new StemParameters();
			reconstruct( new File( args[ 0 ] ), params );
		}
		catch ( final IOException | StemProcessingException | IllegalArgumentException e )
		{
			LOG.error( "Reconstruction of {} failed: {}", args[ 0 ], e.getMessage(), e );
			System.exit( 1 );
		}
	}
}
