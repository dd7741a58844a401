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
package net.preibisch.stemrecon.process.pipeline;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.Threads;
import net.preibisch.stemrecon.process.aggregate.StemAggregator;
import net.preibisch.stemrecon.process.aggregate.StemImages;
import net.preibisch.stemrecon.process.export.StemImageSink;
import net.preibisch.stemrecon.process.mask.AnnularMaskFactory;
import net.preibisch.stemrecon.process.mask.DetectorMasks;
import net.preibisch.stemrecon.process.mask.DetectorMasks.MaskPair;
import net.preibisch.stemrecon.process.mask.MaskFactory;
import net.preibisch.stemrecon.process.pool.OrderedWorkerPool;
import net.preibisch.stemrecon.process.stem.MaskedSumCalculator;
import net.preibisch.stemrecon.process.stem.STEMValues;
import net.preibisch.stemrecon.process.stem.STEMValuesCalculator;
import net.preibisch.stemrecon.process.stem.StemBlockTask;
import net.preibisch.stemrecon.process.stream.Block;
import net.preibisch.stemrecon.process.stream.BlockStreamReader;
import net.preibisch.stemrecon.process.stream.ReadResult;

/**
 * Reads all blocks of a stream, computes their {@link STEMValues} on a worker pool and assembles them
 * into the bright and dark field images.
 * <p>
 * One thread (the caller) reads, builds the masks on the first block, submits, and drains the results
 * in submission order. With maxBlocksInFlight &gt; 0 draining is interleaved with reading so that at most
 * that many blocks are held in memory; with 0 all results are drained after the stream is exhausted.
 * The output does not depend on either setting, values are written by image number.
 */
public class StemPipeline
{
	private static final Logger LOG = LoggerFactory.getLogger( StemPipeline.class );

	public static final double DEFAULT_INNER_RADIUS = 40;
	public static final double DEFAULT_OUTER_RADIUS = 288;

	final int concurrency, width, height, maxBlocksInFlight;
	final double innerRadius, outerRadius;
	final MaskFactory maskFactory;
	final STEMValuesCalculator calculator;

	private volatile PipelineState state = PipelineState.AWAITING_BLOCK;
	private DetectorMasks masks;
	private StemAggregator aggregator;

	/**
	 * @param concurrency - number of workers, anything below 1 means all available processors
	 * @param width - width of the output images
	 * @param height - height of the output images
	 * @param maxBlocksInFlight - maximal number of submitted but not yet drained blocks, 0 means unbounded
	 * @param innerRadius - boundary between bright and dark field
	 * @param outerRadius - outer boundary of the dark field
	 * @param maskFactory - builds the masks
	 * @param calculator - reduces one image to its STEM values
	 */
	public StemPipeline(
			final int concurrency,
			final int width,
			final int height,
			final int maxBlocksInFlight,
			final double innerRadius,
			final double outerRadius,
			final MaskFactory maskFactory,
			final STEMValuesCalculator calculator )
	{
		if ( maxBlocksInFlight < 0 )
			throw new IllegalArgumentException( "maxBlocksInFlight must be >= 0, got " + maxBlocksInFlight );

		this.concurrency = Threads.resolve( concurrency );
		this.width = width;
		this.height = height;
		this.maxBlocksInFlight = maxBlocksInFlight;
		this.innerRadius = innerRadius;
		this.outerRadius = outerRadius;
		this.maskFactory = maskFactory;
		this.calculator = calculator;
	}

	public StemPipeline( final int concurrency, final int width, final int height, final int maxBlocksInFlight )
	{
		this( concurrency, width, height, maxBlocksInFlight, DEFAULT_INNER_RADIUS, DEFAULT_OUTER_RADIUS, new AnnularMaskFactory(), new MaskedSumCalculator() );
	}

	public StemPipeline( final int concurrency, final int width, final int height )
	{
		this( concurrency, width, height, 0 );
	}

	/**
	 * Processes the whole stream.
	 *
	 * @param reader - the stream
	 * @return the completed images
	 * @throws IOException - if the stream cannot be read or is truncated
	 * @throws net.preibisch.stemrecon.process.StemProcessingException - if a block cannot be processed
	 */
	public StemImages run( final BlockStreamReader reader ) throws IOException
	{
		final long t0 = System.currentTimeMillis();

		masks = new DetectorMasks( maskFactory, innerRadius, outerRadius );
		aggregator = new StemAggregator( new StemImages( width, height ) );
		state = PipelineState.AWAITING_BLOCK;

		LOG.info( "Processing {} with {} threads into {}x{} images (max blocks in flight: {})",
				reader.source(), concurrency, width, height, maxBlocksInFlight == 0 ? "unbounded" : maxBlocksInFlight );

		try ( OrderedWorkerPool< List< STEMValues > > pool = new OrderedWorkerPool<>( concurrency ) )
		{
			while ( true )
			{
				final ReadResult result = reader.readBlock();

				if ( result.isTruncated() )
					throw result.truncation();

				if ( result.isEndOfStream() )
					break;

				final Block block = result.block();

				// masks must exist before the first task that reads them is submitted
				final MaskPair maskPair = masks.getOrCreate( block.header() );

				if ( maxBlocksInFlight > 0 && pool.numPending() >= maxBlocksInFlight )
				{
					state = PipelineState.DRAINING_RESULTS;
					aggregator.drainUntil( pool, maxBlocksInFlight - 1 );
					state = PipelineState.AWAITING_BLOCK;
				}

				pool.submit( block.describe() + " of " + reader.source(), new StemBlockTask( block, maskPair, calculator ) );
			}

			state = PipelineState.DRAINING_RESULTS;
			aggregator.drainAll( pool );
			state = PipelineState.FLUSHED;
		}
		catch ( final IOException | RuntimeException e )
		{
			state = PipelineState.FAILED;
			LOG.error( "Processing {} failed after {} blocks at byte offset {}: {}", reader.source(), reader.numBlocks(), reader.offset(), e.getMessage() );
			throw e;
		}

		if ( aggregator.numDuplicates() > 0 )
			LOG.warn( "{} image numbers occurred more than once in {}, the last value was kept.", aggregator.numDuplicates(), reader.source() );

		LOG.info( "Processed {} blocks ({} images) of {} in {} ms", reader.numBlocks(), aggregator.numValues(), reader.source(), System.currentTimeMillis() - t0 );

		return aggregator.images();
	}

	/**
	 * Processes the whole stream and hands the images to the sink.
	 *
	 * @param reader - the stream
	 * @param sink - where the images go
	 * @param streamId - id of the stream
	 * @param imageId - id of the reconstructed image
	 * @return the completed images
	 * @throws IOException - if the stream cannot be read or the sink fails
	 */
	public StemImages process( final BlockStreamReader reader, final StemImageSink sink, final int streamId, final int imageId ) throws IOException
	{
		final StemImages images = run( reader );

		LOG.info( "Exporting stream {}, image {}: {}", streamId, imageId, sink.getDescription() );
		sink.export( images, streamId, imageId );

		return images;
	}

	public PipelineState state() { return state; }

	/**
	 * @return the masks of the last run, null before the first run
	 */
	public DetectorMasks masks() { return masks; }

	/**
	 * @return the aggregator of the last run, null before the first run
	 */
	public StemAggregator aggregator() { return aggregator; }

	public int concurrency() { return concurrency; }
	public int width() { return width; }
	public int height() { return height; }
	public int maxBlocksInFlight() { return maxBlocksInFlight; }
}
