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
package net.preibisch.stemrecon.process.aggregate;

import java.util.BitSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.process.pool.OrderedWorkerPool;
import net.preibisch.stemrecon.process.stem.STEMValues;

/**
 * Writes the results of the compute tasks into the {@link StemImages}. The only place where the output
 * is modified, it must only ever be called from one thread.
 */
public class StemAggregator
{
	private static final Logger LOG = LoggerFactory.getLogger( StemAggregator.class );

	final StemImages images;
	final BitSet seen;

	long numValues = 0;
	long numDuplicates = 0;

	public StemAggregator( final StemImages images )
	{
		this.images = images;
		this.seen = new BitSet( images.numPixels() );
	}

	/**
	 * Adds the values of one block. An image number that was written before is overwritten.
	 *
	 * @param values - the values of one block
	 */
	public void add( final List< STEMValues > values )
	{
		for ( final STEMValues v : values )
		{
			images.set( v.imageNumber(), v.bright(), v.dark() );

			final int index = (int)( v.imageNumber() - 1 );

			if ( seen.get( index ) )
			{
				++numDuplicates;
				LOG.debug( "Image number {} occurred more than once, keeping the last value.", v.imageNumber() );
			}

			seen.set( index );
			++numValues;
		}
	}

	/**
	 * Drains the oldest pending result of the pool (waiting for it) and adds it.
	 */
	public void drainNext( final OrderedWorkerPool< List< STEMValues > > pool )
	{
		add( pool.drainNext() );
	}

	/**
	 * Drains (in submission order) until at most maxPending results are pending.
	 */
	public void drainUntil( final OrderedWorkerPool< List< STEMValues > > pool, final int maxPending )
	{
		while ( pool.numPending() > maxPending )
			drainNext( pool );
	}

	public void drainAll( final OrderedWorkerPool< List< STEMValues > > pool )
	{
		drainUntil( pool, 0 );
	}

	public StemImages images() { return images; }

	public long numValues() { return numValues; }

	/**
	 * @return number of distinct image numbers written
	 */
	public long numImages() { return seen.cardinality(); }

	public long numDuplicates() { return numDuplicates; }
}
