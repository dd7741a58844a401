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
package net.preibisch.stemrecon.process.mask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.process.stream.Header;

/**
 * Holds the bright and dark field masks of one stream. Both are built once, from the dimensions of the
 * first block, and never rebuilt even if later blocks report other dimensions.
 */
public class DetectorMasks
{
	private static final Logger LOG = LoggerFactory.getLogger( DetectorMasks.class );

	public static class MaskPair
	{
		final Mask bright, dark;

		public MaskPair( final Mask bright, final Mask dark )
		{
			this.bright = bright;
			this.dark = dark;
		}

		public Mask bright() { return bright; }
		public Mask dark() { return dark; }
	}

	final MaskFactory factory;
	final double innerRadius, outerRadius;

	private volatile MaskPair masks = null;

	/**
	 * @param factory - builds the masks
	 * @param innerRadius - boundary between bright field (disk) and dark field (annulus)
	 * @param outerRadius - outer boundary of the dark field
	 */
	public DetectorMasks( final MaskFactory factory, final double innerRadius, final double outerRadius )
	{
		this.factory = factory;
		this.innerRadius = innerRadius;
		this.outerRadius = outerRadius;
	}

	/**
	 * @param header - header of the current block, only used if the masks do not exist yet
	 * @return the masks of this stream
	 */
	public MaskPair getOrCreate( final Header header )
	{
		MaskPair m = masks;

		if ( m == null )
		{
			synchronized ( this )
			{
				m = masks;

				if ( m == null )
				{
					final Mask bright = factory.createMask( header.rows(), header.columns(), 0, innerRadius );
					final Mask dark = factory.createMask( header.rows(), header.columns(), innerRadius, outerRadius );

					LOG.info( "Created masks for {}x{} detector: bright field {} pixels, dark field {} pixels",
							header.columns(), header.rows(), bright.count(), dark.count() );

					m = new MaskPair( bright, dark );
					masks = m;
				}
			}
		}

		return m;
	}

	public boolean isInitialized() { return masks != null; }

	/**
	 * @return the masks, or null if no block was seen yet
	 */
	public MaskPair get() { return masks; }

	public double innerRadius() { return innerRadius; }
	public double outerRadius() { return outerRadius; }
}
