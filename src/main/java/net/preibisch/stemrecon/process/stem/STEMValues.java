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
package net.preibisch.stemrecon.process.stem;

/**
 * Bright and dark field intensity sums of one acquired image. The sums are unsigned 64 bit values.
 */
public class STEMValues
{
	final long imageNumber, bright, dark;

	public STEMValues( final long imageNumber, final long bright, final long dark )
	{
		this.imageNumber = imageNumber;
		this.bright = bright;
		this.dark = dark;
	}

	/**
	 * @return the 1-based image number in the acquisition
	 */
	public long imageNumber() { return imageNumber; }
	public long bright() { return bright; }
	public long dark() { return dark; }

	@Override
	public boolean equals( final Object o )
	{
		if ( !( o instanceof STEMValues ) )
			return false;

		final STEMValues v = (STEMValues)o;
		return imageNumber == v.imageNumber && bright == v.bright && dark == v.dark;
	}

	@Override
	public int hashCode()
	{
		return 31 * ( 31 * Long.hashCode( imageNumber ) + Long.hashCode( bright ) ) + Long.hashCode( dark );
	}

	@Override
	public String toString()
	{
		return "STEMValues[image=" + imageNumber + ", bright=" + Long.toUnsignedString( bright ) + ", dark=" + Long.toUnsignedString( dark ) + "]";
	}
}
