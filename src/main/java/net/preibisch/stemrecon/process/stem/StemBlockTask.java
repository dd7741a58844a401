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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import net.preibisch.stemrecon.process.mask.DetectorMasks.MaskPair;
import net.preibisch.stemrecon.process.stream.Block;
import net.preibisch.stemrecon.process.stream.Header;

/**
 * Computes the {@link STEMValues} of all images of one block, in the order of the block.
 */
public class StemBlockTask implements Callable< List< STEMValues > >
{
	final Block block;
	final MaskPair masks;
	final STEMValuesCalculator calculator;

	public StemBlockTask( final Block block, final MaskPair masks, final STEMValuesCalculator calculator )
	{
		this.block = block;
		this.masks = masks;
		this.calculator = calculator;
	}

	@Override
	public List< STEMValues > call()
	{
		final Header header = block.header();
		final ArrayList< STEMValues > values = new ArrayList<>( block.numImages() );

		for ( int i = 0; i < block.numImages(); ++i )
			values.add( calculator.calculate( block.image( i ), header.imageNumber( i ), masks.bright(), masks.dark() ) );

		return values;
	}

	public Block block() { return block; }
}
