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
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import net.preibisch.stemrecon.process.pipeline.StemPipeline;

/**
 * Parameters of one reconstruction run, as read from a JSON file. Fields that are missing in the
 * file keep their defaults.
 */
public class StemParameters
{
	public enum SinkType { RAW, N5, EVENTS }

	public int streamId = 0;
	public int imageId = 1;

	/** -1 = all available processors */
	public int concurrency = -1;

	public int width = 160;
	public int height = 160;

	/** 0 = drain all results after the stream was read */
	public int maxBlocksInFlight = 0;

	public double innerRadius = StemPipeline.DEFAULT_INNER_RADIUS;
	public double outerRadius = StemPipeline.DEFAULT_OUTER_RADIUS;

	/** little, big or native */
	public String byteOrder = "little";

	public SinkType sink = SinkType.RAW;

	/** output directory (RAW), N5 container (N5) or events file (EVENTS, "-" = stdout) */
	public String output = ".";

	/** group inside the N5 container */
	public String n5Group = "stem";

	public static StemParameters load( final File file ) throws IOException
	{
		try ( Reader reader = new FileReader( file, StandardCharsets.UTF_8 ) )
		{
			return load( reader );
		}
	}

	public static StemParameters load( final Reader reader ) throws IOException
	{
		final StemParameters params;

		try
		{
			params = new Gson().fromJson( reader, StemParameters.class );
		}
		catch ( final JsonParseException e )
		{
			throw new IOException( "Cannot parse parameters: " + e.getMessage(), e );
		}

		// empty input
		if ( params == null )
			return new StemParameters();

		params.validate();
		return params;
	}

	/**
	 * @throws IllegalArgumentException if a value is out of range
	 */
	public void validate()
	{
		if ( width <= 0 || height <= 0 || (long)width * height > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Invalid output size " + width + "x" + height );

		if ( maxBlocksInFlight < 0 )
			throw new IllegalArgumentException( "maxBlocksInFlight must be >= 0, got " + maxBlocksInFlight );

		if ( innerRadius < 0 || outerRadius < innerRadius )
			throw new IllegalArgumentException( "Invalid radii: inner=" + innerRadius + ", outer=" + outerRadius );

		if ( streamId < 0 || imageId < 0 )
			throw new IllegalArgumentException( "streamId and imageId must be >= 0" );

		if ( sink == null )
			throw new IllegalArgumentException( "No sink defined, use RAW, N5 or EVENTS" );
	}

	@Override
	public String toString()
	{
		return new Gson().toJson( this );
	}
}
