package net.preibisch.stemrecon.headless.stem;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.io.StringReader;

import org.junit.Test;

import net.preibisch.stemrecon.headless.stem.StemParameters.SinkType;
import net.preibisch.stemrecon.process.pipeline.StemPipeline;

public class StemParametersTest
{
	@Test
	public void testMissingFieldsKeepDefaults() throws IOException
	{
		final StemParameters params = StemParameters.load( new StringReader( "{ \"streamId\": 4, \"width\": 40, \"height\": 30, \"sink\": \"N5\" }" ) );

		assertEquals( 4, params.streamId );
		assertEquals( 40, params.width );
		assertEquals( 30, params.height );
		assertEquals( SinkType.N5, params.sink );
		assertEquals( -1, params.concurrency );
		assertEquals( 1, params.imageId );
		assertEquals( StemPipeline.DEFAULT_INNER_RADIUS, params.innerRadius, 0 );
		assertEquals( StemPipeline.DEFAULT_OUTER_RADIUS, params.outerRadius, 0 );
		assertEquals( "little", params.byteOrder );
	}

	@Test
	public void testEmptyInput() throws IOException
	{
		final StemParameters params = StemParameters.load( new StringReader( "" ) );
		assertEquals( SinkType.RAW, params.sink );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidSize() throws IOException
	{
		StemParameters.load( new StringReader( "{ \"width\": 0 }" ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidRadii() throws IOException
	{
		StemParameters.load( new StringReader( "{ \"innerRadius\": 50, \"outerRadius\": 10 }" ) );
	}

	@Test( expected = IOException.class )
	public void testMalformedJson() throws IOException
	{
		StemParameters.load( new StringReader( "{ \"width\": " ) );
	}

	@Test
	public void testCreatePipeline()
	{
		final StemParameters params = new StemParameters();
		params.concurrency = 3;
		params.width = 8;
		params.height = 2;
		params.maxBlocksInFlight = 6;

		final StemPipeline pipeline = StemReconstruction.createPipeline( params );
		assertEquals( 3, pipeline.concurrency() );
		assertEquals( 8, pipeline.width() );
		assertEquals( 2, pipeline.height() );
		assertEquals( 6, pipeline.maxBlocksInFlight() );
	}
}
