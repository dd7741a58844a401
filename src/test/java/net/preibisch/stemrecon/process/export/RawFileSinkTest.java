package net.preibisch.stemrecon.process.export;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.preibisch.stemrecon.process.aggregate.StemImages;

public class RawFileSinkTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testFileNames()
	{
		assertEquals( "bright-007.001.bin", RawFileSink.fileName( "bright", 7, 1 ) );
		assertEquals( "dark-123.045.bin", RawFileSink.fileName( "dark", 123, 45 ) );
		assertEquals( "dark-1234.001.bin", RawFileSink.fileName( "dark", 1234, 1 ) );
	}

	@Test
	public void testWritesRowMajorUInt64() throws IOException
	{
		final StemImages images = new StemImages( 3, 2 );
		images.set( 1, 11, 21 );
		images.set( 4, 14, 24 );
		images.set( 6, -1L, 26 );

		final File dir = new File( folder.getRoot(), "out" );
		final RawFileSink sink = new RawFileSink( dir );
		sink.export( images, 2, 1 );

		final File bright = new File( dir, "bright-002.001.bin" );
		final File dark = new File( dir, "dark-002.001.bin" );
		assertTrue( bright.isFile() );
		assertTrue( dark.isFile() );
		assertEquals( 6 * 8, bright.length() );

		final ByteBuffer b = ByteBuffer.wrap( Files.readAllBytes( bright.toPath() ) ).order( ByteOrder.LITTLE_ENDIAN );
		assertEquals( 11, b.getLong( 0 ) );
		assertEquals( 0, b.getLong( 8 ) );
		assertEquals( 14, b.getLong( 3 * 8 ) );
		assertEquals( -1L, b.getLong( 5 * 8 ) );

		final ByteBuffer d = ByteBuffer.wrap( Files.readAllBytes( dark.toPath() ) ).order( ByteOrder.LITTLE_ENDIAN );
		assertEquals( 24, d.getLong( 3 * 8 ) );
		assertEquals( 26, d.getLong( 5 * 8 ) );
	}

	@Test
	public void testBigEndian() throws IOException
	{
		final StemImages images = new StemImages( 1, 1 );
		images.set( 1, 1, 2 );

		final RawFileSink sink = new RawFileSink( folder.getRoot(), ByteOrder.BIG_ENDIAN );
		sink.export( images, 0, 0 );

		final byte[] bytes = Files.readAllBytes( sink.brightFile( 0, 0 ).toPath() );
		assertEquals( 8, bytes.length );
		assertEquals( 1, bytes[ 7 ] );
		assertEquals( 0, bytes[ 0 ] );
	}

	@Test
	public void testOverwrites() throws IOException
	{
		final RawFileSink sink = new RawFileSink( folder.getRoot() );

		final StemImages large = new StemImages( 4, 4 );
		sink.export( large, 1, 1 );

		final StemImages small = new StemImages( 2, 1 );
		small.set( 2, 5, 6 );
		sink.export( small, 1, 1 );

		assertEquals( 16, sink.darkFile( 1, 1 ).length() );
	}
}
