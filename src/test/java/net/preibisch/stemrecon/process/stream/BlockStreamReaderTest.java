package net.preibisch.stemrecon.process.stream;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Random;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedShortType;

public class BlockStreamReaderTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testRoundTrip() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 3, 4 );
		final short[] samples = new short[ 3 * 4 * 3 ];
		for ( int i = 0; i < samples.length; ++i )
			samples[ i ] = (short)( 65535 - i * 1000 );

		final Header header = new Header( 3, 3, 4, 7, 0xfffffffeL, new long[] { 17, 3, 0xffffffffL } );
		stream.addBlock( header, samples );

		try ( BlockStreamReader reader = stream.reader() )
		{
			final ReadResult result = reader.readBlock();
			assertTrue( result.isBlock() );

			final Block block = result.block();
			assertEquals( header, block.header() );
			assertArrayEquals( new long[] { 17, 3, 0xffffffffL }, block.header().imageNumbers() );
			assertEquals( 0xfffffffeL, block.header().timestamp() );
			assertArrayEquals( samples, block.samples() );
			assertEquals( 0, block.index() );
			assertEquals( 0, block.offset() );

			// second image, column 1, row 2
			final RandomAccessibleInterval< UnsignedShortType > image = block.image( 1 );
			final RandomAccess< UnsignedShortType > ra = image.randomAccess();
			ra.setPosition( new long[] { 1, 2 } );
			assertEquals( samples[ 12 + 2 * 4 + 1 ] & 0xffff, ra.get().get() );
			final RandomAccess< UnsignedShortType > first = block.image( 0 ).randomAccess();
			first.setPosition( new long[] { 0, 0 } );
			assertEquals( 65535, first.get().get() );

			assertTrue( reader.readBlock().isEndOfStream() );
			assertEquals( StreamFormat.HEADER_BYTES + samples.length * 2, reader.offset() );
		}
	}

	@Test
	public void testMultipleBlocks() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 2, 2 )
				.addConstantBlock( 1, 1, 2 )
				.addConstantBlock( 2, 3 )
				.addConstantBlock( 3, 4, 5, 6 );

		try ( BlockStreamReader reader = stream.reader() )
		{
			for ( int b = 0; b < 3; ++b )
			{
				final ReadResult result = reader.readBlock();
				assertTrue( result.isBlock() );
				assertEquals( b, result.block().index() );
				assertEquals( stream.headers().get( b ), result.header() );
				assertArrayEquals( stream.payloads().get( b ), result.block().samples() );
			}

			assertTrue( reader.readBlock().isEndOfStream() );
			assertEquals( 3, reader.numBlocks() );
		}
	}

	@Test
	public void testEmptyStreamIsCleanEnd() throws IOException
	{
		final BlockStreamReader reader = new BlockStreamReader( new ByteArrayInputStream( new byte[ 0 ] ), StreamFormat.LITTLE_ENDIAN );
		final ReadResult result = reader.readBlock();

		assertTrue( result.isEndOfStream() );
		assertFalse( result.hasTerminator() );
		assertTrue( result.header().isTerminator() );
		assertFalse( reader.hasMoreData() );
	}

	@Test
	public void testTerminator() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 2, 2 ).addConstantBlock( 5, 1 ).terminate();

		try ( BlockStreamReader reader = stream.reader() )
		{
			assertTrue( reader.readBlock().isBlock() );

			final ReadResult end = reader.readBlock();
			assertTrue( end.isEndOfStream() );
			assertTrue( end.hasTerminator() );
			assertEquals( 0, end.header().version() );

			// the terminator carries no payload
			assertEquals( 2 * StreamFormat.HEADER_BYTES + 2 * 2 * 2, reader.offset() );
			assertFalse( reader.hasMoreData() );
		}
	}

	@Test
	public void testTruncatedHeader() throws IOException
	{
		final BlockStreamReader reader = new BlockStreamReader( new ByteArrayInputStream( new byte[ 100 ] ), StreamFormat.LITTLE_ENDIAN );
		final ReadResult result = reader.readBlock();

		assertTrue( result.isTruncated() );
		assertEquals( 0, result.truncation().offset() );
		assertEquals( StreamFormat.HEADER_BYTES, result.truncation().expectedBytes() );
		assertEquals( 100, result.truncation().actualBytes() );
	}

	@Test( expected = TruncatedStreamException.class )
	public void testReadHeaderFailsOnShortStream() throws IOException
	{
		new BlockStreamReader( new ByteArrayInputStream( new byte[ StreamFormat.HEADER_BYTES - 1 ] ), StreamFormat.LITTLE_ENDIAN ).readHeader();
	}

	@Test
	public void testTruncatedPayload() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 4, 4 ).addConstantBlock( 9, 1 );
		final byte[] complete = stream.toByteArray();

		// second block declares 2 images but only 10 samples follow
		final SyntheticStream truncated = new SyntheticStream( 4, 4 );
		truncated.writer.writeHeader( truncated.header( 2, 3 ) );
		truncated.writer.writeSamples( new short[ 32 ], 10 );

		final byte[] bytes = concat( complete, truncated.toByteArray() );

		try ( BlockStreamReader reader = new BlockStreamReader( new ByteArrayInputStream( bytes ), StreamFormat.LITTLE_ENDIAN ) )
		{
			assertTrue( reader.readBlock().isBlock() );

			final ReadResult result = reader.readBlock();
			assertTrue( result.isTruncated() );
			assertFalse( result.isEndOfStream() );

			final TruncatedStreamException e = result.truncation();
			assertEquals( complete.length + StreamFormat.HEADER_BYTES, e.offset() );
			assertEquals( 2 * 4 * 4 * 2, e.expectedBytes() );
			assertEquals( 20, e.actualBytes() );
		}
	}

	@Test
	public void testOddTrailingByteIsTruncation() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 2, 2 );
		stream.writer.writeHeader( stream.header( 1 ) );
		stream.appendRaw( new byte[] { 1, 2, 3 } );

		final ReadResult result = stream.reader().readBlock();
		assertTrue( result.isTruncated() );
		assertEquals( 3, result.truncation().actualBytes() );
	}

	@Test
	public void testOversizedPayloadIsTruncation() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 65536, 65536 );
		stream.writer.writeHeader( stream.header( 1 ) );
		stream.appendRaw( new byte[ 1000 ] );

		final ReadResult result = stream.reader().readBlock();
		assertTrue( result.isTruncated() );
		assertEquals( 65536L * 65536L * 2, result.truncation().expectedBytes() );
		assertEquals( 1000, result.truncation().actualBytes() );
	}

	@Test
	public void testReservedWordsAndTailAreIgnored() throws IOException
	{
		final ByteBuffer buffer = ByteBuffer.allocate( StreamFormat.HEADER_BYTES + 2 * 2 ).order( StreamFormat.LITTLE_ENDIAN.byteOrder() );
		buffer.putInt( 1 ).putInt( 1 ).putInt( 2 ).putInt( 3 ).putInt( 42 );
		for ( int i = 0; i < StreamFormat.RESERVED_WORDS; ++i )
			buffer.putInt( -1 );
		buffer.putInt( 11 );
		while ( buffer.position() < StreamFormat.HEADER_BYTES )
			buffer.putInt( 0xdeadbeef );
		buffer.putShort( (short)7 ).putShort( (short)8 );

		final BlockStreamReader reader = new BlockStreamReader( new ByteArrayInputStream( buffer.array() ), StreamFormat.LITTLE_ENDIAN );
		final Block block = reader.readBlock().block();

		assertEquals( new Header( 1, 1, 2, 3, 42, new long[] { 11 } ), block.header() );
		assertArrayEquals( new short[] { 7, 8 }, block.samples() );
	}

	@Test
	public void testBigEndian() throws IOException
	{
		final SyntheticStream stream = new SyntheticStream( 2, 3, StreamFormat.BIG_ENDIAN ).addRandomBlock( new Random( 3 ), 5, 6 );

		final Block block = stream.reader().readBlock().block();
		assertEquals( stream.headers().get( 0 ), block.header() );
		assertArrayEquals( stream.payloads().get( 0 ), block.samples() );

		// imagesInBlock = 2, most significant byte first
		final byte[] bytes = stream.toByteArray();
		assertArrayEquals( new byte[] { 0, 0, 0, 2 }, Arrays.copyOf( bytes, 4 ) );
	}

	@Test
	public void testTooManyImagesIsMalformed()
	{
		final ByteBuffer buffer = ByteBuffer.allocate( StreamFormat.HEADER_BYTES ).order( StreamFormat.LITTLE_ENDIAN.byteOrder() );
		buffer.putInt( StreamFormat.MAX_IMAGES_IN_BLOCK + 1 ).putInt( 1 ).putInt( 1 ).putInt( 1 );

		try
		{
			new BlockStreamReader( new ByteArrayInputStream( buffer.array() ), StreamFormat.LITTLE_ENDIAN ).readBlock();
			fail( "malformed header was accepted" );
		}
		catch ( final IOException e )
		{
			assertFalse( e instanceof TruncatedStreamException );
		}
	}

	@Test
	public void testOpenFile() throws IOException
	{
		final File file = folder.newFile( "stream.bin" );
		Files.write( file.toPath(), new SyntheticStream( 2, 2 ).addConstantBlock( 1, 1 ).toByteArray() );

		try ( BlockStreamReader reader = BlockStreamReader.open( file, StreamFormat.LITTLE_ENDIAN ) )
		{
			assertTrue( reader.readBlock().isBlock() );
			assertTrue( reader.readBlock().isEndOfStream() );
			assertEquals( file.getAbsolutePath(), reader.source() );
		}
	}

	@Test( expected = SourceUnavailableException.class )
	public void testOpenMissingFile() throws IOException
	{
		BlockStreamReader.open( new File( folder.getRoot(), "missing.bin" ), StreamFormat.LITTLE_ENDIAN );
	}

	private static byte[] concat( final byte[] a, final byte[] b )
	{
		final byte[] c = Arrays.copyOf( a, a.length + b.length );
		System.arraycopy( b, 0, c, a.length, b.length );
		return c;
	}
}
