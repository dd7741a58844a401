package net.preibisch.stemrecon.process.mask;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import net.preibisch.stemrecon.process.mask.DetectorMasks.MaskPair;
import net.preibisch.stemrecon.process.stream.Header;

public class DetectorMasksTest
{
	static class CountingMaskFactory implements MaskFactory
	{
		final AtomicInteger calls = new AtomicInteger();
		final List< double[] > radii = new ArrayList<>();
		final AnnularMaskFactory factory = new AnnularMaskFactory();

		@Override
		public synchronized Mask createMask( final long rows, final long columns, final double innerRadius, final double outerRadius )
		{
			calls.incrementAndGet();
			radii.add( new double[] { innerRadius, outerRadius } );
			return factory.createMask( rows, columns, innerRadius, outerRadius );
		}
	}

	@Test
	public void testBuiltOnceFromFirstHeader()
	{
		final CountingMaskFactory factory = new CountingMaskFactory();
		final DetectorMasks masks = new DetectorMasks( factory, 2, 4 );

		assertFalse( masks.isInitialized() );
		assertNull( masks.get() );

		final MaskPair first = masks.getOrCreate( new Header( 1, 10, 12, 1, 0, new long[] { 1 } ) );
		final MaskPair second = masks.getOrCreate( new Header( 1, 20, 20, 1, 0, new long[] { 2 } ) );

		assertTrue( masks.isInitialized() );
		assertSame( first, second );
		assertSame( first, masks.get() );
		assertEquals( 2, factory.calls.get() );

		assertEquals( 12, first.bright().columns() );
		assertEquals( 10, first.bright().rows() );
		assertEquals( 12, first.dark().columns() );

		assertEquals( 0.0, factory.radii.get( 0 )[ 0 ], 0 );
		assertEquals( 2.0, factory.radii.get( 0 )[ 1 ], 0 );
		assertEquals( 2.0, factory.radii.get( 1 )[ 0 ], 0 );
		assertEquals( 4.0, factory.radii.get( 1 )[ 1 ], 0 );
	}

	@Test
	public void testConcurrentCallersSeeOneInstance() throws Exception
	{
		final CountingMaskFactory factory = new CountingMaskFactory();
		final DetectorMasks masks = new DetectorMasks( factory, 3, 6 );
		final Header header = new Header( 1, 16, 16, 1, 0, new long[] { 1 } );

		final ExecutorService service = Executors.newFixedThreadPool( 8 );
		try
		{
			final List< Callable< MaskPair > > tasks = new ArrayList<>();
			for ( int i = 0; i < 32; ++i )
				tasks.add( () -> masks.getOrCreate( header ) );

			final List< Future< MaskPair > > results = service.invokeAll( tasks );
			final MaskPair expected = results.get( 0 ).get();

			for ( final Future< MaskPair > f : results )
				assertSame( expected, f.get() );

			assertEquals( 2, factory.calls.get() );
		}
		finally
		{
			service.shutdownNow();
		}
	}
}
