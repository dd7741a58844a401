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
package net.preibisch.stemrecon;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class Threads
{
	/**
	 * @return num threads for the executorService, the number of processors available to this JVM
	 */
	public static int numThreads() { return Math.max( 1, Runtime.getRuntime().availableProcessors() ); }

	/**
	 * @param requested - the requested number of threads, anything below 1 means "auto"
	 * @return the number of threads to actually use
	 */
	public static int resolve( final int requested ) { return requested > 0 ? requested : numThreads(); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return createFixedExecutorService( nThreads, "stem-worker" ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads, final String namePrefix )
	{
		return Executors.newFixedThreadPool( nThreads, namedDaemonThreads( namePrefix ) );
	}

	/**
	 * Worker threads are daemons so that an aborted run never keeps the JVM alive.
	 *
	 * @param namePrefix - prefix of the thread names, followed by a running number
	 * @return the ThreadFactory
	 */
	public static ThreadFactory namedDaemonThreads( final String namePrefix )
	{
		final AtomicInteger count = new AtomicInteger( 0 );

		return runnable ->
		{
			final Thread t = new Thread( runnable, namePrefix + "-" + count.incrementAndGet() );
			t.setDaemon( true );
			return t;
		};
	}
}
