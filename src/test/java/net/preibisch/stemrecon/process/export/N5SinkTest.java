package net.preibisch.stemrecon.process.export;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;

import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.preibisch.stemrecon.process.aggregate.StemImages;

public class N5SinkTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testSaveAndLoad() throws IOException {

		final File container = new File(folder.getRoot(), "stem.n5");
		final StemImages images = new StemImages(4, 3);
		for (int i = 1; i <= 12; i++)
			images.set(i, i * 10L, i * 100L);

		N5Sink.open(container, "run").export(images, 3, 1);

		final N5FSReader reader = new N5FSReader(container.getAbsolutePath());
		final String brightPath = N5Sink.datasetPath("run", N5Sink.BRIGHT, 3, 1);
		final String darkPath = N5Sink.datasetPath("run", N5Sink.DARK, 3, 1);
		assertEquals("run/bright/s003-i001", brightPath);

		final DatasetAttributes attr = reader.getDatasetAttributes(brightPath);
		assertEquals(DataType.UINT64, attr.getDataType());
		assertArrayEquals(new long[] {4, 3}, attr.getDimensions());
		assertEquals(3, (int) reader.getAttribute(brightPath, "streamId", Integer.class));

		assertArrayEquals(images.brightData(), N5Sink.load(reader, brightPath));
		assertArrayEquals(images.darkData(), N5Sink.load(reader, darkPath));
	}

	@Test
	public void testReplacesExistingDataset() throws IOException {

		final File container = new File(folder.getRoot(), "stem.n5");
		final StemImages first = new StemImages(2, 2);
		first.set(1, 1, 1);
		N5Sink.open(container, "run").export(first, 0, 1);

		final StemImages second = new StemImages(2, 2);
		second.set(4, 9, 9);
		N5Sink.open(container, "run").export(second, 0, 1);

		final N5FSReader reader = new N5FSReader(container.getAbsolutePath());
		assertArrayEquals(new long[] {0, 0, 0, 9}, N5Sink.load(reader, N5Sink.datasetPath("run", N5Sink.BRIGHT, 0, 1)));
	}
}
