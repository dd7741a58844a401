package net.preibisch.stemrecon.process.export;

import java.io.File;
import java.io.IOException;

import org.janelia.saalfeldlab.n5.Compression;
import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.LongArrayDataBlock;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.stemrecon.process.aggregate.StemImages;

/**
 * Stores both images as single-block UINT64 datasets {group}/bright/s{streamId}-i{imageId} and
 * {group}/dark/s{streamId}-i{imageId}.
 */
public class N5Sink implements StemImageSink {

	private static final Logger LOG = LoggerFactory.getLogger(N5Sink.class);

	public static final String BRIGHT = "bright";
	public static final String DARK = "dark";

	private final N5Writer n5Writer;
	private final String group;
	private final Compression compression;

	public N5Sink(final N5Writer n5Writer, final String group, final Compression compression) {
		this.n5Writer = n5Writer;
		this.group = group;
		this.compression = compression;
	}

	public N5Sink(final N5Writer n5Writer, final String group) {
		this(n5Writer, group, new GzipCompression());
	}

	public static N5Sink open(final File container, final String group) throws IOException {
		return new N5Sink(new N5FSWriter(container.getAbsolutePath()), group);
	}

	public static String datasetPath(final String group, final String field, final int streamId, final int imageId) {
		return String.format("%s/%s/s%03d-i%03d", group, field, streamId, imageId);
	}

	@Override
	public void export(final StemImages images, final int streamId, final int imageId) throws IOException {
		save(images.brightData(), images.width(), images.height(), datasetPath(group, BRIGHT, streamId, imageId), streamId, imageId);
		save(images.darkData(), images.width(), images.height(), datasetPath(group, DARK, streamId, imageId), streamId, imageId);

		LOG.info("Saved {}x{} images of stream {} to N5 group '{}'", images.width(), images.height(), streamId, group);
	}

	private void save(final long[] data, final int width, final int height, final String datasetPath, final int streamId, final int imageId) throws IOException {

		if (n5Writer.exists(datasetPath))
			n5Writer.remove(datasetPath);

		final int[] blockSize = new int[] {width, height};
		final DatasetAttributes attr = new DatasetAttributes(new long[] {width, height}, blockSize, DataType.UINT64, compression);
		n5Writer.createDataset(datasetPath, attr);
		n5Writer.setAttribute(datasetPath, "streamId", streamId);
		n5Writer.setAttribute(datasetPath, "imageId", imageId);

		n5Writer.writeBlock(datasetPath, attr, new LongArrayDataBlock(blockSize, new long[] {0, 0}, data));
	}

	/**
	 * @return the row-major values of one dataset written by this sink
	 */
	public static long[] load(final N5Reader n5Reader, final String datasetPath) throws IOException {

		final DatasetAttributes attr = n5Reader.getDatasetAttributes(datasetPath);
		final DataBlock<?> block = n5Reader.readBlock(datasetPath, attr, new long[] {0, 0});
		return (long[]) block.getData();
	}

	@Override
	public String getDescription() {
		return "N5 datasets in group '" + group + "'";
	}
}
