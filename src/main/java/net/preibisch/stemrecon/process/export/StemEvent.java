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
package net.preibisch.stemrecon.process.export;

/**
 * One message of the live output: the event name and the raw uint64 payload of one image.
 */
public class StemEvent
{
	public static final String BRIGHT = "stem.bright";
	public static final String DARK = "stem.dark";

	final String name;
	final String streamId;
	final String imageId;
	final byte[] data;

	public StemEvent( final String name, final String streamId, final String imageId, final byte[] data )
	{
		this.name = name;
		this.streamId = streamId;
		this.imageId = imageId;
		this.data = data;
	}

	public String name() { return name; }
	public String streamId() { return streamId; }
	public String imageId() { return imageId; }
	public byte[] data() { return data; }

	@Override
	public String toString()
	{
		return "StemEvent[" + name + ", stream=" + streamId + ", image=" + imageId + ", " + data.length + " bytes]";
	}
}
