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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.google.gson.Gson;
import com.google.gson.JsonObject;

/**
 * Writes every event as one JSON object per line:
 * {"event": "stem.bright", "streamId": "1", "imageId": "1", "data": "&lt;base64&gt;"}
 */
public class JsonLinesEventEmitter implements StemEventEmitter, Closeable
{
	final BufferedWriter writer;
	final Gson gson = new Gson();

	public JsonLinesEventEmitter( final OutputStream out )
	{
		this.writer = new BufferedWriter( new OutputStreamWriter( out, StandardCharsets.UTF_8 ) );
	}

	@Override
	public synchronized void emit( final StemEvent event ) throws IOException
	{
		final JsonObject json = new JsonObject();
		json.addProperty( "event", event.name() );
		json.addProperty( "streamId", event.streamId() );
		json.addProperty( "imageId", event.imageId() );
		json.addProperty( "data", Base64.getEncoder().encodeToString( event.data() ) );

		writer.write( gson.toJson( json ) );
		writer.newLine();
		writer.flush();
	}

	/**
	 * @param line - one line written by this emitter
	 * @return the event
	 */
	public static StemEvent parse( final String line )
	{
		final JsonObject json = new Gson().fromJson( line, JsonObject.class );

		return new StemEvent(
				json.get( "event" ).getAsString(),
				json.get( "streamId" ).getAsString(),
				json.get( "imageId" ).getAsString(),
				Base64.getDecoder().decode( json.get( "data" ).getAsString() ) );
	}

	@Override
	public void close() throws IOException
	{
		writer.close();
	}

	@Override
	public String toString()
	{
		return "JSON lines";
	}
}
