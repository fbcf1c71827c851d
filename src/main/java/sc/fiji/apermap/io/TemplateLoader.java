/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.apermap.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import sc.fiji.apermap.IFUType;
import sc.fiji.apermap.Side;
import sc.fiji.apermap.TemplateLoadException;
import sc.fiji.apermap.TraceParameters;
import sc.fiji.apermap.util.Logger;

/**
 * Loads fiber templates from a directory holding one plain-text file per IFU
 * and side, named {@code <IFU>_<side>.txt} (e.g., {@code HR_b.txt}).
 * <p>
 * Files list one position per line, in the first whitespace-separated column;
 * blank lines and lines starting with {@code #} are skipped. Loaded templates
 * are cached: a template is read at most once per loader, even when requested
 * concurrently, and is never modified afterwards.
 * </p>
 */
public class TemplateLoader {

	private record Key(IFUType ifuType, Side side) {}

	private final Path directory;
	private final int nativeBinning;
	private final Map<Key, FiberTemplate> cache = new ConcurrentHashMap<>();
	private final Logger logger = new Logger(TemplateLoader.class);

	/**
	 * @param directory the directory holding the template files
	 * @param params    the parameters providing the native template binning
	 */
	public TemplateLoader(final Path directory, final TraceParameters params) {
		this(directory, params.getTemplateBinning());
	}

	/**
	 * @param directory     the directory holding the template files
	 * @param nativeBinning the binning at which the templates were measured
	 */
	public TemplateLoader(final Path directory, final int nativeBinning) {
		if (directory == null) throw new IllegalArgumentException("Template directory cannot be null");
		if (nativeBinning < 1) throw new IllegalArgumentException("Invalid binning: " + nativeBinning);
		this.directory = directory;
		this.nativeBinning = nativeBinning;
	}

	/**
	 * @return the template at its native binning
	 * @throws TemplateLoadException if the file is missing, unreadable,
	 *                               malformed or empty
	 */
	public FiberTemplate load(final IFUType ifuType, final Side side) throws TemplateLoadException {
		return cache.computeIfAbsent(new Key(ifuType, side), key -> {
			final FiberTemplate template = read(directory.resolve(fileName(ifuType, side)), ifuType, side,
					nativeBinning);
			logger.info("Loaded " + template);
			return template;
		});
	}

	/**
	 * @return the template scaled to the given frame binning
	 * @throws TemplateLoadException if the template cannot be loaded
	 */
	public FiberTemplate load(final IFUType ifuType, final Side side, final int frameBinning)
			throws TemplateLoadException {
		return load(ifuType, side).scaledTo(frameBinning);
	}

	public static String fileName(final IFUType ifuType, final Side side) {
		return ifuType.name() + "_" + side.getPrefix() + ".txt";
	}

	public Path getDirectory() {
		return directory;
	}

	public int getNativeBinning() {
		return nativeBinning;
	}

	/**
	 * Parses a template file.
	 *
	 * @param file    the file
	 * @param ifuType the IFU the template describes
	 * @param side    the spectrograph side the template describes
	 * @param binning the binning at which positions were measured
	 * @return the template
	 * @throws TemplateLoadException if the file cannot be read, holds an invalid
	 *                               value, or holds no value at all
	 */
	public static FiberTemplate read(final Path file, final IFUType ifuType, final Side side, final int binning)
			throws TemplateLoadException {
		final List<String> lines;
		try {
			lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		} catch (final IOException e) {
			throw new TemplateLoadException("Could not read template " + file, e);
		}
		final List<Double> values = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			final String line = lines.get(i).trim();
			if (line.isEmpty() || line.startsWith("#")) continue;
			final String token = line.split("\\s+")[0];
			final double value;
			try {
				value = Double.parseDouble(token);
			} catch (final NumberFormatException e) {
				throw new TemplateLoadException(file.getFileName() + ", line " + (i + 1) + ": invalid value '" + token
						+ "'", e);
			}
			if (!Double.isFinite(value))
				throw new TemplateLoadException(file.getFileName() + ", line " + (i + 1) + ": invalid value " + token);
			if (!values.isEmpty() && value < values.get(values.size() - 1))
				throw new TemplateLoadException(file.getFileName() + ", line " + (i + 1) + ": positions not ascending");
			values.add(value);
		}
		if (values.isEmpty()) throw new TemplateLoadException("Template " + file + " holds no position");
		return new FiberTemplate(ifuType, side, values.stream().mapToDouble(Double::doubleValue).toArray(), binning);
	}

	@Override
	public String toString() {
		return "TemplateLoader[" + directory + ", " + cache.size() + " cached]";
	}

}
