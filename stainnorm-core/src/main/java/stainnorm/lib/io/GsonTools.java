/*-
 * #%L
 * This file is part of stainnorm.
 * %%
 * Copyright (C) 2024 stainnorm developers
 * %%
 * stainnorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * stainnorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with stainnorm.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package stainnorm.lib.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import stainnorm.lib.color.MacenkoParameters;
import stainnorm.lib.color.MacenkoTarget;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.images.servers.transforms.MacenkoNormalizer;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * several key classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link StainMatrix}</li>
 * <li>{@link MacenkoParameters}</li>
 * <li>{@link MacenkoTarget}</li>
 * <li>{@link MacenkoNormalizer}</li>
 * </ul>
 */
public final class GsonTools {

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(StainMatrix.class, StainTypeAdapters.StainMatrixTypeAdapter.INSTANCE.nullSafe())
			.registerTypeAdapter(MacenkoParameters.class, StainTypeAdapters.MacenkoParametersTypeAdapter.INSTANCE.nullSafe())
			.registerTypeAdapter(MacenkoTarget.class, StainTypeAdapters.MacenkoTargetTypeAdapter.INSTANCE.nullSafe())
			.registerTypeAdapter(MacenkoNormalizer.class, StainTypeAdapters.MacenkoNormalizerTypeAdapter.INSTANCE.nullSafe());

	private static final Gson gson = builder.create();

	private static final Gson gsonPretty = builder.create().newBuilder().setPrettyPrinting().create();

	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Get a shared Gson instance, without pretty printing.
	 * @return
	 */
	public static Gson getInstance() {
		return getInstance(false);
	}

	/**
	 * Get a shared Gson instance.
	 * @param pretty if true, request pretty-printing for JSON output
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		return pretty ? gsonPretty : gson;
	}

}
