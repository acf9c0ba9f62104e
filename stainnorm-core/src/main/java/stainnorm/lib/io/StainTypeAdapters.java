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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import stainnorm.lib.color.MacenkoParameters;
import stainnorm.lib.color.MacenkoTarget;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.color.StainVector;
import stainnorm.lib.images.servers.transforms.MacenkoNormalizer;

/**
 * Gson type adapters for stain-related classes.
 */
class StainTypeAdapters {

	/**
	 * Writes a stain matrix as an object mapping stain names to [red, green, blue] arrays, in column order.
	 */
	static class StainMatrixTypeAdapter extends TypeAdapter<StainMatrix> {

		static final StainMatrixTypeAdapter INSTANCE = new StainMatrixTypeAdapter();

		@Override
		public void write(JsonWriter out, StainMatrix value) throws IOException {
			out.beginObject();
			for (int i = 1; i <= 3; i++) {
				StainVector stain = value.getStain(i);
				out.name(stain.getName());
				writeArray(out, stain.getArray());
			}
			out.endObject();
		}

		@Override
		public StainMatrix read(JsonReader in) throws IOException {
			List<StainVector> stains = new ArrayList<>();
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				double[] values = readArray(in);
				if (values.length != 3)
					throw new JsonParseException("Stain '" + name + "' must have 3 values, but has " + values.length);
				if (stains.size() < 2)
					stains.add(StainVector.createStainVector(name, values[0], values[1], values[2]));
				else
					stains.add(StainVector.createResidualStainVector(name, values[0], values[1], values[2]));
			}
			in.endObject();
			if (stains.size() != 3)
				throw new JsonParseException("Stain matrix requires 3 stains, but found " + stains.size());
			return StainMatrix.create(stains.get(0), stains.get(1), stains.get(2));
		}

	}

	/**
	 * Reads parameters by applying any values found to a default builder, so missing values take their defaults.
	 */
	static class MacenkoParametersTypeAdapter extends TypeAdapter<MacenkoParameters> {

		static final MacenkoParametersTypeAdapter INSTANCE = new MacenkoParametersTypeAdapter();

		@Override
		public void write(JsonWriter out, MacenkoParameters value) throws IOException {
			out.beginObject();
			out.name("io").value(value.getIo());
			out.name("beta").value(value.getBeta());
			out.name("alpha").value(value.getAlpha());
			out.name("intensityNorm").value(value.doIntensityNorm());
			out.endObject();
		}

		@Override
		public MacenkoParameters read(JsonReader in) throws IOException {
			MacenkoParameters.Builder builder = MacenkoParameters.builder();
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "io":
					builder.io(in.nextDouble());
					break;
				case "beta":
					builder.beta(in.nextDouble());
					break;
				case "alpha":
					builder.alpha(in.nextDouble());
					break;
				case "intensityNorm":
					builder.intensityNorm(in.nextBoolean());
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			return builder.build();
		}

	}

	static class MacenkoTargetTypeAdapter extends TypeAdapter<MacenkoTarget> {

		static final MacenkoTargetTypeAdapter INSTANCE = new MacenkoTargetTypeAdapter();

		@Override
		public void write(JsonWriter out, MacenkoTarget value) throws IOException {
			out.beginObject();
			out.name("stains");
			StainMatrixTypeAdapter.INSTANCE.write(out, value.getStains());
			out.name("maxConcentrations");
			writeArray(out, value.getMaxConcentrations());
			out.endObject();
		}

		@Override
		public MacenkoTarget read(JsonReader in) throws IOException {
			StainMatrix stains = null;
			double[] maxConcentrations = null;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "stains":
					stains = StainMatrixTypeAdapter.INSTANCE.read(in);
					break;
				case "maxConcentrations":
					maxConcentrations = readArray(in);
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (stains == null || maxConcentrations == null)
				throw new JsonParseException("Target requires both 'stains' and 'maxConcentrations'");
			return MacenkoTarget.create(stains, maxConcentrations);
		}

	}

	static class MacenkoNormalizerTypeAdapter extends TypeAdapter<MacenkoNormalizer> {

		static final MacenkoNormalizerTypeAdapter INSTANCE = new MacenkoNormalizerTypeAdapter();

		@Override
		public void write(JsonWriter out, MacenkoNormalizer value) throws IOException {
			out.beginObject();
			out.name("target");
			MacenkoTargetTypeAdapter.INSTANCE.write(out, value.getTarget());
			out.name("parameters");
			MacenkoParametersTypeAdapter.INSTANCE.write(out, value.getParameters());
			out.endObject();
		}

		@Override
		public MacenkoNormalizer read(JsonReader in) throws IOException {
			MacenkoTarget target = null;
			MacenkoParameters params = MacenkoParameters.getDefault();
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "target":
					target = MacenkoTargetTypeAdapter.INSTANCE.read(in);
					break;
				case "parameters":
					params = MacenkoParametersTypeAdapter.INSTANCE.read(in);
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (target == null)
				throw new JsonParseException("Normalizer requires a 'target'");
			return MacenkoNormalizer.create(target, params);
		}

	}

	private static void writeArray(JsonWriter out, double[] values) throws IOException {
		out.beginArray();
		for (double v : values)
			out.value(v);
		out.endArray();
	}

	private static double[] readArray(JsonReader in) throws IOException {
		List<Double> list = new ArrayList<>();
		in.beginArray();
		while (in.hasNext())
			list.add(in.nextDouble());
		in.endArray();
		return list.stream().mapToDouble(Double::doubleValue).toArray();
	}

}
