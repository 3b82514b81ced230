package io.surfworks.kernelgate.verify;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.surfworks.kernelgate.ir.DataType;
import io.surfworks.kernelgate.ir.KernelIr.Expr;
import io.surfworks.kernelgate.ir.KernelIr.FloatImm;
import io.surfworks.kernelgate.ir.KernelIr.IntImm;
import io.surfworks.kernelgate.ir.KernelIr.StringImm;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Loads GPU constraint maps from JSON.
 *
 * <p>A constraint file is a flat object of limit name to integer:
 * <pre>{@code
 * {
 *   "max_thread_per_block": 1024,
 *   "max_shared_memory_per_block": 49152
 * }
 * }</pre>
 *
 * <p>Values keep their JSON kind so that {@link GpuLimits#fromConstraints}
 * rejects anything that is not an integer.
 */
public final class GpuConstraints {

    private static final Logger LOG = Logger.getLogger(GpuConstraints.class.getName());

    static final String PRESETS_RESOURCE = "/io/surfworks/kernelgate/verify/gpu-targets.json";

    private static volatile Map<String, Map<String, Expr>> presets;

    private GpuConstraints() {}

    /**
     * Load a constraint map from a JSON file.
     */
    public static Map<String, Expr> loadFrom(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Expr> constraints = parse(reader);
            LOG.config(() -> "Loaded " + constraints.size() + " GPU constraints from " + path);
            return constraints;
        }
    }

    /**
     * Parse a constraint map from a JSON reader.
     *
     * @throws IllegalArgumentException if the document is not a JSON object
     */
    public static Map<String, Expr> parse(Reader reader) {
        JsonElement root = JsonParser.parseReader(reader);
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("GPU constraints must be a JSON object, got " + root);
        }
        return toConstraints(root.getAsJsonObject());
    }

    /**
     * Returns the bundled constraints for a named target such as {@code nvidia}.
     *
     * @throws IllegalArgumentException if no preset has that name
     */
    public static Map<String, Expr> preset(String target) {
        Map<String, Expr> constraints = presets().get(target);
        if (constraints == null) {
            throw new IllegalArgumentException(
                "Unknown GPU target '" + target + "', expected one of " + presets().keySet());
        }
        LOG.config(() -> "Using GPU constraint preset " + target);
        return constraints;
    }

    public static Set<String> presetNames() {
        return presets().keySet();
    }

    private static Map<String, Map<String, Expr>> presets() {
        Map<String, Map<String, Expr>> loaded = presets;
        if (loaded == null) {
            synchronized (GpuConstraints.class) {
                loaded = presets;
                if (loaded == null) {
                    loaded = loadPresets();
                    presets = loaded;
                }
            }
        }
        return loaded;
    }

    private static Map<String, Map<String, Expr>> loadPresets() {
        InputStream in = GpuConstraints.class.getResourceAsStream(PRESETS_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing resource " + PRESETS_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            Map<String, Map<String, Expr>> targets = new LinkedHashMap<>();
            for (String name : root.keySet()) {
                targets.put(name, toConstraints(root.getAsJsonObject(name)));
            }
            return Collections.unmodifiableMap(targets);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PRESETS_RESOURCE, e);
        }
    }

    private static Map<String, Expr> toConstraints(JsonObject obj) {
        Map<String, Expr> constraints = new LinkedHashMap<>();
        for (String key : obj.keySet()) {
            JsonElement value = obj.get(key);
            if (value.isJsonNull()) {
                continue;
            }
            constraints.put(key, toExpr(key, value));
        }
        return Collections.unmodifiableMap(constraints);
    }

    private static Expr toExpr(String key, JsonElement value) {
        if (!value.isJsonPrimitive() || value.getAsJsonPrimitive().isBoolean()) {
            throw new IllegalArgumentException(
                "GPU constraint '" + key + "' must be a number or string, got " + value);
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            BigDecimal number = primitive.getAsBigDecimal();
            if (number.stripTrailingZeros().scale() <= 0) {
                try {
                    return IntImm.int64(number.longValueExact());
                } catch (ArithmeticException e) {
                    throw new IllegalArgumentException(
                        "GPU constraint '" + key + "' is out of 64-bit range: " + value, e);
                }
            }
            return new FloatImm(DataType.FLOAT64, number.doubleValue());
        }
        return new StringImm(primitive.getAsString());
    }
}
