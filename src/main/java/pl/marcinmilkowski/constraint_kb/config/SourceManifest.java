package pl.marcinmilkowski.constraint_kb.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.constraint_kb.ingest.SourceKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves where each source lives.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "data_root": "/data/voynich",          (optional, defaults to the manifest's directory)
 *   "sources": {
 *     "class_definitions": "classes.json",
 *     "middle_class_index": "middle_class_index.json",
 *     ...
 *   }
 * }
 *
 * Sources not named in the manifest fall back to their default location
 * under the data root.
 */
public class SourceManifest {
    private static final Logger logger = LoggerFactory.getLogger(SourceManifest.class);

    private final String version;
    private final Path dataRoot;
    private final Map<SourceKind, Path> paths;

    private SourceManifest(String version, Path dataRoot, Map<SourceKind, Path> overrides) {
        this.version = version;
        this.dataRoot = dataRoot;
        EnumMap<SourceKind, Path> resolved = new EnumMap<>(SourceKind.class);
        for (SourceKind kind : SourceKind.values()) {
            Path override = overrides.get(kind);
            resolved.put(kind, override != null ? dataRoot.resolve(override) : dataRoot.resolve(kind.defaultPath()));
        }
        this.paths = Collections.unmodifiableMap(resolved);
    }

    /**
     * Manifest using the original project layout below {@code dataRoot}.
     */
    public static SourceManifest defaultLayout(Path dataRoot) {
        return new SourceManifest("default", dataRoot, Map.of());
    }

    /**
     * Manifest with explicit paths; anything not given uses the default layout.
     */
    public static SourceManifest of(Path dataRoot, Map<SourceKind, Path> paths) {
        return new SourceManifest("inline", dataRoot, paths);
    }

    /**
     * Load a manifest from a JSON file.
     *
     * @param manifestPath Path to the manifest
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static SourceManifest load(Path manifestPath) throws IOException {
        if (!Files.exists(manifestPath)) {
            throw new IOException("Source manifest not found: " + manifestPath);
        }

        JSONObject root;
        try {
            root = JSON.parseObject(Files.readString(manifestPath));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed source manifest " + manifestPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty source manifest: " + manifestPath);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in source manifest");
        }

        Path base = manifestPath.toAbsolutePath().getParent();
        String dataRootValue = root.getString("data_root");
        Path dataRoot = dataRootValue == null || dataRootValue.isBlank() ? base : base.resolve(dataRootValue);

        Map<SourceKind, Path> overrides = new EnumMap<>(SourceKind.class);
        JSONObject sources = root.getJSONObject("sources");
        if (sources != null) {
            for (String key : sources.keySet()) {
                String value = sources.getString(key);
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("Empty path for source '" + key + "' in " + manifestPath);
                }
                overrides.put(SourceKind.fromKey(key), Path.of(value));
            }
        }

        SourceManifest manifest = new SourceManifest(version, dataRoot, overrides);
        logger.info("Loaded source manifest version {}: {} explicit sources, data root {}",
            version, overrides.size(), dataRoot);
        return manifest;
    }

    public Path pathFor(SourceKind kind) {
        return paths.get(kind);
    }

    public String getVersion() {
        return version;
    }

    public Path getDataRoot() {
        return dataRoot;
    }
}
