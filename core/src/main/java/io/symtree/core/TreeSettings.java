// file: src/main/java/io/symtree/core/TreeSettings.java
package io.symtree.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.symtree.core.dto.SettingsJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Diagnostic settings, passed explicitly to the components that read them
 * ({@link Evaluator}, {@link TreeRenderer}). Read-only once built.
 * <p>
 * Supports:
 *  - debugMode:   log every evaluation and reject non-finite results
 *  - renderStyle: prefixes used in tree diagrams (UNICODE or ASCII)
 */
public record TreeSettings(boolean debugMode, RenderStyle renderStyle) {

    private static final TreeSettings DEFAULTS = new TreeSettings(false, RenderStyle.UNICODE);

    public TreeSettings {
        Objects.requireNonNull(renderStyle, "renderStyle");
    }

    public static TreeSettings defaults() {
        return DEFAULTS;
    }

    public TreeSettings withDebugMode(boolean debugMode) {
        return new TreeSettings(debugMode, renderStyle);
    }

    public TreeSettings withRenderStyle(RenderStyle renderStyle) {
        return new TreeSettings(debugMode, renderStyle);
    }

    /**
     * Load settings from a JSON file such as:
     * <pre>
     * { "debugMode": true, "renderStyle": "ascii" }
     * </pre>
     * Missing fields keep their defaults.
     */
    public static TreeSettings fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            SettingsJson json = mapper.readValue(path.toFile(), SettingsJson.class);
            boolean debug = json.debugMode != null ? json.debugMode : DEFAULTS.debugMode();
            RenderStyle style = json.renderStyle != null
                    ? parseStyle(json.renderStyle)
                    : DEFAULTS.renderStyle();
            return new TreeSettings(debug, style);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load TreeSettings from " + path, e);
        }
    }

    private static RenderStyle parseStyle(String raw) {
        try {
            return RenderStyle.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown renderStyle: " + raw, e);
        }
    }
}
