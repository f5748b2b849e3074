package com.publishpipe.publisher.plugin.impl;

import com.publishpipe.publisher.item.PublishItem;
import com.publishpipe.publisher.model.AcceptResult;
import com.publishpipe.publisher.plugin.AbstractPublishPlugin;
import com.publishpipe.publisher.plugin.PluginException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Publishes a file item by copying it into a publish folder.
 *
 * The item's {@code path} property names the source file. Settings:
 * <pre>
 *   extensions   — list of accepted extensions ("exr", ".png"); absent = any
 *   publish_root — destination directory, created on demand
 *   checked      — initial checked-state of accepted units (default true)
 *   visible      — whether accepted units are shown (default true)
 * </pre>
 */
@Component
public class CopyFilePlugin extends AbstractPublishPlugin {

    public static final String NAME = "Copy file to publish folder";

    public static final String PATH_PROPERTY    = "path";
    public static final String EXTENSIONS       = "extensions";
    public static final String PUBLISH_ROOT     = "publish_root";
    public static final String CHECKED          = "checked";
    public static final String VISIBLE          = "visible";

    public CopyFilePlugin() {
        super(NAME);
    }

    // ------------------------------------------------------------------
    // Accept
    // ------------------------------------------------------------------

    @Override
    public AcceptResult runAccept(Map<String, Object> settings, PublishItem item) {
        Path source = sourcePath(item);
        if (source == null) {
            return AcceptResult.ofRejected()
                    .withExtraInfo(Map.of("reason", "item has no '" + PATH_PROPERTY + "' property"));
        }

        List<String> extensions = extensions(settings);
        String ext = extensionOf(source);
        if (!extensions.isEmpty() && !extensions.contains(ext)) {
            return AcceptResult.ofRejected()
                    .withExtraInfo(Map.of(
                            "reason", "extension '" + ext + "' not in " + extensions,
                            "path", source.toString()));
        }

        return AcceptResult.ofAccepted()
                .withVisible(flag(settings, VISIBLE))
                .withChecked(flag(settings, CHECKED))
                .withExtraInfo(Map.of("path", source.toString()));
    }

    // ------------------------------------------------------------------
    // Validate / publish / finalize
    // ------------------------------------------------------------------

    @Override
    public boolean runValidate(Map<String, Object> settings, PublishItem item) {
        Path source = sourcePath(item);
        if (source == null || !Files.isRegularFile(source)) {
            log.warn("Source file missing for item '{}': {}", item.name(), source);
            return false;
        }
        if (publishRoot(settings) == null) {
            log.warn("No '{}' configured for item '{}'", PUBLISH_ROOT, item.name());
            return false;
        }
        return true;
    }

    @Override
    public void runPublish(Map<String, Object> settings, PublishItem item) {
        Path source = sourcePath(item);
        Path root   = publishRoot(settings);
        if (source == null || root == null) {
            throw new PluginException(PluginException.Stage.PUBLISH,
                    "Item '" + item.name() + "' cannot be published: source=" + source + " root=" + root);
        }

        Path target = root.resolve(source.getFileName());
        try {
            Files.createDirectories(root);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PluginException(PluginException.Stage.PUBLISH,
                    "Copy " + source + " -> " + target + " failed", e);
        }
        log.info("Published '{}' to {}", item.name(), target);
    }

    @Override
    public void runFinalize(Map<String, Object> settings, PublishItem item) {
        Path source = sourcePath(item);
        Path root   = publishRoot(settings);
        if (source != null && root != null) {
            log.info("Publish of '{}' complete: {}", item.name(), root.resolve(source.getFileName()));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path sourcePath(PublishItem item) {
        Object raw = item.properties().get(PATH_PROPERTY);
        if (raw instanceof Path p) {
            return p;
        }
        if (raw instanceof String s && !s.isBlank()) {
            return Path.of(s);
        }
        return null;
    }

    private static Path publishRoot(Map<String, Object> settings) {
        Object raw = settings.get(PUBLISH_ROOT);
        if (raw instanceof Path p) {
            return p;
        }
        if (raw instanceof String s && !s.isBlank()) {
            return Path.of(s);
        }
        return null;
    }

    private static List<String> extensions(Map<String, Object> settings) {
        Object raw = settings.get(EXTENSIONS);
        if (raw instanceof Collection<?> c) {
            return c.stream().map(CopyFilePlugin::normalise).toList();
        }
        if (raw instanceof String s && !s.isBlank()) {
            return List.of(normalise(s));
        }
        return List.of();
    }

    private static String normalise(Object ext) {
        String s = String.valueOf(ext).strip().toLowerCase(Locale.ROOT);
        return s.startsWith(".") ? s.substring(1) : s;
    }

    static String extensionOf(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot < 0 ? "" : file.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    // Absent or non-boolean settings default to true.
    private static boolean flag(Map<String, Object> settings, String key) {
        return !(settings.get(key) instanceof Boolean b) || b;
    }
}
