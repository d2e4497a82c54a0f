package io.github.nandaindex.interop.runtime.matching;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Reads the ordered keyword table used as the last matching tier.
 * <pre>
 * rules:
 *   - needle: chat
 *     target: natural_language_generation
 * </pre>
 */
public final class KeywordRuleLoader {

    static final String DEFAULT_RESOURCE = "capability-keywords.yaml";

    private KeywordRuleLoader() {
    }

    public static List<KeywordRule> defaults() {
        InputStream stream = KeywordRuleLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (stream == null) {
            throw new IllegalStateException("Bundled keyword table not found on classpath: " + DEFAULT_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return parse(reader, DEFAULT_RESOURCE);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read keyword table: " + DEFAULT_RESOURCE, ex);
        }
    }

    public static List<KeywordRule> load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Keyword table not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read keyword table: " + path, ex);
        }
    }

    private static List<KeywordRule> parse(Reader reader, String source) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded;
        try {
            loaded = yaml.load(reader);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Keyword table is not valid YAML: " + source, ex);
        }
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException("Keyword table must be a mapping with a 'rules' list: " + source);
        }
        Object rules = root.get("rules");
        if (!(rules instanceof List<?> list)) {
            throw new IllegalArgumentException("'rules' is missing or not a list: " + source);
        }
        List<KeywordRule> results = new ArrayList<>();
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?> rule)
                    || !(rule.get("needle") instanceof String needle)
                    || !(rule.get("target") instanceof String target)) {
                throw new IllegalArgumentException("Each rule needs string 'needle' and 'target' entries: " + source);
            }
            results.add(new KeywordRule(needle, target));
        }
        return List.copyOf(results);
    }
}
