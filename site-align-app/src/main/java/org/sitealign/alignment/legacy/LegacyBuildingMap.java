package org.sitealign.alignment.legacy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.sitealign.alignment.json.JsonUtils;

/**
 * Legacy building map restricted to what level alignment needs.
 * Levels are kept sorted by name, which fixes their solve order.
 */
public class LegacyBuildingMap implements Serializable {

    private final String name;

    @JsonProperty("reference_level_name")
    private final String referenceLevelName;

    private final TreeMap<String, LegacyLevel> levels;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LegacyBuildingMap() {
        this(null, null);
    }

    public LegacyBuildingMap(final String name,
                             final String referenceLevelName) {
        this.name = name;
        this.referenceLevelName = referenceLevelName;
        this.levels = new TreeMap<>();
    }

    public String getName() {
        return name;
    }

    public String getReferenceLevelName() {
        return referenceLevelName;
    }

    public Map<String, LegacyLevel> getLevels() {
        return levels == null ? new TreeMap<>() : levels;
    }

    public List<String> getLevelNames() {
        return new ArrayList<>(getLevels().keySet());
    }

    public LegacyBuildingMap addLevel(final String levelName,
                                      final LegacyLevel level) {
        levels.put(levelName, level);
        return this;
    }

    /**
     * @return index (in level name order) of the reference level,
     *         or 0 if no reference level is designated or the designated level does not exist.
     */
    public int getReferenceLevelIndex() {
        if (referenceLevelName != null) {
            final int index = getLevelNames().indexOf(referenceLevelName);
            if (index >= 0) {
                return index;
            }
        }
        return 0;
    }

    public static LegacyBuildingMap fromYaml(final Reader yaml)
            throws IOException {
        return JsonUtils.YAML_MAPPER.readValue(yaml, LegacyBuildingMap.class);
    }

    public static LegacyBuildingMap fromYaml(final String yaml)
            throws IOException {
        return JsonUtils.YAML_MAPPER.readValue(yaml, LegacyBuildingMap.class);
    }

}
