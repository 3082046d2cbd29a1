package org.javai.tutoreval.scoring;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.tutoreval.judge.RubricDimension;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a {@link Rubric} from YAML.
 *
 * <pre>{@code
 * group_weights:        # optional
 *   base: 0.6
 *   recognition: 0.4
 * dimensions:
 *   relevance:
 *     name: Relevance
 *     group: base
 *     weight: 0.15
 *     description: Does the message respond to the learner's situation?
 *     criteria: { 1: Off-topic, 5: Precisely targeted }
 * }</pre>
 */
public class RubricLoader {

	public static final String DEFAULT_RESOURCE = "/rubric.yaml";

	private final Yaml yaml = new Yaml();

	public Rubric loadDefault() {
		try (InputStream in = RubricLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new RubricConfigException("Missing classpath resource " + DEFAULT_RESOURCE);
			}
			return build(yaml.load(in));
		} catch (RubricConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RubricConfigException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public Rubric load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (RubricConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RubricConfigException("Failed to parse rubric from path: " + path, e);
		}
	}

	public Rubric loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (RubricConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RubricConfigException("Failed to parse rubric from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private Rubric build(Object document) {
		if (!(document instanceof Map)) {
			throw new RubricConfigException("Rubric must be a YAML mapping");
		}
		Map<String, Object> data = (Map<String, Object>) document;
		Map<String, Object> dimensionsMap = mapAt(data.get("dimensions"), "dimensions");
		if (dimensionsMap.isEmpty()) {
			throw new RubricConfigException("Rubric defines no dimensions");
		}
		List<RubricDimension> dimensions = new ArrayList<>();
		for (Map.Entry<String, Object> entry : dimensionsMap.entrySet()) {
			dimensions.add(dimension(entry.getKey(), mapAt(entry.getValue(), entry.getKey())));
		}

		Map<String, Double> groupWeights = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : mapAt(data.get("group_weights"), "group_weights").entrySet()) {
			groupWeights.put(entry.getKey(), number(entry.getValue(), "group_weights." + entry.getKey()));
		}
		return new Rubric(dimensions, groupWeights);
	}

	private RubricDimension dimension(String key, Map<String, Object> fields) {
		Object group = fields.get("group");
		if (group == null) {
			throw new RubricConfigException("Dimension '" + key + "' has no group");
		}
		Map<Integer, String> criteria = new LinkedHashMap<>();
		for (Map.Entry<String, Object> level : mapAt(fields.get("criteria"), key + ".criteria").entrySet()) {
			criteria.put(Integer.valueOf(String.valueOf(level.getKey())), String.valueOf(level.getValue()));
		}
		Object name = fields.get("name");
		Object description = fields.get("description");
		try {
			return new RubricDimension(
					key,
					name != null ? name.toString() : null,
					description != null ? description.toString() : null,
					group.toString(),
					number(fields.get("weight"), key + ".weight"),
					criteria);
		} catch (IllegalArgumentException e) {
			throw new RubricConfigException("Invalid dimension '" + key + "': " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> mapAt(Object value, String where) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new RubricConfigException("Expected a mapping at '" + where + "'");
		}
		// SnakeYAML reads integer keys such as criteria levels as Integer
		Map<String, Object> result = new LinkedHashMap<>();
		((Map<Object, Object>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
		return result;
	}

	private double number(Object value, String where) {
		if (value instanceof Number n) {
			return n.doubleValue();
		}
		throw new RubricConfigException("'" + where + "' must be a number");
	}
}
