package org.javai.tutoreval.cell;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a {@link CellRegistry} from YAML.
 *
 * <pre>{@code
 * defaults:
 *   tutor_model: openrouter.nemotron
 *   critique_model: openrouter.kimi-k2.5
 *   max_rounds: 2
 * cells:
 *   cell_7_recog_multi_unified:
 *     factors: { recognition: true, multi_agent_tutor: true, multi_agent_learner: false }
 *     max_rounds: 3
 * }</pre>
 */
public class CellRegistryLoader {

	public static final String DEFAULT_RESOURCE = "/cells.yaml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the registry bundled with the library.
	 */
	public CellRegistry loadDefault() {
		try (InputStream in = CellRegistryLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new CellRegistryException("Missing classpath resource " + DEFAULT_RESOURCE);
			}
			return load(in);
		} catch (CellRegistryException e) {
			throw e;
		} catch (Exception e) {
			throw new CellRegistryException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public CellRegistry load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (CellRegistryException e) {
			throw e;
		} catch (Exception e) {
			throw new CellRegistryException("Failed to parse cell registry from path: " + path, e);
		}
	}

	public CellRegistry load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (CellRegistryException e) {
			throw e;
		} catch (Exception e) {
			throw new CellRegistryException("Failed to parse cell registry from input stream", e);
		}
	}

	public CellRegistry loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (CellRegistryException e) {
			throw e;
		} catch (Exception e) {
			throw new CellRegistryException("Failed to parse cell registry from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private CellRegistry build(Object document) {
		if (!(document instanceof Map)) {
			throw new CellRegistryException("Cell registry must be a YAML mapping");
		}
		Map<String, Object> data = (Map<String, Object>) document;
		Map<String, Object> defaults = mapOrEmpty(data.get("defaults"), "defaults");

		ModelBinding tutor = ModelBinding.parse(requiredString(defaults, "tutor_model", "defaults"));
		ModelBinding critique = ModelBinding.parse(requiredString(defaults, "critique_model", "defaults"));
		Integer rounds = optionalInt(defaults, "max_rounds", "defaults");

		List<CellDefinition> cells = new ArrayList<>();
		Map<String, Object> cellsMap = mapOrEmpty(data.get("cells"), "cells");
		for (Map.Entry<String, Object> entry : cellsMap.entrySet()) {
			cells.add(buildCell(entry.getKey(), mapOrEmpty(entry.getValue(), entry.getKey())));
		}
		return new CellRegistry(cells, tutor, critique, rounds != null ? rounds : CellRegistry.DEFAULT_MAX_ROUNDS);
	}

	private CellDefinition buildCell(String name, Map<String, Object> cell) {
		Map<String, Object> factorsMap = mapOrEmpty(cell.get("factors"), name + ".factors");
		CellFactors factors = new CellFactors(
				flag(factorsMap, "recognition", name),
				flag(factorsMap, "multi_agent_tutor", name),
				flag(factorsMap, "multi_agent_learner", name));

		String tutorRef = optionalString(cell, "tutor_model");
		String critiqueRef = optionalString(cell, "critique_model");
		return new CellDefinition(
				name,
				factors,
				optionalString(cell, "prompt_variant"),
				tutorRef != null ? ModelBinding.parse(tutorRef) : null,
				critiqueRef != null ? ModelBinding.parse(critiqueRef) : null,
				optionalInt(cell, "max_rounds", name));
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> mapOrEmpty(Object value, String where) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new CellRegistryException("Expected a mapping at '" + where + "'");
		}
		return (Map<String, Object>) value;
	}

	private boolean flag(Map<String, Object> map, String key, String where) {
		Object value = map.get(key);
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new CellRegistryException("Factor '" + key + "' of " + where + " must be true or false");
	}

	private String requiredString(Map<String, Object> map, String key, String where) {
		String value = optionalString(map, key);
		if (value == null || value.isBlank()) {
			throw new CellRegistryException("Missing '" + key + "' in " + where);
		}
		return value;
	}

	private String optionalString(Map<String, Object> map, String key) {
		Object value = map.get(key);
		return value != null ? value.toString() : null;
	}

	private Integer optionalInt(Map<String, Object> map, String key, String where) {
		Object value = map.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new CellRegistryException("'" + key + "' of " + where + " must be an integer");
	}
}
