package org.javai.tutoreval.cell;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named experiment cells plus the model defaults cells fall back on.
 */
public final class CellRegistry {

	public static final int DEFAULT_MAX_ROUNDS = 2;

	private final Map<String, CellDefinition> cells;
	private final ModelBinding defaultTutorModel;
	private final ModelBinding defaultCritiqueModel;
	private final int defaultMaxRounds;

	public CellRegistry(List<CellDefinition> cells, ModelBinding defaultTutorModel,
			ModelBinding defaultCritiqueModel, int defaultMaxRounds) {
		if (defaultTutorModel == null) {
			throw new IllegalArgumentException("defaultTutorModel must not be null");
		}
		if (defaultCritiqueModel == null) {
			throw new IllegalArgumentException("defaultCritiqueModel must not be null");
		}
		if (defaultMaxRounds < 1) {
			throw new IllegalArgumentException("defaultMaxRounds must be >= 1");
		}
		Map<String, CellDefinition> byName = new LinkedHashMap<>();
		for (CellDefinition cell : cells) {
			if (byName.putIfAbsent(cell.name(), cell) != null) {
				throw new CellRegistryException("Duplicate cell name: " + cell.name());
			}
		}
		this.cells = Collections.unmodifiableMap(byName);
		this.defaultTutorModel = defaultTutorModel;
		this.defaultCritiqueModel = defaultCritiqueModel;
		this.defaultMaxRounds = defaultMaxRounds;
	}

	/**
	 * Registry without named cells; only cell keys resolve.
	 */
	public static CellRegistry empty(ModelBinding defaultTutorModel, ModelBinding defaultCritiqueModel) {
		return new CellRegistry(List.of(), defaultTutorModel, defaultCritiqueModel, DEFAULT_MAX_ROUNDS);
	}

	public Optional<CellDefinition> find(String name) {
		return Optional.ofNullable(cells.get(name));
	}

	public Collection<CellDefinition> cells() {
		return cells.values();
	}

	public ModelBinding defaultTutorModel() {
		return defaultTutorModel;
	}

	public ModelBinding defaultCritiqueModel() {
		return defaultCritiqueModel;
	}

	public int defaultMaxRounds() {
		return defaultMaxRounds;
	}
}
