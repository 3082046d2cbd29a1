package org.javai.tutoreval.cell;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an experiment cell identifier to its {@link ExecutionPlan}.
 *
 * <p>Resolution is total: registered names and canonical cell keys resolve from their factors,
 * anything else yields {@link ExecutionPlan#fallback} so one stale identifier cannot stop a batch.</p>
 *
 * <p>Invariant: a plan whose tutor is multi-agent always carries a critique binding, and a plan whose
 * tutor is single-agent always carries {@code null}.</p>
 */
public class CellResolver {

	private static final Logger logger = LoggerFactory.getLogger(CellResolver.class);

	private final CellRegistry registry;

	public CellResolver(CellRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	public ExecutionPlan resolve(String identifier) {
		if (identifier == null || identifier.isBlank()) {
			logger.warn("Blank cell identifier; using fallback plan");
			return ExecutionPlan.fallback(identifier, registry.defaultTutorModel());
		}
		Optional<CellDefinition> definition = registry.find(identifier);
		if (definition.isPresent()) {
			return plan(definition.get());
		}
		if (CellFactors.isCellKey(identifier)) {
			return resolve(CellFactors.fromCellKey(identifier));
		}
		logger.warn("Unknown cell identifier '{}'; using fallback plan (no dialogue, 0 rounds)", identifier);
		return ExecutionPlan.fallback(identifier, registry.defaultTutorModel());
	}

	public ExecutionPlan resolve(CellFactors factors) {
		Objects.requireNonNull(factors, "factors must not be null");
		return plan(new CellDefinition(factors.cellKey(), factors, null, null, null, null));
	}

	private ExecutionPlan plan(CellDefinition definition) {
		CellFactors factors = definition.factors();
		ModelBinding tutor = definition.tutorModel() != null ? definition.tutorModel() : registry.defaultTutorModel();

		ModelBinding critique = null;
		int rounds = 0;
		if (factors.multiAgentTutor()) {
			critique = definition.critiqueModel() != null ? definition.critiqueModel() : registry.defaultCritiqueModel();
			rounds = definition.maxRounds() != null && definition.maxRounds() > 0
					? definition.maxRounds()
					: registry.defaultMaxRounds();
		}

		String promptVariant = definition.promptVariant() != null
				? definition.promptVariant()
				: factors.recognition() ? ExecutionPlan.RECOGNITION_PROMPT : ExecutionPlan.STANDARD_PROMPT;
		String learner = factors.multiAgentLearner() ? ExecutionPlan.EGO_SUPEREGO_LEARNER : ExecutionPlan.UNIFIED_LEARNER;

		return new ExecutionPlan(
				definition.name(),
				factors,
				tutor,
				critique,
				promptVariant,
				factors.multiAgentTutor(),
				rounds,
				learner);
	}
}
