package org.javai.tutoreval.cell;

/**
 * Binds an agent role to a concrete model.
 *
 * @param provider provider identifier (e.g. "openrouter")
 * @param model model identifier understood by that provider
 */
public record ModelBinding(String provider, String model) {

	public ModelBinding {
		if (model == null || model.isBlank()) {
			throw new IllegalArgumentException("model must not be blank");
		}
	}

	/**
	 * Parses {@code provider.model}; a value without a dot is taken as a bare model id.
	 * Only the first dot separates, so model ids such as {@code kimi-k2.5} survive.
	 */
	public static ModelBinding parse(String reference) {
		if (reference == null || reference.isBlank()) {
			throw new IllegalArgumentException("model reference must not be blank");
		}
		int dot = reference.indexOf('.');
		if (dot <= 0 || dot == reference.length() - 1) {
			return new ModelBinding(null, reference.trim());
		}
		return new ModelBinding(reference.substring(0, dot).trim(), reference.substring(dot + 1).trim());
	}

	@Override
	public String toString() {
		return provider == null ? model : provider + "/" + model;
	}
}
