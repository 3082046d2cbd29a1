package org.javai.tutoreval.cell;

/**
 * Thrown when a cell registry definition cannot be read or is inconsistent.
 */
public class CellRegistryException extends RuntimeException {

	public CellRegistryException(String message) {
		super(message);
	}

	public CellRegistryException(String message, Throwable cause) {
		super(message, cause);
	}
}
