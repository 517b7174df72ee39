package org.lexis.indexing.storage;

import java.io.IOException;

/**
 * Thrown when a document collection cannot be read.
 */
public class DocumentLoadException extends IOException {
	public DocumentLoadException(String message) {
		super(message);
	}

	public DocumentLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
