package io.vena.drift.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies the server-side database a client talks to.
 */
@Value
public class DatabaseId {
	public static final String DEFAULT_DATABASE = "(default)";

	@NonNull String projectId;
	@NonNull String database;

	public static DatabaseId forProject(String projectId) {
		return new DatabaseId(projectId, DEFAULT_DATABASE);
	}

	/**
	 * The fully qualified name the server uses for a document.
	 */
	public String documentName(DocumentKey key) {
		return "projects/" + projectId + "/databases/" + database + "/documents/" + key.path().canonicalString();
	}

	@Override
	public String toString() {
		return projectId + "/" + database;
	}
}
