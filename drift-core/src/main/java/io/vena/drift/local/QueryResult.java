package io.vena.drift.local;

import io.vena.drift.model.Document;
import io.vena.drift.model.DocumentKey;
import java.util.Set;
import java.util.SortedMap;
import lombok.Value;

/**
 * The local documents matching a query, along with the keys the server
 * last reported for the query's target.
 */
@Value
public class QueryResult {
	SortedMap<DocumentKey, Document> documents;
	Set<DocumentKey> remoteKeys;
}
