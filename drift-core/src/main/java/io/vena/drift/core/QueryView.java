package io.vena.drift.core;

import lombok.Value;

/**
 * A query the sync engine is listening to, with its target and its view.
 */
@Value
class QueryView {
	Query query;
	int targetId;
	View view;
}
