package io.vena.drift.util;

import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

import static io.vena.drift.util.MdcKeys.CLIENT;
import static io.vena.drift.util.MdcKeys.USER;

public final class MappedDiagnosticContext {

	public static MDCScope setupMDC(String clientName, @Nullable String user) {
		MDCScope result = new MDCScope(CLIENT, USER);
		MDC.put(CLIENT, clientName);
		MDC.put(USER, user == null ? "(anonymous)" : user);
		return result;
	}

	public static MDCScope withMDC(String key, String value) {
		MDCScope result = new MDCScope(key);
		MDC.put(key, value);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entries at the end, it restores them to their prior values,
	 * which allows us to nest these.
	 *
	 * <p>
	 * Use this in a try block that has no catch or finally clause.
	 * Those clauses run after {@link #close()}, so they wouldn't see the diagnostic context.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String[] keys;
		private final String[] oldValues;

		private MDCScope(String... keys) {
			this.keys = keys;
			this.oldValues = new String[keys.length];
			for (int i = 0; i < keys.length; i++) {
				oldValues[i] = MDC.get(keys[i]);
			}
		}

		@Override public void close() {
			for (int i = 0; i < keys.length; i++) {
				if (oldValues[i] == null) {
					MDC.remove(keys[i]);
				} else {
					MDC.put(keys[i], oldValues[i]);
				}
			}
		}
	}

	private MappedDiagnosticContext() {}
}
