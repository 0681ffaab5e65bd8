package io.vena.drift.util;

public final class MdcKeys {
	public static final String CLIENT = "drift.client";
	public static final String USER   = "drift.user";
	public static final String TARGET = "drift.target";
	public static final String BATCH  = "drift.batch";

	private MdcKeys() {}
}
