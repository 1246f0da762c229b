/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.util;

import java.util.Collection;

/**
 * Argument assertions used at API boundaries. Every failure is an
 * {@link IllegalArgumentException} carrying the supplied message.
 *
 * @author Mark Pollack
 */
public final class Assert {

	private Assert() {
	}

	public static void notNull(Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void hasText(String text, String message) {
		if (!hasText(text)) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void notEmpty(Collection<?> collection, String message) {
		if (collection == null || collection.isEmpty()) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * Check whether the given string contains at least one non-whitespace character.
	 * @param text the string to check
	 * @return true if the string is not null and not blank
	 */
	public static boolean hasText(String text) {
		return text != null && !text.isBlank();
	}

}
