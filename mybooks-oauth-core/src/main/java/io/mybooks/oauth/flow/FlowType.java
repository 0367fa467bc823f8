/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.flow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The authorization flows that can be pending at the same time, each with its own
 * persisted state.
 */
public enum FlowType {

	/** Sign-in of the user into the hosting application. */
	USER_LOGIN("user_login"),

	/** Authorization of the registered client application. */
	APP_AUTHORIZE("app_authorize");

	private final String value;

	FlowType(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static FlowType fromValue(String value) {
		for (FlowType type : values()) {
			if (type.value.equals(value)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown flow type: " + value);
	}

}
