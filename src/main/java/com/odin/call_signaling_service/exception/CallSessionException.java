package com.odin.call_signaling_service.exception;

/**
 * Rejected call operation, e.g. a call without remote participants.
 */
public class CallSessionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CallSessionException(String message) {
		super(message);
	}
}
