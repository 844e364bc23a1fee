package com.odin.call_signaling_service.exception;

/**
 * Failure applying or creating a session description or candidate for one peer.
 */
public class NegotiationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public NegotiationException(String message) {
		super(message);
	}

	public NegotiationException(String message, Throwable cause) {
		super(message, cause);
	}
}
