package com.odin.call_signaling_service.exception;

public class SignalingTransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public SignalingTransportException(String message) {
		super(message);
	}

	public SignalingTransportException(String message, Throwable cause) {
		super(message, cause);
	}
}
