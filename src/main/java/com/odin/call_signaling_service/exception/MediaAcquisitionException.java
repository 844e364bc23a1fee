package com.odin.call_signaling_service.exception;

import com.odin.call_signaling_service.enums.MediaKind;

/**
 * Raised when a capture device is unavailable or access is denied.
 */
public class MediaAcquisitionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final MediaKind kind;

	public MediaAcquisitionException(MediaKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public MediaAcquisitionException(MediaKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public MediaKind getKind() {
		return kind;
	}
}
