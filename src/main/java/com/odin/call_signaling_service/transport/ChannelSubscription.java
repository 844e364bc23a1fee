package com.odin.call_signaling_service.transport;

public interface ChannelSubscription {

	String getChannelName();

	boolean isActive();

	/**
	 * Stops delivery. Idempotent.
	 */
	void unsubscribe();
}
