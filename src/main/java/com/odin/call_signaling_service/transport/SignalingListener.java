package com.odin.call_signaling_service.transport;

import com.odin.call_signaling_service.dto.SignalingMessage;

@FunctionalInterface
public interface SignalingListener {

	/**
	 * Called on a transport thread.
	 */
	void onMessage(String channelName, SignalingMessage message);
}
