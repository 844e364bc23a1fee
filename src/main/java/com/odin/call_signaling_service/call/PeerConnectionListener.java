package com.odin.call_signaling_service.call;

import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.media.MediaTrack;

/**
 * Session-side hooks of a {@link PeerConnection}. Always invoked on the
 * device event loop.
 */
public interface PeerConnectionListener {

	void send(SignalingMessage message);

	void onConnected(PeerConnection connection);

	void onRemoteTrack(PeerConnection connection, MediaTrack track);

	/**
	 * @param failed true when the connection was closed by a negotiation or
	 *               transport failure rather than by request
	 */
	void onClosed(PeerConnection connection, boolean failed);
}
