package com.odin.call_signaling_service.media;

import com.odin.call_signaling_service.dto.IceCandidatePayload;

/**
 * Callbacks from the media engine. They may arrive on any thread.
 */
public interface RtcPeerConnectionObserver {

	void onLocalCandidate(IceCandidatePayload candidate);

	void onTransportConnected();

	void onTransportFailed(Throwable cause);

	void onRemoteTrack(MediaTrack track);
}
