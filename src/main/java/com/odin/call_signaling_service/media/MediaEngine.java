package com.odin.call_signaling_service.media;

import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.enums.CallType;

/**
 * Real-time media capability used by the call layer. Implementations own the
 * capture devices and the media transport; the call layer only drives them.
 */
public interface MediaEngine {

	/**
	 * Acquires the microphone, and the camera when {@code callType} is video.
	 * If any device fails, devices already acquired are released before the
	 * returned future completes exceptionally with a
	 * {@link com.odin.call_signaling_service.exception.MediaAcquisitionException}.
	 */
	CompletableFuture<LocalMediaHandle> acquireLocalMedia(CallType callType);

	RtcPeerConnection createPeerConnection(String remoteUserId, RtcPeerConnectionObserver observer);
}
