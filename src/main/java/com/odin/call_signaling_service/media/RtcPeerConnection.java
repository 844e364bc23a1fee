package com.odin.call_signaling_service.media;

import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;

/**
 * Media-engine side of the connection to one remote participant. All
 * asynchronous operations may complete on any thread.
 */
public interface RtcPeerConnection {

	void addTrack(MediaTrack track);

	CompletableFuture<SdpPayload> createOffer();

	CompletableFuture<SdpPayload> createAnswer();

	CompletableFuture<Void> setLocalDescription(SdpPayload description);

	CompletableFuture<Void> setRemoteDescription(SdpPayload description);

	CompletableFuture<Void> addIceCandidate(IceCandidatePayload candidate);

	void close();
}
