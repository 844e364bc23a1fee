package com.odin.call_signaling_service.media;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.config.MediaEngineProperties;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.MediaKind;
import com.odin.call_signaling_service.exception.MediaAcquisitionException;
import com.odin.call_signaling_service.exception.NegotiationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Media engine without real devices or sockets. Descriptions and candidates
 * are synthetic; a connection reports itself connected once both its local
 * and remote descriptions are applied. Used for headless runs and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "media.engine.type", havingValue = "simulated", matchIfMissing = true)
public class SimulatedMediaEngine implements MediaEngine {

	private final MediaEngineProperties properties;

	public SimulatedMediaEngine(MediaEngineProperties properties) {
		this.properties = properties;
	}

	@Override
	public CompletableFuture<LocalMediaHandle> acquireLocalMedia(CallType callType) {
		List<MediaTrack> acquired = new ArrayList<>();
		if (properties.isFailAudio()) {
			return CompletableFuture.failedFuture(
					new MediaAcquisitionException(MediaKind.AUDIO, "Microphone unavailable"));
		}
		acquired.add(new SimulatedTrack(MediaKind.AUDIO));

		if (callType.hasVideo()) {
			if (properties.isFailVideo()) {
				acquired.forEach(MediaTrack::stop);
				log.warn("Camera refused, released {} partially acquired track(s)", acquired.size());
				return CompletableFuture.failedFuture(
						new MediaAcquisitionException(MediaKind.VIDEO, "Camera unavailable"));
			}
			acquired.add(new SimulatedTrack(MediaKind.VIDEO));
		}
		log.info("Acquired simulated local media for {} call: {} track(s)", callType, acquired.size());
		return CompletableFuture.completedFuture(new LocalMediaHandle(acquired));
	}

	@Override
	public RtcPeerConnection createPeerConnection(String remoteUserId, RtcPeerConnectionObserver observer) {
		log.debug("Creating simulated peer connection to {} (stun={})", remoteUserId, properties.getStunServers());
		return new SimulatedPeerConnection(remoteUserId, observer);
	}

	static class SimulatedTrack implements MediaTrack {

		private final String id = UUID.randomUUID().toString();
		private final MediaKind kind;
		private volatile boolean enabled = true;
		private volatile boolean stopped;

		SimulatedTrack(MediaKind kind) {
			this.kind = kind;
		}

		@Override
		public String getId() {
			return id;
		}

		@Override
		public MediaKind getKind() {
			return kind;
		}

		@Override
		public boolean isEnabled() {
			return enabled;
		}

		@Override
		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		@Override
		public boolean isStopped() {
			return stopped;
		}

		@Override
		public void stop() {
			stopped = true;
			enabled = false;
		}
	}

	static class SimulatedPeerConnection implements RtcPeerConnection {

		private final String remoteUserId;
		private final RtcPeerConnectionObserver observer;
		private final List<MediaTrack> localTracks = new ArrayList<>();
		private SdpPayload localDescription;
		private SdpPayload remoteDescription;
		private boolean connected;
		private boolean closed;

		SimulatedPeerConnection(String remoteUserId, RtcPeerConnectionObserver observer) {
			this.remoteUserId = remoteUserId;
			this.observer = observer;
		}

		@Override
		public synchronized void addTrack(MediaTrack track) {
			localTracks.add(track);
		}

		@Override
		public CompletableFuture<SdpPayload> createOffer() {
			return ifOpen(() -> SdpPayload.offer(describe()));
		}

		@Override
		public CompletableFuture<SdpPayload> createAnswer() {
			synchronized (this) {
				if (remoteDescription == null) {
					return CompletableFuture.failedFuture(
							new NegotiationException("Cannot answer without a remote offer"));
				}
			}
			return ifOpen(() -> SdpPayload.answer(describe()));
		}

		@Override
		public CompletableFuture<Void> setLocalDescription(SdpPayload description) {
			synchronized (this) {
				if (closed) {
					return closedFuture();
				}
				localDescription = description;
			}
			observer.onLocalCandidate(new IceCandidatePayload(
					"candidate:1 1 udp 2122260223 127.0.0.1 "
							+ ThreadLocalRandom.current().nextInt(20000, 60000) + " typ host",
					"0", 0));
			maybeConnect();
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public CompletableFuture<Void> setRemoteDescription(SdpPayload description) {
			synchronized (this) {
				if (closed) {
					return closedFuture();
				}
				if (description == null || description.getSdp() == null || description.getSdp().isEmpty()) {
					return CompletableFuture.failedFuture(new NegotiationException("Empty remote description"));
				}
				remoteDescription = description;
			}
			maybeConnect();
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public CompletableFuture<Void> addIceCandidate(IceCandidatePayload candidate) {
			synchronized (this) {
				if (closed) {
					return closedFuture();
				}
				if (remoteDescription == null) {
					return CompletableFuture.failedFuture(
							new NegotiationException("Candidate received before remote description"));
				}
			}
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public synchronized void close() {
			closed = true;
		}

		private void maybeConnect() {
			synchronized (this) {
				if (connected || closed || localDescription == null || remoteDescription == null) {
					return;
				}
				connected = true;
			}
			log.debug("Simulated transport to {} connected", remoteUserId);
			observer.onRemoteTrack(new SimulatedTrack(MediaKind.AUDIO));
			observer.onTransportConnected();
		}

		private synchronized String describe() {
			StringBuilder sdp = new StringBuilder()
					.append("v=0\r\n")
					.append("o=- ").append(ThreadLocalRandom.current().nextLong(1L, Long.MAX_VALUE))
					.append(" 2 IN IP4 127.0.0.1\r\n")
					.append("s=-\r\nt=0 0\r\n");
			for (MediaTrack track : localTracks) {
				sdp.append(track.getKind() == MediaKind.VIDEO
						? "m=video 9 UDP/TLS/RTP/SAVPF 96\r\n"
						: "m=audio 9 UDP/TLS/RTP/SAVPF 111\r\n");
			}
			return sdp.toString();
		}

		private <T> CompletableFuture<T> ifOpen(Supplier<T> supplier) {
			synchronized (this) {
				if (closed) {
					return closedFuture();
				}
			}
			return CompletableFuture.completedFuture(supplier.get());
		}

		private static <T> CompletableFuture<T> closedFuture() {
			return CompletableFuture.failedFuture(new NegotiationException("Peer connection closed"));
		}
	}
}
