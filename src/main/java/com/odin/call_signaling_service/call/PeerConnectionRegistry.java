package com.odin.call_signaling_service.call;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.media.LocalMediaHandle;
import com.odin.call_signaling_service.media.MediaEngine;
import com.odin.call_signaling_service.media.MediaTrack;

import lombok.extern.slf4j.Slf4j;

/**
 * The peer connections of one call session, keyed by remote user id.
 * Connections are only created for roster members other than the local user.
 * Accessed from the device event loop only.
 */
@Slf4j
public class PeerConnectionRegistry {

	private final String localUserId;
	private final Set<String> roster;
	private final MediaEngine mediaEngine;
	private final Executor eventLoop;
	private final PeerConnectionListener listener;

	private final Map<String, PeerConnection> connections = new LinkedHashMap<>();
	private LocalMediaHandle localMedia;
	private boolean closed;

	public PeerConnectionRegistry(String localUserId, Collection<String> roster, MediaEngine mediaEngine,
			Executor eventLoop, PeerConnectionListener listener) {
		this.localUserId = localUserId;
		this.roster = Collections.unmodifiableSet(new LinkedHashSet<>(roster));
		this.mediaEngine = mediaEngine;
		this.eventLoop = eventLoop;
		this.listener = listener;
	}

	/**
	 * The lexicographically smaller user id is the polite side of a pair.
	 */
	public static boolean isPolite(String localUserId, String remoteUserId) {
		return localUserId.compareTo(remoteUserId) < 0;
	}

	public Optional<PeerConnection> get(String userId) {
		return Optional.ofNullable(connections.get(userId));
	}

	/**
	 * Returns the connection to {@code userId}, creating it on first use.
	 * Empty for the local user, for ids outside the roster and after
	 * {@link #closeAll()}.
	 */
	public Optional<PeerConnection> getOrCreate(String userId) {
		PeerConnection existing = connections.get(userId);
		if (existing != null) {
			return Optional.of(existing);
		}
		if (closed) {
			log.debug("Registry closed, not creating connection to {}", userId);
			return Optional.empty();
		}
		if (userId == null || userId.equals(localUserId) || !roster.contains(userId)) {
			log.warn("Refusing peer connection to {}: not a remote roster member", userId);
			return Optional.empty();
		}
		PeerConnection connection = new PeerConnection(localUserId, userId, isPolite(localUserId, userId),
				mediaEngine, eventLoop, listener);
		connections.put(userId, connection);
		log.info("Created peer connection {} → {} (polite={})", localUserId, userId, connection.isPolite());
		if (localMedia != null) {
			attachLocalMedia(connection, localMedia);
		}
		return Optional.of(connection);
	}

	/**
	 * Attaches every track of {@code handle} to {@code connection}; tracks
	 * already attached are skipped.
	 *
	 * @return number of tracks newly attached
	 */
	public int attachLocalMedia(PeerConnection connection, LocalMediaHandle handle) {
		int attached = 0;
		for (MediaTrack track : handle.getTracks()) {
			if (connection.attachTrack(track)) {
				attached++;
			}
		}
		if (attached > 0) {
			log.debug("Attached {} local track(s) to connection with {}", attached, connection.getRemoteUserId());
		}
		return attached;
	}

	/**
	 * Uses {@code handle} for every current and future connection.
	 */
	public void useLocalMedia(LocalMediaHandle handle) {
		this.localMedia = handle;
		for (PeerConnection connection : connections.values()) {
			attachLocalMedia(connection, handle);
		}
	}

	public void onRemoteMediaAttached(PeerConnection connection, Consumer<MediaTrack> callback) {
		connection.addRemoteMediaCallback(callback);
	}

	/**
	 * Closes every connection. Runs once; later calls are ignored.
	 */
	public void closeAll() {
		if (closed) {
			log.warn("closeAll() called twice for session of {}", localUserId);
			return;
		}
		closed = true;
		for (PeerConnection connection : new ArrayList<>(connections.values())) {
			try {
				connection.close();
			} catch (Exception e) {
				log.error("Failed to close connection to {}: {}", connection.getRemoteUserId(), e.getMessage(), e);
			}
		}
		log.info("Closed {} peer connection(s) of {}", connections.size(), localUserId);
	}

	public boolean isClosed() {
		return closed;
	}

	public Collection<PeerConnection> all() {
		return Collections.unmodifiableCollection(connections.values());
	}

	public Set<String> getRoster() {
		return roster;
	}

	public boolean allClosed() {
		return connections.values().stream().allMatch(c -> c.getState().isTerminal());
	}

	/**
	 * Remote participants that neither negotiated nor left, i.e. invitees
	 * that may still be ringing.
	 */
	public List<String> unanswered() {
		return connections.values().stream()
				.filter(c -> c.getState().getRank() < PeerConnectionState.NEGOTIATING.getRank())
				.map(PeerConnection::getRemoteUserId)
				.collect(Collectors.toList());
	}
}
