package com.odin.call_signaling_service.media;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.odin.call_signaling_service.enums.MediaKind;

import lombok.extern.slf4j.Slf4j;

/**
 * Local capture tracks owned by one call session. Peer connections hold the
 * tracks for sending only; stopping them is the session's job.
 */
@Slf4j
public class LocalMediaHandle {

	private final List<MediaTrack> tracks;

	public LocalMediaHandle(List<MediaTrack> tracks) {
		this.tracks = Collections.unmodifiableList(new ArrayList<>(tracks));
	}

	public List<MediaTrack> getTracks() {
		return tracks;
	}

	public Optional<MediaTrack> firstTrack(MediaKind kind) {
		return tracks.stream().filter(t -> t.getKind() == kind).findFirst();
	}

	/**
	 * Flips the first track of the given kind.
	 *
	 * @return the new enabled flag, or empty when there is no such track
	 */
	public Optional<Boolean> toggle(MediaKind kind) {
		return firstTrack(kind).map(track -> {
			track.setEnabled(!track.isEnabled());
			return track.isEnabled();
		});
	}

	public boolean isEnabled(MediaKind kind) {
		return firstTrack(kind).map(MediaTrack::isEnabled).orElse(false);
	}

	/**
	 * Stops every track. A failing track does not prevent the others from
	 * being stopped.
	 */
	public void stopAll() {
		for (MediaTrack track : tracks) {
			try {
				if (!track.isStopped()) {
					track.stop();
				}
			} catch (Exception e) {
				log.error("Failed to stop {} track {}: {}", track.getKind(), track.getId(), e.getMessage(), e);
			}
		}
	}
}
