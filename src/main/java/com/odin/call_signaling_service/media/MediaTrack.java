package com.odin.call_signaling_service.media;

import com.odin.call_signaling_service.enums.MediaKind;

public interface MediaTrack {

	String getId();

	MediaKind getKind();

	boolean isEnabled();

	void setEnabled(boolean enabled);

	boolean isStopped();

	void stop();
}
