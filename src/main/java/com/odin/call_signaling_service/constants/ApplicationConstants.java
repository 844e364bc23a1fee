package com.odin.call_signaling_service.constants;

public class ApplicationConstants {

	// Channels
	public static final String INVITES_CHANNEL = "call-invites";
	public static final String CALL_CHANNEL_PREFIX = "call-";
	public static final String REDIS_CHANNEL_PREFIX = "signaling:";

	// Signaling event tags
	public static final String EVENT_INCOMING_CALL = "incoming-call";
	public static final String EVENT_CALL_CANCELLED = "call-cancelled";
	public static final String EVENT_CALL_DECLINED = "call-declined";
	public static final String EVENT_OFFER = "offer";
	public static final String EVENT_ANSWER = "answer";
	public static final String EVENT_ICE_CANDIDATE = "ice-candidate";
	public static final String EVENT_PARTICIPANT_JOINED = "participant-joined";
	public static final String EVENT_CALL_ENDED = "call-ended";

	// Invitations
	public static final long DEFAULT_RING_TIMEOUT_MS = 60_000L;

	// Push notification
	public static final long CALL_NOTIFICATION_ID = 3001L;
	public static final String PUSH_TITLE_VIDEO = "Incoming video call";
	public static final String PUSH_TITLE_VOICE = "Incoming voice call";
	public static final String PUSH_BODY = "Tap to answer";
	public static final String PUSH_TAG_PREFIX = "chat-";
	public static final String NOTIFICATION_MAP_TITLE = "title";
	public static final String NOTIFICATION_MAP_BODY = "body";
	public static final String NOTIFICATION_MAP_TAG = "tag";

	// Profile lookup
	public static final String CUSTOMER = "/customer";
	public static final String DETAILS = "/details";
	public static final String PROFILE_CACHE = "profileCache";

	// Logging
	public static final String MDC_CALL_ID = "X-Call-ID";
	public static final String MDC_USER_ID = "X-User-ID";

}
