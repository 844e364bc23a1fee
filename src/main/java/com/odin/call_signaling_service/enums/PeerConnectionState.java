package com.odin.call_signaling_service.enums;

/**
 * Negotiation state of one remote participant. The rank orders the states;
 * a connection never moves to a lower rank.
 */
public enum PeerConnectionState {

	NEW(0),
	LOCAL_OFFER_SENT(1),
	REMOTE_OFFER_RECEIVED(1),
	NEGOTIATING(2),
	CONNECTED(3),
	CLOSED(4);

	private final int rank;

	PeerConnectionState(int rank) {
		this.rank = rank;
	}

	public int getRank() {
		return rank;
	}

	public boolean isTerminal() {
		return this == CLOSED;
	}

	/**
	 * Whether a connection in this state may move to {@code target}.
	 * The only lateral edge is the polite side abandoning its own offer.
	 */
	public boolean canTransitionTo(PeerConnectionState target) {
		if (this == CLOSED) {
			return false;
		}
		if (target == CLOSED) {
			return true;
		}
		switch (this) {
		case NEW:
			return target == LOCAL_OFFER_SENT || target == REMOTE_OFFER_RECEIVED;
		case LOCAL_OFFER_SENT:
			return target == NEGOTIATING || target == REMOTE_OFFER_RECEIVED;
		case REMOTE_OFFER_RECEIVED:
			return target == NEGOTIATING;
		case NEGOTIATING:
			return target == CONNECTED;
		default:
			return false;
		}
	}
}
