package com.odin.call_signaling_service.dto;

public interface SignalingMessageVisitor<R> {

	R visitInvite(InviteMessage message);

	R visitCallCancelled(CallCancelledMessage message);

	R visitCallDeclined(CallDeclinedMessage message);

	R visitOffer(OfferMessage message);

	R visitAnswer(AnswerMessage message);

	R visitIceCandidate(IceCandidateMessage message);

	R visitParticipantJoined(ParticipantJoinedMessage message);

	R visitCallEnded(CallEndedMessage message);
}
