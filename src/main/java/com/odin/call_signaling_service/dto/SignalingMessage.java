package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.odin.call_signaling_service.constants.ApplicationConstants;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Closed family of messages exchanged over the signaling channels. The
 * {@code event} property carries the variant on the wire; receivers dispatch
 * with {@link #accept(SignalingMessageVisitor)} instead of inspecting fields.
 * <p>
 * {@code to} is null for messages meant for every subscriber of a call
 * channel ({@link CallEndedMessage}, {@link ParticipantJoinedMessage}).
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
		@JsonSubTypes.Type(value = InviteMessage.class, name = ApplicationConstants.EVENT_INCOMING_CALL),
		@JsonSubTypes.Type(value = CallCancelledMessage.class, name = ApplicationConstants.EVENT_CALL_CANCELLED),
		@JsonSubTypes.Type(value = CallDeclinedMessage.class, name = ApplicationConstants.EVENT_CALL_DECLINED),
		@JsonSubTypes.Type(value = OfferMessage.class, name = ApplicationConstants.EVENT_OFFER),
		@JsonSubTypes.Type(value = AnswerMessage.class, name = ApplicationConstants.EVENT_ANSWER),
		@JsonSubTypes.Type(value = IceCandidateMessage.class, name = ApplicationConstants.EVENT_ICE_CANDIDATE),
		@JsonSubTypes.Type(value = ParticipantJoinedMessage.class, name = ApplicationConstants.EVENT_PARTICIPANT_JOINED),
		@JsonSubTypes.Type(value = CallEndedMessage.class, name = ApplicationConstants.EVENT_CALL_ENDED) })
public abstract class SignalingMessage {

	private String from;
	private String to;

	SignalingMessage() {
	}

	SignalingMessage(String from, String to) {
		this.from = from;
		this.to = to;
	}

	public abstract <R> R accept(SignalingMessageVisitor<R> visitor);

	@JsonIgnore
	public abstract String getEvent();

	/**
	 * A message without recipient is for everyone on the channel.
	 */
	@JsonIgnore
	public boolean isAddressedTo(String userId) {
		return to == null || to.equals(userId);
	}
}
