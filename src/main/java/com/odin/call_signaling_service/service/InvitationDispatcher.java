package com.odin.call_signaling_service.service;

import java.util.Collection;

import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallCancelledMessage;
import com.odin.call_signaling_service.dto.CallDeclinedMessage;
import com.odin.call_signaling_service.dto.InviteMessage;
import com.odin.call_signaling_service.dto.SignalingMessage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends invitations, cancellations and declines over the invites channel.
 * One recipient failing never stops delivery to the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvitationDispatcher {

	private final InvitesChannel invitesChannel;
	private final KafkaNotificationService kafkaNotificationService;

	public void sendInvite(Collection<String> recipients, InviteMessage invite) {
		int delivered = 0;
		for (String recipient : recipients) {
			InviteMessage addressed = new InviteMessage(invite.getChatRoomId(), invite.getCallType(), invite.getFrom(),
					recipient, invite.getParticipants(), invite.getTimestamp());
			if (publish(addressed)) {
				delivered++;
			}
		}
		log.info("Invited {}/{} recipient(s) to call {}", delivered, recipients.size(), invite.getChatRoomId());

		// Push reaches invitees that are not listening right now
		try {
			String title = invite.getCallType() != null && invite.getCallType().hasVideo()
					? ApplicationConstants.PUSH_TITLE_VIDEO
					: ApplicationConstants.PUSH_TITLE_VOICE;
			kafkaNotificationService.publishCallNotification(recipients, title, ApplicationConstants.PUSH_BODY,
					ApplicationConstants.PUSH_TAG_PREFIX + invite.getChatRoomId());
		} catch (Exception e) {
			log.error("Push notification for call {} failed: {}", invite.getChatRoomId(), e.getMessage(), e);
		}
	}

	public void sendCancel(Collection<String> recipients, String chatRoomId, String from) {
		for (String recipient : recipients) {
			publish(new CallCancelledMessage(chatRoomId, from, recipient));
		}
		log.info("Cancelled call {} for {}", chatRoomId, recipients);
	}

	public void sendDecline(String inviter, String chatRoomId, String from) {
		if (publish(new CallDeclinedMessage(chatRoomId, from, inviter))) {
			log.info("Declined call {} from {}", chatRoomId, inviter);
		}
	}

	private boolean publish(SignalingMessage message) {
		try {
			invitesChannel.publish(message);
			return true;
		} catch (Exception e) {
			log.error("Failed to send {} to {}: {}", message.getEvent(), message.getTo(), e.getMessage(), e);
			return false;
		}
	}
}
