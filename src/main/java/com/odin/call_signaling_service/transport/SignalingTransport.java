package com.odin.call_signaling_service.transport;

import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.exception.SignalingTransportException;

/**
 * Named broadcast channels carrying {@link SignalingMessage}s.
 * <p>
 * Delivery is best effort: no persistence, no retry, and nothing published
 * before a subscription is registered reaches that subscriber. Ordering is
 * only guaranteed per sender and subscriber, so receivers must tolerate
 * reordering and duplicates across senders.
 */
public interface SignalingTransport {

	/**
	 * Publishes to every current subscriber of {@code channelName}.
	 *
	 * @throws SignalingTransportException when the message could not be handed
	 *                                     to the broker
	 */
	void publish(String channelName, SignalingMessage message);

	/**
	 * Registers {@code listener} on {@code channelName}. Callers must subscribe
	 * before advertising their presence on the channel.
	 */
	ChannelSubscription subscribe(String channelName, SignalingListener listener);
}
