package com.odin.call_signaling_service.transport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.dto.SignalingMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process signaling channels for single-node runs. Messages go through the
 * JSON codec so subscribers never share instances with the publisher.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "signaling.transport.type", havingValue = "local")
public class LocalSignalingTransport implements SignalingTransport {

	private final Map<String, List<LocalSubscription>> channels = new ConcurrentHashMap<>();
	private final SignalingCodec codec;

	public LocalSignalingTransport(SignalingCodec codec) {
		this.codec = codec;
	}

	@Override
	public void publish(String channelName, SignalingMessage message) {
		String payload = codec.encode(message);
		List<LocalSubscription> subscribers = channels.get(channelName);
		if (subscribers == null || subscribers.isEmpty()) {
			log.debug("No subscriber on {} for {} message", channelName, message.getEvent());
			return;
		}
		for (LocalSubscription subscription : subscribers) {
			codec.decode(payload).ifPresent(decoded -> subscription.deliver(decoded));
		}
	}

	@Override
	public ChannelSubscription subscribe(String channelName, SignalingListener listener) {
		LocalSubscription subscription = new LocalSubscription(channelName, listener);
		channels.computeIfAbsent(channelName, k -> new CopyOnWriteArrayList<>()).add(subscription);
		log.info("Subscribed to local signaling channel {}", channelName);
		return subscription;
	}

	public int subscriberCount(String channelName) {
		List<LocalSubscription> subscribers = channels.get(channelName);
		return subscribers == null ? 0 : subscribers.size();
	}

	private class LocalSubscription implements ChannelSubscription {

		private final String channelName;
		private final SignalingListener listener;
		private final AtomicBoolean active = new AtomicBoolean(true);

		LocalSubscription(String channelName, SignalingListener listener) {
			this.channelName = channelName;
			this.listener = listener;
		}

		void deliver(SignalingMessage message) {
			if (!active.get()) {
				return;
			}
			try {
				listener.onMessage(channelName, message);
			} catch (Exception e) {
				log.error("Listener on {} failed for {} message: {}", channelName, message.getEvent(),
						e.getMessage(), e);
			}
		}

		@Override
		public String getChannelName() {
			return channelName;
		}

		@Override
		public boolean isActive() {
			return active.get();
		}

		@Override
		public void unsubscribe() {
			if (!active.compareAndSet(true, false)) {
				return;
			}
			List<LocalSubscription> subscribers = channels.get(channelName);
			if (subscribers != null) {
				subscribers.remove(this);
			}
			log.info("Unsubscribed from local signaling channel {}", channelName);
		}
	}
}
