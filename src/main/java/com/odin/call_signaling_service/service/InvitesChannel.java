package com.odin.call_signaling_service.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.transport.ChannelSubscription;
import com.odin.call_signaling_service.transport.SignalingListener;
import com.odin.call_signaling_service.transport.SignalingTransport;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * The process-wide {@code call-invites} channel. Subscribed on first use and
 * kept for the lifetime of the process; inbound messages go to the local
 * device whose user id is the message recipient.
 */
@Slf4j
@Service
public class InvitesChannel implements SignalingListener {

	private final SignalingTransport transport;
	private final Map<String, SignalingListener> devices = new ConcurrentHashMap<>();
	private final Object subscribeLock = new Object();
	private volatile ChannelSubscription subscription;

	public InvitesChannel(SignalingTransport transport) {
		this.transport = transport;
	}

	/**
	 * Subscribes to the invites channel unless already subscribed. Safe to call
	 * from any thread; only the first call subscribes.
	 */
	public void ensureSubscribed() {
		if (subscription != null) {
			return;
		}
		synchronized (subscribeLock) {
			if (subscription == null) {
				subscription = transport.subscribe(ApplicationConstants.INVITES_CHANNEL, this);
				log.info("Invites channel {} established", ApplicationConstants.INVITES_CHANNEL);
			}
		}
	}

	public void register(String userId, SignalingListener device) {
		ensureSubscribed();
		devices.put(userId, device);
		log.debug("Device {} listening for invitations", userId);
	}

	public void unregister(String userId) {
		devices.remove(userId);
	}

	public void publish(SignalingMessage message) {
		ensureSubscribed();
		transport.publish(ApplicationConstants.INVITES_CHANNEL, message);
	}

	@Override
	public void onMessage(String channelName, SignalingMessage message) {
		String to = message.getTo();
		if (to == null) {
			log.warn("Dropping {} without recipient on {}", message.getEvent(), channelName);
			return;
		}
		SignalingListener device = devices.get(to);
		if (device == null) {
			log.trace("No local device for {} ({})", to, message.getEvent());
			return;
		}
		device.onMessage(channelName, message);
	}

	@PreDestroy
	public void close() {
		ChannelSubscription current = subscription;
		if (current != null) {
			current.unsubscribe();
		}
		devices.clear();
	}
}
