package com.odin.call_signaling_service.service;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.call.CallEventListener;
import com.odin.call_signaling_service.media.MediaEngine;
import com.odin.call_signaling_service.transport.SignalingTransport;

import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Call agents of the users connected to this pod. Each agent is a
 * {@link CallSessionManager} driven by its own single-threaded event loop.
 */
@Slf4j
@Service
public class CallAgentRegistry {

	private final MediaEngine mediaEngine;
	private final SignalingTransport transport;
	private final InvitationDispatcher invitationDispatcher;
	private final InvitesChannel invitesChannel;
	private final long ringTimeoutMs;

	// userId -> agent
	private final Map<String, Agent> agents = new ConcurrentHashMap<>();

	public CallAgentRegistry(MediaEngine mediaEngine, SignalingTransport transport,
			InvitationDispatcher invitationDispatcher, InvitesChannel invitesChannel,
			@Value("${call.invite.ring-timeout-ms:60000}") long ringTimeoutMs) {
		this.mediaEngine = mediaEngine;
		this.transport = transport;
		this.invitationDispatcher = invitationDispatcher;
		this.invitesChannel = invitesChannel;
		this.ringTimeoutMs = ringTimeoutMs;
	}

	/**
	 * Creates the agent for {@code userId}, replacing (and shutting down) an
	 * agent left over from an earlier connection.
	 */
	public CallSessionManager connect(String userId, CallEventListener listener) {
		ExecutorService eventLoop = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "call-loop-" + userId);
			thread.setDaemon(true);
			return thread;
		});
		CallSessionManager manager = new CallSessionManager(userId, mediaEngine, transport, invitationDispatcher,
				eventLoop, listener, ringTimeoutMs);
		Agent previous = agents.put(userId, new Agent(manager, eventLoop));
		if (previous != null) {
			log.info("Replacing call agent of {}", userId);
			previous.stop();
		}
		invitesChannel.register(userId, manager);
		log.info("Call agent ready for {} ({} connected)", userId, agents.size());
		return manager;
	}

	public void disconnect(String userId) {
		if (userId == null) {
			return;
		}
		Agent agent = agents.remove(userId);
		if (agent == null) {
			return;
		}
		invitesChannel.unregister(userId);
		agent.stop();
		log.info("Call agent of {} stopped ({} connected)", userId, agents.size());
	}

	public Optional<CallSessionManager> getAgent(String userId) {
		return Optional.ofNullable(agents.get(userId)).map(Agent::getManager);
	}

	public int size() {
		return agents.size();
	}

	@PreDestroy
	public void shutdownAll() {
		for (String userId : new ArrayList<>(agents.keySet())) {
			disconnect(userId);
		}
	}

	@Getter
	@RequiredArgsConstructor
	private static final class Agent {

		private final CallSessionManager manager;
		private final ExecutorService eventLoop;

		// queued shutdown runs after everything already on the loop
		void stop() {
			manager.shutdown();
			eventLoop.shutdown();
		}
	}
}
