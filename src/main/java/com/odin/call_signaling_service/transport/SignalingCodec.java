package com.odin.call_signaling_service.transport;

import java.io.IOException;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.exception.SignalingTransportException;

import lombok.extern.slf4j.Slf4j;

/**
 * JSON wire form of signaling messages. The variant travels in the
 * {@code event} property.
 */
@Slf4j
@Component
public class SignalingCodec {

	private final ObjectMapper objectMapper = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	public String encode(SignalingMessage message) {
		try {
			return objectMapper.writeValueAsString(message);
		} catch (JsonProcessingException e) {
			throw new SignalingTransportException("Failed to encode " + message.getEvent() + " message", e);
		}
	}

	/**
	 * Decodes a payload; malformed or unknown payloads are logged and dropped.
	 */
	public Optional<SignalingMessage> decode(byte[] payload) {
		try {
			return Optional.ofNullable(objectMapper.readValue(payload, SignalingMessage.class));
		} catch (IOException e) {
			log.warn("Dropping undecodable signaling payload ({} bytes): {}", payload.length, e.getMessage());
			return Optional.empty();
		}
	}

	public Optional<SignalingMessage> decode(String payload) {
		try {
			return Optional.ofNullable(objectMapper.readValue(payload, SignalingMessage.class));
		} catch (IOException e) {
			log.warn("Dropping undecodable signaling payload: {}", e.getMessage());
			return Optional.empty();
		}
	}
}
