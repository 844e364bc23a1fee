package com.odin.call_signaling_service.utility;

import java.util.List;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.ResponseDTO;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class Utility {

	private final ObjectMapper objectMapper;

	private final RestTemplate restTemplate;

	/**
	 * Converts a loosely typed response payload; a list yields its first element.
	 */
	public <D, E> E getAnInstance(D dto, Class<E> entityClass) {
		try {
			if (dto instanceof List<?>) {
				List<?> dtoList = (List<?>) dto;
				return dtoList.isEmpty() ? null : objectMapper.convertValue(dtoList.get(0), entityClass);
			}
			return dto == null ? null : objectMapper.convertValue(dto, entityClass);
		} catch (Exception e) {
			log.error("Error occured while converting to class {} : {}", entityClass.getSimpleName(),
					ExceptionUtils.getStackTrace(e));
			return null;
		}
	}

	public <T> ResponseDTO makeRestCall(String url, T requestBody, HttpMethod httpMethod) {
		try {
			HttpHeaders headers = new HttpHeaders();
			headers.setContentType(MediaType.APPLICATION_JSON);

			// Propagate the call and user being served, if any
			String callId = MDC.get(ApplicationConstants.MDC_CALL_ID);
			if (callId != null) {
				headers.set(ApplicationConstants.MDC_CALL_ID, callId);
			}
			String userId = MDC.get(ApplicationConstants.MDC_USER_ID);
			if (userId != null) {
				headers.set(ApplicationConstants.MDC_USER_ID, userId);
			}
			HttpEntity<T> entity = new HttpEntity<>(requestBody, headers);

			ResponseEntity<ResponseDTO> response = restTemplate.exchange(url, httpMethod, entity, ResponseDTO.class);

			if (response.getStatusCode().is2xxSuccessful()) {
				return response.getBody();
			} else {
				throw new RuntimeException("Failed with HTTP error code : " + response.getStatusCode());
			}
		} catch (Exception e) {
			throw new RuntimeException("Error while making REST call", e);
		}
	}
}
