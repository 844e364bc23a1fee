package com.odin.call_signaling_service.service;

import org.apache.commons.lang.StringUtils;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.Profile;
import com.odin.call_signaling_service.repo.ProfileRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Display names of callers. A failed lookup shows the user id and is not
 * cached, so the next call retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallerProfileService {

	private final ProfileRepository profileRepository;

	@Cacheable(value = ApplicationConstants.PROFILE_CACHE, key = "#userId", unless = "#result == #userId")
	public String getDisplayName(String userId) {
		try {
			Profile profile = profileRepository.findByCustomerId(userId);
			if (profile != null && StringUtils.isNotBlank(profile.getDisplayName())) {
				return profile.getDisplayName();
			}
			log.debug("No profile name for userId={}", userId);
		} catch (Exception e) {
			log.error("Profile lookup failed for userId={}: {}", userId, e.getMessage(), e);
		}
		return userId;
	}
}
