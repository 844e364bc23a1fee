package com.odin.call_signaling_service.dto;

import org.apache.commons.lang.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * The part of a customer profile shown on an incoming call.
 */
@Data
@Builder
@ToString
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Profile {

	private Integer customerId;

	private String mobile;

	private String firstName;

	private String lastName;

	private Boolean isActive;

	@JsonIgnore
	public String getDisplayName() {
		String name = StringUtils.trimToEmpty(StringUtils.defaultString(firstName) + " "
				+ StringUtils.defaultString(lastName));
		return StringUtils.isNotBlank(name) ? name : mobile;
	}
}
