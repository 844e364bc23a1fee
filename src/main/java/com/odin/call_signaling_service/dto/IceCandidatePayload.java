package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IceCandidatePayload {
    private String candidate;
    private String sdpMid;
    private Integer sdpMLineIndex;
}
