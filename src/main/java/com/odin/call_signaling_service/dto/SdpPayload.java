package com.odin.call_signaling_service.dto;

import com.odin.call_signaling_service.enums.SdpType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SdpPayload {

    private SdpType type;
    private String sdp;

    public static SdpPayload offer(String sdp) {
        return new SdpPayload(SdpType.OFFER, sdp);
    }

    public static SdpPayload answer(String sdp) {
        return new SdpPayload(SdpType.ANSWER, sdp);
    }
}
