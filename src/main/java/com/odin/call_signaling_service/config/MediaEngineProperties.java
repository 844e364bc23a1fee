package com.odin.call_signaling_service.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Settings of the media engine backing the call layer.
 */
@Data
@Component
@ConfigurationProperties(prefix = "media.engine")
public class MediaEngineProperties {

    /**
     * Engine implementation. Only {@code simulated} ships with the service;
     * a native engine registers its own {@code MediaEngine} bean.
     */
    private String type = "simulated";

    /**
     * STUN servers handed to the engine when creating peer connections.
     */
    private List<String> stunServers = new ArrayList<>(List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302"));

    /**
     * Simulated engine: refuse the microphone.
     */
    private boolean failAudio = false;

    /**
     * Simulated engine: refuse the camera (after the microphone was granted).
     */
    private boolean failVideo = false;
}
