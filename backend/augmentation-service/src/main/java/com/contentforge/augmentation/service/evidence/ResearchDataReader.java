package com.contentforge.augmentation.service.evidence;

import com.contentforge.augmentation.dto.ResearchData;
import com.contentforge.augmentation.exception.AugmentationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the research bundle stored by the upstream research stage as JSON.
 */
@Component
@Slf4j
public class ResearchDataReader {

    private final ObjectMapper objectMapper;

    public ResearchDataReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    /**
     * @param json research bundle; blank input reads as an empty bundle
     * @throws AugmentationException with {@link AugmentationException#INVALID_RESEARCH_DATA} on unreadable JSON
     */
    public ResearchData read(String json) {
        if (json == null || json.isBlank()) {
            return ResearchData.empty();
        }
        try {
            ResearchData data = objectMapper.readValue(json, ResearchData.class);
            return data != null ? data : ResearchData.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable research data: {}", e.getOriginalMessage());
            throw new AugmentationException(AugmentationException.INVALID_RESEARCH_DATA,
                    "Research data is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
