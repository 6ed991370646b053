package com.whatifplatform.common.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.whatifplatform.common.model.RangeValue;

/**
 * ROI projection from the attribution system. {@code confidence} is in [0, 100].
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoiAttributionSnapshot(
    @JsonProperty("roi_percent_range") RangeValue roiPercentRange,
    @JsonProperty("confidence")        double confidence
) {}
