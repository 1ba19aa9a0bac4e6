package my.policypayout.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"segment", "policy type", "location", "payin", "remark", "lob", "resolved segment",
		"payin category", "Calculated Payout", "Formula Used", "Rule Explanation"})
public record PayoutRowDto(@JsonProperty("segment") String segment,
						   @JsonProperty("policy type") String policyType,
						   @JsonProperty("location") String location,
						   @JsonProperty("payin") String payin,
						   @JsonProperty("remark") String remark,
						   @JsonProperty("lob") String lob,
						   @JsonProperty("resolved segment") String resolvedSegment,
						   @JsonProperty("payin category") String payinCategory,
						   @JsonProperty("Calculated Payout") String calculatedPayout,
						   @JsonProperty("Formula Used") String formulaUsed,
						   @JsonProperty("Rule Explanation") String ruleExplanation) {
}
