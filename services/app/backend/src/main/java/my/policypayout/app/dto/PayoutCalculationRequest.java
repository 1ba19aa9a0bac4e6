package my.policypayout.app.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public record PayoutCalculationRequest(@NotBlank @JsonAlias("company_name") String companyName,
									   @NotNull @JsonAlias("policy_data") List<Map<String, Object>> records) {
}
