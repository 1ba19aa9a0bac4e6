package my.policypayout.app.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record PayoutTableValidateRequest(@NotBlank @JsonAlias("contentYaml") String contentJson) {
}
