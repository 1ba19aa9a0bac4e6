package my.policypayout.app.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Payout payout,
		Extraction extraction
) {
	public record Payout(
			@NotBlank String tableLocation,
			@Min(1) Integer workerThreads,
			@Min(1) Integer parallelThreshold
	) {
	}

	public record Extraction(
			String provider
	) {
	}
}
