package my.policypayout.app.api;

import my.policypayout.app.dto.HealthDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

	@GetMapping("/health")
	public HealthDto health() {
		return new HealthDto("healthy");
	}
}
