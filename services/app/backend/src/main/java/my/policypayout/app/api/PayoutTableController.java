package my.policypayout.app.api;

import jakarta.validation.Valid;
import my.policypayout.app.dto.PayoutTableDto;
import my.policypayout.app.dto.PayoutTableValidateRequest;
import my.policypayout.app.dto.PayoutTableValidateResponse;
import my.policypayout.app.service.PayoutTableService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/payout-table")
public class PayoutTableController {
	private final PayoutTableService tableService;

	public PayoutTableController(PayoutTableService tableService) {
		this.tableService = tableService;
	}

	@GetMapping
	public PayoutTableDto active() {
		return tableService.describeActive();
	}

	@PostMapping("/reload")
	public PayoutTableDto reload() {
		return tableService.reload();
	}

	@PostMapping("/validate")
	public PayoutTableValidateResponse validate(@Valid @RequestBody PayoutTableValidateRequest request) {
		return tableService.validate(request.contentJson());
	}
}
