package my.policypayout.app.api;

import jakarta.validation.Valid;
import my.policypayout.app.dto.PayoutBatchResultDto;
import my.policypayout.app.dto.PayoutCalculationRequest;
import my.policypayout.app.dto.PayoutExtractionResultDto;
import my.policypayout.app.export.PayoutCsvWriter;
import my.policypayout.app.service.PayoutBatchService;
import my.policypayout.app.service.PolicyExtractionService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/payouts")
public class PayoutController {
	private final PayoutBatchService batchService;
	private final PolicyExtractionService extractionService;
	private final PayoutCsvWriter csvWriter;

	public PayoutController(PayoutBatchService batchService, PolicyExtractionService extractionService) {
		this.batchService = batchService;
		this.extractionService = extractionService;
		this.csvWriter = new PayoutCsvWriter();
	}

	@PostMapping("/calculate")
	public PayoutBatchResultDto calculate(@Valid @RequestBody PayoutCalculationRequest request) {
		return batchService.process(request.records(), request.companyName());
	}

	@PostMapping(path = "/calculate.csv", produces = "text/csv")
	public ResponseEntity<String> calculateCsv(@Valid @RequestBody PayoutCalculationRequest request) {
		PayoutBatchResultDto result = batchService.process(request.records(), request.companyName());
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"payouts.csv\"")
				.contentType(MediaType.parseMediaType("text/csv"))
				.body(csvWriter.write(result.calculatedData()));
	}

	@PostMapping(path = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public PayoutExtractionResultDto extract(@RequestParam("companyName") String companyName,
											 @RequestParam("file") MultipartFile file) {
		return extractionService.extractAndCalculate(file, companyName);
	}
}
