package my.policypayout.app.service;

import my.policypayout.app.dto.PayoutBatchResultDto;
import my.policypayout.app.dto.PayoutExtractionResultDto;
import my.policypayout.app.dto.PayoutSummaryDto;
import my.policypayout.app.extraction.NoopPolicyExtractionClient;
import my.policypayout.app.extraction.PolicyExtractionClient;
import my.policypayout.app.extraction.PolicyExtractionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PolicyExtractionServiceTest {
	@Mock
	private PolicyExtractionClient extractionClient;

	@Mock
	private PayoutBatchService batchService;

	private final MockMultipartFile image = new MockMultipartFile("file", "grid.jpg", "image/jpeg", new byte[]{1});

	@Test
	void passesExtractedRecordsToBatch() {
		String extracted = "[{\"segment\": \"Taxi\", \"payin\": \"25%\"}]";
		PayoutSummaryDto metrics = new PayoutSummaryDto(1, 25.0, 1, "Acme", Map.of("-3%", 1));
		when(extractionClient.extract(any(), eq("grid.jpg"), eq("image/jpeg"))).thenReturn(extracted);
		when(batchService.process(List.of(Map.of("segment", "Taxi", "payin", "25%")), "Acme"))
				.thenReturn(new PayoutBatchResultDto("default", List.of(), metrics));

		PayoutExtractionResultDto result = new PolicyExtractionService(extractionClient, batchService)
				.extractAndCalculate(image, "Acme");

		assertThat(result.tableName()).isEqualTo("default");
		assertThat(result.extractedText()).isEqualTo(extracted);
		assertThat(result.parsedData()).containsExactly(Map.of("segment", "Taxi", "payin", "25%"));
		assertThat(result.metrics()).isSameAs(metrics);
	}

	@Test
	void emptyFileIsRejectedBeforeExtraction() {
		MockMultipartFile empty = new MockMultipartFile("file", "grid.jpg", "image/jpeg", new byte[0]);

		assertThatThrownBy(() -> new PolicyExtractionService(extractionClient, batchService)
				.extractAndCalculate(empty, "Acme"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Empty file");
		verifyNoInteractions(extractionClient, batchService);
	}

	@Test
	void nothingExtractedIsEmptyBatch() {
		when(extractionClient.extract(any(), anyString(), anyString())).thenReturn("[]");

		assertThatThrownBy(() -> new PolicyExtractionService(extractionClient, batchService)
				.extractAndCalculate(image, "Acme"))
				.isInstanceOf(EmptyBatchException.class)
				.hasMessage("No text extracted from image");
		verify(extractionClient).extract(any(), anyString(), anyString());
		verifyNoInteractions(batchService);
	}

	@Test
	void disabledExtractionIsNotRetryable() {
		PolicyExtractionService service = new PolicyExtractionService(new NoopPolicyExtractionClient(), batchService);

		assertThatThrownBy(() -> service.extractAndCalculate(image, "Acme"))
				.isInstanceOfSatisfying(PolicyExtractionException.class, ex -> assertThat(ex.isRetryable()).isFalse());
	}
}
