package my.policypayout.app.service;

import my.policypayout.app.config.AppProperties;
import my.policypayout.app.dto.PayoutBatchResultDto;
import my.policypayout.app.dto.PayoutRowDto;
import my.policypayout.app.dto.PayoutSummaryDto;
import my.policypayout.app.rules.PayoutTables;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PayoutBatchServiceTest {
	@Mock
	private PayoutTableService tableService;

	private PayoutBatchService service;

	@BeforeEach
	void setUp() {
		when(tableService.current()).thenReturn(PayoutTables.defaultTable());
		service = new PayoutBatchService(tableService,
				new AppProperties(new AppProperties.Payout("classpath:payout_table.json", 2, 2), null));
	}

	@AfterEach
	void tearDown() {
		service.shutdown();
	}

	@Test
	void rejectsEmptyBatch() {
		assertThatThrownBy(() -> service.process(List.of(), "Bajaj"))
				.isInstanceOf(EmptyBatchException.class)
				.hasMessage("No policy data found");
	}

	@Test
	void rejectsMissingCompany() {
		assertThatThrownBy(() -> service.process(List.of(Map.of("segment", "TAXI")), " "))
				.isInstanceOf(EmptyBatchException.class);
	}

	@Test
	void summarizesBatch() {
		List<Map<String, Object>> records = List.of(
				Map.of("segment", "TW TP", "payin", "55%"),
				Map.of("segment", "BUS", "payin", 40),
				Map.of("segment", "Staff bus", "payin", "30%"));

		PayoutBatchResultDto result = service.process(records, "Bajaj");

		assertThat(result.tableName()).isEqualTo("default");
		assertThat(result.calculatedData()).hasSize(3);
		PayoutSummaryDto metrics = result.metrics();
		assertThat(metrics.totalRecords()).isEqualTo(3);
		assertThat(metrics.avgPayin()).isEqualTo(41.7);
		assertThat(metrics.uniqueSegments()).isEqualTo(2);
		assertThat(metrics.companyName()).isEqualTo("Bajaj");
		assertThat(metrics.formulaSummary()).containsEntry("-3%", 1).containsEntry("88% of Payin", 2);
	}

	@Test
	void failedRecordsStillCountTowardAveragePayin() {
		PayoutRowDto errorRow = new PayoutRowDto("TAXI", "", "", "40%", "", "UNKNOWN", "", "",
				PayoutResultAssembler.ERROR_PAYOUT, PayoutResultAssembler.ERROR_FORMULA, "Error: boom");
		PayoutRowDto okRow = new PayoutRowDto("TAXI", "Comp", "N/A", "20.00%", "", "TAXI", "TAXI",
				"Payin Below 20%", "18.00%", "-2%", "Matched rule taxi-1");

		PayoutSummaryDto metrics = service.summarize(List.of(
				PayoutOutcome.success(okRow, 20.0, "TAXI"),
				PayoutOutcome.failure(errorRow, 40.0, "TAXI", "boom")), "Acme");

		assertThat(metrics.avgPayin()).isEqualTo(30.0);
		assertThat(metrics.formulaSummary())
				.containsEntry("-2%", 1)
				.containsEntry(PayoutResultAssembler.ERROR_FORMULA, 1);
	}

	@Test
	void parallelRunKeepsInputOrder() {
		List<Map<String, Object>> records = new ArrayList<>();
		for (int i = 0; i < 40; i++) {
			records.add(Map.of("segment", "Taxi", "payin", i + "%", "location", "L" + i));
		}

		List<PayoutRowDto> rows = service.process(records, "Acme").calculatedData();

		assertThat(rows).hasSize(40);
		for (int i = 0; i < 40; i++) {
			assertThat(rows.get(i).location()).isEqualTo("L" + i);
		}
	}

	@Test
	void failedRecordDoesNotAbortBatch() {
		List<Map<String, Object>> records = List.of(
				Map.of("segment", "Taxi", "payin", "25%"),
				Map.of("segment", "Taxi", "payin", "-"));

		List<PayoutRowDto> rows = service.process(records, "Acme").calculatedData();

		assertThat(rows).hasSize(2);
		assertThat(rows.get(0).calculatedPayout()).isEqualTo("22.00%");
		assertThat(rows.get(1).calculatedPayout()).isEqualTo("0.00%");
	}
}
