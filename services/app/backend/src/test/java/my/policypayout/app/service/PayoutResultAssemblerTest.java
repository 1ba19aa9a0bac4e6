package my.policypayout.app.service;

import my.policypayout.app.dto.PayoutRowDto;
import my.policypayout.app.rules.PayoutRulesEngine;
import my.policypayout.app.rules.PayoutTables;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PayoutResultAssemblerTest {
	private final PayoutResultAssembler assembler = new PayoutResultAssembler();
	private final PayoutRulesEngine engine = new PayoutRulesEngine(PayoutTables.defaultTable());

	@Test
	void twoWheelerThirdPartyForListedInsurer() {
		PayoutOutcome outcome = assembler.assemble(raw("TW TP", "55%", "NIL"), "Bajaj", engine);

		PayoutRowDto row = outcome.row();
		assertThat(outcome.failed()).isFalse();
		assertThat(row.lob()).isEqualTo("TW");
		assertThat(row.resolvedSegment()).isEqualTo("TW TP");
		assertThat(row.payin()).isEqualTo("55.00%");
		assertThat(row.payinCategory()).isEqualTo("Payin Above 50%");
		assertThat(row.calculatedPayout()).isEqualTo("52.00%");
		assertThat(row.formulaUsed()).isEqualTo("-3%");
		assertThat(row.ruleExplanation()).startsWith("Matched rule").contains("Bajaj");
	}

	@Test
	void lightCommercialVehicleForListedInsurer() {
		PayoutOutcome outcome = assembler.assemble(raw("CV upto 2.5 Tn", "15%", ""), "Reliance", engine);

		assertThat(outcome.row().lob()).isEqualTo("CV");
		assertThat(outcome.resolvedSegment()).isEqualTo("Upto 2.5 GVW");
		assertThat(outcome.row().calculatedPayout()).isEqualTo("13.00%");
	}

	@Test
	void busWithoutSchoolKeywordIsStaffBus() {
		PayoutOutcome outcome = assembler.assemble(raw("BUS", 40, null), "Acme", engine);

		assertThat(outcome.resolvedSegment()).isEqualTo("STAFF BUS");
		assertThat(outcome.row().calculatedPayout()).isEqualTo("35.20%");
		assertThat(outcome.row().formulaUsed()).isEqualTo("88% of Payin");
	}

	@Test
	void unknownLobKeepsPayinAndReportsNoMatch() {
		PayoutOutcome outcome = assembler.assemble(raw("Something else", "12%", ""), "Acme", engine);

		assertThat(outcome.failed()).isFalse();
		assertThat(outcome.row().lob()).isEqualTo("UNKNOWN");
		assertThat(outcome.row().calculatedPayout()).isEqualTo("12.00%");
		assertThat(outcome.row().formulaUsed()).isEqualTo(PayoutResultAssembler.NO_MATCH_FORMULA);
		assertThat(outcome.row().ruleExplanation()).startsWith("no rule for UNKNOWN/");
	}

	@Test
	void rerunningOnOutputRowGivesSameResult() {
		PayoutRowDto first = assembler.assemble(raw("TW TP", "55%", "NIL"), "Bajaj", engine).row();

		Map<String, Object> again = raw(first.segment(), first.payin(), first.remark());
		again.put("policy_type", first.policyType());
		again.put("location", first.location());
		PayoutRowDto second = assembler.assemble(again, "Bajaj", engine).row();

		assertThat(second).isEqualTo(first);
	}

	@Test
	void faultBecomesErrorRow() {
		PayoutRulesEngine failing = mock(PayoutRulesEngine.class);
		when(failing.evaluate(any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

		PayoutOutcome outcome = assembler.assemble(raw("TAXI", "20%", ""), "Acme", failing);

		assertThat(outcome.failed()).isTrue();
		assertThat(outcome.fault()).isEqualTo("boom");
		assertThat(outcome.payinValue()).isEqualTo(20.0);
		assertThat(outcome.row().segment()).isEqualTo("TAXI");
		assertThat(outcome.row().calculatedPayout()).isEqualTo(PayoutResultAssembler.ERROR_PAYOUT);
		assertThat(outcome.row().formulaUsed()).isEqualTo(PayoutResultAssembler.ERROR_FORMULA);
		assertThat(outcome.row().ruleExplanation()).isEqualTo("Error: boom");
	}

	private Map<String, Object> raw(String segment, Object payin, String remark) {
		Map<String, Object> raw = new HashMap<>();
		raw.put("segment", segment);
		raw.put("payin", payin);
		raw.put("remark", remark);
		return raw;
	}
}
