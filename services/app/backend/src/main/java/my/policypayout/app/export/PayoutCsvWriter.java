package my.policypayout.app.export;

import my.policypayout.app.dto.PayoutRowDto;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

public class PayoutCsvWriter {
	static final String[] HEADER = {
			"segment", "policy type", "location", "payin", "remark",
			"Calculated Payout", "Formula Used", "Rule Explanation"
	};

	public String write(List<PayoutRowDto> rows) {
		StringWriter out = new StringWriter();
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(HEADER)
				.setRecordSeparator("\n")
				.build();
		try (CSVPrinter printer = new CSVPrinter(out, format)) {
			for (PayoutRowDto row : rows) {
				printer.printRecord(
						row.segment(),
						row.policyType(),
						row.location(),
						row.payin(),
						row.remark(),
						row.calculatedPayout(),
						row.formulaUsed(),
						row.ruleExplanation()
				);
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to write payout CSV", ex);
		}
		return out.toString();
	}
}
