package my.policypayout.app.dto;

import java.util.List;

public record PayoutBatchResultDto(String tableName,
								   List<PayoutRowDto> calculatedData,
								   PayoutSummaryDto metrics) {
}
