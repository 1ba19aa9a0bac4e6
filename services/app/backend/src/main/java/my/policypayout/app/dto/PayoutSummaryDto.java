package my.policypayout.app.dto;

import java.util.Map;

public record PayoutSummaryDto(int totalRecords,
							   double avgPayin,
							   int uniqueSegments,
							   String companyName,
							   Map<String, Integer> formulaSummary) {
}
