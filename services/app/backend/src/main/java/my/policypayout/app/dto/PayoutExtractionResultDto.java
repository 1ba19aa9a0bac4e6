package my.policypayout.app.dto;

import java.util.List;
import java.util.Map;

/**
 * Batch result of an image upload, together with the raw extraction output and the
 * records parsed from it.
 */
public record PayoutExtractionResultDto(String tableName,
										String extractedText,
										List<Map<String, Object>> parsedData,
										List<PayoutRowDto> calculatedData,
										PayoutSummaryDto metrics) {
}
