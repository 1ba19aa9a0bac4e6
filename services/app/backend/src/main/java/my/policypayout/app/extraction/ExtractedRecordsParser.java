package my.policypayout.app.extraction;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns extraction output into raw records. Tolerates Markdown code fences and text
 * around the JSON array; a single JSON object is read as a one-record batch.
 */
public class ExtractedRecordsParser {
	private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*|\\s*```");
	private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "bmp", "tiff");
	private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;

	public ExtractedRecordsParser() {
		this.objectMapper = JsonMapper.builder().build();
	}

	public List<Map<String, Object>> parse(String extractedText) {
		if (extractedText == null || extractedText.isBlank()) {
			return List.of();
		}
		String cleaned = CODE_FENCE.matcher(extractedText).replaceAll("").trim();
		int start = cleaned.indexOf('[');
		int end = cleaned.lastIndexOf(']');
		if (start >= 0 && end > start) {
			cleaned = cleaned.substring(start, end + 1);
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(cleaned);
		} catch (JacksonException ex) {
			throw new IllegalArgumentException("Extraction output is not valid JSON: " + ex.getMessage(), ex);
		}
		List<Map<String, Object>> records = new ArrayList<>();
		if (root.isObject()) {
			records.add(objectMapper.convertValue(root, RECORD_TYPE));
		} else if (root.isArray()) {
			for (JsonNode item : root) {
				if (item.isObject()) {
					records.add(objectMapper.convertValue(item, RECORD_TYPE));
				}
			}
		}
		return records;
	}

	public void requireImage(String filename, String contentType) {
		String name = filename == null ? "" : filename;
		int dot = name.lastIndexOf('.');
		String extension = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
		boolean image = contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("image/");
		if (!IMAGE_EXTENSIONS.contains(extension) && !image) {
			throw new IllegalArgumentException("Unsupported file type: " + name);
		}
	}
}
