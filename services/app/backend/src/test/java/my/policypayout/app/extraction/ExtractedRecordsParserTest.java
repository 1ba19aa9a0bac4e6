package my.policypayout.app.extraction;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractedRecordsParserTest {
	private final ExtractedRecordsParser parser = new ExtractedRecordsParser();

	@Test
	void stripsCodeFencesAndSurroundingText() {
		String text = """
				Here is the table:
				```json
				[{"segment": "TW TP", "payin": "55%"}, {"segment": "Taxi", "payin": 20}]
				```
				""";

		List<Map<String, Object>> records = parser.parse(text);

		assertThat(records).hasSize(2);
		assertThat(records.get(0)).containsEntry("segment", "TW TP");
		assertThat(records.get(1)).containsEntry("payin", 20);
	}

	@Test
	void singleObjectIsOneRecord() {
		assertThat(parser.parse("{\"segment\": \"BUS\"}")).containsExactly(Map.of("segment", "BUS"));
	}

	@Test
	void skipsNonObjectItems() {
		assertThat(parser.parse("[1, \"x\", {\"segment\": \"BUS\"}]")).hasSize(1);
	}

	@Test
	void blankOutputIsEmpty() {
		assertThat(parser.parse("  ")).isEmpty();
	}

	@Test
	void rejectsInvalidJson() {
		assertThatThrownBy(() -> parser.parse("[{segment: }]"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageStartingWith("Extraction output is not valid JSON");
	}

	@Test
	void acceptsImagesOnly() {
		assertThatCode(() -> parser.requireImage("grid.PNG", null)).doesNotThrowAnyException();
		assertThatCode(() -> parser.requireImage("upload", "image/webp")).doesNotThrowAnyException();
		assertThatThrownBy(() -> parser.requireImage("grid.pdf", "application/pdf"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unsupported file type: grid.pdf");
	}
}
