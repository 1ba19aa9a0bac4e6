package my.policypayout.app.rules;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FormulaParserTest {
	private final FormulaParser parser = new FormulaParser();

	@Test
	void parsesPercentOfPayin() {
		Formula formula = parser.parse("90% of Payin").orElseThrow();

		assertThat(formula).isInstanceOf(Formula.PercentOf.class);
		assertThat(((Formula.PercentOf) formula).factor()).isCloseTo(0.90, within(1e-9));
		assertThat(formula.apply(60.0)).isCloseTo(54.0, within(1e-9));
		assertThat(formula.description()).isEqualTo("90% of Payin");
	}

	@Test
	void parsesFlatDeductions() {
		assertThat(parser.parse("-3%")).containsInstanceOf(Formula.SubtractFlat.class);
		assertThat(parser.parse("Less 2% of Payin").orElseThrow().apply(10.0)).isCloseTo(8.0, within(1e-9));
		assertThat(parser.parse("- 4 %").orElseThrow().apply(10.0)).isCloseTo(6.0, within(1e-9));
	}

	@Test
	void clampsAtZero() {
		assertThat(parser.parse("-5%").orElseThrow().apply(3.0)).isEqualTo(0.0);
	}

	@Test
	void parsesIdentity() {
		assertThat(parser.parse("Payin")).containsInstanceOf(Formula.Identity.class);
		assertThat(Formula.Identity.INSTANCE.apply(12.5)).isEqualTo(12.5);
	}

	@Test
	void rejectsUnknownText() {
		assertThat(parser.parse("half of payin")).isEmpty();
		assertThat(parser.parse("")).isEmpty();
		assertThat(parser.parse(null)).isEmpty();
	}
}
