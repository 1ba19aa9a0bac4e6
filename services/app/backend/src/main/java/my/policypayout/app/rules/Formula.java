package my.policypayout.app.rules;

/**
 * Payout formula applied to a payin value. Results are floored at zero.
 */
public interface Formula {
	double apply(double payinValue);

	String description();

	static double clamp(double value) {
		return Math.max(0.0d, value);
	}

	record PercentOf(double factor, String description) implements Formula {
		@Override
		public double apply(double payinValue) {
			return Formula.clamp(payinValue * factor);
		}
	}

	record SubtractFlat(double points, String description) implements Formula {
		@Override
		public double apply(double payinValue) {
			return Formula.clamp(payinValue - points);
		}
	}

	record Identity(String description) implements Formula {
		public static final Identity INSTANCE = new Identity("Payin");

		@Override
		public double apply(double payinValue) {
			return Formula.clamp(payinValue);
		}
	}
}
