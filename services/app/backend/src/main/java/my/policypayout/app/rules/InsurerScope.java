package my.policypayout.app.rules;

import java.util.Set;

public interface InsurerScope {
	String describe();

	record AllCompanies() implements InsurerScope {
		@Override
		public String describe() {
			return "All Companies";
		}
	}

	/**
	 * @param names insurer names as declared, matched after normalization
	 */
	record ExplicitList(Set<String> names) implements InsurerScope {
		public ExplicitList {
			names = Set.copyOf(names);
		}

		@Override
		public String describe() {
			return String.join(", ", names.stream().sorted().toList());
		}
	}

	/**
	 * Every insurer not explicitly listed by a sibling rule of the same LOB and segment.
	 */
	record RestOfCompanies() implements InsurerScope {
		@Override
		public String describe() {
			return "Rest of Companies";
		}
	}
}
