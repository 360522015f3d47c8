package my.temperaturescore.app.model;

import java.util.function.Function;

public enum GroupingKey {
	SECTOR(Company::sector),
	REGION(Company::region);

	public static final String UNKNOWN = "unknown";

	private final Function<Company, String> extractor;

	GroupingKey(Function<Company, String> extractor) {
		this.extractor = extractor;
	}

	public String valueOf(Company company) {
		if (company == null) {
			return UNKNOWN;
		}
		String value = extractor.apply(company);
		return value == null || value.isBlank() ? UNKNOWN : value.trim();
	}
}
