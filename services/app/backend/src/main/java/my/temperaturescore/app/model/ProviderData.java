package my.temperaturescore.app.model;

import java.util.List;

public record ProviderData(List<Company> companies, List<Target> targets) {
	public ProviderData {
		companies = companies == null ? List.of() : List.copyOf(companies);
		targets = targets == null ? List.of() : List.copyOf(targets);
	}
}
