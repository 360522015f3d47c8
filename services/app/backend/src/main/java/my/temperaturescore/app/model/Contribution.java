package my.temperaturescore.app.model;

/**
 * @param weight normalized weight of the company within its partition
 * @param contribution weight times temperature score
 * @param relativeContribution share of the partition score, in percent
 */
public record Contribution(
		String companyId,
		String companyName,
		double temperatureScore,
		double weight,
		double contribution,
		double relativeContribution
) {
}
