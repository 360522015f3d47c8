package my.temperaturescore.app.model;

public record Holding(String companyId, Double investmentValue) {
}
