package my.temperaturescore.app.dto;

public record HoldingDto(String companyId, Double investmentValue) {
}
