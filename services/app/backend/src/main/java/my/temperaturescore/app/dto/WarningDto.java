package my.temperaturescore.app.dto;

public record WarningDto(String type, String companyId, String message) {
}
