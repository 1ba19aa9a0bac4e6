package my.policypayout.app.dto;

public record HealthDto(String status) {
}
