package my.policypayout.app.dto;

import java.util.List;

public record PayoutTableDto(String name, int size, List<PayoutRuleDto> rules) {
}
