package my.policypayout.app.dto;

public record PayoutRuleDto(int position,
							String id,
							String lob,
							String segment,
							String insurers,
							String formula,
							String remarks) {
}
