package my.policypayout.app.dto;

import java.util.List;

public record PayoutTableValidateResponse(boolean valid, List<String> errors) {
}
